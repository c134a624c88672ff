package warden.core.port.out;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.UserPermissions;

/**
 * Port for the downstream permissions API.
 */
public interface PermissionsClient {

    /**
     * Fetch the permission snapshot for a user.
     *
     * @param email          the user's email
     * @param forwardedToken the caller's bearer token to forward, may be null
     * @return the permissions; an authenticated caller without access yields an empty snapshot.
     *         Fails with {@code DownstreamApiException}.
     */
    Uni<UserPermissions> getUserPermissions(String email, String forwardedToken);

    /**
     * Release network resources. Safe to call more than once.
     */
    void close();
}
