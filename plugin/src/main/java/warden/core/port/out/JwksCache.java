package warden.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.KeySet;
import warden.core.model.auth.SigningKey;

/**
 * Port for holding the identity provider's public signing keys.
 *
 * <p>Implementations are responsible for:
 * <ul>
 *   <li>Fetching the key set document from the provider</li>
 *   <li>Serving keys from the held set until its TTL elapses</li>
 *   <li>Recovering from key rotation with a single forced refresh</li>
 * </ul>
 */
public interface JwksCache {

    /**
     * Resolve a signing key by id.
     *
     * <p>A miss in the held set forces exactly one refresh before failing.
     *
     * @param keyId the key id ({@code kid}) from the token header
     * @return the key; fails with {@code KeyNotFoundException} or {@code KeySetFetchException}
     */
    Uni<SigningKey> getKey(String keyId);

    /**
     * Fetch the key set from the provider and replace the held set.
     *
     * <p>On failure the previously held set is kept and returned; without one the Uni fails
     * with {@code KeySetFetchException}.
     *
     * @return the key set now held
     */
    Uni<KeySet> refresh();

    /**
     * The currently held key set, if any has been fetched.
     */
    Optional<KeySet> currentKeySet();

    /**
     * Release network resources. Safe to call more than once.
     */
    void close();
}
