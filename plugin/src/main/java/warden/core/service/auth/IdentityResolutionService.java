package warden.core.service.auth;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.AuthenticatedIdentity;
import warden.core.model.auth.TokenClaims;
import warden.core.port.out.PermissionsClient;
import warden.core.port.out.TokenValidator;

/**
 * Turns a bearer token into an {@link AuthenticatedIdentity}.
 *
 * <p>
 * Validation runs first (short-circuited by the token result cache when enabled); permissions
 * are then resolved cache-aside by the email derived from the claims, forwarding the caller's
 * token to the permissions API on a miss.
 *
 * <p>
 * Failures propagate unchanged; mapping them to host results happens at the plugin boundary.
 */
public class IdentityResolutionService {

    private static final Logger LOG = Logger.getLogger(IdentityResolutionService.class);

    private final TokenValidator tokenValidator;
    private final TokenResultCache tokenResultCache;
    private final PermissionResolver permissionResolver;
    private final PermissionsClient permissionsClient;

    public IdentityResolutionService(
            TokenValidator tokenValidator,
            TokenResultCache tokenResultCache,
            PermissionResolver permissionResolver,
            PermissionsClient permissionsClient) {
        this.tokenValidator = tokenValidator;
        this.tokenResultCache = tokenResultCache;
        this.permissionResolver = permissionResolver;
        this.permissionsClient = permissionsClient;
    }

    public Uni<AuthenticatedIdentity> resolve(String token) {
        return validate(token).flatMap(claims -> {
            final var email = claims.resolvedEmail();
            return permissionResolver
                    .resolve(email, () -> permissionsClient.getUserPermissions(email, token))
                    .map(permissions -> AuthenticatedIdentity.of(claims, permissions));
        });
    }

    private Uni<TokenClaims> validate(String token) {
        if (tokenResultCache == null || !tokenResultCache.isEnabled()) {
            return tokenValidator.validate(token);
        }
        return tokenResultCache.get(token).flatMap(cached -> {
            if (cached.isPresent()) {
                LOG.debugv("Token result cache hit for subject {0}", cached.get().subject());
                return Uni.createFrom().item(cached.get());
            }
            return tokenValidator
                    .validate(token)
                    .call(claims -> tokenResultCache.put(token, claims));
        });
    }
}
