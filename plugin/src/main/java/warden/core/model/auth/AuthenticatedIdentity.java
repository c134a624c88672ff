package warden.core.model.auth;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Identity resolved for one request.
 *
 * <p>Admin and active flags are defaults; they are not derived from token claims.
 */
public record AuthenticatedIdentity(
        String email,
        String fullName,
        String subject,
        boolean admin,
        boolean active,
        List<String> customers,
        Set<String> roles,
        Set<String> permissions,
        String authMethod) {

    public static final String AUTH_METHOD = "cognito";

    public AuthenticatedIdentity {
        customers = customers != null ? List.copyOf(customers) : List.of();
        roles = roles != null ? Set.copyOf(roles) : Set.of();
        permissions = permissions != null ? Set.copyOf(permissions) : Set.of();
        if (authMethod == null) {
            authMethod = AUTH_METHOD;
        }
    }

    /**
     * Combine verified claims with the caller's permission snapshot.
     */
    public static AuthenticatedIdentity of(TokenClaims claims, UserPermissions permissions) {
        return new AuthenticatedIdentity(
                claims.resolvedEmail(),
                claims.displayName(),
                claims.subject(),
                false,
                true,
                permissions.customers(),
                permissions.roles(),
                permissions.permissions(),
                AUTH_METHOD);
    }

    /**
     * User record handed to the host gateway.
     */
    public Map<String, Object> toGatewayUser() {
        final var user = new LinkedHashMap<String, Object>();
        user.put("email", email);
        user.put("full_name", fullName != null && !fullName.isBlank() ? fullName : email);
        user.put("is_admin", admin);
        user.put("is_active", active);
        return user;
    }

    /**
     * Metadata kept in the request context for later hooks.
     */
    public Map<String, Object> toMetadata() {
        final var metadata = new LinkedHashMap<String, Object>();
        metadata.put("auth_method", authMethod);
        metadata.put("cognito_sub", subject);
        metadata.put("customers", customers);
        metadata.put("roles", List.copyOf(new TreeSet<>(roles)));
        metadata.put("permissions", List.copyOf(new TreeSet<>(permissions)));
        return metadata;
    }
}
