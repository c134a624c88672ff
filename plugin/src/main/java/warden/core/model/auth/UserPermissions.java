package warden.core.model.auth;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Authorization snapshot for one identity.
 *
 * <p>Serialized as JSON into the permission cache; the permissions API stays the source of truth.
 *
 * @param email       identity the snapshot belongs to
 * @param customers   customer (tenant) ids in API order
 * @param roles       role names
 * @param permissions fine-grained permission strings
 * @param fetchedAt   when the snapshot was fetched from the API
 */
public record UserPermissions(
        @JsonProperty("email") String email,
        @JsonProperty("customers") List<String> customers,
        @JsonProperty("roles") Set<String> roles,
        @JsonProperty("permissions") Set<String> permissions,
        @JsonProperty("fetched_at") Instant fetchedAt) {

    public UserPermissions {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email cannot be null or blank");
        }
        customers = customers != null ? List.copyOf(customers) : List.of();
        roles = roles != null ? Set.copyOf(roles) : Set.of();
        permissions = permissions != null ? Set.copyOf(permissions) : Set.of();
        if (fetchedAt == null) {
            fetchedAt = Instant.now();
        }
    }

    /**
     * Authenticated caller without any customer access.
     */
    public static UserPermissions empty(String email) {
        return new UserPermissions(email, List.of(), Set.of(), Set.of(), Instant.now());
    }
}
