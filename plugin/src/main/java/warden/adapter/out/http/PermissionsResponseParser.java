package warden.adapter.out.http;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import warden.core.exception.DownstreamApiException;
import warden.core.model.auth.UserPermissions;

/**
 * Normalizes permissions API response bodies into {@link UserPermissions}.
 *
 * <h2>Accepted Shapes</h2>
 * <pre>{@code
 * [ {"cloud_id": "cloud-001", "role": "admin", "permissions": ["write:config"]} ]
 *
 * {
 *   "customers": [ {"cloudId": "cloud-002", "permission_level": "viewer"} ],
 *   "roles": ["auditor"],
 *   "permissions": ["read:audit"]
 * }
 * }</pre>
 *
 * <p>An object without {@code customers} falls back to its {@code data} array. Every caller with
 * at least one customer receives the default permissions.
 */
public class PermissionsResponseParser {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final List<String> CUSTOMER_ID_FIELDS = List.of("cloud_id", "cloudId", "id");
    private static final List<String> ROLE_FIELDS = List.of("role", "permission_level");
    private static final List<String> COLLECTION_FIELDS = List.of("customers", "data");
    private static final String ROLES_FIELD = "roles";
    private static final String PERMISSIONS_FIELD = "permissions";

    private final List<String> defaultPermissions;

    public PermissionsResponseParser(List<String> defaultPermissions) {
        this.defaultPermissions = defaultPermissions != null ? List.copyOf(defaultPermissions) : List.of();
    }

    /**
     * Parse a successful response body.
     *
     * @param email the identity the response belongs to
     * @param body  the raw response body
     * @return normalized permissions
     * @throws DownstreamApiException if the body is not JSON
     */
    public UserPermissions parse(String email, String body) {
        if (body == null || body.isBlank()) {
            return UserPermissions.empty(email);
        }

        final JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw DownstreamApiException.failure("Permissions API returned invalid JSON: " + e.getOriginalMessage(), e);
        }

        final var customers = new LinkedHashSet<String>();
        final var roles = new LinkedHashSet<String>();
        final var permissions = new LinkedHashSet<String>();

        for (var entry : entries(root)) {
            if (!entry.isObject()) {
                continue;
            }
            firstPresent(entry, CUSTOMER_ID_FIELDS).ifPresent(customers::add);
            firstPresent(entry, ROLE_FIELDS).ifPresent(roles::add);
            addStrings(entry.get(PERMISSIONS_FIELD), permissions);
        }

        if (root.isObject()) {
            addStrings(root.get(ROLES_FIELD), roles);
            addStrings(root.get(PERMISSIONS_FIELD), permissions);
        }

        if (!customers.isEmpty()) {
            permissions.addAll(defaultPermissions);
        }

        return new UserPermissions(email, new ArrayList<>(customers), roles, permissions, null);
    }

    private static List<JsonNode> entries(JsonNode root) {
        if (root.isArray()) {
            return toList(root);
        }
        if (root.isObject()) {
            for (var field : COLLECTION_FIELDS) {
                final var candidate = root.get(field);
                if (candidate != null && candidate.isArray() && !candidate.isEmpty()) {
                    return toList(candidate);
                }
            }
        }
        return List.of();
    }

    private static List<JsonNode> toList(JsonNode array) {
        final var result = new ArrayList<JsonNode>(array.size());
        array.forEach(result::add);
        return result;
    }

    private static Optional<String> firstPresent(JsonNode entry, List<String> fields) {
        for (var field : fields) {
            final var value = entry.get(field);
            if (isPresent(value)) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }

    // Null, empty strings, false and zero count as absent
    private static boolean isPresent(JsonNode value) {
        if (value == null || value.isNull() || value.isContainerNode()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty();
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            return value.asDouble() != 0;
        }
        return true;
    }

    private static void addStrings(JsonNode array, Set<String> target) {
        if (array == null || !array.isArray()) {
            return;
        }
        for (var value : array) {
            if (value != null && !value.isNull() && !value.isContainerNode()) {
                target.add(value.asText());
            }
        }
    }
}
