package warden.core.model.auth;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only request context supplied by the host to the header injection hook.
 *
 * @param metadata  metadata recorded by the identity hook for this request
 * @param user      host user record ({@code email}, ...)
 * @param requestId request correlation id, may be null
 */
public record HookContext(Map<String, Object> metadata, Map<String, Object> user, String requestId) {

    public HookContext {
        metadata = metadata != null ? metadata : Map.of();
        user = user != null ? user : Map.of();
    }

    /**
     * Normalize a mapping-shaped host context.
     *
     * @param context the context map with {@code metadata}, {@code user} and {@code request_id}, may be null
     */
    @SuppressWarnings("unchecked")
    public static HookContext fromMap(Map<String, ?> context) {
        if (context == null) {
            return new HookContext(null, null, null);
        }
        final var metadata = context.get("metadata") instanceof Map<?, ?> m ? (Map<String, Object>) m : null;
        final var user = context.get("user") instanceof Map<?, ?> u ? (Map<String, Object>) u : null;
        final var requestId = context.get("request_id");
        return new HookContext(metadata, user, requestId != null ? requestId.toString() : null);
    }

    public Optional<String> authMethod() {
        return Optional.ofNullable(metadata.get("auth_method")).map(Object::toString);
    }

    public Optional<String> userEmail() {
        return Optional.ofNullable(user.get("email"))
                .map(Object::toString)
                .filter(email -> !email.isBlank());
    }

    public Optional<String> requestIdValue() {
        return Optional.ofNullable(requestId).filter(id -> !id.isBlank());
    }

    /**
     * Customer ids recorded in the metadata, in recorded order.
     */
    public List<String> customers() {
        final var raw = metadata.get("customers");
        if (raw instanceof List<?> list) {
            return list.stream().filter(c -> c != null).map(Object::toString).toList();
        }
        return List.of();
    }
}
