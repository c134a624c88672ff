package warden.core.model.auth;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a plugin hook as seen by the host.
 *
 * @param modifiedPayload    replacement payload, null when unchanged
 * @param metadata           metadata for later hooks, null when none
 * @param error              error surfaced when the chain is aborted, null otherwise
 * @param continueProcessing whether the host should continue its authentication chain
 */
public record PluginResult(
        Map<String, Object> modifiedPayload, Map<String, Object> metadata, Error error, boolean continueProcessing) {

    /**
     * Error payload returned to the caller.
     *
     * @param message human-readable message
     * @param code    machine-readable code
     */
    public record Error(String message, String code) {}

    /**
     * Let the host continue without changes.
     */
    public static PluginResult proceed() {
        return new PluginResult(null, null, null, true);
    }

    /**
     * Continue with an established identity.
     */
    public static PluginResult authenticated(Map<String, Object> user, Map<String, Object> metadata) {
        return new PluginResult(user, metadata, null, true);
    }

    /**
     * Continue with a replaced payload.
     */
    public static PluginResult modified(Map<String, Object> payload) {
        return new PluginResult(payload, null, null, true);
    }

    /**
     * Abort the host's authentication chain.
     */
    public static PluginResult abort(String message, String code) {
        return new PluginResult(null, null, new Error(message, code), false);
    }

    public boolean hasModifiedPayload() {
        return modifiedPayload != null;
    }

    /**
     * Wire form handed to the host; absent parts are omitted.
     */
    public Map<String, Object> toMap() {
        final var result = new LinkedHashMap<String, Object>();
        if (modifiedPayload != null) {
            result.put("modified_payload", modifiedPayload);
        }
        if (metadata != null) {
            result.put("metadata", metadata);
        }
        if (error != null) {
            result.put("error", Map.of("message", error.message(), "code", error.code()));
        }
        result.put("continue_processing", continueProcessing);
        return result;
    }
}
