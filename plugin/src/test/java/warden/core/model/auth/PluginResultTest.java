package warden.core.model.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PluginResult")
class PluginResultTest {

    @Test
    @DisplayName("should render only continue_processing when proceeding")
    void shouldRenderProceed() {
        assertEquals(Map.of("continue_processing", true), PluginResult.proceed().toMap());
        assertFalse(PluginResult.proceed().hasModifiedPayload());
    }

    @Test
    @DisplayName("should render the error when aborting")
    void shouldRenderAbort() {
        assertEquals(
                Map.of(
                        "error", Map.of("message", "Token expired", "code", "TOKEN_EXPIRED"),
                        "continue_processing", false),
                PluginResult.abort("Token expired", "TOKEN_EXPIRED").toMap());
    }
}
