package warden.core.model.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Credentials")
class CredentialsTest {

    @Nested
    @DisplayName("fromPayload()")
    class FromPayload {

        @Test
        @DisplayName("should read mapping-shaped credentials")
        void shouldReadMap() {
            final var credentials =
                    Credentials.fromPayload(Map.of("credentials", Map.of("scheme", "Bearer", "credentials", "tok")));

            assertEquals(Optional.of("tok"), credentials.bearerToken());
        }

        @Test
        @DisplayName("should pass through typed credentials")
        void shouldPassThroughTyped() {
            final var typed = new Credentials("bearer", "tok");

            assertSame(typed, Credentials.fromPayload(Map.of("credentials", typed)));
        }

        @Test
        @DisplayName("should yield no token for missing or unexpected shapes")
        void shouldYieldNothing() {
            final var nullCredentials = new HashMap<String, Object>();
            nullCredentials.put("credentials", null);

            assertTrue(Credentials.fromPayload(null).bearerToken().isEmpty());
            assertTrue(Credentials.fromPayload(Map.of()).bearerToken().isEmpty());
            assertTrue(Credentials.fromPayload(nullCredentials).bearerToken().isEmpty());
            assertTrue(Credentials.fromPayload(Map.of("credentials", "Bearer tok")).bearerToken().isEmpty());
        }
    }

    @Test
    @DisplayName("should match the bearer scheme case-insensitively")
    void shouldMatchSchemeCaseInsensitively() {
        assertEquals(Optional.of("tok"), new Credentials("BEARER", "tok").bearerToken());
        assertTrue(new Credentials("Basic", "dXNlcjpwYXNz").bearerToken().isEmpty());
        assertTrue(new Credentials("Bearer", " ").bearerToken().isEmpty());
    }

    @Test
    @DisplayName("should parse an Authorization header")
    void shouldParseHeader() {
        assertEquals(Optional.of("abc.def.ghi"), Credentials.fromAuthorizationHeader("Bearer abc.def.ghi").bearerToken());
        assertTrue(Credentials.fromAuthorizationHeader("Bearer").bearerToken().isEmpty());
        assertTrue(Credentials.fromAuthorizationHeader(null).bearerToken().isEmpty());
    }
}
