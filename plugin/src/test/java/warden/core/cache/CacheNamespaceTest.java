package warden.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CacheNamespace")
class CacheNamespaceTest {

    @Test
    @DisplayName("should build prefix plus 16 hex characters of the lowercased email hash")
    void shouldBuildPermissionKey() {
        final var key = CacheNamespace.PERMISSIONS.key("Alice@Example.COM");

        assertEquals("warden:auth:permissions:ff8d9819fc0e12bf", key);
        assertEquals(CacheNamespace.PERMISSIONS.prefix().length() + 16, key.length());
    }

    @Test
    @DisplayName("should use the leading SHA-256 hex digits")
    void shouldUseLeadingDigestDigits() {
        assertEquals("warden:auth:token:ba7816bf8f01cfea", CacheNamespace.TOKEN_RESULT.key("abc"));
    }

    @Test
    @DisplayName("should hash tokens and key ids as given")
    void shouldKeepCaseForTokens() {
        assertNotEquals(CacheNamespace.TOKEN_RESULT.key("abc.DEF"), CacheNamespace.TOKEN_RESULT.key("abc.def"));
        assertNotEquals(CacheNamespace.KEY_SET.key("Kid"), CacheNamespace.KEY_SET.key("kid"));
    }

    @Test
    @DisplayName("should keep namespaces apart for the same identity")
    void shouldSeparateNamespaces() {
        assertTrue(CacheNamespace.TOKEN_RESULT.key("x").startsWith("warden:auth:token:"));
        assertTrue(CacheNamespace.KEY_SET.key("x").startsWith("warden:auth:jwks:"));
        assertNotEquals(CacheNamespace.PERMISSIONS.key("x"), CacheNamespace.TOKEN_RESULT.key("x"));
    }

    @Test
    @DisplayName("should reject null identities")
    void shouldRejectNull() {
        assertThrows(IllegalArgumentException.class, () -> CacheNamespace.PERMISSIONS.key(null));
    }
}
