package warden.core.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Key namespaces in the shared identity cache.
 *
 * <p>A key is the namespace prefix followed by the first 16 hex characters (64 bits) of the
 * SHA-256 of the identity, so raw emails and tokens never appear in the store's key space.
 * Emails are lowercased before hashing; key ids and tokens are hashed as given.
 */
public enum CacheNamespace {
    /** Key ids still unknown after a successful key set refresh. */
    KEY_SET("warden:auth:jwks:", true),
    /** Permission snapshots keyed by email. */
    PERMISSIONS("warden:auth:permissions:", false),
    /** Validated token claims keyed by raw token. */
    TOKEN_RESULT("warden:auth:token:", true);

    static final int HASH_HEX_CHARS = 16;

    private static final HexFormat HEX = HexFormat.of();

    private final String prefix;
    private final boolean caseSensitive;

    CacheNamespace(String prefix, boolean caseSensitive) {
        this.prefix = prefix;
        this.caseSensitive = caseSensitive;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Cache key for an identity string.
     *
     * @param identity email, key id or token
     * @return namespaced, hashed key
     */
    public String key(String identity) {
        if (identity == null) {
            throw new IllegalArgumentException("Cache identity cannot be null");
        }
        final var normalized = caseSensitive ? identity : identity.toLowerCase(Locale.ROOT);
        return prefix + HEX.formatHex(sha256(normalized), 0, HASH_HEX_CHARS / 2);
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is required on every JVM", e);
        }
    }
}
