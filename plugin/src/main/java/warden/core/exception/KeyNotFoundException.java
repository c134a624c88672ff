package warden.core.exception;

/**
 * The token references a key id that is absent from the key set even after a forced refresh.
 */
public class KeyNotFoundException extends AuthenticationException {

    public static final String CODE = "KEY_NOT_FOUND";

    private final String keyId;

    public KeyNotFoundException(String keyId) {
        super("Key with kid '" + keyId + "' not found in JWKS", CODE);
        this.keyId = keyId;
    }

    /** Returns the key id that could not be resolved. */
    public String getKeyId() {
        return keyId;
    }
}
