package warden.core.exception;

/**
 * The token signature does not verify against the resolved signing key.
 */
public class InvalidSignatureException extends TokenValidationException {

    public static final String CODE = "INVALID_SIGNATURE";

    public InvalidSignatureException() {
        this("Invalid token signature", null);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
