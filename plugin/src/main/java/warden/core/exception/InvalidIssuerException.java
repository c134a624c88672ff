package warden.core.exception;

/**
 * The token's {@code iss} is not the configured provider issuer.
 */
public class InvalidIssuerException extends TokenValidationException {

    public static final String CODE = "INVALID_ISSUER";

    public InvalidIssuerException() {
        this("Invalid token issuer", null);
    }

    public InvalidIssuerException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
