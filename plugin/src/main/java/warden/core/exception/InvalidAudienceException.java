package warden.core.exception;

/**
 * An access token was issued to a different application client.
 */
public class InvalidAudienceException extends TokenValidationException {

    public static final String CODE = "INVALID_AUDIENCE";

    public InvalidAudienceException(String message) {
        super(message, CODE, null);
    }
}
