package warden.core.exception;

/**
 * A bearer token was rejected.
 *
 * <p>Subclasses narrow the reason; all of them abort the authentication chain.
 */
public class TokenValidationException extends AuthenticationException {

    public static final String CODE = "INVALID_TOKEN";

    public TokenValidationException(String message) {
        super(message, CODE);
    }

    public TokenValidationException(String message, Throwable cause) {
        super(message, CODE, cause);
    }

    protected TokenValidationException(String message, String code, Throwable cause) {
        super(message, code, cause);
    }
}
