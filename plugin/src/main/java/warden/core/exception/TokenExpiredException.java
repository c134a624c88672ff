package warden.core.exception;

/**
 * The token's {@code exp} lies in the past beyond the configured clock skew.
 */
public class TokenExpiredException extends TokenValidationException {

    public static final String CODE = "TOKEN_EXPIRED";

    public TokenExpiredException() {
        this("Token has expired", null);
    }

    public TokenExpiredException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
