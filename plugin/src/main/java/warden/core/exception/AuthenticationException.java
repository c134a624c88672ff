package warden.core.exception;

/**
 * Base type for every authentication failure raised by the plugin.
 *
 * <p>Each failure carries a short machine-readable code that is surfaced to the
 * host in the error payload when the authentication chain is aborted.
 */
public class AuthenticationException extends RuntimeException {

    public static final String DEFAULT_CODE = "AUTH_ERROR";

    private final String code;

    public AuthenticationException(String message, String code) {
        super(message);
        this.code = code;
    }

    public AuthenticationException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /** Returns the machine-readable error code. */
    public String getCode() {
        return code;
    }
}
