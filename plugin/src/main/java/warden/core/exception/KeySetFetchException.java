package warden.core.exception;

/**
 * The provider's key set could not be fetched and no previously fetched set is available.
 */
public class KeySetFetchException extends AuthenticationException {

    public static final String CODE = "JWKS_FETCH_ERROR";

    public KeySetFetchException(String message) {
        super(message, CODE);
    }

    public KeySetFetchException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
