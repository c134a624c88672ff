package warden.core.exception;

/**
 * A cache entry could not be read or written.
 *
 * <p>Never escapes the cache layer: callers treat it as a miss.
 */
public class CacheException extends AuthenticationException {

    public static final String CODE = "CACHE_ERROR";

    public CacheException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
