package warden.core.exception;

/**
 * The permissions API could not produce a permission set.
 *
 * <p>Carries the HTTP status when the API answered, or flags a timeout when it did not
 * answer in time. Transport failures carry neither.
 */
public class DownstreamApiException extends AuthenticationException {

    public static final String CODE = "PERMISSIONS_API_ERROR";
    public static final String TIMEOUT_CODE = "PERMISSIONS_API_TIMEOUT";

    private final Integer statusCode;
    private final boolean timeout;

    private DownstreamApiException(String message, String code, Integer statusCode, boolean timeout, Throwable cause) {
        super(message, code, cause);
        this.statusCode = statusCode;
        this.timeout = timeout;
    }

    /**
     * The API answered with an unusable status.
     */
    public static DownstreamApiException status(int statusCode, String message) {
        return new DownstreamApiException(message, CODE + "_" + statusCode, statusCode, false, null);
    }

    /**
     * The API did not answer within the configured timeout.
     */
    public static DownstreamApiException timeout(String message) {
        return new DownstreamApiException(message, TIMEOUT_CODE, null, true, null);
    }

    /**
     * The request failed before a status was received, or the body could not be read.
     */
    public static DownstreamApiException failure(String message, Throwable cause) {
        return new DownstreamApiException(message, CODE, null, false, cause);
    }

    /** Returns the HTTP status, or null when none was received. */
    public Integer getStatusCode() {
        return statusCode;
    }

    /** Returns true when the request timed out. */
    public boolean isTimeout() {
        return timeout;
    }
}
