package warden.core.port.out;

/**
 * Port interface for recording authentication metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record an established identity.
     *
     * @param method the authentication method
     */
    void recordAuthSuccess(String method);

    /**
     * Record a rejected or degraded authentication.
     *
     * @param code the error code
     */
    void recordAuthFailure(String code);

    /**
     * Record a permission cache hit.
     */
    void recordPermissionCacheHit();

    /**
     * Record a permission cache miss.
     */
    void recordPermissionCacheMiss();

    /**
     * Record a key set refresh attempt.
     *
     * @param outcome "success", "stale" or "failure"
     */
    void recordKeySetRefresh(String outcome);

    /**
     * Record a call to the permissions API.
     *
     * @param statusCode HTTP status, or 0 when no response was received
     * @param durationMs call latency in milliseconds
     */
    void recordPermissionsApiCall(int statusCode, long durationMs);

    /**
     * Record a cache operation that timed out or failed.
     *
     * @param cacheName the logical cache
     * @param operation the operation name
     */
    void recordCacheFailure(String cacheName, String operation);
}
