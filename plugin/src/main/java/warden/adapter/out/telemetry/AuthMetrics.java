package warden.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import warden.core.port.out.Metrics;

/**
 * Micrometer metrics for identity resolution.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code warden.auth.success} - Established identities by method</li>
 *   <li>{@code warden.auth.failure} - Rejected or degraded requests by error code</li>
 *   <li>{@code warden.permissions.cache.hits} - Permission cache hits</li>
 *   <li>{@code warden.permissions.cache.misses} - Permission cache misses</li>
 *   <li>{@code warden.jwks.refresh} - Key set refreshes by outcome</li>
 *   <li>{@code warden.permissions.api.calls} - Permissions API calls by status</li>
 *   <li>{@code warden.permissions.api.duration} - Permissions API latency</li>
 *   <li>{@code warden.cache.failures} - Identity cache timeouts and failures by operation</li>
 * </ul>
 */
public class AuthMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    /**
     * @param registry the registry to record into; null disables recording
     * @param enabled  whether recording is enabled
     */
    public AuthMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = registry != null && enabled;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAuthSuccess(String method) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.auth.success")
                .description("Requests with an established identity")
                .tag("method", nullSafe(method))
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuthFailure(String code) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.auth.failure")
                .description("Requests rejected or continued without identity")
                .tag("code", nullSafe(code))
                .register(registry)
                .increment();
    }

    @Override
    public void recordPermissionCacheHit() {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.permissions.cache.hits")
                .description("Permission cache hits")
                .register(registry)
                .increment();
    }

    @Override
    public void recordPermissionCacheMiss() {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.permissions.cache.misses")
                .description("Permission cache misses")
                .register(registry)
                .increment();
    }

    @Override
    public void recordKeySetRefresh(String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.jwks.refresh")
                .description("Key set refresh attempts")
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordPermissionsApiCall(int statusCode, long durationMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.permissions.api.calls")
                .description("Permissions API calls")
                .tag("status", String.valueOf(statusCode))
                .tag("status_class", statusClass(statusCode))
                .register(registry)
                .increment();

        Timer.builder("warden.permissions.api.duration")
                .description("Permissions API latency")
                .tag("status_class", statusClass(statusCode))
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordCacheFailure(String cacheName, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.cache.failures")
                .description("Identity cache operations that timed out or failed")
                .tag("cache", nullSafe(cacheName))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    private String statusClass(int statusCode) {
        return switch (statusCode / 100) {
            case 1 -> "1xx";
            case 2 -> "2xx";
            case 3 -> "3xx";
            case 4 -> "4xx";
            case 5 -> "5xx";
            default -> "unknown";
        };
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
