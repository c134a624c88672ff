package warden.config;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the Warden identity plugin.
 *
 * <p>Configuration prefix: {@code warden}
 *
 * <p>Built once at startup by {@link WardenConfigLoader} and passed to every component
 * constructor. No component looks configuration up on its own.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code WARDEN_PROVIDER_USER_POOL_ID} - identity provider user pool (required)</li>
 *   <li>{@code WARDEN_PROVIDER_APP_CLIENT_ID} - application client id (required)</li>
 *   <li>{@code WARDEN_PERMISSIONS_API_URL} - permissions API base URL (required)</li>
 *   <li>{@code WARDEN_PERMISSIONS_API_KEY} - permissions API key (required)</li>
 *   <li>{@code WARDEN_CACHE_URL} - e.g., "redis://cache:6379/0" or "memory:"</li>
 *   <li>{@code WARDEN_FAIL_MODE} - "open" or "closed"</li>
 * </ul>
 */
@ConfigMapping(prefix = "warden")
public interface WardenConfig {

    String ISSUER_TEMPLATE = "https://cognito-idp.%s.amazonaws.com/%s";
    String JWKS_PATH = "/.well-known/jwks.json";

    /**
     * User pool id at the identity provider.
     */
    String providerUserPoolId();

    /**
     * Region hosting the user pool.
     *
     * @return region (default: us-east-2)
     */
    @WithDefault("us-east-2")
    String providerRegion();

    /**
     * Application client id that access tokens must carry in {@code client_id}.
     */
    String providerAppClientId();

    /**
     * Explicit issuer URL, replacing the one derived from region and user pool.
     *
     * <p>Useful for provider emulators and tests.
     */
    Optional<String> providerIssuer();

    /**
     * Base URL of the downstream permissions API.
     */
    String permissionsApiUrl();

    /**
     * API key sent to the permissions API in {@code x-api-key}.
     */
    String permissionsApiKey();

    /**
     * Identity cache location.
     *
     * <p>{@code redis://} and {@code rediss://} URLs select the Redis store;
     * {@code memory:} selects a process-local store.
     *
     * @return cache URL (default: redis://localhost:6379/0)
     */
    @WithDefault("redis://localhost:6379/0")
    String cacheUrl();

    /**
     * TTL for cached permission sets.
     *
     * @return TTL duration (default: 5 minutes)
     */
    @WithDefault("PT300S")
    Duration permissionCacheTtl();

    /**
     * Maximum age of the held key set before it is refetched on access.
     *
     * @return TTL duration (default: 1 hour)
     */
    @WithDefault("PT3600S")
    Duration keySetCacheTtl();

    /**
     * Whether identity headers are injected before downstream invocations.
     */
    @WithDefault("true")
    boolean enableHeaderPropagation();

    /**
     * Leeway applied to exp, nbf and iat checks.
     *
     * @return clock skew tolerance (default: 5 minutes)
     */
    @WithDefault("PT300S")
    Duration clockSkewTolerance();

    /**
     * Maximum time to wait for the key set document.
     *
     * @return fetch timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration keySetFetchTimeout();

    /**
     * How long a stale key set keeps being served after a failed refresh before the next
     * TTL-driven fetch. Lookups of an unknown key id still force a refresh.
     *
     * @return backoff duration (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration keySetRetryBackoff();

    /**
     * Maximum time to wait for the permissions API.
     *
     * @return request timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration permissionsApiTimeout();

    /**
     * Maximum time for a single cache read, write or delete.
     *
     * @return operation timeout (default: 2 seconds)
     */
    @WithDefault("PT2S")
    Duration cacheOperationTimeout();

    /**
     * How long a key id still missing after a forced refresh is remembered as unknown.
     *
     * <p>Set to zero to disable.
     *
     * @return TTL duration (default: 60 seconds)
     */
    @WithDefault("PT60S")
    Duration unknownKeyCacheTtl();

    /**
     * Behaviour when permissions cannot be resolved for an otherwise valid token.
     */
    @WithDefault("open")
    FailMode failMode();

    /**
     * Permissions granted to every caller that has at least one customer.
     */
    @WithDefault("read:metrics,read:logs")
    List<String> defaultPermissions();

    /**
     * Share one in-flight downstream fetch between concurrent cache misses for the same email.
     */
    @WithDefault("false")
    boolean coalescePermissionFetches();

    /**
     * Cache validated token claims so repeated requests skip signature verification.
     */
    @WithDefault("false")
    boolean tokenResultCacheEnabled();

    /**
     * Upper bound for cached token claims; entries never outlive the token.
     *
     * @return TTL duration (default: 60 seconds)
     */
    @WithDefault("PT60S")
    Duration tokenResultCacheTtl();

    /**
     * Whether Micrometer meters are recorded.
     */
    @WithDefault("true")
    boolean metricsEnabled();

    /**
     * Issuer every token must carry in {@code iss}.
     *
     * @return the override, or the issuer derived from region and user pool
     */
    default String issuer() {
        return providerIssuer()
                .filter(issuer -> !issuer.isBlank())
                .map(issuer -> issuer.endsWith("/") ? issuer.substring(0, issuer.length() - 1) : issuer)
                .orElseGet(() -> String.format(ISSUER_TEMPLATE, providerRegion(), providerUserPoolId()));
    }

    /**
     * Location of the provider's published key set.
     */
    default URI jwksUri() {
        return URI.create(issuer() + JWKS_PATH);
    }

    /**
     * Policy applied when the permissions API fails.
     */
    enum FailMode {
        /** Continue the request without an identity. */
        OPEN,
        /** Abort the authentication chain. */
        CLOSED
    }
}
