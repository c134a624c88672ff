package warden.adapter.in.plugin;

import java.time.Clock;
import java.util.Locale;

import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import warden.adapter.out.auth.JwtTokenValidator;
import warden.adapter.out.http.RemotePermissionsClient;
import warden.adapter.out.storage.memory.InMemoryIdentityCacheStore;
import warden.adapter.out.storage.redis.RedisIdentityCacheStore;
import warden.adapter.out.telemetry.AuthMetrics;
import warden.config.WardenConfig;
import warden.config.WardenConfigLoader;
import warden.core.port.out.IdentityCacheStore;
import warden.core.service.auth.HeaderPropagationService;
import warden.core.service.auth.IdentityResolutionService;
import warden.core.service.auth.JwksCacheService;
import warden.core.service.auth.PermissionCache;
import warden.core.service.auth.PermissionResolver;
import warden.core.service.auth.TokenResultCache;

/**
 * Assembles a {@link WardenAuthPlugin} from configuration.
 *
 * <p>The host owns the Vert.x instance and the meter registry; the plugin owns everything
 * created here and releases it on {@link WardenAuthPlugin#shutdown()}.
 */
public final class WardenPluginFactory {

    private static final Logger LOG = Logger.getLogger(WardenPluginFactory.class);

    static final String MEMORY_SCHEME = "memory:";

    private WardenPluginFactory() {}

    /**
     * Build a plugin from default configuration sources (system properties, environment,
     * {@code META-INF/microprofile-config.properties}).
     */
    public static WardenAuthPlugin fromEnvironment(Vertx vertx, MeterRegistry registry) {
        return create(WardenConfigLoader.fromEnvironment(), vertx, registry);
    }

    /**
     * Build a plugin.
     *
     * @param config   plugin configuration
     * @param vertx    Vert.x instance for HTTP and Redis clients
     * @param registry meter registry, may be null to disable metrics
     */
    public static WardenAuthPlugin create(WardenConfig config, Vertx vertx, MeterRegistry registry) {
        return create(config, vertx, registry, Clock.systemUTC());
    }

    static WardenAuthPlugin create(WardenConfig config, Vertx vertx, MeterRegistry registry, Clock clock) {
        final var metrics = new AuthMetrics(registry, config.metricsEnabled());
        final var cacheStore = createCacheStore(config, vertx);

        final var jwksCache = new JwksCacheService(vertx, config, cacheStore, metrics, clock);
        final var tokenValidator = new JwtTokenValidator(jwksCache, config, clock);
        final var permissionsClient = new RemotePermissionsClient(vertx, config, metrics);
        final var permissionResolver =
                new PermissionResolver(new PermissionCache(cacheStore, config, metrics), config, metrics);
        final var tokenResultCache = new TokenResultCache(cacheStore, config, metrics, clock);

        final var identityResolutionService = new IdentityResolutionService(
                tokenValidator, tokenResultCache, permissionResolver, permissionsClient);

        LOG.debugv("Assembled identity plugin with {0} identity cache", cacheStore.name());
        return new WardenAuthPlugin(
                config,
                jwksCache,
                permissionsClient,
                cacheStore,
                identityResolutionService,
                new HeaderPropagationService(config),
                metrics);
    }

    static IdentityCacheStore createCacheStore(WardenConfig config, Vertx vertx) {
        final var url = config.cacheUrl();
        if (url.toLowerCase(Locale.ROOT).startsWith(MEMORY_SCHEME)) {
            return new InMemoryIdentityCacheStore();
        }
        return RedisIdentityCacheStore.create(vertx, url);
    }
}
