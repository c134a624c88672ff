package warden.core.service.auth;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.core.model.auth.UserPermissions;
import warden.core.port.out.Metrics;

/**
 * Cache-aside resolution of permission snapshots.
 *
 * <p>A hit returns the cached snapshot without calling the fetch function. A miss calls it
 * exactly once and stores the result with the configured TTL. Fetch failures propagate and
 * leave the cache untouched.
 *
 * <p>When {@code warden.coalesce-permission-fetches} is set, concurrent misses for the same
 * email share one in-flight fetch.
 */
public class PermissionResolver {

    private static final Logger LOG = Logger.getLogger(PermissionResolver.class);

    private final PermissionCache cache;
    private final Metrics metrics;
    private final boolean coalesce;
    private final Map<String, Uni<UserPermissions>> inFlightFetches = new ConcurrentHashMap<>();

    public PermissionResolver(PermissionCache cache, WardenConfig config, Metrics metrics) {
        this.cache = cache;
        this.metrics = metrics;
        this.coalesce = config.coalescePermissionFetches();
    }

    public Uni<UserPermissions> resolve(String email, Supplier<Uni<UserPermissions>> fetch) {
        return cache.get(email).flatMap(cached -> {
            if (cached.isPresent()) {
                LOG.debugv("Permission cache hit for {0}", email);
                metrics.recordPermissionCacheHit();
                return Uni.createFrom().item(cached.get());
            }
            LOG.debugv("Permission cache miss for {0}", email);
            metrics.recordPermissionCacheMiss();
            return coalesce ? coalescedFetch(email, fetch) : fetchAndStore(email, fetch);
        });
    }

    public Uni<Boolean> invalidate(String email) {
        LOG.debugv("Invalidating cached permissions for {0}", email);
        return cache.invalidate(email);
    }

    private Uni<UserPermissions> coalescedFetch(String email, Supplier<Uni<UserPermissions>> fetch) {
        final var key = email.toLowerCase(Locale.ROOT);
        return Uni.createFrom().deferred(() -> inFlightFetches.computeIfAbsent(key, k -> fetchAndStore(email, fetch)
                .onTermination()
                .invoke(() -> inFlightFetches.remove(k))
                .memoize()
                .indefinitely()));
    }

    private Uni<UserPermissions> fetchAndStore(String email, Supplier<Uni<UserPermissions>> fetch) {
        return Uni.createFrom()
                .deferred(fetch::get)
                .flatMap(permissions -> cache.put(email, permissions).replaceWith(permissions));
    }
}
