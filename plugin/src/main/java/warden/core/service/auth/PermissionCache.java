package warden.core.service.auth;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.core.cache.CacheNamespace;
import warden.core.cache.JsonCacheCodec;
import warden.core.cache.NamespacedCache;
import warden.core.model.auth.UserPermissions;
import warden.core.port.out.IdentityCacheStore;
import warden.core.port.out.Metrics;

/**
 * Permission snapshots in the identity cache, keyed by email.
 *
 * <h2>Key Structure</h2>
 * <ul>
 *   <li>{@code warden:auth:permissions:{hash}} - JSON snapshot, hash of the lowercased email</li>
 * </ul>
 *
 * <p>Store failures never propagate: reads degrade to a miss, writes and deletes are logged.
 * Undecodable entries and entries recorded for another email are treated as a miss.
 */
public class PermissionCache {

    private static final Logger LOG = Logger.getLogger(PermissionCache.class);

    static final String CACHE_NAME = "permissions";

    private final NamespacedCache<UserPermissions> entries;
    private final Duration defaultTtl;

    public PermissionCache(IdentityCacheStore store, WardenConfig config, Metrics metrics) {
        this.entries = new NamespacedCache<>(
                CACHE_NAME,
                CacheNamespace.PERMISSIONS,
                new JsonCacheCodec<>(UserPermissions.class),
                store,
                config.cacheOperationTimeout(),
                metrics);
        this.defaultTtl = config.permissionCacheTtl();
    }

    public Uni<Optional<UserPermissions>> get(String email) {
        return entries.get(email).map(cached -> cached.filter(permissions -> belongsTo(permissions, email)));
    }

    public Uni<Void> put(String email, UserPermissions permissions) {
        return put(email, permissions, defaultTtl);
    }

    public Uni<Void> put(String email, UserPermissions permissions, Duration ttl) {
        return entries.put(email, permissions, ttl);
    }

    /**
     * Remove the snapshot for an email.
     *
     * @return true if an entry was removed
     */
    public Uni<Boolean> invalidate(String email) {
        return entries.remove(email);
    }

    private static boolean belongsTo(UserPermissions permissions, String email) {
        if (permissions.email().equalsIgnoreCase(email)) {
            return true;
        }
        LOG.warnv("Cached permissions belong to a different email, ignoring entry for {0}", email);
        return false;
    }
}
