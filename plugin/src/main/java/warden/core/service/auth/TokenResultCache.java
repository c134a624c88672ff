package warden.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.config.WardenConfig;
import warden.core.cache.CacheNamespace;
import warden.core.cache.JsonCacheCodec;
import warden.core.cache.NamespacedCache;
import warden.core.model.auth.TokenClaims;
import warden.core.port.out.IdentityCacheStore;
import warden.core.port.out.Metrics;

/**
 * Claims of recently validated tokens, keyed by a hash of the raw token.
 *
 * <p>Disabled unless {@code warden.token-result-cache-enabled} is set. An entry lives for the
 * configured TTL or until the token expires, whichever comes first.
 */
public class TokenResultCache {

    static final String CACHE_NAME = "token-results";

    private final NamespacedCache<TokenClaims> entries;
    private final boolean enabled;
    private final Duration ttl;
    private final Clock clock;

    public TokenResultCache(IdentityCacheStore store, WardenConfig config, Metrics metrics, Clock clock) {
        this.entries = new NamespacedCache<>(
                CACHE_NAME,
                CacheNamespace.TOKEN_RESULT,
                new JsonCacheCodec<>(TokenClaims.class),
                store,
                config.cacheOperationTimeout(),
                metrics);
        this.enabled = config.tokenResultCacheEnabled();
        this.ttl = config.tokenResultCacheTtl();
        this.clock = clock;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Uni<Optional<TokenClaims>> get(String token) {
        if (!enabled) {
            return Uni.createFrom().item(Optional.empty());
        }
        return entries.get(token).map(cached -> cached.filter(claims -> claims.expiresAt() != null
                && claims.expiresAt().isAfter(clock.instant())));
    }

    public Uni<Void> put(String token, TokenClaims claims) {
        if (!enabled || claims.expiresAt() == null) {
            return Uni.createFrom().voidItem();
        }
        final var remaining = Duration.between(clock.instant(), claims.expiresAt());
        final var entryTtl = remaining.compareTo(ttl) < 0 ? remaining : ttl;
        if (entryTtl.isZero() || entryTtl.isNegative()) {
            return Uni.createFrom().voidItem();
        }
        return entries.put(token, claims, entryTtl);
    }
}
