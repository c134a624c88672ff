package warden.adapter.out.storage.memory;

import java.time.Duration;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.smallrye.mutiny.Uni;

import warden.core.port.out.IdentityCacheStore;

/**
 * Caffeine-backed identity cache store for single-instance deployments and tests.
 *
 * <p>
 * Selected with a {@code memory:} cache URL. Each entry expires after the TTL given
 * when it was written; reads do not extend it.
 */
public class InMemoryIdentityCacheStore implements IdentityCacheStore {

    static final long DEFAULT_MAX_ENTRIES = 10_000;

    private final Cache<String, Entry> cache;

    public InMemoryIdentityCacheStore() {
        this(DEFAULT_MAX_ENTRIES, Ticker.systemTicker());
    }

    /**
     * @param maxEntries the maximum number of entries in the cache
     * @param ticker     time source for expiry
     */
    public InMemoryIdentityCacheStore(long maxEntries, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfter(new PerEntryExpiry())
                .maximumSize(maxEntries)
                .ticker(ticker)
                .build();
    }

    /**
     * Expiry policy that honours the TTL stored with each entry.
     */
    private static class PerEntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return Uni.createFrom().item(() -> Optional.ofNullable(cache.getIfPresent(key)).map(Entry::value));
    }

    @Override
    public Uni<Void> set(String key, String value, Duration ttl) {
        return Uni.createFrom().item(() -> {
            cache.put(key, new Entry(value, Math.max(1, ttl.toNanos())));
            return null;
        });
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return Uni.createFrom().item(() -> cache.asMap().remove(key) != null);
    }

    @Override
    public Uni<Boolean> ping() {
        return Uni.createFrom().item(true);
    }

    @Override
    public void close() {
        cache.invalidateAll();
    }

    private record Entry(String value, long ttlNanos) {}
}
