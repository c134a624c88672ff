package warden.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port for the shared TTL key/value store behind the identity caches.
 *
 * <p>Keys arrive already namespaced and hashed. Values are opaque strings (JSON).
 * Implementations may fail any operation; callers treat failures as misses.
 */
public interface IdentityCacheStore {

    /**
     * Read a value.
     *
     * @param key the cache key
     * @return the value, or empty when absent or expired
     */
    Uni<Optional<String>> get(String key);

    /**
     * Write a value that expires after the given TTL.
     *
     * @param key   the cache key
     * @param value the value
     * @param ttl   time-to-live, must be positive
     */
    Uni<Void> set(String key, String value, Duration ttl);

    /**
     * Delete a value.
     *
     * @param key the cache key
     * @return true when an entry existed
     */
    Uni<Boolean> delete(String key);

    /**
     * Check that the store is reachable.
     *
     * @return true when the store answered
     */
    Uni<Boolean> ping();

    /**
     * Human-readable backend name for logging.
     */
    String name();

    /**
     * Release connections. Safe to call more than once.
     */
    void close();
}
