package warden.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.exception.CacheException;
import warden.core.port.out.IdentityCacheStore;
import warden.core.port.out.Metrics;

/**
 * Typed view of one namespace in the identity cache store.
 *
 * <p>The identity cache only accelerates lookups, so no call on this view fails. A store that is
 * slow or down, or an entry that does not decode to a value, reads as a miss. Failed writes are
 * dropped and failed removals report {@code false}. Each degraded call is logged and counted
 * against the view's cache name with the operation ({@code get}, {@code set}, {@code delete} or
 * {@code decode}).
 *
 * @param <T> the cached value type
 */
public class NamespacedCache<T> {

    private static final Logger LOG = Logger.getLogger(NamespacedCache.class);

    static final String DECODE_OPERATION = "decode";

    private final String cacheName;
    private final CacheNamespace namespace;
    private final CacheCodec<T> codec;
    private final IdentityCacheStore store;
    private final Duration operationTimeout;
    private final Metrics metrics;

    /**
     * @param cacheName        name used in logs and the {@code cache} metric tag
     * @param namespace        key namespace of the entries
     * @param codec            entry encoding
     * @param store            backing identity cache store
     * @param operationTimeout upper bound for a single store call
     * @param metrics          failure counters, may be null
     */
    public NamespacedCache(
            String cacheName,
            CacheNamespace namespace,
            CacheCodec<T> codec,
            IdentityCacheStore store,
            Duration operationTimeout,
            Metrics metrics) {
        this.cacheName = cacheName;
        this.namespace = namespace;
        this.codec = codec;
        this.store = store;
        this.operationTimeout = operationTimeout;
        this.metrics = metrics;
    }

    public String cacheName() {
        return cacheName;
    }

    /**
     * Read the entry for an identity.
     *
     * @param identity email, key id or token
     * @return the decoded value, or empty on a miss
     */
    public Uni<Optional<T>> get(String identity) {
        final Uni<Optional<String>> read = Uni.createFrom()
                .deferred(() -> store.get(namespace.key(identity)))
                .map(payload -> payload != null ? payload : Optional.<String>empty());
        return bounded(read, "get", Optional::empty).map(payload -> payload.flatMap(this::decode));
    }

    /**
     * Store an entry. Encoding and store failures are logged and dropped.
     */
    public Uni<Void> put(String identity, T value, Duration ttl) {
        final Uni<Void> write = Uni.createFrom()
                .deferred(() -> store.set(namespace.key(identity), codec.encode(value), ttl));
        return bounded(write, "set", () -> null);
    }

    /**
     * Remove the entry for an identity.
     *
     * @return true if an entry was removed; false when absent or when the store failed
     */
    public Uni<Boolean> remove(String identity) {
        final Uni<Boolean> delete = Uni.createFrom()
                .deferred(() -> store.delete(namespace.key(identity)))
                .map(Boolean.TRUE::equals);
        return bounded(delete, "delete", () -> false);
    }

    private Optional<T> decode(String payload) {
        try {
            final var value = codec.decode(payload);
            if (value == null) {
                LOG.warnv("Entry without a value in {0} cache, treating as a miss", cacheName);
                recordFailure(DECODE_OPERATION);
            }
            return Optional.ofNullable(value);
        } catch (RuntimeException e) {
            LOG.warnv("Undecodable entry in {0} cache, treating as a miss: {1}", cacheName, e.getMessage());
            recordFailure(DECODE_OPERATION);
            return Optional.empty();
        }
    }

    private <R> Uni<R> bounded(Uni<R> operation, String operationName, Supplier<R> fallback) {
        return operation
                .ifNoItem()
                .after(operationTimeout)
                .failWith(() -> new CacheException(operationName + " timed out after " + operationTimeout, null))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Identity cache {0} failed in {1} cache, continuing without it: {2}",
                            operationName, cacheName, error.getMessage());
                    recordFailure(operationName);
                    return fallback.get();
                });
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordCacheFailure(cacheName, operationName);
        }
    }
}
