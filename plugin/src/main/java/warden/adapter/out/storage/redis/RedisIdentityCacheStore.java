package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.RedisAPI;
import org.jboss.logging.Logger;

import warden.core.port.out.IdentityCacheStore;

/**
 * Redis implementation of the identity cache store.
 *
 * <p>Shared between gateway instances. Values are plain strings written with
 * {@code SETEX}; TTLs are rounded up to whole seconds with a minimum of one second.
 *
 * <h2>Commands</h2>
 * <ul>
 *   <li>{@code GET key}</li>
 *   <li>{@code SETEX key seconds value}</li>
 *   <li>{@code DEL key}</li>
 *   <li>{@code PING}</li>
 * </ul>
 */
public class RedisIdentityCacheStore implements IdentityCacheStore {

    private static final Logger LOG = Logger.getLogger(RedisIdentityCacheStore.class);
    private static final String PONG = "PONG";

    private final Redis redis;
    private final RedisAPI api;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RedisIdentityCacheStore(Redis redis, RedisAPI api) {
        this.redis = redis;
        this.api = api;
    }

    /**
     * Create a store connected to the given Redis URL, e.g. {@code redis://cache:6379/0}.
     */
    public static RedisIdentityCacheStore create(Vertx vertx, String url) {
        final var redis = Redis.createClient(vertx, url);
        return new RedisIdentityCacheStore(redis, RedisAPI.api(redis));
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return api.get(key).map(response -> response == null ? Optional.empty() : Optional.of(response.toString()));
    }

    @Override
    public Uni<Void> set(String key, String value, Duration ttl) {
        return api.setex(key, String.valueOf(ttlSeconds(ttl)), value).replaceWithVoid();
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return api.del(List.of(key)).map(response -> response != null && response.toInteger() > 0);
    }

    @Override
    public Uni<Boolean> ping() {
        return api.ping(List.of()).map(response -> response != null && PONG.equalsIgnoreCase(response.toString()));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOG.debug("Closing Redis identity cache connection");
            redis.close();
        }
    }

    static long ttlSeconds(Duration ttl) {
        final var seconds = ttl.getSeconds() + (ttl.getNano() > 0 ? 1 : 0);
        return Math.max(1, seconds);
    }
}
