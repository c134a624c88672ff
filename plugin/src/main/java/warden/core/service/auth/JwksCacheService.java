package warden.core.service.auth;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.json.JsonUtil;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.lang.JoseException;

import warden.config.WardenConfig;
import warden.core.cache.CacheNamespace;
import warden.core.cache.JsonCacheCodec;
import warden.core.cache.NamespacedCache;
import warden.core.exception.KeyNotFoundException;
import warden.core.exception.KeySetFetchException;
import warden.core.model.auth.KeySet;
import warden.core.model.auth.SigningKey;
import warden.core.port.out.IdentityCacheStore;
import warden.core.port.out.JwksCache;
import warden.core.port.out.Metrics;

/**
 * Holds the identity provider's JSON Web Key Set.
 *
 * <p>Features:
 * <ul>
 *   <li>Lazy refresh once the held set is older than the configured TTL</li>
 *   <li>Stale-but-available fallback when a refresh fails, with a backoff before the next
 *       TTL-driven attempt</li>
 *   <li>One forced refresh per lookup when a key id is missing (key rotation)</li>
 *   <li>Key ids still missing from a successfully fetched set remembered in the identity cache
 *       to bound forced refreshes</li>
 *   <li>Thundering herd protection via request coalescing</li>
 * </ul>
 *
 * <p>Thread-safety: the held set is replaced atomically and never mutated, so readers
 * always see a complete set.
 */
public class JwksCacheService implements JwksCache {

    private static final Logger LOG = Logger.getLogger(JwksCacheService.class);
    private static final String KEYS_FIELD = "keys";

    static final String UNKNOWN_KEYS_CACHE = "jwks";

    private final WebClient webClient;
    private final URI jwksUri;
    private final Duration cacheTtl;
    private final Duration fetchTimeout;
    private final Duration retryBackoff;
    private final Duration unknownKeyTtl;
    private final NamespacedCache<Instant> unknownKeys;
    private final Metrics metrics;
    private final Clock clock;

    private final AtomicReference<KeySet> current = new AtomicReference<>();
    private final AtomicReference<Instant> retryNotBefore = new AtomicReference<>(Instant.MIN);
    private final Map<URI, Uni<Fetch>> inFlightFetches = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JwksCacheService(
            Vertx vertx, WardenConfig config, IdentityCacheStore cacheStore, Metrics metrics, Clock clock) {
        this.webClient = WebClient.create(vertx);
        this.jwksUri = config.jwksUri();
        this.cacheTtl = config.keySetCacheTtl();
        this.fetchTimeout = config.keySetFetchTimeout();
        this.retryBackoff = config.keySetRetryBackoff();
        this.unknownKeyTtl = config.unknownKeyCacheTtl();
        this.unknownKeys = cacheStore == null
                ? null
                : new NamespacedCache<>(
                        UNKNOWN_KEYS_CACHE,
                        CacheNamespace.KEY_SET,
                        new JsonCacheCodec<>(Instant.class),
                        cacheStore,
                        config.cacheOperationTimeout(),
                        metrics);
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Uni<SigningKey> getKey(String keyId) {
        return lookup().flatMap(lookup -> {
            final var key = lookup.keySet().find(keyId);
            if (key.isPresent()) {
                return Uni.createFrom().item(key.get());
            }
            if (lookup.fetch() != null) {
                // This lookup already went to the provider; a second fetch would not change the answer
                return keyNotFound(keyId, lookup.fetch());
            }
            return retryWithRefresh(keyId);
        });
    }

    @Override
    public Uni<KeySet> refresh() {
        LOG.debugv("Refreshing JWKS from {0}", jwksUri);
        return getOrCreateFetch().map(Fetch::keySet);
    }

    @Override
    public Optional<KeySet> currentKeySet() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOG.debug("Closing JWKS web client");
            webClient.close();
        }
    }

    private Uni<Lookup> lookup() {
        return Uni.createFrom().deferred(() -> {
            final var held = current.get();
            final var now = clock.instant();
            if (held != null && !held.isOlderThan(cacheTtl, now)) {
                return Uni.createFrom().item(new Lookup(held, null));
            }
            if (held != null && now.isBefore(retryNotBefore.get())) {
                LOG.debugv("JWKS refresh backing off until {0}, serving stale set", retryNotBefore.get());
                return Uni.createFrom().item(new Lookup(held, null));
            }
            LOG.debugv("JWKS missing or older than {0}, fetching", cacheTtl);
            return getOrCreateFetch().map(fetch -> new Lookup(fetch.keySet(), fetch));
        });
    }

    private Uni<SigningKey> retryWithRefresh(String keyId) {
        return isKnownUnknown(keyId).flatMap(known -> {
            if (known) {
                LOG.debugv("Key {0} recently confirmed unknown, skipping refresh", keyId);
                return Uni.createFrom().failure(new KeyNotFoundException(keyId));
            }
            LOG.infov("Key {0} not found, refreshing JWKS from {1}", keyId, jwksUri);
            return getOrCreateFetch().flatMap(fetch -> fetch.keySet()
                    .find(keyId)
                    .map(key -> Uni.createFrom().item(key))
                    .orElseGet(() -> keyNotFound(keyId, fetch)));
        });
    }

    /**
     * Fail the lookup. The key id is remembered as unknown only when the provider actually
     * served a set without it; after a failed fetch it may belong to a rotation not yet seen.
     */
    private Uni<SigningKey> keyNotFound(String keyId, Fetch fetch) {
        final Uni<Void> remember = fetch.installed() ? rememberUnknown(keyId) : Uni.createFrom().voidItem();
        return remember.replaceWith(Uni.createFrom().failure(new KeyNotFoundException(keyId)));
    }

    /**
     * Get an existing in-flight fetch or create a new one.
     * This prevents thundering herd by coalescing concurrent requests.
     */
    private Uni<Fetch> getOrCreateFetch() {
        return Uni.createFrom().deferred(() -> inFlightFetches.computeIfAbsent(jwksUri, uri -> createFetch()));
    }

    private Uni<Fetch> createFetch() {
        return fetchAndInstall()
                .onTermination()
                .invoke(() -> inFlightFetches.remove(jwksUri))
                .memoize()
                .indefinitely();
    }

    private Uni<Fetch> fetchAndInstall() {
        LOG.infov("Fetching JWKS from {0}", jwksUri);

        return webClient
                .getAbs(jwksUri.toString())
                .ssl("https".equals(jwksUri.getScheme()))
                .putHeader("Accept", "application/json")
                .send()
                .ifNoItem()
                .after(fetchTimeout)
                .failWith(() -> {
                    LOG.warnv("JWKS fetch timeout for {0} after {1}", jwksUri, fetchTimeout);
                    return new KeySetFetchException("Timeout fetching JWKS from " + jwksUri);
                })
                .map(this::parseResponse)
                .map(keySet -> {
                    current.set(keySet);
                    retryNotBefore.set(Instant.MIN);
                    metrics.recordKeySetRefresh("success");
                    LOG.infov("Cached {0} keys from {1}", keySet.size(), jwksUri);
                    return new Fetch(keySet, true);
                })
                .onFailure()
                .recoverWithUni(error -> {
                    final var stale = current.get();
                    if (stale != null) {
                        final var retryAt = clock.instant().plus(retryBackoff);
                        retryNotBefore.set(retryAt);
                        LOG.warnv(
                                "Using stale cached JWKS for {0} until {1} due to: {2}",
                                jwksUri, retryAt, error.getMessage());
                        metrics.recordKeySetRefresh("stale");
                        return Uni.createFrom().item(new Fetch(stale, false));
                    }
                    LOG.errorv(error, "Failed to fetch JWKS from {0}", jwksUri);
                    metrics.recordKeySetRefresh("failure");
                    return Uni.createFrom().failure(toFetchException(error));
                });
    }

    private KeySet parseResponse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw new KeySetFetchException("JWKS endpoint returned status " + response.statusCode());
        }
        return parseKeySet(response.bodyAsString());
    }

    /**
     * Parse a key set document. Every key must parse, otherwise nothing is installed.
     */
    @SuppressWarnings("unchecked")
    KeySet parseKeySet(String body) {
        if (body == null || body.isBlank()) {
            throw new KeySetFetchException("JWKS response body is empty");
        }
        try {
            final var document = JsonUtil.parseJson(body);
            if (!(document.get(KEYS_FIELD) instanceof List<?> rawKeys) || rawKeys.isEmpty()) {
                throw new KeySetFetchException("JWKS document has no keys");
            }

            final var keys = new ArrayList<SigningKey>(rawKeys.size());
            for (var rawKey : rawKeys) {
                if (!(rawKey instanceof Map<?, ?> params)) {
                    throw new KeySetFetchException("JWKS entry is not an object");
                }
                final var jwk = JsonWebKey.Factory.newJwk((Map<String, Object>) params);
                if (!(jwk instanceof PublicJsonWebKey)) {
                    throw new KeySetFetchException("JWKS entry is not a public key: " + jwk.getKeyType());
                }
                if (jwk.getKeyId() == null || jwk.getKeyId().isBlank()) {
                    throw new KeySetFetchException("JWKS entry is missing 'kid'");
                }
                keys.add(new SigningKey(jwk.getKeyId(), jwk.getAlgorithm(), jwk.getKey()));
            }
            return new KeySet(keys, clock.instant());
        } catch (JoseException e) {
            throw new KeySetFetchException("Failed to parse JWKS response: " + e.getMessage(), e);
        }
    }

    private Uni<Boolean> isKnownUnknown(String keyId) {
        if (!negativeCachingEnabled()) {
            return Uni.createFrom().item(false);
        }
        return unknownKeys.get(keyId).map(Optional::isPresent);
    }

    private Uni<Void> rememberUnknown(String keyId) {
        if (!negativeCachingEnabled()) {
            return Uni.createFrom().voidItem();
        }
        LOG.debugv("Remembering key {0} as unknown for {1}", keyId, unknownKeyTtl);
        return unknownKeys.put(keyId, clock.instant(), unknownKeyTtl);
    }

    private boolean negativeCachingEnabled() {
        return unknownKeys != null && unknownKeyTtl != null && !unknownKeyTtl.isZero() && !unknownKeyTtl.isNegative();
    }

    private static KeySetFetchException toFetchException(Throwable error) {
        if (error instanceof KeySetFetchException fetchException) {
            return fetchException;
        }
        return new KeySetFetchException("Failed to fetch JWKS: " + error.getMessage(), error);
    }

    /**
     * Outcome of one trip to the provider.
     *
     * @param keySet    the set now held
     * @param installed true when the provider served a new set; false when the fetch failed and
     *                  the stale set was kept
     */
    private record Fetch(KeySet keySet, boolean installed) {}

    /**
     * Key set seen by one lookup, with the fetch it triggered (null when served from memory).
     */
    private record Lookup(KeySet keySet, Fetch fetch) {}
}
