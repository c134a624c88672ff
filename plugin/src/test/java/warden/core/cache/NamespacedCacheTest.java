package warden.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.adapter.out.storage.memory.InMemoryIdentityCacheStore;
import warden.core.port.out.IdentityCacheStore;
import warden.core.port.out.Metrics;

@DisplayName("NamespacedCache")
@ExtendWith(MockitoExtension.class)
class NamespacedCacheTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);
    private static final String CACHE_NAME = "unknown-keys";
    private static final String KEY_ID = "key-9";
    private static final Instant RECORDED_AT = Instant.parse("2026-01-15T10:00:00Z");

    @Mock
    private Metrics metrics;

    @Mock
    private IdentityCacheStore failingStore;

    private InMemoryIdentityCacheStore store;
    private NamespacedCache<Instant> cache;

    @BeforeEach
    void setUp() {
        store = new InMemoryIdentityCacheStore();
        cache = cacheOver(store);
    }

    private NamespacedCache<Instant> cacheOver(IdentityCacheStore backing) {
        return new NamespacedCache<>(
                CACHE_NAME, CacheNamespace.KEY_SET, new JsonCacheCodec<>(Instant.class), backing, TIMEOUT, metrics);
    }

    private void storeRaw(String payload) {
        store.set(CacheNamespace.KEY_SET.key(KEY_ID), payload, Duration.ofMinutes(1)).await().indefinitely();
    }

    @Nested
    @DisplayName("Healthy store")
    class HealthyStore {

        @Test
        @DisplayName("should store entries under the namespaced key")
        void shouldStoreUnderNamespacedKey() {
            cache.put(KEY_ID, RECORDED_AT, Duration.ofMinutes(1)).await().indefinitely();

            assertEquals(
                    Optional.of("\"2026-01-15T10:00:00Z\""),
                    store.get(CacheNamespace.KEY_SET.key(KEY_ID)).await().indefinitely());
            assertEquals(Optional.of(RECORDED_AT), cache.get(KEY_ID).await().indefinitely());
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("should report whether remove deleted an entry")
        void shouldReportRemoval() {
            cache.put(KEY_ID, RECORDED_AT, Duration.ofMinutes(1)).await().indefinitely();

            assertTrue(cache.remove(KEY_ID).await().indefinitely());
            assertFalse(cache.remove(KEY_ID).await().indefinitely());
        }

        @Test
        @DisplayName("should read a missing entry as a miss without counting a failure")
        void shouldReadMissingAsMiss() {
            assertTrue(cache.get(KEY_ID).await().indefinitely().isEmpty());
            verify(metrics, never()).recordCacheFailure(anyString(), anyString());
        }
    }

    @Nested
    @DisplayName("Undecodable entries")
    class UndecodableEntries {

        @Test
        @DisplayName("should read JSON null as a miss")
        void shouldReadJsonNullAsMiss() {
            storeRaw("null");

            assertTrue(cache.get(KEY_ID).await().indefinitely().isEmpty());
            verify(metrics).recordCacheFailure(CACHE_NAME, "decode");
        }

        @Test
        @DisplayName("should read malformed JSON as a miss")
        void shouldReadMalformedAsMiss() {
            storeRaw("{\"truncated");

            assertTrue(cache.get(KEY_ID).await().indefinitely().isEmpty());
            verify(metrics).recordCacheFailure(CACHE_NAME, "decode");
        }

        @Test
        @DisplayName("should read a value that does not parse as a miss")
        void shouldReadUnparseableValueAsMiss() {
            storeRaw("\"yesterday\"");

            assertTrue(cache.get(KEY_ID).await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("Degraded store")
    class DegradedStore {

        @Test
        @DisplayName("should turn a slow read into a miss")
        void shouldTurnTimeoutIntoMiss() {
            when(failingStore.get(anyString())).thenReturn(Uni.createFrom().nothing());

            final var result = cacheOver(failingStore).get(KEY_ID).await().atMost(Duration.ofSeconds(2));

            assertTrue(result.isEmpty());
            verify(metrics).recordCacheFailure(CACHE_NAME, "get");
        }

        @Test
        @DisplayName("should turn a null store item into a miss")
        void shouldTurnNullItemIntoMiss() {
            when(failingStore.get(anyString())).thenReturn(Uni.createFrom().nullItem());

            assertTrue(cacheOver(failingStore).get(KEY_ID).await().indefinitely().isEmpty());
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("should drop failed writes")
        void shouldDropFailedWrites() {
            when(failingStore.set(anyString(), anyString(), any(Duration.class)))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("read-only replica")));

            cacheOver(failingStore).put(KEY_ID, RECORDED_AT, Duration.ofMinutes(1)).await().indefinitely();

            verify(metrics).recordCacheFailure(CACHE_NAME, "set");
        }

        @Test
        @DisplayName("should report false when delete fails")
        void shouldReportFalseOnFailedDelete() {
            when(failingStore.delete(anyString()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("connection reset")));

            assertFalse(cacheOver(failingStore).remove(KEY_ID).await().indefinitely());
            verify(metrics).recordCacheFailure(CACHE_NAME, "delete");
        }

        @Test
        @DisplayName("should tolerate a missing metrics sink")
        void shouldTolerateNullMetrics() {
            when(failingStore.get(anyString()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("down")));
            final var withoutMetrics = new NamespacedCache<>(
                    CACHE_NAME, CacheNamespace.KEY_SET, new JsonCacheCodec<>(Instant.class), failingStore, TIMEOUT, null);

            assertTrue(withoutMetrics.get(KEY_ID).await().indefinitely().isEmpty());
        }
    }
}
