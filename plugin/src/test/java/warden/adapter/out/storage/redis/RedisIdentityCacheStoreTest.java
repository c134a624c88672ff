package warden.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.mutiny.redis.client.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("RedisIdentityCacheStore")
@ExtendWith(MockitoExtension.class)
class RedisIdentityCacheStoreTest {

    @Mock
    private Redis redis;

    @Mock
    private RedisAPI api;

    @Mock
    private Response response;

    private RedisIdentityCacheStore store;

    @BeforeEach
    void setUp() {
        store = new RedisIdentityCacheStore(redis, api);
    }

    @Nested
    @DisplayName("Commands")
    class Commands {

        @Test
        @DisplayName("should map GET responses to optional values")
        void shouldGet() {
            when(response.toString()).thenReturn("{\"email\":\"a@x.com\"}");
            when(api.get("hit")).thenReturn(Uni.createFrom().item(response));
            when(api.get("miss")).thenReturn(Uni.createFrom().nullItem());

            assertEquals(Optional.of("{\"email\":\"a@x.com\"}"), store.get("hit").await().indefinitely());
            assertTrue(store.get("miss").await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should write with SETEX in whole seconds")
        void shouldSetWithTtl() {
            when(api.setex("key", "300", "value")).thenReturn(Uni.createFrom().item(response));

            store.set("key", "value", Duration.ofSeconds(300)).await().indefinitely();

            verify(api).setex("key", "300", "value");
        }

        @Test
        @DisplayName("should report deleted entries")
        void shouldDelete() {
            when(response.toInteger()).thenReturn(1, 0);
            when(api.del(List.of("key"))).thenReturn(Uni.createFrom().item(response));

            assertTrue(store.delete("key").await().indefinitely());
            assertFalse(store.delete("key").await().indefinitely());
        }

        @Test
        @DisplayName("should ping")
        void shouldPing() {
            when(response.toString()).thenReturn("PONG");
            when(api.ping(List.of())).thenReturn(Uni.createFrom().item(response));

            assertTrue(store.ping().await().indefinitely());
        }
    }

    @Test
    @DisplayName("should round TTLs up to whole seconds with a one second minimum")
    void shouldRoundTtl() {
        assertEquals(1, RedisIdentityCacheStore.ttlSeconds(Duration.ZERO));
        assertEquals(1, RedisIdentityCacheStore.ttlSeconds(Duration.ofMillis(10)));
        assertEquals(2, RedisIdentityCacheStore.ttlSeconds(Duration.ofMillis(1500)));
        assertEquals(60, RedisIdentityCacheStore.ttlSeconds(Duration.ofSeconds(60)));
    }

    @Test
    @DisplayName("should close the connection once")
    void shouldCloseOnce() {
        store.close();
        store.close();

        verify(redis, times(1)).close();
    }
}
