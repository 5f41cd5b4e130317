package com.example.tieredcache.api;

import com.example.tieredcache.backend.MockBackend;
import com.example.tieredcache.core.BoundedMemoryCache;
import com.example.tieredcache.refresh.BackgroundRevalidator;
import com.example.tieredcache.refresh.DirectFetchStrategy;
import com.example.tieredcache.remote.EntryCodec;
import com.example.tieredcache.remote.RemoteCacheSettings;
import com.example.tieredcache.remote.RemoteCommandCache;
import com.example.tieredcache.remote.RemoteCommandException;
import com.example.tieredcache.support.InMemoryCommandChannel;
import com.example.tieredcache.support.MutableClock;
import com.example.tieredcache.tiered.TieredCache;
import com.example.tieredcache.tiered.TieredCacheSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CacheControllerTest {

    private final MutableClock clock = new MutableClock();
    private final EntryCodec codec = new EntryCodec(new ObjectMapper());

    private MockBackend backend;
    private TieredCache cache;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        backend = new MockBackend(clock, 0);
        use(RemoteCommandCache.unconfigured(RemoteCacheSettings.defaults(), codec, clock));
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private void use(RemoteCommandCache remote) {
        if (cache != null) {
            cache.close();
        }
        cache = new TieredCache(
            new BoundedMemoryCache(100, Duration.ofMinutes(5), clock),
            remote,
            TieredCacheSettings.defaults(),
            new DirectFetchStrategy(),
            new BackgroundRevalidator(1));
        mvc = MockMvcBuilders.standaloneSetup(new CacheController(cache, backend)).build();
    }

    @Test
    void secondReadIsServedFromCache() throws Exception {
        mvc.perform(get("/item").param("key", "a"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cached").value(false))
            .andExpect(jsonPath("$.value.payload").value("value-for-a"))
            .andExpect(jsonPath("$.value.version").value(1));

        mvc.perform(get("/item").param("key", "a"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cached").value(true))
            .andExpect(jsonPath("$.stale").value(false))
            .andExpect(jsonPath("$.value.version").value(1));

        mvc.perform(get("/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.backendRequests").value(1))
            .andExpect(jsonPath("$.cache.memory.size").value(1));
    }

    @Test
    void forceRefreshFetchesAgain() throws Exception {
        mvc.perform(get("/item").param("key", "a"));

        mvc.perform(get("/item").param("key", "a").param("forceRefresh", "true"))
            .andExpect(jsonPath("$.cached").value(false))
            .andExpect(jsonPath("$.value.version").value(2));
    }

    @Test
    void originFailureIsBadGateway() throws Exception {
        backend.failNext(1);

        mvc.perform(get("/item").param("key", "b"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.key").value("b"))
            .andExpect(jsonPath("$.error").value("Origin unavailable for b"));
    }

    @Test
    void invalidateByTag() throws Exception {
        mvc.perform(get("/item").param("key", "p1").param("tags", "posts"));
        mvc.perform(get("/item").param("key", "p2").param("tags", "posts", "featured"));
        mvc.perform(get("/item").param("key", "u1").param("tags", "users"));

        mvc.perform(post("/invalidate/tag").param("tag", "posts"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value(2));

        mvc.perform(get("/item").param("key", "u1"))
            .andExpect(jsonPath("$.cached").value(true));
    }

    @Test
    void invalidateByPattern() throws Exception {
        mvc.perform(get("/item").param("key", "posts:1:content"));
        mvc.perform(get("/item").param("key", "posts:2:content"));

        mvc.perform(post("/invalidate/pattern").param("regex", "^posts:1:"))
            .andExpect(jsonPath("$.removed").value(1));
    }

    @Test
    void badPatternIsBadRequest() throws Exception {
        mvc.perform(post("/invalidate/pattern").param("regex", "posts:("))
            .andExpect(status().isBadRequest());
    }

    @Test
    void deleteItem() throws Exception {
        mvc.perform(get("/item").param("key", "a"));

        mvc.perform(delete("/item").param("key", "a"))
            .andExpect(jsonPath("$.deleted").value(true));
        mvc.perform(delete("/item").param("key", "a"))
            .andExpect(jsonPath("$.deleted").value(false));
    }

    @Test
    void healthWarnsWithoutRemote() throws Exception {
        mvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("warn"))
            .andExpect(jsonPath("$.message").value("Remote cache not configured (using in-memory cache)"));
    }

    @Test
    void healthPassesWhenConnected() throws Exception {
        use(new RemoteCommandCache(new InMemoryCommandChannel(), RemoteCacheSettings.defaults(), codec, clock));
        cache.initialize().join();

        mvc.perform(get("/health"))
            .andExpect(jsonPath("$.status").value("pass"));
    }

    @Test
    void healthReportsLastErrorWhenUnreachable() throws Exception {
        InMemoryCommandChannel channel = new InMemoryCommandChannel();
        channel.failWith(new RemoteCommandException("PING failed with HTTP 401"));
        use(new RemoteCommandCache(channel, RemoteCacheSettings.defaults(), codec, clock));
        cache.initialize().join();

        mvc.perform(get("/health"))
            .andExpect(jsonPath("$.status").value("warn"))
            .andExpect(jsonPath("$.lastError").value("PING failed with HTTP 401"));
    }

    @Test
    void resetClearsCacheAndCounter() throws Exception {
        mvc.perform(get("/item").param("key", "a"));

        mvc.perform(get("/reset")).andExpect(status().isOk());

        mvc.perform(get("/stats"))
            .andExpect(jsonPath("$.backendRequests").value(0))
            .andExpect(jsonPath("$.cache.memory.size").value(0));
    }
}
