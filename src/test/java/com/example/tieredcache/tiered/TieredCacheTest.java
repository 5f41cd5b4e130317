package com.example.tieredcache.tiered;

import com.example.tieredcache.core.BoundedMemoryCache;
import com.example.tieredcache.core.CacheOptions;
import com.example.tieredcache.refresh.BackgroundRevalidator;
import com.example.tieredcache.refresh.DirectFetchStrategy;
import com.example.tieredcache.remote.EntryCodec;
import com.example.tieredcache.remote.RemoteCacheSettings;
import com.example.tieredcache.remote.RemoteCommandCache;
import com.example.tieredcache.remote.RemoteCommandException;
import com.example.tieredcache.support.InMemoryCommandChannel;
import com.example.tieredcache.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.awaitility.Awaitility.await;

class TieredCacheTest {

    private final EntryCodec codec = new EntryCodec(new ObjectMapper());
    private final MutableClock clock = new MutableClock();

    private BoundedMemoryCache memory;
    private BackgroundRevalidator background;
    private TieredCache cache;

    @BeforeEach
    void setUp() {
        memory = new BoundedMemoryCache(100, Duration.ofMinutes(5), clock);
        background = new BackgroundRevalidator(2);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private TieredCache build(RemoteCommandCache remote, TieredCacheSettings settings) {
        cache = new TieredCache(memory, remote, settings, new DirectFetchStrategy(), background);
        return cache;
    }

    private RemoteCommandCache unconfiguredRemote() {
        return RemoteCommandCache.unconfigured(RemoteCacheSettings.defaults(), codec, clock);
    }

    @Nested
    @DisplayName("without a remote tier")
    class MemoryOnly {

        @BeforeEach
        void init() {
            build(unconfiguredRemote(), new TieredCacheSettings(true, Duration.ofMillis(500)));
        }

        @Test
        @DisplayName("works from memory and reports no remote stats")
        void degradesToMemory() {
            assertThat(cache.set("k", "v").join()).isFalse();

            assertThat(cache.get("k", String.class)).isEqualTo("v");
            assertThat(cache.isRemoteAvailable()).isFalse();
            assertThat(cache.getStats().getRemote()).isNull();
            assertThat(cache.getStats().getTotalHits()).isEqualTo(1);
        }

        @Test
        @DisplayName("a null remote tier behaves the same")
        void nullRemote() {
            build(null, TieredCacheSettings.defaults());

            cache.set("k", "v");

            assertThat(cache.getWithMeta("k", String.class).getSource()).isEqualTo(CacheSource.MEMORY);
            assertThat(cache.getStats().getRemote()).isNull();
        }

        @Test
        @DisplayName("a miss reports the origin as source")
        void missIsOrigin() {
            CacheResult<String> result = cache.getWithMeta("missing", String.class);

            assertThat(result.isHit()).isFalse();
            assertThat(result.getSource()).isEqualTo(CacheSource.ORIGIN);
            assertThat(result.getValue()).isNull();
        }

        @Test
        @DisplayName("getOrFetch calls the fetcher once, then serves the cached value")
        void readThrough() {
            AtomicInteger calls = new AtomicInteger();

            FetchResult<String> first = cache.getOrFetch("k", String.class, () -> "v" + calls.incrementAndGet());
            FetchResult<String> second = cache.getOrFetch("k", String.class, () -> "v" + calls.incrementAndGet());

            assertThat(first.isCached()).isFalse();
            assertThat(first.getValue()).isEqualTo("v1");
            assertThat(second.isCached()).isTrue();
            assertThat(second.isStale()).isFalse();
            assertThat(second.getValue()).isEqualTo("v1");
            assertThat(calls.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("forceRefresh bypasses a fresh entry")
        void forceRefresh() {
            cache.set("k", "old");

            FetchResult<String> result = cache.getOrFetch("k", String.class, () -> "new", CacheOptions.defaults().forceRefresh());

            assertThat(result.isCached()).isFalse();
            assertThat(result.getValue()).isEqualTo("new");
            assertThat(cache.get("k", String.class)).isEqualTo("new");
        }

        @Test
        @DisplayName("a null fetch result is returned but not cached")
        void nullNotCached() {
            FetchResult<String> result = cache.getOrFetch("k", String.class, () -> null);

            assertThat(result.getValue()).isNull();
            assertThat(memory.has("k")).isFalse();
        }

        @Test
        @DisplayName("an unchecked fetcher failure on a miss reaches the caller as is")
        void uncheckedFailure() {
            IllegalStateException boom = new IllegalStateException("boom");

            assertThatThrownBy(() -> cache.getOrFetch("k", String.class, () -> {
                throw boom;
            })).isSameAs(boom);
            assertThat(memory.has("k")).isFalse();
        }

        @Test
        @DisplayName("a checked fetcher failure on a miss is wrapped with the key")
        void checkedFailure() {
            CacheFetchException error = catchThrowableOfType(() -> cache.getOrFetch("posts:1", String.class, () -> {
                throw new IOException("origin down");
            }), CacheFetchException.class);

            assertThat(error).hasCauseInstanceOf(IOException.class);
            assertThat(error.getKey()).isEqualTo("posts:1");
        }

        @Test
        @DisplayName("clear empties memory")
        void clear() {
            cache.set("a", 1);
            cache.set("b", 2);

            cache.clear();

            assertThat(memory.size()).isZero();
        }
    }

    @Nested
    @DisplayName("stale-while-revalidate")
    class StaleWhileRevalidate {

        private final CacheOptions shortTtl = CacheOptions.ttl(Duration.ofMillis(100));

        @BeforeEach
        void init() {
            build(unconfiguredRemote(), new TieredCacheSettings(true, Duration.ofMillis(500)));
        }

        @Test
        @DisplayName("an expired entry within the stale window is served while a refresh runs")
        void servesStale() throws Exception {
            cache.getOrFetch("k", String.class, () -> "v1", shortTtl);
            clock.advance(Duration.ofMillis(150));

            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger calls = new AtomicInteger();
            FetchResult<String> result = cache.getOrFetch("k", String.class, () -> {
                calls.incrementAndGet();
                release.await(5, TimeUnit.SECONDS);
                return "v2";
            }, shortTtl);

            assertThat(result.getValue()).isEqualTo("v1");
            assertThat(result.isCached()).isTrue();
            assertThat(result.isStale()).isTrue();

            release.countDown();
            await().atMost(5, TimeUnit.SECONDS).until(() -> "v2".equals(memory.get("k", String.class)));

            FetchResult<String> refreshed = cache.getOrFetch("k", String.class, () -> "v3", shortTtl);
            assertThat(refreshed.getValue()).isEqualTo("v2");
            assertThat(refreshed.isCached()).isTrue();
            assertThat(refreshed.isStale()).isFalse();
            assertThat(calls.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("an entry older than the stale window is fetched synchronously")
        void beyondStaleWindow() {
            cache.getOrFetch("k", String.class, () -> "v1", shortTtl);
            clock.advance(Duration.ofMillis(700));

            FetchResult<String> result = cache.getOrFetch("k", String.class, () -> "v2", shortTtl);

            assertThat(result.getValue()).isEqualTo("v2");
            assertThat(result.isCached()).isFalse();
            assertThat(result.isStale()).isFalse();
        }

        @Test
        @DisplayName("getWithMeta labels a stale entry")
        void staleSource() {
            cache.set("k", "v1", shortTtl);
            clock.advance(Duration.ofMillis(150));

            CacheResult<String> result = cache.getWithMeta("k", String.class);

            assertThat(result.isHit()).isFalse();
            assertThat(result.isStale()).isTrue();
            assertThat(result.getSource()).isEqualTo(CacheSource.STALE);
            assertThat(result.getAge()).isEqualTo(150);
        }

        @Test
        @DisplayName("a failing background refresh is swallowed and the stale value stays")
        void backgroundFailure() {
            cache.getOrFetch("k", String.class, () -> "v1", shortTtl);
            clock.advance(Duration.ofMillis(150));

            CountDownLatch attempted = new CountDownLatch(1);
            FetchResult<String> result = cache.getOrFetch("k", String.class, () -> {
                attempted.countDown();
                throw new IOException("origin down");
            }, shortTtl);

            assertThat(result.getValue()).isEqualTo("v1");
            await().atMost(5, TimeUnit.SECONDS).until(() -> attempted.getCount() == 0);
            assertThat(cache.getWithMeta("k", String.class).getValue()).isEqualTo("v1");
        }

        @Test
        @DisplayName("when disabled an expired entry is a plain miss")
        void disabled() {
            build(unconfiguredRemote(), new TieredCacheSettings(false, Duration.ofMillis(500)));
            cache.set("k", "v1", shortTtl);
            clock.advance(Duration.ofMillis(150));

            FetchResult<String> result = cache.getOrFetch("k", String.class, () -> "v2", shortTtl);

            assertThat(result.getValue()).isEqualTo("v2");
            assertThat(result.isCached()).isFalse();
        }
    }

    @Nested
    @DisplayName("with a remote tier")
    class WithRemote {

        private InMemoryCommandChannel channel;
        private RemoteCommandCache remote;

        @BeforeEach
        void init() {
            channel = new InMemoryCommandChannel();
            remote = new RemoteCommandCache(channel, RemoteCacheSettings.defaults(), codec, clock);
            build(remote, TieredCacheSettings.defaults());
        }

        @Test
        @DisplayName("the remote tier is probed once on first use")
        void probesOnce() {
            cache.get("a", String.class);
            cache.get("b", String.class);

            assertThat(cache.isRemoteAvailable()).isTrue();
            assertThat(channel.commandsNamed("PING")).hasSize(1);
        }

        @Test
        @DisplayName("set writes both tiers")
        void writesBoth() {
            assertThat(cache.set("k", "v", CacheOptions.tags("posts")).join()).isTrue();

            assertThat(memory.get("k", String.class)).isEqualTo("v");
            assertThat(channel.rawValue("app:k")).isNotNull();
            assertThat(channel.members("app:tag:posts")).containsExactly("app:k");
        }

        @Test
        @DisplayName("a remote hit is copied back into memory with its tags")
        void backfill() {
            cache.set("k", "v", CacheOptions.tags("posts")).join();
            memory.delete("k");

            CacheResult<String> result = cache.getWithMeta("k", String.class);

            assertThat(result.getSource()).isEqualTo(CacheSource.REMOTE);
            assertThat(result.getValue()).isEqualTo("v");
            assertThat(memory.get("k", String.class)).isEqualTo("v");
            assertThat(memory.ttl("k")).isEqualTo(300L);
            assertThat(memory.invalidateByTag("posts")).isEqualTo(1);
        }

        @Test
        @DisplayName("a failing remote write is invisible to the caller")
        void writeBehindFailure() {
            cache.initialize().join();
            channel.failWith(new RemoteCommandException("SET failed with HTTP 500"));

            assertThat(cache.set("k", "v").join()).isFalse();

            assertThat(cache.get("k", String.class)).isEqualTo("v");
            assertThat(cache.getStats().getRemote().getErrors()).isEqualTo(1);
        }

        @Test
        @DisplayName("a failing remote read degrades to a fetch")
        void readFailure() {
            cache.initialize().join();
            channel.failWith(new RemoteCommandException("GET failed with HTTP 500"));

            FetchResult<String> result = cache.getOrFetch("k", String.class, () -> "fetched");

            assertThat(result.getValue()).isEqualTo("fetched");
            assertThat(result.isCached()).isFalse();
        }

        @Test
        @DisplayName("delete removes from both tiers")
        void delete() {
            cache.set("k", "v").join();

            assertThat(cache.delete("k")).isTrue();

            assertThat(memory.has("k")).isFalse();
            assertThat(channel.rawValue("app:k")).isNull();
            assertThat(cache.delete("k")).isFalse();
        }

        @Test
        @DisplayName("tag invalidation sums the counts of both tiers")
        void invalidateByTag() {
            cache.set("p1", "v", CacheOptions.tags("posts")).join();
            cache.set("p2", "v", CacheOptions.tags("posts")).join();
            cache.set("u1", "v", CacheOptions.tags("users")).join();

            assertThat(cache.invalidateByTag("posts")).isEqualTo(4);

            assertThat(cache.get("p1", String.class)).isNull();
            assertThat(cache.get("u1", String.class)).isEqualTo("v");
        }

        @Test
        @DisplayName("pattern invalidation translates the regex for the remote tier")
        void invalidateByPattern() {
            cache.set("posts:123:content", "v").join();
            cache.set("posts:123:metadata", "v").join();
            cache.set("posts:456:content", "v").join();

            assertThat(cache.invalidateByPattern("^posts:123:")).isEqualTo(4);

            assertThat(channel.commandsNamed("KEYS").get(0)).containsExactly("KEYS", "app:posts:123:*");
            assertThat(cache.get("posts:456:content", String.class)).isEqualTo("v");
        }

        @Test
        @DisplayName("a regex without a glob form is matched against every remote key")
        void invalidateByRegexOnlyPattern() {
            cache.set("posts:123:content", "a", CacheOptions.tags("posts")).join();
            cache.set("posts:456:content", "b").join();
            cache.set("posts:abc:content", "c").join();

            assertThat(cache.invalidateByPattern("^posts:\\d+:content$")).isEqualTo(4);

            assertThat(channel.commandsNamed("KEYS").get(0)).containsExactly("KEYS", "app:*");
            assertThat(channel.rawValue("app:posts:123:content")).isNull();
            assertThat(channel.rawValue("app:posts:456:content")).isNull();
            assertThat(channel.members("app:tag:posts")).containsExactly("app:posts:123:content");
            assertThat(cache.get("posts:123:content", String.class)).isNull();
            assertThat(cache.get("posts:abc:content", String.class)).isEqualTo("c");
        }

        @Test
        @DisplayName("clear empties both tiers")
        void clear() {
            cache.set("a", "v").join();
            cache.set("b", "v", CacheOptions.tags("t")).join();

            cache.clear();

            assertThat(memory.size()).isZero();
            assertThat(channel.rawValue("app:a")).isNull();
            assertThat(channel.rawValue("app:b")).isNull();
        }

        @Test
        @DisplayName("stats combine both tiers")
        void stats() {
            cache.set("k", "v").join();
            memory.delete("k");

            cache.get("k", String.class);
            cache.get("k", String.class);
            cache.get("missing", String.class);

            TieredCacheStats stats = cache.getStats();
            assertThat(stats.getRemote()).isNotNull();
            assertThat(stats.getTotalHits()).isEqualTo(2);
            assertThat(stats.getTotalMisses()).isEqualTo(3);
        }
    }
}
