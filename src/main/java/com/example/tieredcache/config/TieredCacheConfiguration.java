package com.example.tieredcache.config;

import com.example.tieredcache.core.BoundedMemoryCache;
import com.example.tieredcache.refresh.BackgroundRevalidator;
import com.example.tieredcache.refresh.CoalescingFetchStrategy;
import com.example.tieredcache.refresh.DirectFetchStrategy;
import com.example.tieredcache.refresh.FetchStrategy;
import com.example.tieredcache.remote.CommandChannel;
import com.example.tieredcache.remote.EntryCodec;
import com.example.tieredcache.remote.HttpCommandChannel;
import com.example.tieredcache.remote.RemoteCacheSettings;
import com.example.tieredcache.remote.RemoteCommandCache;
import com.example.tieredcache.remote.RemoteEndpoint;
import com.example.tieredcache.tiered.TieredCache;
import com.example.tieredcache.tiered.TieredCacheProvider;
import com.example.tieredcache.tiered.TieredCacheSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TieredCacheProperties.class)
public class TieredCacheConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TieredCacheConfiguration.class);

    @Bean
    public Clock cacheClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TieredCacheProvider tieredCacheProvider(TieredCacheProperties properties, ObjectMapper objectMapper, Clock cacheClock) {
        return new TieredCacheProvider(() -> createCache(properties, objectMapper, cacheClock));
    }

    // The provider owns shutdown of the instance.
    @Bean(destroyMethod = "")
    public TieredCache tieredCache(TieredCacheProvider provider) {
        return provider.get();
    }

    static TieredCache createCache(TieredCacheProperties properties, ObjectMapper objectMapper, Clock clock) {
        TieredCacheProperties.Memory memory = properties.getMemory();
        BoundedMemoryCache memoryCache = new BoundedMemoryCache(memory.getMaxEntries(), memory.getDefaultTtl(), clock);

        TieredCacheProperties.Remote remote = properties.getRemote();
        RemoteCacheSettings remoteSettings = new RemoteCacheSettings(
            remote.getKeyPrefix(), remote.getDefaultTtl(), remote.getConnectTimeout(), remote.getCommandTimeout());
        RemoteCommandCache remoteCache = new RemoteCommandCache(
            channelFor(remote, objectMapper), remoteSettings, new EntryCodec(objectMapper), clock);

        FetchStrategy fetchStrategy = properties.isCoalesceFetches()
            ? new CoalescingFetchStrategy()
            : new DirectFetchStrategy();

        return new TieredCache(
            memoryCache,
            remoteCache,
            new TieredCacheSettings(properties.isStaleWhileRevalidate(), properties.getMaxStaleAge()),
            fetchStrategy,
            new BackgroundRevalidator(properties.getRevalidationThreads()));
    }

    // null means unconfigured; a bad URL yields a channel that fails its probe
    private static CommandChannel channelFor(TieredCacheProperties.Remote remote, ObjectMapper objectMapper) {
        String url = remote.getUrl();
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new HttpCommandChannel(RemoteEndpoint.parse(url), remote.getConnectTimeout(), objectMapper);
        } catch (IllegalArgumentException e) {
            log.warn("Remote cache URL rejected: {}", e.getMessage());
            return (timeout, command) -> CompletableFuture.failedFuture(e);
        }
    }
}
