package com.example.tieredcache.remote;

import java.time.Duration;

public final class RemoteCacheSettings {

    private final String keyPrefix;
    private final Duration defaultTtl;
    private final Duration connectTimeout;
    private final Duration commandTimeout;

    public RemoteCacheSettings(String keyPrefix, Duration defaultTtl, Duration connectTimeout, Duration commandTimeout) {
        this.keyPrefix = keyPrefix;
        this.defaultTtl = defaultTtl;
        this.connectTimeout = connectTimeout;
        this.commandTimeout = commandTimeout;
    }

    public static RemoteCacheSettings defaults() {
        return new RemoteCacheSettings("app:", Duration.ofSeconds(300), Duration.ofSeconds(5), Duration.ofSeconds(2));
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }
}
