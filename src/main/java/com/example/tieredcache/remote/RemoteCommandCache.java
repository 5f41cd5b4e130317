package com.example.tieredcache.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared tier reached through a {@link CommandChannel}. Every operation completes normally: failures
 * are logged, counted in {@code errors}/{@code lastError} and reported as a miss, {@code false},
 * {@code 0} or {@code -1}.
 *
 * <p>The endpoint is probed once by {@link #connect()}. Without a channel the instance stays
 * {@link RemoteState#UNCONFIGURED}; a failed probe leaves it {@link RemoteState#UNAVAILABLE} for good.
 */
public class RemoteCommandCache {

    private static final Logger log = LoggerFactory.getLogger(RemoteCommandCache.class);

    private final CommandChannel channel;
    private final RemoteCacheSettings settings;
    private final EntryCodec codec;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private volatile RemoteState state;
    private volatile String lastError;
    private volatile Instant lastConnectedAt;
    private CompletableFuture<Boolean> connectAttempt;

    public RemoteCommandCache(CommandChannel channel, RemoteCacheSettings settings, EntryCodec codec, Clock clock) {
        this.channel = channel;
        this.settings = settings;
        this.codec = codec;
        this.clock = clock;
        this.state = channel == null ? RemoteState.UNCONFIGURED : RemoteState.CONNECTING;
    }

    public static RemoteCommandCache unconfigured(RemoteCacheSettings settings, EntryCodec codec, Clock clock) {
        return new RemoteCommandCache(null, settings, codec, clock);
    }

    /** Probes the endpoint with {@code PING}. Repeated calls share the first attempt. */
    public synchronized CompletableFuture<Boolean> connect() {
        if (connectAttempt != null) {
            return connectAttempt;
        }
        if (channel == null) {
            log.debug("No remote cache configured, running memory-only");
            connectAttempt = CompletableFuture.completedFuture(false);
            return connectAttempt;
        }

        connectAttempt = send(settings.getConnectTimeout(), List.of("PING"))
            .handle((result, error) -> {
                if (error == null && result != null && "PONG".equals(result.asText())) {
                    lastConnectedAt = clock.instant();
                    state = RemoteState.CONNECTED;
                    log.info("Connected to remote cache (prefix={})", settings.getKeyPrefix());
                    return true;
                }
                Throwable cause = error != null
                    ? unwrap(error)
                    : new RemoteCommandException("PING returned " + result);
                errors.incrementAndGet();
                lastError = describe(cause);
                state = RemoteState.UNAVAILABLE;
                log.warn("Remote cache connection failed, continuing memory-only: {}", lastError);
                return false;
            });
        return connectAttempt;
    }

    public boolean isConfigured() {
        return channel != null;
    }

    public boolean isAvailable() {
        return state == RemoteState.CONNECTED;
    }

    public RemoteState getState() {
        return state;
    }

    public <T> CompletableFuture<T> get(String key, Class<T> type) {
        return getWithMeta(key, type).thenApply(RemoteLookup::getValue);
    }

    public <T> CompletableFuture<RemoteLookup<T>> getWithMeta(String key, Class<T> type) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(RemoteLookup.miss());
        }
        return send(List.of("GET", fullKey(key)))
            .thenApply(result -> this.decodeLookup(key, result, type))
            .exceptionally(error -> {
                recordError("GET", error);
                misses.incrementAndGet();
                return RemoteLookup.miss();
            });
    }

    /**
     * Stores the value wrapped with its creation time and tags. Tags are also added to their tag
     * sets, which expire after twice the entry TTL.
     *
     * @param ttl entry TTL, {@code null} for the default; rounded down to whole seconds, at least one
     */
    public CompletableFuture<Boolean> set(String key, Object value, Duration ttl, List<String> tags) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(false);
        }

        long ttlSeconds = toSeconds(ttl != null ? ttl : settings.getDefaultTtl());
        String fullKey = fullKey(key);
        String payload;
        try {
            payload = codec.encode(value, clock.millis(), tags);
        } catch (JsonProcessingException e) {
            recordError("SET", e);
            return CompletableFuture.completedFuture(false);
        }

        CompletableFuture<JsonNode> chain = send(List.of("SET", fullKey, payload, "EX", Long.toString(ttlSeconds)));
        for (String tag : tags) {
            String tagKey = tagKey(tag);
            chain = chain
                .thenCompose(ignored -> send(List.of("SADD", tagKey, fullKey)))
                .thenCompose(ignored -> send(List.of("EXPIRE", tagKey, Long.toString(ttlSeconds * 2))));
        }
        return chain
            .thenApply(ignored -> true)
            .exceptionally(error -> {
                recordError("SET", error);
                return false;
            });
    }

    public CompletableFuture<Boolean> delete(String key) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(false);
        }
        return send(List.of("DEL", fullKey(key)))
            .thenApply(result -> result.asLong() > 0)
            .exceptionally(error -> {
                recordError("DEL", error);
                return false;
            });
    }

    public CompletableFuture<Boolean> has(String key) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(false);
        }
        return send(List.of("EXISTS", fullKey(key)))
            .thenApply(result -> result.asInt() == 1)
            .exceptionally(error -> {
                recordError("EXISTS", error);
                return false;
            });
    }

    /** Remaining TTL in seconds as reported by the store, -1 when unknown. */
    public CompletableFuture<Long> ttl(String key) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(-1L);
        }
        return send(List.of("TTL", fullKey(key)))
            .thenApply(result -> result.isNumber() ? result.asLong() : -1L)
            .exceptionally(error -> {
                recordError("TTL", error);
                return -1L;
            });
    }

    /** Deletes every key in the tag set and the set itself; returns the number of member keys. */
    public CompletableFuture<Integer> invalidateByTag(String tag) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(0);
        }
        String tagKey = tagKey(tag);
        return send(List.of("SMEMBERS", tagKey))
            .thenCompose(result -> {
                List<String> keys = textArray(result);
                if (keys.isEmpty()) {
                    return CompletableFuture.completedFuture(0);
                }
                List<String> command = new ArrayList<>(keys.size() + 2);
                command.add("DEL");
                command.addAll(keys);
                command.add(tagKey);
                return send(command).thenApply(ignored -> keys.size());
            })
            .exceptionally(error -> {
                recordError("invalidateByTag", error);
                return 0;
            });
    }

    /**
     * Deletes keys matching a glob within this cache's namespace.
     *
     * @param glob glob without the key prefix, e.g. {@code posts:123:*}
     */
    public CompletableFuture<Integer> deleteByPattern(String glob) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(0);
        }
        return send(List.of("KEYS", settings.getKeyPrefix() + glob))
            .thenCompose(result -> deleteKeys(textArray(result)))
            .exceptionally(error -> {
                recordError("deleteByPattern", error);
                return 0;
            });
    }

    /**
     * Deletes the entries whose unprefixed key {@code pattern} finds a match in. Lists the whole
     * namespace and filters here, so it serves regexes that have no glob form. Tag sets are skipped.
     */
    public CompletableFuture<Integer> deleteMatching(Pattern pattern) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(0);
        }
        String prefix = settings.getKeyPrefix();
        String tagPrefix = tagKey("");
        return send(List.of("KEYS", prefix + "*"))
            .thenCompose(result -> {
                List<String> matching = new ArrayList<>();
                for (String fullKey : textArray(result)) {
                    if (!fullKey.startsWith(prefix) || fullKey.startsWith(tagPrefix)) {
                        continue;
                    }
                    if (pattern.matcher(fullKey.substring(prefix.length())).find()) {
                        matching.add(fullKey);
                    }
                }
                return deleteKeys(matching);
            })
            .exceptionally(error -> {
                recordError("deleteMatching", error);
                return 0;
            });
    }

    /** Removes everything under the key prefix, tag sets included. */
    public CompletableFuture<Integer> clear() {
        return deleteByPattern("*");
    }

    public RemoteCacheStats getStats() {
        return new RemoteCacheStats(state, hits.get(), misses.get(), errors.get(), lastError, lastConnectedAt);
    }

    static long toSeconds(Duration ttl) {
        return Math.max(1, ttl.getSeconds());
    }

    private <T> RemoteLookup<T> decodeLookup(String key, JsonNode result, Class<T> type) {
        if (result == null || result.isNull()) {
            misses.incrementAndGet();
            return RemoteLookup.miss();
        }
        try {
            RemoteEntry<T> entry = codec.decode(result, type);
            hits.incrementAndGet();
            return RemoteLookup.hit(entry.getValue(), clock.millis() - entry.getCreatedAt(), entry.getTags());
        } catch (JsonProcessingException | IllegalArgumentException | DateTimeException e) {
            log.warn("Undecodable remote entry for key {}: {}", key, e.getMessage());
            misses.incrementAndGet();
            return RemoteLookup.miss();
        }
    }

    private CompletableFuture<Integer> deleteKeys(List<String> keys) {
        if (keys.isEmpty()) {
            return CompletableFuture.completedFuture(0);
        }
        List<String> command = new ArrayList<>(keys.size() + 1);
        command.add("DEL");
        command.addAll(keys);
        return send(command).thenApply(ignored -> keys.size());
    }

    private CompletableFuture<JsonNode> send(List<String> command) {
        return send(settings.getCommandTimeout(), command);
    }

    private CompletableFuture<JsonNode> send(Duration timeout, List<String> command) {
        try {
            return channel.execute(timeout, command);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void recordError(String operation, Throwable error) {
        Throwable cause = unwrap(error);
        errors.incrementAndGet();
        lastError = describe(cause);
        log.warn("Remote cache {} failed: {}", operation, lastError);
    }

    private String fullKey(String key) {
        return settings.getKeyPrefix() + key;
    }

    private String tagKey(String tag) {
        return settings.getKeyPrefix() + "tag:" + tag;
    }

    private static List<String> textArray(JsonNode result) {
        List<String> values = new ArrayList<>();
        if (result != null && result.isArray()) {
            result.forEach(node -> values.add(node.asText()));
        }
        return values;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
