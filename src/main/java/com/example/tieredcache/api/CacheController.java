package com.example.tieredcache.api;

import com.example.tieredcache.backend.MockBackend;
import com.example.tieredcache.backend.OriginRecord;
import com.example.tieredcache.core.CacheOptions;
import com.example.tieredcache.remote.RemoteCacheStats;
import com.example.tieredcache.tiered.CacheFetchException;
import com.example.tieredcache.tiered.FetchResult;
import com.example.tieredcache.tiered.TieredCache;
import com.example.tieredcache.tiered.TieredCacheStats;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CacheController {

    private final TieredCache cache;
    private final MockBackend backend;

    public CacheController(TieredCache cache, MockBackend backend) {
        this.cache = cache;
        this.backend = backend;
    }

    @GetMapping("/item")
    public FetchResult<OriginRecord> getItem(
        @RequestParam String key,
        @RequestParam(required = false) Long ttlMs,
        @RequestParam(required = false) List<String> tags,
        @RequestParam(defaultValue = "false") boolean forceRefresh
    ) {
        CacheOptions options = CacheOptions.defaults();
        if (ttlMs != null) {
            options = options.withTtl(Duration.ofMillis(ttlMs));
        }
        if (tags != null) {
            options = options.withTags(tags);
        }
        if (forceRefresh) {
            options = options.forceRefresh();
        }
        return cache.getOrFetch(key, OriginRecord.class, () -> backend.fetch(key), options);
    }

    @DeleteMapping("/item")
    public Map<String, Object> deleteItem(@RequestParam String key) {
        return Map.of("deleted", cache.delete(key));
    }

    @PostMapping("/invalidate/tag")
    public Map<String, Object> invalidateTag(@RequestParam String tag) {
        return Map.of("removed", cache.invalidateByTag(tag));
    }

    @PostMapping("/invalidate/pattern")
    public Map<String, Object> invalidatePattern(@RequestParam String regex) {
        return Map.of("removed", cache.invalidateByPattern(regex));
    }

    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        TieredCacheStats stats = cache.getStats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cache", stats);
        body.put("backendRequests", backend.getRequestCount());
        return body;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        RemoteCacheStats remote = cache.getStats().getRemote();
        Map<String, Object> body = new LinkedHashMap<>();
        if (remote == null) {
            body.put("status", "warn");
            body.put("message", "Remote cache not configured (using in-memory cache)");
        } else if (cache.isRemoteAvailable()) {
            body.put("status", "pass");
            body.put("message", "Remote cache connected");
        } else {
            body.put("status", "warn");
            body.put("message", "Remote cache configured but not connected");
            body.put("lastError", remote.getLastError());
        }
        return body;
    }

    @GetMapping("/reset")
    public void reset() {
        backend.resetCount();
        cache.clear();
    }

    @ExceptionHandler(CacheFetchException.class)
    public ResponseEntity<Map<String, Object>> onFetchFailure(CacheFetchException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(Map.of("key", e.getKey(), "error", String.valueOf(e.getCause().getMessage())));
    }

    @ExceptionHandler(PatternSyntaxException.class)
    public ResponseEntity<Map<String, Object>> onBadPattern(PatternSyntaxException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getDescription()));
    }
}
