package com.example.tieredcache.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** What the simulated origin returns for a key. */
public class OriginRecord {

    private final String key;
    private final String payload;
    private final long version;
    private final Instant fetchedAt;

    @JsonCreator
    public OriginRecord(@JsonProperty("key") String key,
                        @JsonProperty("payload") String payload,
                        @JsonProperty("version") long version,
                        @JsonProperty("fetchedAt") Instant fetchedAt) {
        this.key = key;
        this.payload = payload;
        this.version = version;
        this.fetchedAt = fetchedAt;
    }

    public String getKey() {
        return key;
    }

    public String getPayload() {
        return payload;
    }

    public long getVersion() {
        return version;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }
}
