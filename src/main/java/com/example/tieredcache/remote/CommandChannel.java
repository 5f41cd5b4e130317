package com.example.tieredcache.remote;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Transport for the remote tier: sends one command (a list of tokens such as
 * {@code ["SET", "app:k", "...", "EX", "300"]}) and completes with the {@code result} node of the
 * reply. Completes exceptionally on transport failure, non-2xx status, error replies or timeout.
 */
public interface CommandChannel {
    CompletableFuture<JsonNode> execute(Duration timeout, List<String> command);
}
