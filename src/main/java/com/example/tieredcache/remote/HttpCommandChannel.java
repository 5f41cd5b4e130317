package com.example.tieredcache.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Posts each command as a JSON array to the endpoint's base URI with a bearer token and unwraps
 * the {@code {"result": ...}} reply.
 */
public class HttpCommandChannel implements CommandChannel {

    private final RemoteEndpoint endpoint;
    private final HttpClient client;
    private final ObjectMapper objectMapper;

    public HttpCommandChannel(RemoteEndpoint endpoint, Duration connectTimeout, ObjectMapper objectMapper) {
        this(endpoint, HttpClient.newBuilder().connectTimeout(connectTimeout).build(), objectMapper);
    }

    public HttpCommandChannel(RemoteEndpoint endpoint, HttpClient client, ObjectMapper objectMapper) {
        this.endpoint = endpoint;
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<JsonNode> execute(Duration timeout, List<String> command) {
        String body;
        try {
            body = objectMapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new RemoteCommandException("Cannot encode command", e));
        }

        HttpRequest request = HttpRequest.newBuilder()
            .uri(endpoint.getBaseUri())
            .timeout(timeout)
            .header("Authorization", "Bearer " + endpoint.getToken())
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> unwrap(command.get(0), response));
    }

    private JsonNode unwrap(String commandName, HttpResponse<String> response) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new RemoteCommandException(commandName + " failed with HTTP " + response.statusCode());
        }

        JsonNode reply;
        try {
            reply = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new RemoteCommandException(commandName + " returned an unreadable body", e);
        }
        if (reply == null || !reply.isObject()) {
            throw new RemoteCommandException(commandName + " returned an unexpected body");
        }
        if (reply.hasNonNull("error")) {
            throw new RemoteCommandException(commandName + " failed: " + reply.get("error").asText());
        }
        JsonNode result = reply.get("result");
        return result == null ? NullNode.getInstance() : result;
    }
}
