package com.example.tieredcache.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wire format of a remote entry: {@code {"v": <value>, "c": <created millis>, "t": [<tag>, ...]}}
 * with {@link TaggedValueModule} applied to the value.
 */
public class EntryCodec {

    private final ObjectMapper mapper;

    public EntryCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy().registerModule(new TaggedValueModule());
    }

    public String encode(Object value, long createdAt, List<String> tags) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        root.set("v", mapper.valueToTree(value));
        root.put("c", createdAt);
        ArrayNode tagArray = root.putArray("t");
        tags.forEach(tagArray::add);
        return mapper.writeValueAsString(root);
    }

    /**
     * Decodes a {@code GET} result, which is normally the stored string but may already be a parsed
     * object depending on the endpoint.
     */
    public <T> RemoteEntry<T> decode(JsonNode stored, Class<T> type) throws JsonProcessingException {
        JsonNode root = stored.isTextual() ? mapper.readTree(stored.asText()) : stored;
        if (root == null || !root.isObject() || !root.has("v") || !root.has("c")) {
            throw new IllegalArgumentException("Not a cache entry");
        }

        List<String> tags = new ArrayList<>();
        JsonNode tagNode = root.get("t");
        if (tagNode != null && tagNode.isArray()) {
            tagNode.forEach(t -> tags.add(t.asText()));
        }

        return new RemoteEntry<>(readValue(root.get("v"), type), root.get("c").asLong(), tags);
    }

    private <T> T readValue(JsonNode node, Class<T> type) throws JsonProcessingException {
        if (!isUntyped(type)) {
            return mapper.treeToValue(node, type);
        }
        Object value = untag(node);
        if (value != null && !type.isInstance(value)) {
            throw new IllegalArgumentException("Stored value is not a " + type.getSimpleName());
        }
        return type.cast(value);
    }

    // Object, Map and List targets would otherwise keep tagged scalars as nested maps.
    private static boolean isUntyped(Class<?> type) {
        return type.isAssignableFrom(LinkedHashMap.class) || type.isAssignableFrom(ArrayList.class);
    }

    // Untyped reads: plain JSON containers plus the two tagged scalars.
    private Object untag(JsonNode node) throws JsonProcessingException {
        if (node.isObject()) {
            if (node.size() == 1 && node.get(TaggedValueModule.BIGINT_TAG) != null) {
                return new BigInteger(node.get(TaggedValueModule.BIGINT_TAG).asText());
            }
            if (node.size() == 1 && node.get(TaggedValueModule.DATE_TAG) != null) {
                return Instant.parse(node.get(TaggedValueModule.DATE_TAG).asText());
            }
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), untag(field.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                list.add(untag(element));
            }
            return list;
        }
        return mapper.treeToValue(node, Object.class);
    }
}
