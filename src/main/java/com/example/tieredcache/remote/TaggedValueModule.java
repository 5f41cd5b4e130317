package com.example.tieredcache.remote;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Date;

/**
 * Writes values that do not survive plain JSON as single-field objects:
 * {@code {"__bigint__": "123"}} for {@link BigInteger} and {@code {"__date__": "2024-01-01T00:00:00Z"}}
 * for {@link Instant} and {@link Date}. The matching deserializers accept the tagged form as well as
 * the plain scalar.
 */
public class TaggedValueModule extends SimpleModule {

    public static final String BIGINT_TAG = "__bigint__";
    public static final String DATE_TAG = "__date__";

    public TaggedValueModule() {
        super("TaggedValueModule");
        addSerializer(BigInteger.class, new BigIntegerSerializer());
        addSerializer(Instant.class, new InstantSerializer());
        addSerializer(Date.class, new DateSerializer());
        addDeserializer(BigInteger.class, new BigIntegerDeserializer());
        addDeserializer(Instant.class, new InstantDeserializer());
        addDeserializer(Date.class, new DateDeserializer());
    }

    static final class BigIntegerSerializer extends StdSerializer<BigInteger> {
        BigIntegerSerializer() {
            super(BigInteger.class);
        }

        @Override
        public void serialize(BigInteger value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField(BIGINT_TAG, value.toString());
            gen.writeEndObject();
        }
    }

    static final class InstantSerializer extends StdSerializer<Instant> {
        InstantSerializer() {
            super(Instant.class);
        }

        @Override
        public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField(DATE_TAG, value.toString());
            gen.writeEndObject();
        }
    }

    static final class DateSerializer extends StdSerializer<Date> {
        DateSerializer() {
            super(Date.class);
        }

        @Override
        public void serialize(Date value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField(DATE_TAG, value.toInstant().toString());
            gen.writeEndObject();
        }
    }

    static final class BigIntegerDeserializer extends StdDeserializer<BigInteger> {
        BigIntegerDeserializer() {
            super(BigInteger.class);
        }

        @Override
        public BigInteger deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() == JsonToken.START_OBJECT) {
                return new BigInteger(taggedText(p, BIGINT_TAG));
            }
            if (p.currentToken() == JsonToken.VALUE_STRING) {
                return new BigInteger(p.getText().trim());
            }
            return p.getBigIntegerValue();
        }
    }

    static final class InstantDeserializer extends StdDeserializer<Instant> {
        InstantDeserializer() {
            super(Instant.class);
        }

        @Override
        public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return readInstant(p);
        }
    }

    static final class DateDeserializer extends StdDeserializer<Date> {
        DateDeserializer() {
            super(Date.class);
        }

        @Override
        public Date deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return Date.from(readInstant(p));
        }
    }

    private static Instant readInstant(JsonParser p) throws IOException {
        if (p.currentToken() == JsonToken.START_OBJECT) {
            return Instant.parse(taggedText(p, DATE_TAG));
        }
        if (p.currentToken() == JsonToken.VALUE_NUMBER_INT) {
            return Instant.ofEpochMilli(p.getLongValue());
        }
        return Instant.parse(p.getText().trim());
    }

    private static String taggedText(JsonParser p, String tag) throws IOException {
        JsonNode node = p.readValueAsTree();
        JsonNode tagged = node.get(tag);
        if (tagged == null || !tagged.isTextual()) {
            throw JsonMappingException.from(p, "Expected a text field named " + tag);
        }
        return tagged.asText();
    }
}
