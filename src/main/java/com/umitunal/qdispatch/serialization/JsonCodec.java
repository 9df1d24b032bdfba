package com.umitunal.qdispatch.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;

/**
 * JSON payloads through Jackson. Readable in the store, and the format the HTTP surface accepts.
 *
 * @param <T> the payload type
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private final Class<T> type;
    private final ObjectReader reader;
    private final ObjectWriter writer;

    public JsonCodec(Class<T> type) {
        this(type, createDefaultMapper());
    }

    public JsonCodec(Class<T> type, ObjectMapper mapper) {
        this.type = type;
        this.reader = mapper.readerFor(type);
        this.writer = mapper.writerFor(type);
    }

    @Override
    public byte[] encode(T payload) {
        try {
            return writer.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot write " + type.getSimpleName() + " payload as JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try {
            return reader.readValue(bytes);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + type.getSimpleName() + " payload from JSON", e);
        }
    }

    @Override
    public String name() {
        return "json:" + type.getName();
    }

    /**
     * Lenient mapper shared by payload storage and the HTTP surface: unknown fields are ignored.
     */
    public static ObjectMapper createDefaultMapper() {
        return new ObjectMapper()
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
