package com.umitunal.jobmgr.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON-lines codec using Jackson. The default mapper never indents, so every
 * record stays on one line and quoting keeps any character inside a field.
 *
 * @param <T> the type to serialize
 */
public class JsonRecordCodec<T> implements RecordCodec<T> {
    private final ObjectMapper mapper;
    private final Class<T> type;

    public JsonRecordCodec(Class<T> type) {
        this(type, createDefaultMapper());
    }

    public JsonRecordCodec(Class<T> type, ObjectMapper mapper) {
        this.type = type;
        this.mapper = mapper;
    }

    @Override
    public String encode(T record) {
        try {
            return mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + type.getSimpleName() + " to JSON", e);
        }
    }

    @Override
    public T decode(String line) {
        if (line == null || line.isBlank()) {
            throw new IllegalArgumentException("empty " + type.getSimpleName() + " record");
        }
        try {
            T value = mapper.readValue(line, type);
            if (value == null) {
                throw new IllegalArgumentException("null " + type.getSimpleName() + " record");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid " + type.getSimpleName() + " record: "
                    + e.getOriginalMessage(), e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, false);
        mapper.configure(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES, true);
        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        return mapper;
    }
}
