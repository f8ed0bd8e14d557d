package com.touchline.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON conversion for the rule columns stored as {@code columnDefinition = "JSON"}:
 * the condition tree, the time windows and the sequences.
 *
 * <p>Unknown properties are ignored so rows written by older builds still load.
 * Unreadable JSON raises {@link IllegalStateException}; the rule store treats that
 * as a broken row and skips it.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private JsonHelper() {}

    /**
     * Writes {@code value} as its declared type, so polymorphic type ids such as the
     * condition node's {@code @type} are always present. Null in, null out.
     */
    public static <T> String write(T value, Class<T> declaredType) {
        if (value == null) {
            return null;
        }
        try {
            return MAPPER.writerFor(declaredType).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write " + declaredType.getSimpleName() + " as JSON", e);
        }
    }

    /** Writes a list column. Empty or null lists are stored as SQL NULL. */
    public static <T> String writeList(List<T> values, Class<T> elementType) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        JavaType listType = MAPPER.getTypeFactory().constructCollectionType(List.class, elementType);
        try {
            return MAPPER.writerFor(listType).writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write list of " + elementType.getSimpleName() + " as JSON", e);
        }
    }

    public static <T> T read(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        return read(json, MAPPER.constructType(type));
    }

    /** Reads a list column; NULL or blank yields an empty, mutable list. */
    public static <T> List<T> readList(String json, Class<T> elementType) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        List<T> values = read(json, MAPPER.getTypeFactory().constructCollectionType(List.class, elementType));
        return values != null ? values : new ArrayList<>();
    }

    private static <T> T read(String json, JavaType type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON for {}: {}", type.toCanonical(), e.getOriginalMessage());
            throw new IllegalStateException("Cannot read JSON as " + type.toCanonical(), e);
        }
    }
}
