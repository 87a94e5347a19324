package net.gaiming.adapters.persistence;

import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON (de)serialization for the text columns that hold maps and lists.
 */
public class JsonColumns {

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() { };
    private static final TypeReference<Map<String, Double>> DOUBLE_MAP = new TypeReference<>() { };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to serialize JSON column value of type "
                + value.getClass().getSimpleName(), ex);
        }
    }

    public Map<String, Object> readObjectMap(String json) {
        if (!StringUtils.hasText(json)) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(read(json, OBJECT_MAP)));
    }

    public Map<String, Double> readDoubleMap(String json) {
        if (!StringUtils.hasText(json)) {
            return Map.of();
        }
        return Map.copyOf(read(json, DOUBLE_MAP));
    }

    public List<String> readStringList(String json) {
        if (!StringUtils.hasText(json)) {
            return List.of();
        }
        return List.copyOf(read(json, STRING_LIST));
    }

    public <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to parse JSON column value", ex);
        }
    }
}
