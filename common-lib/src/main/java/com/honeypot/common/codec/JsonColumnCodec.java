package com.honeypot.common.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.honeypot.common.exception.SerializationException;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes list- and map-valued fields into the JSON text columns of the durable store and back.
 *
 * <p>List contract (signal labels, keyword lists):
 * <ul>
 *   <li>an absent list is written as {@code []}, never as SQL {@code NULL}</li>
 *   <li>a {@code NULL} or blank column reads back as an empty list, never {@code null}</li>
 *   <li>element order is preserved in both directions</li>
 *   <li>{@code null} elements are refused on write and reported as corrupt on read</li>
 * </ul>
 *
 * <p>Map fields (metadata, details, callback response) keep their absence: {@code null} in,
 * {@code null} out.
 *
 * <p>Stored text that does not parse raises {@link SerializationException}.
 */
public class JsonColumnCodec {

    private static final String COMPONENT = "json-column-codec";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonColumnCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException when the list holds a {@code null} element
     */
    public String writeList(List<String> values) {
        if (values == null) {
            return write(Collections.emptyList());
        }
        if (values.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("List column values must not contain null: " + values);
        }
        return write(values);
    }

    public List<String> readList(String column) {
        if (column == null || column.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<String> parsed = objectMapper.readValue(column, STRING_LIST);
            if (parsed == null) {
                return Collections.emptyList();
            }
            if (parsed.stream().anyMatch(Objects::isNull)) {
                throw new SerializationException(COMPONENT, "Stored list holds a null element: " + abbreviate(column));
            }
            return List.copyOf(parsed);
        } catch (JsonProcessingException e) {
            throw new SerializationException(COMPONENT, "Stored list is not a JSON string array: " + abbreviate(column), e);
        }
    }

    public String writeMap(Map<String, Object> values) {
        return values == null ? null : write(values);
    }

    public Map<String, Object> readMap(String column) {
        if (column == null || column.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(column, OBJECT_MAP);
        } catch (JsonProcessingException e) {
            throw new SerializationException(COMPONENT, "Stored value is not a JSON object: " + abbreviate(column), e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException(COMPONENT, "Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    private static String abbreviate(String column) {
        return column.length() <= 64 ? column : column.substring(0, 64) + "...";
    }
}
