package io.duomap.validation;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a JSON object into raw field values for a {@link ValueValidator}.
 * <p>
 * Values keep Jackson's natural Java types ({@code Integer}, {@code Long},
 * {@code Double}, {@code String}, {@code Boolean}, nested maps and lists);
 * coercion to column types is left to the validator.
 */
public final class JsonObjectReader {

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public JsonObjectReader() {
        this(new ObjectMapper());
    }

    public JsonObjectReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @return field values in document order
     * @throws JsonInputException if the text is not well-formed JSON or not an object
     */
    public Map<String, Object> read(String entityName, String json) {
        if (json == null || json.isBlank()) {
            throw new JsonInputException("Empty JSON input for " + entityName);
        }
        LinkedHashMap<String, Object> values;
        try {
            values = mapper.readValue(json, OBJECT_TYPE);
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            throw new JsonInputException("Invalid JSON for " + entityName + ": " + e.getOriginalMessage(), e,
                    location == null ? -1 : location.getLineNr(),
                    location == null ? -1 : location.getColumnNr());
        }
        if (values == null) {
            throw new JsonInputException("JSON input for " + entityName + " must be an object, got null");
        }
        return values;
    }
}
