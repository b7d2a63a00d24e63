package net.audiobookorganizer.store;

import net.audiobookorganizer.exception.StoreEncodingException;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.json.JsonMapper;

/**
 * JSON encoding for stored records: snake_case property names, unknown properties ignored so
 * older records stay readable after fields are added.
 */
public final class StoreJson {

    private final ObjectMapper objectMapper;

    public StoreJson() {
        this(JsonMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .build());
    }

    public StoreJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectMapper mapper() {
        return objectMapper;
    }

    public byte[] encode(String key, Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JacksonException ex) {
            throw new StoreEncodingException(key, ex);
        }
    }

    public String encodeToString(String key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JacksonException ex) {
            throw new StoreEncodingException(key, ex);
        }
    }

    public <T> T decode(String key, byte[] data, Class<T> type) {
        try {
            return objectMapper.readValue(data, type);
        } catch (JacksonException ex) {
            throw new StoreEncodingException(key, ex);
        }
    }

    public <T> T decode(String key, String data, Class<T> type) {
        try {
            return objectMapper.readValue(data, type);
        } catch (JacksonException ex) {
            throw new StoreEncodingException(key, ex);
        }
    }

    public <T> T decode(String key, byte[] data, TypeReference<T> type) {
        try {
            return objectMapper.readValue(data, type);
        } catch (JacksonException ex) {
            throw new StoreEncodingException(key, ex);
        }
    }

    public <T> T decode(String key, String data, TypeReference<T> type) {
        try {
            return objectMapper.readValue(data, type);
        } catch (JacksonException ex) {
            throw new StoreEncodingException(key, ex);
        }
    }
}
