package warden.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import warden.core.exception.CacheException;

/**
 * Jackson codec for cache entries. Instants are written as ISO-8601 strings and unknown
 * properties are ignored, so entries written by older versions still decode.
 */
public final class JsonCacheCodec<T> implements CacheCodec<T> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Class<T> type;

    public JsonCacheCodec(Class<T> type) {
        this.type = type;
    }

    @Override
    public String encode(T value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to encode " + type.getSimpleName(), e);
        }
    }

    @Override
    public T decode(String payload) {
        try {
            return OBJECT_MAPPER.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to decode " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
