package io.a2a.lite.util;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jspecify.annotations.Nullable;

/**
 * Shared JSON mapper and small helpers used across client and server.
 */
public final class Utils {

    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private Utils() {
    }

    public static <T> T unmarshalFrom(String data, TypeReference<T> typeRef) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(data, typeRef);
    }

    public static <T> T unmarshalFrom(byte[] data, Class<T> type) throws java.io.IOException {
        return OBJECT_MAPPER.readValue(data, type);
    }

    public static String toJsonString(Object value) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(value);
    }

    public static <T> T defaultIfNull(@Nullable T value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        return value;
    }

    /**
     * Returns the current UTC time, never earlier than {@code previous}.
     *
     * @param previous the last timestamp issued for the same record, may be {@code null}
     * @return a timestamp that does not go backwards
     */
    public static OffsetDateTime nextTimestamp(@Nullable OffsetDateTime previous) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        if (previous != null && now.isBefore(previous)) {
            return previous;
        }
        return now;
    }
}
