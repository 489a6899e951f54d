package io.ksp.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * JSON helpers shared by the SDK modules.
 */
public final class Utils {

    /**
     * The mapper used for every request and response body.
     */
    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Utils() {
    }

    /**
     * Deserializes JSON text into the given type.
     *
     * @param data the JSON text
     * @param typeRef the target type
     * @param <T> the target type
     * @return the decoded value
     * @throws JsonProcessingException if the text is not valid JSON for the target type
     */
    public static <T> T unmarshalFrom(String data, TypeReference<T> typeRef) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(data, typeRef);
    }

    /**
     * Serializes a value to compact JSON text.
     *
     * @param value the value
     * @return the JSON text
     * @throws JsonProcessingException if the value cannot be serialized
     */
    public static String toJsonString(@Nullable Object value) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(value);
    }

    public static <T> T defaultIfNull(@Nullable T value, T defaultValue) {
        return value == null ? defaultValue : value;
    }
}
