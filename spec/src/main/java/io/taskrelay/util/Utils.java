package io.taskrelay.util;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jspecify.annotations.Nullable;

/**
 * Shared JSON mapper and small collection helpers used across the modules.
 */
public final class Utils {

    /**
     * The mapper used for every wire and storage representation.
     * Dates are written as ISO-8601 strings and unknown properties are ignored.
     */
    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private Utils() {
    }

    /**
     * Deserializes a JSON string.
     *
     * @param data the JSON text
     * @param typeRef the target type
     * @param <T> the target type
     * @return the deserialized value
     * @throws JsonProcessingException if the text is not valid JSON for the target type
     */
    public static <T> T unmarshalFrom(String data, TypeReference<T> typeRef) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(data, typeRef);
    }

    /**
     * Serializes a value to a JSON string.
     *
     * @param value the value
     * @return the JSON text
     * @throws JsonProcessingException if the value cannot be serialized
     */
    public static String toJsonString(Object value) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(value);
    }

    /**
     * Returns an immutable copy of the list, or an empty list for {@code null}.
     */
    public static <T> List<T> copyOrEmpty(@Nullable List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    /**
     * Returns a new list holding the elements of {@code list} followed by {@code element}.
     */
    public static <T> List<T> append(List<T> list, T element) {
        List<T> result = new ArrayList<>(list.size() + 1);
        result.addAll(list);
        result.add(element);
        return List.copyOf(result);
    }
}
