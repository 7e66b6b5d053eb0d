package dev.maxim.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * The ObjectMapper every Maxim API call goes through.
 *
 * <p>The API speaks camelCase JSON, so no naming strategy is applied. Null and empty-Optional
 * properties are left out of request bodies, and fields the SDK does not know are ignored in
 * responses.
 */
public final class MaximJsonMapper {
    private static final ObjectMapper INSTANCE = create();

    private MaximJsonMapper() {}

    public static ObjectMapper get() {
        return INSTANCE;
    }

    private static ObjectMapper create() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new Jdk8Module())
                .setSerializationInclusion(JsonInclude.Include.NON_ABSENT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
