package dev.maxim.config;

import static org.junit.jupiter.api.Assertions.*;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class MaximConfigTest {
    @Test
    void defaultsApply() {
        var config = MaximConfig.of(
                        "MAXIM_API_KEY", "foobar", "MAXIM_BASE_URL", "https://app.getmaxim.ai");
        assertEquals("foobar", config.apiKey());
        assertEquals("https://app.getmaxim.ai", config.baseUrl());
        assertEquals(Duration.ofSeconds(30), config.requestTimeout());
        assertEquals(5, config.maxRetries());
    }

    @Test
    void baseUrlLosesTrailingSlash() {
        var config = MaximConfig.of(
                        "MAXIM_API_KEY", "foobar", "MAXIM_BASE_URL", "http://localhost:3000/");
        assertEquals("http://localhost:3000", config.baseUrl());
    }

    @Test
    void missingApiKeyFails() {
        assertThrows(RuntimeException.class, () -> MaximConfig.of("MAXIM_API_KEY", ""));
    }

    @Test
    void danglingOverrideKeyFails() {
        assertThrows(RuntimeException.class, () -> MaximConfig.of("MAXIM_API_KEY"));
    }

    @Test
    void negativeRetriesFail() {
        assertThrows(
                RuntimeException.class,
                () -> MaximConfig.builder().apiKey("key").maxRetries(-1).build());
    }

    @Test
    void nullWorkspaceOverrideClearsDefault() {
        var config = MaximConfig.builder().apiKey("key").defaultWorkspaceId(null).build();
        assertTrue(config.defaultWorkspaceId().isEmpty());
    }

    @Test
    public void testBuilderEqualsEnv() {
        var fromEnv =
                MaximConfig.of(
                        "MAXIM_API_KEY", "testkey",
                        "MAXIM_WORKSPACE_ID", "unit-test");
        var fromBuilder =
                MaximConfig.builder().apiKey("testkey").defaultWorkspaceId("unit-test").build();
        var otherBuilder =
                MaximConfig.builder().apiKey("otherkey").defaultWorkspaceId("unit-test").build();
        assertEquals(fromEnv, fromBuilder);
        assertNotEquals(fromEnv, otherBuilder);
    }

    @Test
    public void testBuilderHasMethodForEveryField() {
        List<String> fieldsToSkip = List.of("envOverrides");
        Field[] configFields = MaximConfig.class.getDeclaredFields();

        Method[] builderMethods = MaximConfig.Builder.class.getDeclaredMethods();
        Set<String> builderMethodNames =
                Arrays.stream(builderMethods).map(Method::getName).collect(Collectors.toSet());

        for (Field field : configFields) {
            String configFieldName = field.getName();
            if (fieldsToSkip.contains(configFieldName) || field.isSynthetic()) {
                continue;
            }
            assertTrue(
                    builderMethodNames.contains(configFieldName),
                    "Builder is missing method for field: " + configFieldName);
        }
    }
}
