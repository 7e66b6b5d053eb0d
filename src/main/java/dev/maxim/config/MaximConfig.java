package dev.maxim.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Configuration for the Maxim SDK with sane defaults.
 *
 * <p>Most SDK users will want to use envars to configure all Maxim settings.
 *
 * <p>However, it's also possible to override any envar during config construction.
 */
@Getter
@Accessors(fluent = true)
public final class MaximConfig extends BaseConfig {
    private final String apiKey = getRequiredConfig("MAXIM_API_KEY");
    private final String baseUrl =
            stripTrailingSlash(getConfig("MAXIM_BASE_URL", "https://app.getmaxim.ai"));
    private final Optional<String> defaultWorkspaceId =
            Optional.ofNullable(getConfig("MAXIM_WORKSPACE_ID", null, String.class));
    private final Duration requestTimeout =
            Duration.ofSeconds(getConfig("MAXIM_REQUEST_TIMEOUT", 30));
    private final int maxRetries = getConfig("MAXIM_MAX_RETRIES", 5);
    private final boolean debug = getConfig("MAXIM_DEBUG", false);

    public static MaximConfig fromEnvironment() {
        return of();
    }

    public static MaximConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new RuntimeException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new MaximConfig(overridesMap);
    }

    private MaximConfig(Map<String, String> envOverrides) {
        super(envOverrides);
        if (maxRetries < 0) {
            throw new RuntimeException("MAXIM_MAX_RETRIES must not be negative: " + maxRetries);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> envOverrides = new HashMap<>();

        public Builder apiKey(String value) {
            envOverrides.put("MAXIM_API_KEY", value);
            return this;
        }

        public Builder baseUrl(String value) {
            envOverrides.put("MAXIM_BASE_URL", value);
            return this;
        }

        public Builder defaultWorkspaceId(String value) {
            if (value != null) {
                envOverrides.put("MAXIM_WORKSPACE_ID", value);
            } else {
                envOverrides.put("MAXIM_WORKSPACE_ID", NULL_OVERRIDE);
            }
            return this;
        }

        public Builder requestTimeout(Duration value) {
            envOverrides.put("MAXIM_REQUEST_TIMEOUT", String.valueOf(value.getSeconds()));
            return this;
        }

        public Builder maxRetries(int value) {
            envOverrides.put("MAXIM_MAX_RETRIES", String.valueOf(value));
            return this;
        }

        public Builder debug(boolean value) {
            envOverrides.put("MAXIM_DEBUG", String.valueOf(value));
            return this;
        }

        public MaximConfig build() {
            return new MaximConfig(envOverrides);
        }
    }
}
