package dev.maxim.config;

import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Resolves settings from environment variables, with optional per-instance overrides.
 *
 * <p>Overrides win over the environment. An override of {@link #NULL_OVERRIDE} forces a setting
 * to be treated as unset even if the environment defines it.
 */
abstract class BaseConfig {
    static final String NULL_OVERRIDE = "__MAXIM_NULL_OVERRIDE__";

    private final Map<String, String> envOverrides;

    BaseConfig(Map<String, String> envOverrides) {
        this.envOverrides = Map.copyOf(envOverrides);
    }

    protected String getRequiredConfig(String key) {
        var value = getConfig(key, null, String.class);
        if (value == null || value.isBlank()) {
            throw new RuntimeException("required config is missing: " + key);
        }
        return value;
    }

    protected String getConfig(String key, String defaultValue) {
        return getConfig(key, defaultValue, String.class);
    }

    protected boolean getConfig(String key, boolean defaultValue) {
        return getConfig(key, defaultValue, Boolean.class);
    }

    protected int getConfig(String key, int defaultValue) {
        return getConfig(key, defaultValue, Integer.class);
    }

    @SuppressWarnings("unchecked")
    protected <T> T getConfig(String key, @Nullable T defaultValue, Class<T> type) {
        var raw = lookup(key);
        if (raw == null) {
            return defaultValue;
        }
        if (type == String.class) {
            return (T) raw;
        } else if (type == Boolean.class) {
            return (T) Boolean.valueOf(raw.trim());
        } else if (type == Integer.class) {
            try {
                return (T) Integer.valueOf(raw.trim());
            } catch (NumberFormatException e) {
                throw new RuntimeException(
                        "config %s must be an integer. Found: %s".formatted(key, raw), e);
            }
        }
        throw new IllegalArgumentException("unsupported config type: " + type);
    }

    @Nullable
    private String lookup(String key) {
        if (envOverrides.containsKey(key)) {
            var override = envOverrides.get(key);
            return NULL_OVERRIDE.equals(override) ? null : override;
        }
        return System.getenv(key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return envOverrides.equals(((BaseConfig) o).envOverrides);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), envOverrides);
    }
}
