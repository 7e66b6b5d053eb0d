package dev.maxim;

import dev.maxim.api.MaximApiClient;
import dev.maxim.config.MaximConfig;
import dev.maxim.testrun.TestRun;
import java.util.concurrent.atomic.AtomicReference;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Main entry point for the Maxim SDK.
 *
 * <p>Most users will interact with a singleton instance via {@link #get()}, though you can create
 * independent instances if needed.
 *
 * @see MaximConfig
 * @see #testRunBuilder(String, String)
 */
@Slf4j
public class Maxim {
    private static final AtomicReference<Maxim> instance = new AtomicReference<>();

    /** get or create the global maxim instance, configured from the environment */
    public static Maxim get() {
        var current = instance.get();
        if (null == current) {
            return get(MaximConfig.fromEnvironment());
        } else {
            return current;
        }
    }

    /** get or create the global maxim instance from the given config */
    public static Maxim get(MaximConfig config) {
        var current = instance.get();
        if (null == current) {
            var success = instance.compareAndSet(null, of(config));
            if (success) {
                log.info("initialized global Maxim sdk for {}", config.baseUrl());
            }
            return instance.get();
        } else {
            return current;
        }
    }

    /** Create a new Maxim instance from the given config */
    public static Maxim of(MaximConfig config) {
        return new Maxim(config, MaximApiClient.of(config));
    }

    /** Create a new Maxim instance talking to the platform through the given client */
    public static Maxim of(MaximConfig config, MaximApiClient apiClient) {
        return new Maxim(config, apiClient);
    }

    @Getter
    @Accessors(fluent = true)
    private final MaximConfig config;

    @Getter
    @Accessors(fluent = true)
    private final MaximApiClient apiClient;

    private Maxim(MaximConfig config, MaximApiClient apiClient) {
        this.config = config;
        this.apiClient = apiClient;
    }

    /** Create a new test run builder */
    public TestRun.Builder testRunBuilder(String name, String workspaceId) {
        return TestRun.builder()
                .config(config)
                .apiClient(apiClient)
                .name(name)
                .workspaceId(workspaceId);
    }

    /** Create a new test run builder for the configured default workspace */
    public TestRun.Builder testRunBuilder(String name) {
        return TestRun.builder().config(config).apiClient(apiClient).name(name);
    }
}
