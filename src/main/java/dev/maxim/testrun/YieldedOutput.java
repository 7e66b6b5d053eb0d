package dev.maxim.testrun;

import dev.maxim.api.MaximApiClient;
import javax.annotation.Nullable;

/**
 * Output produced for one row.
 *
 * @param retrievedContextToEvaluate context retrieved while producing the output (a string or a
 *     list of strings). Overrides the row's own context when present.
 * @param meta usage and cost of producing the output
 */
public record YieldedOutput(
        String data, @Nullable Object retrievedContextToEvaluate, @Nullable OutputMeta meta) {

    public static YieldedOutput of(String data) {
        return new YieldedOutput(data, null, null);
    }

    public static YieldedOutput of(String data, Object retrievedContextToEvaluate) {
        return new YieldedOutput(data, retrievedContextToEvaluate, null);
    }

    public record OutputMeta(
            @Nullable MaximApiClient.Usage usage, @Nullable MaximApiClient.Cost cost) {}
}
