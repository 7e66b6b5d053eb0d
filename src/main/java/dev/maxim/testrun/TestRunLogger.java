package dev.maxim.testrun;

import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Receives progress of a test run. Implementations must be safe to call from many threads. */
public interface TestRunLogger {
    void info(String message);

    void error(String message);

    /** Called once for every row that was pushed successfully. */
    void processed(String message, ProcessedEntry entry);

    /**
     * @param output null when the platform produces the output itself
     * @param evaluationResults null when no local evaluator ran
     */
    record ProcessedEntry(
            Map<String, Object> datasetEntry,
            @Nullable YieldedOutput output,
            @Nullable List<LocalEvaluationResult> evaluationResults) {}
}
