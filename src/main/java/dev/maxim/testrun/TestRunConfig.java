package dev.maxim.testrun;

import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/** Validated, immutable configuration of a test run. */
public record TestRunConfig(
        String name,
        String workspaceId,
        DataSource data,
        @Nullable DataStructure dataStructure,
        List<Evaluator> evaluators,
        OutputStrategy outputStrategy,
        int concurrency,
        @Nullable HumanEvaluationConfig humanEvaluationConfig,
        TestRunLogger logger,
        List<String> tags) {

    public static final int DEFAULT_CONCURRENCY = 10;

    public TestRunConfig {
        evaluators = List.copyOf(evaluators);
        tags = List.copyOf(tags);
    }

    public Optional<DataStructure> declaredStructure() {
        return Optional.ofNullable(dataStructure);
    }
}
