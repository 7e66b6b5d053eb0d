package dev.maxim.testrun;

import java.util.Map;

/** Scores a row under several names at once. Returns one score per declared name. */
@FunctionalInterface
public interface CombinedEvaluationFunction {
    Map<String, EvaluationScore> evaluate(EvaluationInput result, Map<String, Object> data)
            throws Exception;
}
