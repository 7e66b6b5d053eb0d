package dev.maxim.testrun;

import java.util.Map;

@FunctionalInterface
public interface LocalEvaluationFunction {
    EvaluationScore evaluate(EvaluationInput result, Map<String, Object> data) throws Exception;
}
