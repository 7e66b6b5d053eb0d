package dev.maxim.testrun;

/** Outcome of one named local evaluation on one row. */
public record LocalEvaluationResult(
        String name, EvaluationScore result, PassFailCriteria passFailCriteria) {}
