package dev.maxim.testrun;

import javax.annotation.Nullable;

/**
 * What a local evaluator scores.
 *
 * @param contextToEvaluate a string, a list of strings, or null
 */
public record EvaluationInput(String output, @Nullable Object contextToEvaluate) {}
