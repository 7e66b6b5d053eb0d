package dev.maxim.testrun;

import com.fasterxml.jackson.annotation.JsonInclude;
import javax.annotation.Nullable;

/**
 * Score produced by a local evaluator.
 *
 * @param score a number, a boolean, or the string {@code "Err"} when evaluation failed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvaluationScore(Object score, @Nullable String reasoning) {
    public static final String ERROR_SCORE = "Err";

    public EvaluationScore {
        if (!(score instanceof Number || score instanceof Boolean || score instanceof String)) {
            throw new IllegalArgumentException(
                    "score must be a number, a boolean or a string: " + score);
        }
    }

    public static EvaluationScore of(double score) {
        return new EvaluationScore(score, null);
    }

    public static EvaluationScore of(double score, String reasoning) {
        return new EvaluationScore(score, reasoning);
    }

    public static EvaluationScore of(boolean score) {
        return new EvaluationScore(score, null);
    }

    public static EvaluationScore of(boolean score, String reasoning) {
        return new EvaluationScore(score, reasoning);
    }

    public static EvaluationScore error(String reasoning) {
        return new EvaluationScore(ERROR_SCORE, reasoning);
    }

    public boolean isError() {
        return ERROR_SCORE.equals(score);
    }
}
