package dev.maxim.testrun;

import dev.maxim.MaximUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs local and combined evaluators against one row. An evaluator that throws never fails the
 * row: each of its names gets an {@code "Err"} score carrying the error instead. The result holds
 * exactly one entry per declared evaluator name, in declaration order.
 */
@Slf4j
final class LocalEvaluatorRunner {
    private final List<Evaluator> evaluators;

    LocalEvaluatorRunner(List<Evaluator> evaluators) {
        this.evaluators =
                evaluators.stream()
                        .filter(
                                e -> e instanceof Evaluator.Local
                                        || e instanceof Evaluator.Combined)
                        .toList();
    }

    boolean isEmpty() {
        return evaluators.isEmpty();
    }

    List<LocalEvaluationResult> run(EvaluationInput input, Map<String, Object> data) {
        var results = new ArrayList<LocalEvaluationResult>();
        for (var evaluator : evaluators) {
            if (evaluator instanceof Evaluator.Local local) {
                results.add(runLocal(local, input, data));
            } else if (evaluator instanceof Evaluator.Combined combined) {
                results.addAll(runCombined(combined, input, data));
            }
        }
        return results;
    }

    private LocalEvaluationResult runLocal(
            Evaluator.Local evaluator, EvaluationInput input, Map<String, Object> data) {
        EvaluationScore score;
        try {
            score = evaluator.function().evaluate(input, data);
            if (score == null) {
                score = EvaluationScore.error("Evaluator returned no score");
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.debug("Evaluator '{}' threw exception", evaluator.name(), e);
            score =
                    EvaluationScore.error(
                            "Error while running evaluator %s: %s"
                                    .formatted(evaluator.name(), MaximUtils.buildErrorMessage(e)));
        }
        return new LocalEvaluationResult(evaluator.name(), score, evaluator.passFailCriteria());
    }

    private List<LocalEvaluationResult> runCombined(
            Evaluator.Combined evaluator, EvaluationInput input, Map<String, Object> data) {
        Map<String, EvaluationScore> scores;
        try {
            scores = evaluator.function().evaluate(input, data);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.debug("Combined evaluator {} threw exception", evaluator.names(), e);
            var reasoning =
                    "Error while running combined evaluator with names %s: %s"
                            .formatted(evaluator.names(), MaximUtils.buildErrorMessage(e));
            return evaluator.names().stream()
                    .map(
                            name ->
                                    new LocalEvaluationResult(
                                            name,
                                            EvaluationScore.error(reasoning),
                                            evaluator.passFailCriteria().get(name)))
                    .toList();
        }
        if (scores == null) {
            scores = Map.of();
        }
        for (var returned : scores.keySet()) {
            if (!evaluator.names().contains(returned)) {
                log.warn(
                        "Ignoring score \"{}\" of combined evaluator with names {}",
                        returned,
                        evaluator.names());
            }
        }
        var results = new ArrayList<LocalEvaluationResult>();
        for (var name : evaluator.names()) {
            var score = scores.get(name);
            if (score == null) {
                score =
                        EvaluationScore.error(
                                "No score returned for \"%s\" by combined evaluator with names %s"
                                        .formatted(name, evaluator.names()));
            }
            results.add(
                    new LocalEvaluationResult(name, score, evaluator.passFailCriteria().get(name)));
        }
        return results;
    }
}
