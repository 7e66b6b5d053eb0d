package dev.maxim.testrun;

import static org.junit.jupiter.api.Assertions.*;

import dev.maxim.testrun.PassFailCriteria.Operator;
import dev.maxim.testrun.PassFailCriteria.OverallFor;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LocalEvaluatorRunnerTest {
    private static final PassFailCriteria CRITERIA =
            PassFailCriteria.of(
                    PassFailCriteria.entry(Operator.GREATER_THAN_OR_EQUAL, 0.5),
                    PassFailCriteria.overall(
                            Operator.GREATER_THAN_OR_EQUAL, 80, OverallFor.AVERAGE));

    private static final EvaluationInput INPUT = new EvaluationInput("Paris", "capital of France");

    @Test
    void localScoresArePassedThrough() {
        var runner =
                new LocalEvaluatorRunner(
                        List.of(
                                Evaluator.local(
                                        "exact",
                                        (result, data) ->
                                                EvaluationScore.of(
                                                        result.output().equals(data.get("answer"))),
                                        CRITERIA)));

        var results = runner.run(INPUT, Map.of("answer", "Paris"));

        assertEquals(1, results.size());
        assertEquals("exact", results.get(0).name());
        assertEquals(true, results.get(0).result().score());
        assertSame(CRITERIA, results.get(0).passFailCriteria());
    }

    @Test
    void throwingLocalEvaluatorYieldsErr() {
        var runner =
                new LocalEvaluatorRunner(
                        List.of(
                                Evaluator.local(
                                        "broken",
                                        (result, data) -> {
                                            throw new IllegalStateException("model offline");
                                        },
                                        CRITERIA),
                                Evaluator.local(
                                        "length",
                                        (result, data) -> EvaluationScore.of(result.output().length()),
                                        CRITERIA)));

        var results = runner.run(INPUT, Map.of());

        assertEquals(2, results.size());
        assertTrue(results.get(0).result().isError());
        assertTrue(results.get(0).result().reasoning().contains("model offline"));
        assertEquals(5.0, results.get(1).result().score());
    }

    @Test
    void failedAssertionInEvaluatorYieldsErr() {
        var runner =
                new LocalEvaluatorRunner(
                        List.of(
                                Evaluator.local(
                                        "asserting",
                                        (result, data) -> {
                                            throw new AssertionError("expected a city");
                                        },
                                        CRITERIA),
                                Evaluator.combined(
                                        List.of("a", "b"),
                                        (result, data) -> {
                                            throw new AssertionError("expected scores");
                                        },
                                        Map.of("a", CRITERIA, "b", CRITERIA))));

        var results = runner.run(INPUT, Map.of());

        assertEquals(
                List.of("asserting", "a", "b"),
                results.stream().map(LocalEvaluationResult::name).toList());
        assertTrue(results.stream().allMatch(r -> r.result().isError()));
        assertTrue(results.get(0).result().reasoning().contains("expected a city"));
        assertTrue(results.get(2).result().reasoning().contains("expected scores"));
    }

    @Test
    void throwingCombinedEvaluatorYieldsErrForEveryName() {
        var runner =
                new LocalEvaluatorRunner(
                        List.of(
                                Evaluator.combined(
                                        List.of("a", "b"),
                                        (result, data) -> {
                                            throw new RuntimeException("nope");
                                        },
                                        Map.of("a", CRITERIA, "b", CRITERIA))));

        var results = runner.run(INPUT, Map.of());

        assertEquals(List.of("a", "b"), results.stream().map(LocalEvaluationResult::name).toList());
        assertTrue(results.stream().allMatch(r -> r.result().isError()));
        assertEquals("Err", results.get(1).result().score());
    }

    @Test
    void combinedEvaluatorMissingNameIsSynthesized() {
        var runner =
                new LocalEvaluatorRunner(
                        List.of(
                                Evaluator.combined(
                                        List.of("a", "b"),
                                        (result, data) ->
                                                Map.of(
                                                        "a", EvaluationScore.of(1.0, "fine"),
                                                        "stray", EvaluationScore.of(0.0)),
                                        Map.of("a", CRITERIA, "b", CRITERIA))));

        var results = runner.run(INPUT, Map.of());

        assertEquals(2, results.size());
        assertEquals(1.0, results.get(0).result().score());
        assertEquals("fine", results.get(0).result().reasoning());
        assertEquals("b", results.get(1).name());
        assertTrue(results.get(1).result().isError());
    }

    @Test
    void platformEvaluatorsAreIgnored() {
        var runner = new LocalEvaluatorRunner(List.of(Evaluator.platform("Faithfulness")));

        assertTrue(runner.isEmpty());
        assertTrue(runner.run(INPUT, Map.of()).isEmpty());
    }

    @Test
    void combinedEvaluatorNeedsCriteriaForEveryName() {
        assertThrows(
                ConfigurationException.class,
                () ->
                        Evaluator.combined(
                                List.of("a", "b"), (result, data) -> Map.of(), Map.of("a", CRITERIA)));
    }

    @Test
    void booleanCriteriaOnlyAllowEquality() {
        assertThrows(
                ConfigurationException.class,
                () -> PassFailCriteria.entry(Operator.GREATER_THAN, true));
        assertDoesNotThrow(() -> PassFailCriteria.entry(Operator.NOT_EQUAL, false));
    }

    @Test
    void criteriaEncodeForEvaluatorConfig() {
        var criteria =
                PassFailCriteria.of(
                        PassFailCriteria.entry(Operator.EQUAL, true),
                        PassFailCriteria.overall(
                                Operator.GREATER_THAN, 90, OverallFor.PERCENTAGE_OF_PASSED_RESULTS));

        @SuppressWarnings("unchecked")
        var wire =
                (Map<String, Map<String, Object>>)
                        criteria.toWireConfig().get("passFailCriteria");

        assertEquals(
                Map.of("value", "Yes", "operator", "=", "name", "score"), wire.get("entryLevel"));
        assertEquals(
                Map.of("value", 90.0, "operator", ">", "name", "queriesPassed"),
                wire.get("runLevel"));
    }
}
