package dev.maxim.testrun;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * When a local evaluator's score counts as a pass, for each entry and for the run overall.
 *
 * <pre>{@code
 * PassFailCriteria.of(
 *         PassFailCriteria.entry(Operator.GREATER_THAN_OR_EQUAL, 0.7),
 *         PassFailCriteria.overall(Operator.GREATER_THAN_OR_EQUAL, 80, OverallFor.PERCENTAGE_OF_PASSED_RESULTS));
 * }</pre>
 */
public record PassFailCriteria(OnEachEntry onEachEntry, ForTestRunOverall forTestrunOverall) {
    public PassFailCriteria {
        Objects.requireNonNull(onEachEntry, "onEachEntry");
        Objects.requireNonNull(forTestrunOverall, "forTestrunOverall");
    }

    public static PassFailCriteria of(OnEachEntry onEachEntry, ForTestRunOverall overall) {
        return new PassFailCriteria(onEachEntry, overall);
    }

    public static OnEachEntry entry(Operator scoreShouldBe, double value) {
        return new OnEachEntry(scoreShouldBe, value);
    }

    public static OnEachEntry entry(Operator scoreShouldBe, boolean value) {
        return new OnEachEntry(scoreShouldBe, value);
    }

    public static ForTestRunOverall overall(
            Operator overallShouldBe, double value, OverallFor aggregation) {
        return new ForTestRunOverall(overallShouldBe, value, aggregation);
    }

    /** Encoding of these criteria inside a run's evaluator config. */
    Map<String, Object> toWireConfig() {
        var entryLevel = new LinkedHashMap<String, Object>();
        entryLevel.put(
                "value",
                onEachEntry.value() instanceof Boolean bool
                        ? (bool ? "Yes" : "No")
                        : onEachEntry.value());
        entryLevel.put("operator", onEachEntry.scoreShouldBe().symbol());
        entryLevel.put("name", "score");

        var runLevel = new LinkedHashMap<String, Object>();
        runLevel.put("value", forTestrunOverall.value());
        runLevel.put("operator", forTestrunOverall.overallShouldBe().symbol());
        runLevel.put("name", forTestrunOverall.aggregation().wireName());

        var criteria = new LinkedHashMap<String, Object>();
        criteria.put("entryLevel", entryLevel);
        criteria.put("runLevel", runLevel);
        return Map.of("passFailCriteria", criteria);
    }

    /** @param value a number, or a boolean compared with {@code =} or {@code !=} only */
    public record OnEachEntry(Operator scoreShouldBe, Object value) {
        public OnEachEntry {
            Objects.requireNonNull(scoreShouldBe, "scoreShouldBe");
            if (value instanceof Boolean) {
                if (scoreShouldBe != Operator.EQUAL && scoreShouldBe != Operator.NOT_EQUAL) {
                    throw new ConfigurationException(
                            "boolean scores can only be compared with = or !=, found "
                                    + scoreShouldBe.symbol());
                }
            } else if (!(value instanceof Number)) {
                throw new ConfigurationException(
                        "pass/fail value must be a number or a boolean: " + value);
            }
        }
    }

    public record ForTestRunOverall(
            Operator overallShouldBe,
            double value,
            @JsonProperty("for") OverallFor aggregation) {
        public ForTestRunOverall {
            Objects.requireNonNull(overallShouldBe, "overallShouldBe");
            Objects.requireNonNull(aggregation, "aggregation");
        }
    }

    public enum Operator {
        GREATER_THAN_OR_EQUAL(">="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        EQUAL("="),
        NOT_EQUAL("!=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        @JsonValue
        public String symbol() {
            return symbol;
        }
    }

    public enum OverallFor {
        AVERAGE("average", "meanScore"),
        PERCENTAGE_OF_PASSED_RESULTS("percentageOfPassedResults", "queriesPassed");

        private final String jsonName;
        private final String wireName;

        OverallFor(String jsonName, String wireName) {
            this.jsonName = jsonName;
            this.wireName = wireName;
        }

        @JsonValue
        public String jsonName() {
            return jsonName;
        }

        String wireName() {
            return wireName;
        }
    }
}
