package dev.maxim.testrun;

import java.util.*;

/**
 * An evaluator scores the output of each row. Three kinds exist:
 *
 * <ul>
 *   <li>{@link Platform}: resolved by name and run by the platform.
 *   <li>{@link Local}: a function run in this process producing one score.
 *   <li>{@link Combined}: a function run in this process producing several named scores.
 * </ul>
 */
public interface Evaluator {
    /** Names of the scores this evaluator produces. */
    List<String> names();

    static Evaluator platform(String name) {
        return new Platform(name);
    }

    static Evaluator local(
            String name, LocalEvaluationFunction function, PassFailCriteria passFailCriteria) {
        return new Local(name, function, passFailCriteria);
    }

    static Evaluator combined(
            List<String> names,
            CombinedEvaluationFunction function,
            Map<String, PassFailCriteria> passFailCriteria) {
        return new Combined(names, function, passFailCriteria);
    }

    record Platform(String name) implements Evaluator {
        public Platform {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public List<String> names() {
            return List.of(name);
        }
    }

    record Local(String name, LocalEvaluationFunction function, PassFailCriteria passFailCriteria)
            implements Evaluator {
        public Local {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(function, "function");
            Objects.requireNonNull(passFailCriteria, "passFailCriteria");
        }

        @Override
        public List<String> names() {
            return List.of(name);
        }
    }

    record Combined(
            List<String> names,
            CombinedEvaluationFunction function,
            Map<String, PassFailCriteria> passFailCriteria)
            implements Evaluator {
        public Combined {
            names = List.copyOf(names);
            Objects.requireNonNull(function, "function");
            passFailCriteria = Map.copyOf(passFailCriteria);
            if (names.isEmpty()) {
                throw new ConfigurationException("a combined evaluator needs at least one name");
            }
            if (new HashSet<>(names).size() != names.size()) {
                throw new ConfigurationException(
                        "combined evaluator declares a name more than once: " + names);
            }
            for (var name : names) {
                if (!passFailCriteria.containsKey(name)) {
                    throw new ConfigurationException(
                            "No pass fail criteria found with name \"%s\" for combined evaluator with names %s"
                                    .formatted(name, names));
                }
            }
        }
    }
}
