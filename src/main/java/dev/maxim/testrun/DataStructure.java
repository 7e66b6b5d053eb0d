package dev.maxim.testrun;

import java.util.*;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps column names to their {@link ColumnRole}. Column order is preserved.
 *
 * <p>A data structure holds at most one column each of the singular roles (INPUT,
 * EXPECTED_OUTPUT, CONTEXT_TO_EVALUATE, SCENARIO, EXPECTED_STEPS) and any number of variables.
 */
@Slf4j
public final class DataStructure {
    private final Map<String, ColumnRole> columns;

    private DataStructure(LinkedHashMap<String, ColumnRole> columns) {
        this.columns = Collections.unmodifiableMap(columns);
        Map<ColumnRole, String> seen = new EnumMap<>(ColumnRole.class);
        for (var column : columns.entrySet()) {
            var role = Objects.requireNonNull(column.getValue(), "role of " + column.getKey());
            if (role.isSingular()) {
                var previous = seen.putIfAbsent(role, column.getKey());
                if (previous != null) {
                    throw new ConfigurationException(
                            "Data structure contains more than one %s column: \"%s\" and \"%s\""
                                    .formatted(role, previous, column.getKey()));
                }
            }
        }
    }

    /** Create a data structure. Iteration order of the given map becomes the column order. */
    public static DataStructure of(Map<String, ColumnRole> columns) {
        return new DataStructure(new LinkedHashMap<>(columns));
    }

    /** Adopt a structure reported by the platform. Unrecognized roles are treated as variables. */
    public static DataStructure fromPlatform(Map<String, String> platformStructure) {
        var columns = new LinkedHashMap<String, ColumnRole>();
        platformStructure.forEach(
                (column, role) -> {
                    try {
                        columns.put(column, ColumnRole.valueOf(role));
                    } catch (IllegalArgumentException | NullPointerException e) {
                        log.debug("treating column {} of role {} as a variable", column, role);
                        columns.put(column, ColumnRole.VARIABLE);
                    }
                });
        return new DataStructure(columns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, ColumnRole> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    /** The column holding the given singular role. */
    public Optional<String> columnFor(ColumnRole role) {
        for (var column : columns.entrySet()) {
            if (column.getValue() == role) {
                return Optional.of(column.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * Check that the value of every column of a row matches its role.
     *
     * @throws ConfigurationException if a column is unknown or holds a value of the wrong type
     */
    public void validateRow(Map<String, ?> data) {
        for (var entry : data.entrySet()) {
            var column = entry.getKey();
            var value = entry.getValue();
            var role = columns.get(column);
            if (role == null) {
                throw new ConfigurationException(
                        "Unknown column \"%s\" found in data entry, expected one of %s"
                                .formatted(column, columns.keySet()));
            }
            switch (role) {
                case INPUT, EXPECTED_OUTPUT, SCENARIO, EXPECTED_STEPS -> {
                    if (!(value instanceof String)) {
                        throw new ConfigurationException(
                                "%s column \"%s\" has a data entry which is not a string"
                                        .formatted(describe(role), column));
                    }
                }
                case CONTEXT_TO_EVALUATE, VARIABLE -> {
                    if (!isStringOrStringList(value)) {
                        throw new ConfigurationException(
                                "%s column \"%s\" has a data entry which is not a string or a list of strings"
                                        .formatted(describe(role), column));
                    }
                }
                case NULLABLE_VARIABLE -> {
                    if (value != null && !isStringOrStringList(value)) {
                        throw new ConfigurationException(
                                "Nullable variable column \"%s\" has a data entry which is not null, a string or a list of strings"
                                        .formatted(column));
                    }
                }
            }
        }
    }

    /**
     * Check that every declared column exists on the platform side. Extra platform columns are
     * fine.
     *
     * @throws ConfigurationException naming the first missing column
     */
    public void validateAgainst(Map<String, String> platformStructure) {
        for (var column : columns.keySet()) {
            if (!platformStructure.containsKey(column)) {
                throw new ConfigurationException(
                        "The provided data structure contains key \"%s\" which is not present in the dataset on the platform"
                                .formatted(column));
            }
        }
    }

    /**
     * Check that a tabular file's header lists the declared columns in the declared order.
     *
     * @throws ConfigurationException if the header disagrees with this structure
     */
    public void validateHeader(List<String> header) {
        var expected = columnNames();
        if (!expected.equals(header)) {
            throw new ConfigurationException(
                    "Columns of the tabular file %s do not match the data structure %s"
                            .formatted(header, expected));
        }
    }

    private static boolean isStringOrStringList(@Nullable Object value) {
        if (value instanceof String) {
            return true;
        }
        if (value instanceof List<?> list) {
            return list.stream().allMatch(item -> item instanceof String);
        }
        return false;
    }

    private static String describe(ColumnRole role) {
        return switch (role) {
            case INPUT -> "Input";
            case EXPECTED_OUTPUT -> "Expected output";
            case CONTEXT_TO_EVALUATE -> "Context to evaluate";
            case VARIABLE -> "Variable";
            case NULLABLE_VARIABLE -> "Nullable variable";
            case SCENARIO -> "Scenario";
            case EXPECTED_STEPS -> "Expected steps";
        };
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DataStructure other && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "DataStructure" + columns;
    }

    public static final class Builder {
        private final LinkedHashMap<String, ColumnRole> columns = new LinkedHashMap<>();

        public Builder column(String name, ColumnRole role) {
            columns.put(Objects.requireNonNull(name), Objects.requireNonNull(role));
            return this;
        }

        public Builder input(String name) {
            return column(name, ColumnRole.INPUT);
        }

        public Builder expectedOutput(String name) {
            return column(name, ColumnRole.EXPECTED_OUTPUT);
        }

        public Builder contextToEvaluate(String name) {
            return column(name, ColumnRole.CONTEXT_TO_EVALUATE);
        }

        public Builder variable(String name) {
            return column(name, ColumnRole.VARIABLE);
        }

        public Builder nullableVariable(String name) {
            return column(name, ColumnRole.NULLABLE_VARIABLE);
        }

        public DataStructure build() {
            return new DataStructure(new LinkedHashMap<>(columns));
        }
    }
}
