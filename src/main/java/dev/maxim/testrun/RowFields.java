package dev.maxim.testrun;

import java.util.List;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/** Typed fields of a row, pulled out by column role. Absent or empty values are null. */
record RowFields(
        @Nullable String input,
        @Nullable String expectedOutput,
        @Nullable Object contextToEvaluate,
        @Nullable String scenario,
        @Nullable String expectedSteps) {

    static RowFields extract(Row row, DataStructure structure) {
        var data = row.data();
        var contextColumn = structure.columnFor(ColumnRole.CONTEXT_TO_EVALUATE);
        return new RowFields(
                text(row, structure, ColumnRole.INPUT),
                text(row, structure, ColumnRole.EXPECTED_OUTPUT),
                contextColumn.map(data::get).orElse(null),
                text(row, structure, ColumnRole.SCENARIO),
                text(row, structure, ColumnRole.EXPECTED_STEPS));
    }

    @Nullable
    private static String text(Row row, DataStructure structure, ColumnRole role) {
        return structure.columnFor(role).map(column -> asText(row.data().get(column))).orElse(null);
    }

    @Nullable
    static String asText(@Nullable Object value) {
        if (value == null) {
            return null;
        }
        var text =
                value instanceof List<?> list
                        ? list.stream().map(String::valueOf).collect(Collectors.joining(","))
                        : String.valueOf(value);
        return text.isEmpty() ? null : text;
    }
}
