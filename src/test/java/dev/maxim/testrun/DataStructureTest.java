package dev.maxim.testrun;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DataStructureTest {
    private final DataStructure structure =
            DataStructure.builder()
                    .input("question")
                    .expectedOutput("answer")
                    .contextToEvaluate("docs")
                    .variable("topic")
                    .nullableVariable("notes")
                    .build();

    @Test
    void keepsColumnOrder() {
        assertEquals(
                List.of("question", "answer", "docs", "topic", "notes"), structure.columnNames());
        assertEquals("docs", structure.columnFor(ColumnRole.CONTEXT_TO_EVALUATE).orElseThrow());
        assertTrue(structure.columnFor(ColumnRole.SCENARIO).isEmpty());
    }

    @Test
    void rejectsTwoInputColumns() {
        var columns = new LinkedHashMap<String, ColumnRole>();
        columns.put("q1", ColumnRole.INPUT);
        columns.put("q2", ColumnRole.INPUT);

        var error = assertThrows(ConfigurationException.class, () -> DataStructure.of(columns));
        assertTrue(error.getMessage().contains("INPUT"));
    }

    @Test
    void allowsManyVariables() {
        assertDoesNotThrow(
                () ->
                        DataStructure.of(
                                Map.of(
                                        "a", ColumnRole.VARIABLE,
                                        "b", ColumnRole.VARIABLE,
                                        "c", ColumnRole.NULLABLE_VARIABLE)));
    }

    @Test
    void validRowPasses() {
        var row = new HashMap<String, Object>();
        row.put("question", "What is the capital of France?");
        row.put("answer", "Paris");
        row.put("docs", List.of("France is a country", "Paris is its capital"));
        row.put("topic", "geography");
        row.put("notes", null);

        assertDoesNotThrow(() -> structure.validateRow(row));
    }

    @Test
    void inputMustBeString() {
        var error =
                assertThrows(
                        ConfigurationException.class,
                        () -> structure.validateRow(Map.of("question", List.of("a"))));
        assertTrue(error.getMessage().contains("Input column \"question\""));
    }

    @Test
    void variableMustBeStringOrStringList() {
        assertThrows(
                ConfigurationException.class, () -> structure.validateRow(Map.of("topic", 42)));
        assertThrows(
                ConfigurationException.class,
                () -> structure.validateRow(Map.of("topic", List.of("ok", 1))));
    }

    @Test
    void onlyNullableVariablesMayBeNull() {
        var row = new HashMap<String, Object>();
        row.put("topic", null);

        assertThrows(ConfigurationException.class, () -> structure.validateRow(row));
    }

    @Test
    void unknownColumnFails() {
        assertThrows(
                ConfigurationException.class, () -> structure.validateRow(Map.of("other", "x")));
    }

    @Test
    void platformStructureMayHaveExtraColumns() {
        var platform =
                Map.of(
                        "question", "INPUT",
                        "answer", "EXPECTED_OUTPUT",
                        "docs", "CONTEXT_TO_EVALUATE",
                        "topic", "VARIABLE",
                        "notes", "NULLABLE_VARIABLE",
                        "extra", "VARIABLE");

        assertDoesNotThrow(() -> structure.validateAgainst(platform));
    }

    @Test
    void platformStructureMissingColumnFails() {
        var error =
                assertThrows(
                        ConfigurationException.class,
                        () -> structure.validateAgainst(Map.of("question", "INPUT")));
        assertTrue(error.getMessage().contains("answer"));
    }

    @Test
    void headerMustMatchOrder() {
        assertDoesNotThrow(
                () -> structure.validateHeader(List.of("question", "answer", "docs", "topic", "notes")));
        assertThrows(
                ConfigurationException.class,
                () -> structure.validateHeader(List.of("answer", "question", "docs", "topic", "notes")));
    }

    @Test
    void adoptsPlatformStructure() {
        var platform = new LinkedHashMap<String, String>();
        platform.put("q", "INPUT");
        platform.put("meta", "SOMETHING_NEW");

        var adopted = DataStructure.fromPlatform(platform);

        assertEquals(ColumnRole.INPUT, adopted.columns().get("q"));
        assertEquals(ColumnRole.VARIABLE, adopted.columns().get("meta"));
    }
}
