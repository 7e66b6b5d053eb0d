package dev.maxim.testrun;

/** Semantic tag of a dataset column. */
public enum ColumnRole {
    INPUT(true),
    EXPECTED_OUTPUT(true),
    CONTEXT_TO_EVALUATE(true),
    VARIABLE(false),
    NULLABLE_VARIABLE(false),
    SCENARIO(true),
    EXPECTED_STEPS(true);

    private final boolean singular;

    ColumnRole(boolean singular) {
        this.singular = singular;
    }

    /** true if a data structure may hold at most one column with this role */
    public boolean isSingular() {
        return singular;
    }
}
