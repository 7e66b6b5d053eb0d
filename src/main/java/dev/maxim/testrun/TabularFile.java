package dev.maxim.testrun;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** A parsed tabular file such as a CSV. Parsing itself happens elsewhere. */
public interface TabularFile {
    /** column names in file order */
    List<String> header();

    int rowCount();

    /** Row at the given zero-based index, keyed by column name. Empty if out of range. */
    Optional<Map<String, Object>> row(int index);
}
