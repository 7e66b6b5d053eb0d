package dev.maxim.testrun;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * One unit of evaluation input: column name to value. Values are strings, lists of strings, or
 * null for nullable variables.
 *
 * @param id id of the row on the platform, for rows of a platform dataset
 */
public record Row(Map<String, Object> data, @Nullable String id) {
    public Row {
        // copy preserving null values, which Map.copyOf rejects
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static Row of(Map<String, ?> data) {
        return new Row(new LinkedHashMap<>(data), null);
    }

    public Optional<String> datasetEntryId() {
        return Optional.ofNullable(id);
    }
}
