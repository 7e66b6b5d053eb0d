package dev.maxim.testrun;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/** A data source which is entirely in memory. */
class DataSourceInMemoryImpl implements DataSource {
    private final List<Row> rows;

    DataSourceInMemoryImpl(List<? extends Map<String, ?>> rows) {
        var copy = new ArrayList<Row>(rows.size());
        for (var row : rows) {
            copy.add(Row.of(row));
        }
        this.rows = List.copyOf(copy);
    }

    @Override
    public void validate(DataStructure dataStructure) {
        for (var row : rows) {
            dataStructure.validateRow(row.data());
        }
    }

    @Override
    public Cursor openCursor(Context context) {
        var structure = context.declaredStructure();
        if (structure == null) {
            throw new ConfigurationException("A data structure is required for in-memory data");
        }
        validate(structure);
        return new Cursor() {
            private final AtomicBoolean consumed = new AtomicBoolean(false);

            @Override
            public DataStructure dataStructure() {
                return structure;
            }

            @Override
            public Optional<Page> nextPage() {
                if (consumed.getAndSet(true)) {
                    return Optional.empty();
                }
                return Optional.of(
                        new Page(
                                0,
                                0,
                                rows.size(),
                                index -> Optional.of(rows.get(index))));
            }

            @Override
            public void close() {
                consumed.set(true);
            }
        };
    }
}
