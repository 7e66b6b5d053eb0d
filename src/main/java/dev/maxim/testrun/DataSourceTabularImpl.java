package dev.maxim.testrun;

import java.util.Optional;

/** Rows of a tabular file. The file's header must list the declared columns in order. */
class DataSourceTabularImpl implements DataSource {
    private final TabularFile file;

    DataSourceTabularImpl(TabularFile file) {
        this.file = file;
    }

    @Override
    public void validate(DataStructure dataStructure) {
        dataStructure.validateHeader(file.header());
    }

    @Override
    public Cursor openCursor(Context context) {
        var structure = context.declaredStructure();
        if (structure == null) {
            throw new ConfigurationException("A data structure is required for tabular data");
        }
        validate(structure);
        int rowCount = file.rowCount();
        return new Cursor() {
            private boolean consumed = false;

            @Override
            public DataStructure dataStructure() {
                return structure;
            }

            @Override
            public Optional<Page> nextPage() {
                if (consumed) {
                    return Optional.empty();
                }
                consumed = true;
                return Optional.of(
                        new Page(
                                0,
                                0,
                                rowCount,
                                index -> file.row(index).map(data -> new Row(data, null))));
            }

            @Override
            public void close() {
                consumed = true;
            }
        };
    }
}
