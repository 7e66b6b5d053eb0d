package dev.maxim.testrun;

import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Rows of a dataset hosted on the platform. The row count and structure are fetched when the
 * cursor opens and each row is fetched on demand.
 */
@Slf4j
class DataSourcePlatformImpl implements DataSource {
    private final String datasetId;

    DataSourcePlatformImpl(String datasetId) {
        this.datasetId = Objects.requireNonNull(datasetId);
    }

    @Override
    public Optional<String> datasetId() {
        return Optional.of(datasetId);
    }

    @Override
    public Cursor openCursor(Context context) {
        var client = context.apiClient();
        var platformStructure = client.getDatasetStructure(datasetId);
        final DataStructure structure;
        if (context.declaredStructure() != null) {
            context.declaredStructure().validateAgainst(platformStructure);
            structure = context.declaredStructure();
        } else {
            structure = DataStructure.fromPlatform(platformStructure);
        }
        int totalRows = client.getDatasetTotalRows(datasetId);
        log.debug("dataset {} has {} rows", datasetId, totalRows);
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
                                totalRows,
                                index ->
                                        client.getDatasetRow(datasetId, index)
                                                .map(row -> new Row(row.data(), row.id()))));
            }

            @Override
            public void close() {
                consumed = true;
            }
        };
    }
}
