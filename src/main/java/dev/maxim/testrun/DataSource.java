package dev.maxim.testrun;

import dev.maxim.api.MaximApiClient;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Data sources supply the rows of a test run. Every source is exposed as a sequence of pages of
 * indexed rows.
 *
 * <p>In-memory lists, tabular files and platform datasets know their row count up front and
 * produce a single page. A {@link PageFunction} produces one page per call until it runs dry.
 */
public interface DataSource {
    Cursor openCursor(Context context);

    /** id of the platform dataset backing this source, if any */
    default Optional<String> datasetId() {
        return Optional.empty();
    }

    /**
     * Check rows that are already known against a declared structure. Sources that fetch rows
     * later validate them when the cursor is opened or a page is fetched.
     */
    default void validate(DataStructure dataStructure) {}

    /** Collaborators a cursor may need. */
    record Context(
            MaximApiClient apiClient,
            @Nullable DataStructure declaredStructure,
            TestRunLogger logger) {}

    @NotThreadSafe
    interface Cursor extends AutoCloseable {
        /** Structure the rows of this cursor follow. */
        DataStructure dataStructure();

        /**
         * Fetch the next page. Returns empty if there are no more pages.
         *
         * <p>Implementations may make external requests to fetch data.
         */
        Optional<Page> nextPage();

        /** close all cursor resources */
        @Override
        void close();
    }

    /**
     * A contiguous run of row indices. Rows are fetched one at a time through {@link #row(int)},
     * which may make an external request.
     */
    record Page(int number, int firstIndex, int size, RowFetcher fetcher) {
        public Optional<Row> row(int index) throws Exception {
            if (index < firstIndex || index >= firstIndex + size) {
                throw new IndexOutOfBoundsException(
                        "index %d is outside page %d [%d, %d)"
                                .formatted(index, number, firstIndex, firstIndex + size));
            }
            return fetcher.fetch(index);
        }
    }

    @FunctionalInterface
    interface RowFetcher {
        Optional<Row> fetch(int index) throws Exception;
    }

    /** Supplies rows one page at a time. */
    @FunctionalInterface
    interface PageFunction {
        /**
         * @param page zero-based page number
         * @return the rows of the page, or null once there are no more pages
         */
        @Nullable
        List<Map<String, Object>> fetch(int page) throws Exception;
    }

    /** An in-memory data source of the given rows. */
    static DataSource of(List<? extends Map<String, ?>> rows) {
        return new DataSourceInMemoryImpl(rows);
    }

    /** A data source backed by a tabular file. */
    static DataSource ofTable(TabularFile file) {
        return new DataSourceTabularImpl(file);
    }

    /** A data source backed by a dataset on the platform. */
    static DataSource ofDataset(String datasetId) {
        return new DataSourcePlatformImpl(datasetId);
    }

    /** A data source fetching rows page by page from the given function. */
    static DataSource ofPages(PageFunction pageFunction) {
        return new DataSourcePagedImpl(pageFunction);
    }
}
