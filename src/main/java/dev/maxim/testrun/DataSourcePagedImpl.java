package dev.maxim.testrun;

import dev.maxim.MaximUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Rows produced page by page by a user function. Pages are numbered from zero and fetched only
 * when asked for. A page whose rows do not match the declared structure is skipped and does not
 * consume any row indices.
 */
@Slf4j
class DataSourcePagedImpl implements DataSource {
    private final PageFunction pageFunction;

    DataSourcePagedImpl(PageFunction pageFunction) {
        this.pageFunction = pageFunction;
    }

    @Override
    public Cursor openCursor(Context context) {
        var structure = context.declaredStructure();
        if (structure == null) {
            throw new ConfigurationException("A data structure is required for paged data");
        }
        return new Cursor() {
            private int pageNumber = 0;
            private int nextIndex = 0;
            private boolean done = false;

            @Override
            public DataStructure dataStructure() {
                return structure;
            }

            @Override
            public Optional<Page> nextPage() {
                while (!done) {
                    int current = pageNumber++;
                    var rawRows = fetch(current);
                    if (rawRows == null) {
                        done = true;
                        break;
                    }
                    var rows = new ArrayList<Row>(rawRows.size());
                    try {
                        for (var data : rawRows) {
                            structure.validateRow(data);
                            rows.add(Row.of(data));
                        }
                    } catch (ConfigurationException e) {
                        context.logger()
                                .error(
                                        "Skipping page %d: %s"
                                                .formatted(
                                                        current + 1,
                                                        MaximUtils.buildErrorMessage(e)));
                        continue;
                    }
                    int firstIndex = nextIndex;
                    nextIndex += rows.size();
                    var pageRows = List.copyOf(rows);
                    return Optional.of(
                            new Page(
                                    current,
                                    firstIndex,
                                    pageRows.size(),
                                    index -> Optional.of(pageRows.get(index - firstIndex))));
                }
                return Optional.empty();
            }

            private List<Map<String, Object>> fetch(int page) {
                try {
                    log.debug("fetching page {}", page);
                    return pageFunction.fetch(page);
                } catch (Exception e) {
                    throw new TestRunException("Failed to fetch page " + page, e);
                }
            }

            @Override
            public void close() {
                done = true;
            }
        };
    }
}
