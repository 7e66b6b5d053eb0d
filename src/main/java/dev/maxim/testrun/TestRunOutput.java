package dev.maxim.testrun;

import dev.maxim.api.MaximApiClient;
import java.util.List;

/**
 * Result of a finished test run.
 *
 * @param failedEntryIndices indices of the rows that failed before they could be pushed, ascending
 */
public record TestRunOutput(
        MaximApiClient.TestRunResult testRunResult, List<Integer> failedEntryIndices) {
    public TestRunOutput {
        failedEntryIndices = List.copyOf(failedEntryIndices);
    }

    public String createReportString() {
        var report = new StringBuilder("Test run report: ").append(testRunResult.link());
        if (failedEntryIndices.isEmpty()) {
            report.append(" (all entries pushed)");
        } else {
            report.append(" (")
                    .append(failedEntryIndices.size())
                    .append(" entries failed locally: ")
                    .append(failedEntryIndices)
                    .append(')');
        }
        return report.toString();
    }
}
