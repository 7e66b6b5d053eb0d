package dev.maxim;

import dev.maxim.api.MaximApiClient;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class MaximUtils {
    /** construct a link to a test run within a workspace */
    public static String createTestRunURI(String baseUrl, String workspaceId, String testRunId) {
        return "%s/workspace/%s/testrun/%s".formatted(baseUrl, workspaceId, testRunId);
    }

    /**
     * Render an error and its whole cause chain as one message. Causes are listed one per line,
     * outermost first.
     */
    public static String buildErrorMessage(Throwable error) {
        var message = new StringBuilder();
        message.append(describe(error));
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(error);
        var cause = error.getCause();
        if (cause != null && seen.add(cause)) {
            message.append(":\n\tCaused by:");
            while (cause != null) {
                message.append("\n\t\t=> ").append(describe(cause));
                cause = cause.getCause();
                // cause chains may loop
                if (cause != null && !seen.add(cause)) {
                    break;
                }
            }
        }
        return message.toString();
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    /** Bordered text table of the entry counts of a test run. */
    public static String createStatusTable(MaximApiClient.EntryStatus status) {
        Map<String, Integer> rows = new LinkedHashMap<>();
        rows.put("running", status.running());
        rows.put("queued", status.queued());
        rows.put("completed", status.completed());
        rows.put("failed", status.failed());
        rows.put("stopped", status.stopped());
        rows.put("total", status.total());

        int keyWidth = rows.keySet().stream().mapToInt(String::length).max().orElse(0);
        int numberWidth = 5;
        var border = "+" + "-".repeat(keyWidth + numberWidth + 5) + "+";
        var table = new StringBuilder(border).append('\n');
        rows.forEach(
                (key, value) ->
                        table.append("| ")
                                .append(padRight(key, keyWidth))
                                .append(" : ")
                                .append(padLeft(String.valueOf(value), numberWidth))
                                .append(" |\n"));
        return table.append(border).toString();
    }

    private static String padRight(String value, int width) {
        return value + " ".repeat(Math.max(0, width - value.length()));
    }

    private static String padLeft(String value, int width) {
        return " ".repeat(Math.max(0, width - value.length())) + value;
    }
}
