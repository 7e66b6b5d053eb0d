package dev.maxim.testrun;

import dev.maxim.MaximUtils;
import dev.maxim.api.MaximApiClient;
import dev.maxim.api.MaximApiClient.RunState;
import dev.maxim.api.MaximApiClient.TestRunStatus;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Polls a test run on the platform until it reaches a terminal state or the timeout runs out.
 *
 * <p>The poll interval grows with the timeout. A run is done once it is FAILED or STOPPED, or
 * COMPLETE with every entry completed, failed or stopped.
 */
@Slf4j
final class CompletionPoller {
    /** (timeout minutes, interval seconds) anchors of the poll interval curve */
    private static final double[][] ANCHORS = {
        {10, 5}, {15, 5}, {30, 10}, {60, 15}, {120, 30}, {1440, 120}
    };

    private static final int MIN_INTERVAL_SECONDS = 5;
    private static final int MIN_AI_INTERVAL_SECONDS = 15;
    private static final int MAX_INTERVAL_SECONDS = 120;

    /** Pauses the polling thread. */
    @FunctionalInterface
    interface Sleeper {
        Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }

    private final MaximApiClient client;
    private final TestRunLogger logger;
    private final Sleeper sleeper;

    CompletionPoller(MaximApiClient client, TestRunLogger logger, Sleeper sleeper) {
        this.client = client;
        this.logger = logger;
        this.sleeper = sleeper;
    }

    /**
     * Poll interval in seconds for a run with the given timeout. Interpolates between the two
     * anchors around the timeout with quadratic easing, then clamps to [5, 120]. When an AI
     * evaluator is in use the floor is 15.
     */
    static int calculatePollingInterval(double timeoutMinutes, boolean aiEvaluatorInUse) {
        double[] lower = ANCHORS[0];
        double[] upper = ANCHORS[ANCHORS.length - 1];
        for (int i = 0; i < ANCHORS.length - 1; i++) {
            if (timeoutMinutes >= ANCHORS[i][0] && timeoutMinutes <= ANCHORS[i + 1][0]) {
                lower = ANCHORS[i];
                upper = ANCHORS[i + 1];
                break;
            }
        }
        double interpolated;
        if (lower[0] == upper[0]) {
            interpolated = lower[1];
        } else {
            double t = (timeoutMinutes - lower[0]) / (upper[0] - lower[0]);
            interpolated = lower[1] + (upper[1] - lower[1]) * Math.pow(t, 2);
        }
        long rounded = Math.round(interpolated);
        long floor = aiEvaluatorInUse ? MIN_AI_INTERVAL_SECONDS : MIN_INTERVAL_SECONDS;
        return (int) Math.min(Math.max(rounded, floor), MAX_INTERVAL_SECONDS);
    }

    /** Number of polls the timeout allows at the given interval. */
    static long maxIterations(double timeoutMinutes, int intervalSeconds) {
        return (long) Math.ceil(Math.round(timeoutMinutes) * 60.0 / intervalSeconds);
    }

    static boolean isDone(TestRunStatus status) {
        var state = status.testRunStatus();
        if (state == RunState.FAILED || state == RunState.STOPPED) {
            return true;
        }
        var entries = status.entryStatus();
        return state == RunState.COMPLETE
                && entries.total() == entries.completed() + entries.failed() + entries.stopped();
    }

    /**
     * Block until the run is done.
     *
     * @return the final status, always COMPLETE
     * @throws TestRunTerminalStateException if the run ended FAILED or STOPPED
     * @throws TestRunTimeoutException if the run is still going once the timeout is used up
     */
    TestRunStatus awaitCompletion(
            String testRunId, String runUrl, double timeoutMinutes, boolean aiEvaluatorInUse)
            throws InterruptedException {
        int interval = calculatePollingInterval(timeoutMinutes, aiEvaluatorInUse);
        long maxIterations = maxIterations(timeoutMinutes, interval);
        logger.info("Polling interval: %d seconds".formatted(interval));

        long polls = 0;
        TestRunStatus status;
        while (true) {
            status = client.getTestRunStatus(testRunId);
            polls++;
            logger.info("Test run status: " + status.testRunStatus());
            logger.info("\n" + MaximUtils.createStatusTable(status.entryStatus()));
            if (isDone(status)) {
                break;
            }
            if (polls > maxIterations) {
                throw new TestRunTimeoutException(Math.round(timeoutMinutes), runUrl);
            }
            log.debug("test run {} not done after {} polls", testRunId, polls);
            sleeper.sleep(Duration.ofSeconds(interval));
        }

        if (status.testRunStatus() != RunState.COMPLETE) {
            throw new TestRunTerminalStateException(status.testRunStatus(), runUrl);
        }
        return status;
    }
}
