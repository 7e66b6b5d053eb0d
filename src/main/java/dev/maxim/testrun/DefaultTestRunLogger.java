package dev.maxim.testrun;

import lombok.extern.slf4j.Slf4j;

/** Forwards test run progress to SLF4J. */
@Slf4j
public class DefaultTestRunLogger implements TestRunLogger {
    @Override
    public void info(String message) {
        log.info(message);
    }

    @Override
    public void error(String message) {
        log.error(message);
    }

    @Override
    public void processed(String message, ProcessedEntry entry) {
        log.info(message);
        if (entry.evaluationResults() != null) {
            for (var result : entry.evaluationResults()) {
                log.debug("  {}: {}", result.name(), result.result());
            }
        }
    }
}
