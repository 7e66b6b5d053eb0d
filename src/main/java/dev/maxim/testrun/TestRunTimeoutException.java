package dev.maxim.testrun;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Raised when the hosted run does not finish within the requested timeout. The run keeps going on
 * the platform and can be inspected at {@link #runUrl()}.
 */
@Getter
@Accessors(fluent = true)
public class TestRunTimeoutException extends TestRunException {
    private final String runUrl;

    public TestRunTimeoutException(long timeoutMinutes, String runUrl) {
        super(
                "Test run is taking over timeout period (%d minutes) to complete, please check the report on our web portal directly: %s"
                        .formatted(timeoutMinutes, runUrl));
        this.runUrl = runUrl;
    }
}
