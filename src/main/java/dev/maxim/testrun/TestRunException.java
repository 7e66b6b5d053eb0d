package dev.maxim.testrun;

import javax.annotation.Nullable;

/** Base class of every error raised by a test run. */
public class TestRunException extends RuntimeException {
    public TestRunException(String message) {
        super(message);
    }

    public TestRunException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
