package dev.maxim.testrun;

import dev.maxim.api.MaximApiClient;
import lombok.Getter;
import lombok.experimental.Accessors;

/** Raised when the hosted run ends FAILED or STOPPED. */
@Getter
@Accessors(fluent = true)
public class TestRunTerminalStateException extends TestRunException {
    private final MaximApiClient.RunState state;
    private final String runUrl;

    public TestRunTerminalStateException(MaximApiClient.RunState state, String runUrl) {
        super(describe(state, runUrl));
        this.state = state;
        this.runUrl = runUrl;
    }

    private static String describe(MaximApiClient.RunState state, String runUrl) {
        if (state == MaximApiClient.RunState.STOPPED) {
            return "Test run was stopped, please check the report on our web portal: " + runUrl;
        }
        return "Test run failed, please check the report on our web portal: " + runUrl;
    }
}
