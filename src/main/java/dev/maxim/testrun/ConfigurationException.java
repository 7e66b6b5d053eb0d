package dev.maxim.testrun;

/** Raised synchronously when a test run is misconfigured. No remote call has been made. */
public class ConfigurationException extends TestRunException {
    public ConfigurationException(String message) {
        super(message);
    }
}
