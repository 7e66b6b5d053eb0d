package dev.maxim.testrun;

import java.util.List;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/** Who reviews the entries of a run with human evaluators, and how. */
public record HumanEvaluationConfig(List<String> emails, @Nullable String instructions) {
    private static final Pattern EMAIL =
            Pattern.compile(
                    "^(?!\\.)(?!.*\\.\\.)([A-Z0-9_'+\\-.]*)[A-Z0-9_+-]@([A-Z0-9][A-Z0-9\\-]*\\.)+[A-Z]{2,}$",
                    Pattern.CASE_INSENSITIVE);

    public HumanEvaluationConfig {
        emails = List.copyOf(emails);
        for (var email : emails) {
            if (!EMAIL.matcher(email).matches()) {
                throw new ConfigurationException("Invalid email address: " + email);
            }
        }
    }

    public static HumanEvaluationConfig of(String... emails) {
        return new HumanEvaluationConfig(List.of(emails), null);
    }
}
