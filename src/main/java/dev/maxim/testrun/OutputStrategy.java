package dev.maxim.testrun;

import dev.maxim.api.MaximApiClient;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * How the output of each row is produced: by a function in this process, or by running a prompt
 * version, prompt chain version or workflow on the platform.
 */
public interface OutputStrategy {

    /** the platform entity the run is tied to, if any */
    default Optional<Remote> remote() {
        return Optional.empty();
    }

    record Custom(OutputFunction function) implements OutputStrategy {
        public Custom {
            Objects.requireNonNull(function, "function");
        }
    }

    /**
     * @param contextToEvaluate name of the variable the platform should treat as the context to
     *     evaluate
     */
    record Remote(Kind kind, String id, @Nullable String contextToEvaluate)
            implements OutputStrategy {
        public Remote {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(id, "id");
        }

        @Override
        public Optional<Remote> remote() {
            return Optional.of(this);
        }

        /** Run this entity on the platform for one row. */
        YieldedOutput execute(
                MaximApiClient client, @Nullable String input, Map<String, Object> data) {
            var inputText = input == null ? "" : input;
            return switch (kind) {
                case PROMPT_VERSION -> {
                    var response =
                            client.executePromptForData(
                                    new MaximApiClient.ExecutePromptRequest(
                                            id, inputText, data, contextToEvaluate));
                    yield new YieldedOutput(
                            orEmpty(response.output()),
                            response.contextToEvaluate(),
                            new YieldedOutput.OutputMeta(response.usage(), response.cost()));
                }
                case PROMPT_CHAIN_VERSION -> {
                    var response =
                            client.executePromptChainForData(
                                    new MaximApiClient.ExecutePromptChainRequest(
                                            id, inputText, data, contextToEvaluate));
                    yield new YieldedOutput(
                            orEmpty(response.output()),
                            response.contextToEvaluate(),
                            new YieldedOutput.OutputMeta(response.usage(), response.cost()));
                }
                case WORKFLOW -> {
                    var response =
                            client.executeWorkflowForData(
                                    new MaximApiClient.ExecuteWorkflowRequest(
                                            id, data, contextToEvaluate));
                    var latency = response.latency();
                    yield new YieldedOutput(
                            orEmpty(response.output()),
                            response.contextToEvaluate(),
                            new YieldedOutput.OutputMeta(
                                    latency == null
                                            ? null
                                            : MaximApiClient.Usage.ofLatency(latency),
                                    null));
                }
            };
        }

        private static String orEmpty(@Nullable String output) {
            return output == null ? "" : output;
        }
    }

    enum Kind {
        PROMPT_VERSION,
        PROMPT_CHAIN_VERSION,
        WORKFLOW
    }
}
