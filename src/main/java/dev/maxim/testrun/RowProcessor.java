package dev.maxim.testrun;

import dev.maxim.MaximUtils;
import dev.maxim.api.MaximApiClient;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the pipeline of one row: extract fields, produce the output, evaluate it locally and push
 * the entry. A row that fails at any step is not pushed. Its index is recorded and the batch goes
 * on.
 */
@Slf4j
final class RowProcessor {
    static final AttributeKey<String> TEST_RUN_ID = AttributeKey.stringKey("maxim.test_run.id");
    static final AttributeKey<Long> ENTRY_INDEX =
            AttributeKey.longKey("maxim.test_run.entry_index");

    private final MaximApiClient client;
    private final MaximApiClient.TestRunHandle handle;
    private final @Nullable String datasetId;
    private final DataStructure dataStructure;
    private final OutputStrategy outputStrategy;
    private final LocalEvaluatorRunner evaluatorRunner;
    private final Map<String, String> localEvaluatorIds;
    private final TestRunLogger logger;
    private final Tracer tracer;
    private final Set<Integer> failedIndices;

    RowProcessor(
            MaximApiClient client,
            MaximApiClient.TestRunHandle handle,
            @Nullable String datasetId,
            DataStructure dataStructure,
            OutputStrategy outputStrategy,
            LocalEvaluatorRunner evaluatorRunner,
            Map<String, String> localEvaluatorIds,
            TestRunLogger logger,
            Tracer tracer,
            Set<Integer> failedIndices) {
        this.client = client;
        this.handle = handle;
        this.datasetId = datasetId;
        this.dataStructure = dataStructure;
        this.outputStrategy = outputStrategy;
        this.evaluatorRunner = evaluatorRunner;
        this.localEvaluatorIds = Map.copyOf(localEvaluatorIds);
        this.logger = logger;
        this.tracer = tracer;
        this.failedIndices = failedIndices;
    }

    /** Process the row at the index. Never throws. */
    void process(int index, DataSource.Page page) {
        var span =
                tracer.spanBuilder("test-run-entry")
                        .setAttribute(TEST_RUN_ID, handle.id())
                        .setAttribute(ENTRY_INDEX, (long) index)
                        .startSpan();
        try (var unused = span.makeCurrent()) {
            processOrThrow(index, page);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            failedIndices.add(index);
            var error =
                    new TestRunException(
                            "Error while running data entry at index [%d]".formatted(index), e);
            log.debug("row {} of test run {} failed", index, handle.id(), e);
            logger.error(MaximUtils.buildErrorMessage(error));
        } finally {
            span.end();
        }
    }

    private void processOrThrow(int index, DataSource.Page page) throws Exception {
        var row =
                page.row(index)
                        .orElseThrow(
                                () -> new TestRunException("No row found at index " + index));
        var fields = RowFields.extract(row, dataStructure);
        var reference = handle.reference(datasetId, row.id());

        if (outputStrategy instanceof OutputStrategy.Custom || !evaluatorRunner.isEmpty()) {
            var output = produceOutput(row, fields);
            Object contextToEvaluate = fields.contextToEvaluate();
            if (output.retrievedContextToEvaluate() != null) {
                if (contextToEvaluate != null) {
                    logger.info(
                            ("Detected retrieved context returned from output function for row %d"
                                            + " that had contextToEvaluate set from the dataset."
                                            + " Overriding the contextToEvaluate from dataset with"
                                            + " the retrieved context")
                                    .formatted(index + 1));
                }
                contextToEvaluate = output.retrievedContextToEvaluate();
            }

            List<LocalEvaluationResult> evaluationResults = null;
            if (!evaluatorRunner.isEmpty()) {
                evaluationResults =
                        evaluatorRunner.run(
                                new EvaluationInput(output.data(), contextToEvaluate), row.data());
            }

            client.pushTestRunEntry(
                    new MaximApiClient.PushTestRunEntryRequest(
                            reference,
                            runConfig(output.meta()),
                            new MaximApiClient.TestRunEntry(
                                    fields.input(),
                                    output.data(),
                                    fields.expectedOutput(),
                                    contextToEvaluate,
                                    fields.scenario(),
                                    fields.expectedSteps(),
                                    row.data(),
                                    evaluationResults == null
                                            ? null
                                            : evaluationResults.stream()
                                                    .map(this::toWire)
                                                    .toList())));
            reportProcessed(
                    index, new TestRunLogger.ProcessedEntry(row.data(), output, evaluationResults));
            return;
        }

        // the platform produces the output itself
        var remote = outputStrategy.remote().orElseThrow();
        var contextHint =
                remote.contextToEvaluate() != null
                        ? remote.contextToEvaluate()
                        : dataStructure.columnFor(ColumnRole.CONTEXT_TO_EVALUATE).orElse(null);
        client.pushTestRunEntry(
                new MaximApiClient.PushTestRunEntryRequest(
                        reference,
                        null,
                        new MaximApiClient.TestRunEntry(
                                fields.input(),
                                null,
                                fields.expectedOutput(),
                                contextHint,
                                fields.scenario(),
                                fields.expectedSteps(),
                                row.data(),
                                null)));
        reportProcessed(index, new TestRunLogger.ProcessedEntry(row.data(), null, null));
    }

    /** Runs after the push. Logger errors do not mark the row failed. */
    private void reportProcessed(int index, TestRunLogger.ProcessedEntry entry) {
        try {
            logger.processed("Ran test run entry " + (index + 1), entry);
        } catch (RuntimeException e) {
            log.warn("Test run logger failed to report entry {} as processed", index + 1, e);
        }
    }

    private YieldedOutput produceOutput(Row row, RowFields fields) throws Exception {
        YieldedOutput output;
        if (outputStrategy instanceof OutputStrategy.Custom custom) {
            output = custom.function().produce(row.data());
        } else if (outputStrategy instanceof OutputStrategy.Remote remote) {
            output = remote.execute(client, fields.input(), row.data());
        } else {
            throw new IllegalStateException("unsupported output strategy: " + outputStrategy);
        }
        if (output == null) {
            throw new TestRunException("Output function returned no output");
        }
        return output;
    }

    private MaximApiClient.LocalEvaluationResultEntry toWire(LocalEvaluationResult result) {
        return new MaximApiClient.LocalEvaluationResultEntry(
                localEvaluatorIds.get(result.name()),
                result.name(),
                result.result(),
                result.passFailCriteria());
    }

    @Nullable
    private static MaximApiClient.RunConfig runConfig(@Nullable YieldedOutput.OutputMeta meta) {
        if (meta == null) {
            return null;
        }
        var usage = meta.usage();
        return new MaximApiClient.RunConfig(
                usage == null
                        ? null
                        : new MaximApiClient.RunUsage(
                                usage.promptTokens(),
                                usage.completionTokens(),
                                usage.totalTokens(),
                                usage.latency()),
                meta.cost());
    }
}
