package dev.maxim.testrun;

import dev.maxim.MaximUtils;
import dev.maxim.api.MaximApiClient;
import dev.maxim.config.MaximConfig;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import java.util.*;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * A batch evaluation run on the Maxim platform.
 *
 * <p>Running a test run creates it on the platform, pushes one entry per row of the data source,
 * marks it processed and then waits for the platform to finish scoring. Rows run concurrently up
 * to the configured concurrency. A row that fails is reported in {@link
 * TestRunOutput#failedEntryIndices()} and does not stop the others.
 *
 * <pre>{@code
 * var output =
 *         maxim.testRunBuilder("nightly", workspaceId)
 *                 .data(DataSource.of(rows))
 *                 .dataStructure(structure)
 *                 .outputFunction(data -> YieldedOutput.of(callModel(data)))
 *                 .evaluators(Evaluator.platform("Faithfulness"))
 *                 .build()
 *                 .run();
 * }</pre>
 */
@Slf4j
public final class TestRun {
    private static final AttributeKey<String> TEST_RUN_NAME =
            AttributeKey.stringKey("maxim.test_run.name");
    private static final String HUMAN_EVALUATOR_TYPE = "Human";
    private static final String AI_EVALUATOR_TYPE = "AI";
    public static final double DEFAULT_TIMEOUT_MINUTES = 15;

    private final @Nonnull TestRunConfig config;
    private final @Nonnull MaximConfig maximConfig;
    private final @Nonnull MaximApiClient client;
    private final @Nonnull Tracer tracer;
    private final @Nonnull CompletionPoller.Sleeper sleeper;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private TestRun(Builder builder, TestRunConfig config) {
        this.config = config;
        this.maximConfig = Objects.requireNonNull(builder.maximConfig);
        this.client = Objects.requireNonNull(builder.apiClient);
        this.tracer = Objects.requireNonNull(builder.tracer);
        this.sleeper = builder.sleeper;
    }

    public TestRunConfig config() {
        return config;
    }

    /** Runs the test run, waiting up to fifteen minutes for the platform to finish. */
    public TestRunOutput run() {
        return run(DEFAULT_TIMEOUT_MINUTES);
    }

    /**
     * Runs the test run. A test run can be run only once.
     *
     * @param timeoutMinutes how long to wait for the platform once every entry is pushed
     * @throws ConfigurationException if a platform evaluator needs a human evaluation config that
     *     is missing. Nothing is created on the platform in that case.
     * @throws TestRunTimeoutException if the platform does not finish in time
     * @throws TestRunTerminalStateException if the platform run fails or is stopped
     */
    public TestRunOutput run(double timeoutMinutes) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("test run \"" + config.name() + "\" was already run");
        }
        var logger = config.logger();
        var runSpan =
                tracer.spanBuilder("test-run")
                        .setAttribute(TEST_RUN_NAME, config.name())
                        .startSpan();
        try (var unused = runSpan.makeCurrent()) {
            return runInScope(timeoutMinutes, runSpan);
        } catch (RuntimeException e) {
            runSpan.setStatus(StatusCode.ERROR, e.getMessage());
            runSpan.recordException(e);
            logger.error(
                    MaximUtils.buildErrorMessage(
                            new TestRunException(
                                    "Error while running test run " + config.name(), e)));
            throw e;
        } finally {
            runSpan.end();
        }
    }

    private TestRunOutput runInScope(double timeoutMinutes, Span runSpan) {
        var logger = config.logger();
        logger.info("Creating test run \"%s\"...".formatted(config.name()));

        var platformEvaluators = resolvePlatformEvaluators();
        if (config.humanEvaluationConfig() == null
                && platformEvaluators.stream()
                        .anyMatch(e -> HUMAN_EVALUATOR_TYPE.equals(e.type()))) {
            throw new ConfigurationException(
                    "Human evaluator found in evaluators, but no human evaluation config was"
                            + " provided.");
        }

        var localEvaluatorIds = new LinkedHashMap<String, String>();
        var evaluatorConfig = new ArrayList<>(platformEvaluators);
        for (var evaluator : config.evaluators()) {
            for (var entry : localCriteria(evaluator).entrySet()) {
                var id = UUID.randomUUID().toString();
                localEvaluatorIds.put(entry.getKey(), id);
                evaluatorConfig.add(
                        new MaximApiClient.EvaluatorConfig(
                                id,
                                entry.getKey(),
                                "Local",
                                false,
                                null,
                                entry.getValue().toWireConfig()));
            }
        }

        var remote = config.outputStrategy().remote();
        var handle =
                client.createTestRun(
                        new MaximApiClient.CreateTestRunRequest(
                                config.name(),
                                config.workspaceId(),
                                "SINGLE",
                                evaluatorConfig,
                                !localEvaluatorIds.isEmpty(),
                                remoteId(remote, OutputStrategy.Kind.WORKFLOW),
                                remoteId(remote, OutputStrategy.Kind.PROMPT_VERSION),
                                remoteId(remote, OutputStrategy.Kind.PROMPT_CHAIN_VERSION),
                                config.humanEvaluationConfig(),
                                config.tags().isEmpty() ? null : config.tags()));
        runSpan.setAttribute(RowProcessor.TEST_RUN_ID, handle.id());
        var runUrl =
                MaximUtils.createTestRunURI(
                        maximConfig.baseUrl(), config.workspaceId(), handle.id());

        try {
            var failedIndices = pushEntries(handle, localEvaluatorIds, runUrl);

            var finalStatus =
                    new CompletionPoller(client, logger, sleeper)
                            .awaitCompletion(
                                    handle.id(),
                                    runUrl,
                                    timeoutMinutes,
                                    platformEvaluators.stream()
                                            .anyMatch(e -> AI_EVALUATOR_TYPE.equals(e.type())));
            log.debug("test run {} finished with {}", handle.id(), finalStatus.entryStatus());

            var result = client.getTestRunFinalResult(handle.id());
            result = result.withLink(maximConfig.baseUrl() + result.link());
            logger.info(
                    "Test run \"%s\" completed successfully! View the report here: %s"
                            .formatted(config.name(), result.link()));
            return new TestRunOutput(result, failedIndices);
        } catch (TestRunTimeoutException | TestRunTerminalStateException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TestRunException(
                    "Interrupted while running test run %s: %s".formatted(config.name(), runUrl),
                    e);
        } catch (RuntimeException e) {
            throw new TestRunException(
                    "Error while running test run %s (%s): %s"
                            .formatted(config.name(), runUrl, MaximUtils.buildErrorMessage(e)),
                    e);
        }
    }

    /**
     * Push every row and mark the run processed. If anything other than a single row fails, the
     * run is marked failed before the error propagates.
     */
    private List<Integer> pushEntries(
            MaximApiClient.TestRunHandle handle,
            Map<String, String> localEvaluatorIds,
            String runUrl)
            throws InterruptedException {
        var logger = config.logger();
        Set<Integer> failedIndices = new ConcurrentSkipListSet<>();
        var gateKey = ConcurrencyGate.key(config.workspaceId(), config.name(), handle.id());
        try {
            var gate = ConcurrencyGate.forKey(gateKey, config.concurrency());
            var dataContext =
                    new DataSource.Context(client, config.dataStructure(), logger);
            try (var cursor = config.data().openCursor(dataContext)) {
                var datasetId = config.data().datasetId();
                if (datasetId.isPresent()) {
                    client.attachDatasetToTestRun(handle.id(), datasetId.get());
                }
                var processor =
                        new RowProcessor(
                                client,
                                handle,
                                datasetId.orElse(null),
                                cursor.dataStructure(),
                                config.outputStrategy(),
                                new LocalEvaluatorRunner(config.evaluators()),
                                localEvaluatorIds,
                                logger,
                                tracer,
                                failedIndices);
                dispatch(cursor, gate, processor);
            } finally {
                ConcurrencyGate.evict(gateKey);
            }

            logger.info("Marking test run as processed...");
            client.markTestRunProcessed(handle.id());
            logger.info(
                    "You can now either quit and view the report on our web portal here: %s"
                                    .formatted(runUrl)
                            + " OR wait for the test run to complete to get back the results to"
                            + " use through the SDK.");
        } catch (RuntimeException | InterruptedException e) {
            markFailed(handle);
            throw e;
        }
        return List.copyOf(failedIndices);
    }

    /**
     * Feed rows to the processor page by page. All rows of a page finish before the next page is
     * fetched.
     */
    private void dispatch(
            DataSource.Cursor cursor, ConcurrencyGate gate, RowProcessor processor)
            throws InterruptedException {
        ExecutorService executor =
                Executors.newFixedThreadPool(config.concurrency(), new RowThreadFactory());
        try {
            Optional<DataSource.Page> next;
            while ((next = cursor.nextPage()).isPresent()) {
                var page = next.get();
                log.debug(
                        "dispatching page {} with rows [{}, {})",
                        page.number(),
                        page.firstIndex(),
                        page.firstIndex() + page.size());
                var futures = new ArrayList<Future<?>>(page.size());
                for (int i = page.firstIndex(); i < page.firstIndex() + page.size(); i++) {
                    final int index = i;
                    gate.acquire();
                    try {
                        futures.add(
                                executor.submit(
                                        Context.current()
                                                .wrap(
                                                        () -> {
                                                            try {
                                                                processor.process(index, page);
                                                            } finally {
                                                                gate.release();
                                                            }
                                                        })));
                    } catch (RejectedExecutionException e) {
                        gate.release();
                        throw e;
                    }
                }
                for (var future : futures) {
                    try {
                        future.get();
                    } catch (ExecutionException e) {
                        throw new TestRunException(
                                "Unexpected error while processing rows", e.getCause());
                    }
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private void markFailed(MaximApiClient.TestRunHandle handle) {
        try {
            client.markTestRunFailed(handle.id());
        } catch (RuntimeException markError) {
            log.warn("Failed to mark test run {} as failed", handle.id(), markError);
        }
    }

    private List<MaximApiClient.EvaluatorConfig> resolvePlatformEvaluators() {
        var resolved = new ArrayList<MaximApiClient.EvaluatorConfig>();
        for (var evaluator : config.evaluators()) {
            if (evaluator instanceof Evaluator.Platform platform) {
                resolved.add(client.fetchPlatformEvaluator(platform.name(), config.workspaceId()));
            }
        }
        return resolved;
    }

    private static Map<String, PassFailCriteria> localCriteria(Evaluator evaluator) {
        var criteria = new LinkedHashMap<String, PassFailCriteria>();
        if (evaluator instanceof Evaluator.Local local) {
            criteria.put(local.name(), local.passFailCriteria());
        } else if (evaluator instanceof Evaluator.Combined combined) {
            for (var name : combined.names()) {
                criteria.put(name, combined.passFailCriteria().get(name));
            }
        }
        return criteria;
    }

    @Nullable
    private static String remoteId(
            Optional<OutputStrategy.Remote> remote, OutputStrategy.Kind kind) {
        return remote.filter(r -> r.kind() == kind).map(OutputStrategy.Remote::id).orElse(null);
    }

    private static final class RowThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNTER = new AtomicInteger();
        private final int pool = POOL_COUNTER.incrementAndGet();
        private final AtomicInteger threadCounter = new AtomicInteger();

        @Override
        public Thread newThread(@Nonnull Runnable runnable) {
            var thread =
                    new Thread(
                            runnable,
                            "maxim-test-run-%d-row-%d"
                                    .formatted(pool, threadCounter.incrementAndGet()));
            thread.setDaemon(true);
            return thread;
        }
    }

    /** Creates a new test run builder. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for test runs. Every method validates its argument right away and throws {@link
     * ConfigurationException} on misuse. {@link #build()} checks the configuration as a whole.
     */
    public static final class Builder {
        private @Nullable String name;
        private @Nullable String workspaceId;
        private @Nullable DataSource data;
        private @Nullable DataStructure dataStructure;
        private @Nonnull List<Evaluator> evaluators = List.of();
        private @Nullable OutputFunction outputFunction;
        private @Nullable OutputStrategy.Remote promptVersion;
        private @Nullable OutputStrategy.Remote promptChainVersion;
        private @Nullable OutputStrategy.Remote workflow;
        private int concurrency = TestRunConfig.DEFAULT_CONCURRENCY;
        private @Nullable HumanEvaluationConfig humanEvaluationConfig;
        private @Nullable TestRunLogger logger;
        private @Nonnull List<String> tags = List.of();
        private @Nullable MaximConfig maximConfig;
        private @Nullable MaximApiClient apiClient;
        private @Nullable Tracer tracer;
        private @Nonnull CompletionPoller.Sleeper sleeper = CompletionPoller.Sleeper.SYSTEM;

        public TestRun build() {
            var errors = new ArrayList<String>();
            if (name == null || name.isBlank()) {
                errors.add("Name is required to run a test.");
            }
            if (maximConfig == null) {
                maximConfig = MaximConfig.fromEnvironment();
            }
            if (workspaceId == null) {
                workspaceId = maximConfig.defaultWorkspaceId().orElse(null);
            }
            if (workspaceId == null || workspaceId.isBlank()) {
                errors.add("Workspace Id is required to run a test.");
            }
            var strategies = new ArrayList<OutputStrategy>();
            if (outputFunction != null) {
                strategies.add(new OutputStrategy.Custom(outputFunction));
            }
            for (var remote : Arrays.asList(promptVersion, promptChainVersion, workflow)) {
                if (remote != null) {
                    strategies.add(remote);
                }
            }
            if (strategies.size() != 1) {
                errors.add(
                        "Exactly one of outputFunction, promptVersion, promptChainVersion, or"
                                + " workflow must be set.");
            }
            if (data == null) {
                errors.add("Data or dataset id is required to run a test.");
            } else if (dataStructure == null && data.datasetId().isEmpty()) {
                errors.add("Data structure is required unless data is a platform dataset.");
            }
            if (!errors.isEmpty()) {
                throw new ConfigurationException(
                        "Missing required configuration for test run%s:\n\t%s"
                                .formatted(
                                        name == null ? "" : " \"" + name + "\"",
                                        String.join(",\n\t", errors)));
            }
            if (dataStructure != null) {
                data.validate(dataStructure);
            }
            if (apiClient == null) {
                apiClient = MaximApiClient.of(maximConfig);
            }
            if (tracer == null) {
                tracer = GlobalOpenTelemetry.getTracer("maxim-sdk-java");
            }
            if (logger == null) {
                logger = new DefaultTestRunLogger();
            }
            var config =
                    new TestRunConfig(
                            name,
                            workspaceId,
                            data,
                            dataStructure,
                            evaluators,
                            strategies.get(0),
                            concurrency,
                            humanEvaluationConfig,
                            logger,
                            tags);
            return new TestRun(this, config);
        }

        public Builder name(@Nonnull String name) {
            this.name = Objects.requireNonNull(name);
            return this;
        }

        public Builder workspaceId(@Nonnull String workspaceId) {
            this.workspaceId = Objects.requireNonNull(workspaceId);
            return this;
        }

        public Builder config(MaximConfig config) {
            this.maximConfig = config;
            return this;
        }

        public Builder apiClient(MaximApiClient apiClient) {
            this.apiClient = apiClient;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        Builder sleeper(CompletionPoller.Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper);
            return this;
        }

        public Builder data(@Nonnull DataSource data) {
            this.data = Objects.requireNonNull(data);
            if (dataStructure != null) {
                data.validate(dataStructure);
            }
            return this;
        }

        /** Rows held in memory. */
        public Builder data(@Nonnull List<? extends Map<String, ?>> rows) {
            return data(DataSource.of(rows));
        }

        /** Rows of a dataset on the platform. */
        public Builder datasetId(@Nonnull String datasetId) {
            return data(DataSource.ofDataset(datasetId));
        }

        public Builder dataStructure(@Nonnull DataStructure dataStructure) {
            this.dataStructure = Objects.requireNonNull(dataStructure);
            if (data != null) {
                data.validate(dataStructure);
            }
            return this;
        }

        public Builder evaluators(Evaluator... evaluators) {
            var names = new HashSet<String>();
            for (var evaluator : evaluators) {
                for (var evaluatorName : evaluator.names()) {
                    if (!names.add(evaluatorName)) {
                        throw new ConfigurationException(
                                "Multiple evaluators with the same name \"%s\" found"
                                        .formatted(evaluatorName));
                    }
                }
            }
            this.evaluators = List.of(evaluators);
            return this;
        }

        /** Produce each row's output with a function in this process. */
        public Builder outputFunction(@Nonnull OutputFunction outputFunction) {
            this.outputFunction = Objects.requireNonNull(outputFunction);
            return this;
        }

        public Builder promptVersion(@Nonnull String promptVersionId) {
            return promptVersion(promptVersionId, null);
        }

        /**
         * Produce each row's output by running a prompt version on the platform.
         *
         * @param contextToEvaluate variable to treat as the context to evaluate
         */
        public Builder promptVersion(
                @Nonnull String promptVersionId, @Nullable String contextToEvaluate) {
            this.promptVersion =
                    new OutputStrategy.Remote(
                            OutputStrategy.Kind.PROMPT_VERSION, promptVersionId, contextToEvaluate);
            return this;
        }

        public Builder promptChainVersion(@Nonnull String promptChainVersionId) {
            return promptChainVersion(promptChainVersionId, null);
        }

        public Builder promptChainVersion(
                @Nonnull String promptChainVersionId, @Nullable String contextToEvaluate) {
            this.promptChainVersion =
                    new OutputStrategy.Remote(
                            OutputStrategy.Kind.PROMPT_CHAIN_VERSION,
                            promptChainVersionId,
                            contextToEvaluate);
            return this;
        }

        public Builder workflow(@Nonnull String workflowId) {
            return workflow(workflowId, null);
        }

        public Builder workflow(@Nonnull String workflowId, @Nullable String contextToEvaluate) {
            this.workflow =
                    new OutputStrategy.Remote(
                            OutputStrategy.Kind.WORKFLOW, workflowId, contextToEvaluate);
            return this;
        }

        /** Maximum number of rows processed at the same time. Defaults to 10. */
        public Builder concurrency(int concurrency) {
            if (concurrency < 1) {
                throw new ConfigurationException(
                        "concurrency must be at least 1, found " + concurrency);
            }
            this.concurrency = concurrency;
            return this;
        }

        public Builder humanEvaluationConfig(@Nonnull HumanEvaluationConfig config) {
            this.humanEvaluationConfig = Objects.requireNonNull(config);
            return this;
        }

        public Builder logger(@Nonnull TestRunLogger logger) {
            this.logger = Objects.requireNonNull(logger);
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = List.copyOf(tags);
            return this;
        }

        public Builder tags(String... tags) {
            this.tags = List.of(tags);
            return this;
        }
    }
}
