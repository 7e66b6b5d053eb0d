package dev.maxim.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.maxim.config.MaximConfig;
import dev.maxim.json.MaximJsonMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Provides the necessary API calls for the Maxim SDK. Users of the SDK should favor using {@link
 * dev.maxim.testrun.TestRun}.
 *
 * <p>Every response from the Maxim API is wrapped in either {@code {"data": ...}} or {@code
 * {"error": {"message": ...}}}. Implementations unwrap the data and raise {@link ApiException} for
 * errors.
 */
public interface MaximApiClient {
    /** Resolve a platform evaluator by name within a workspace. */
    EvaluatorConfig fetchPlatformEvaluator(@Nonnull String name, @Nonnull String workspaceId);

    /** Create a new test run. */
    TestRunHandle createTestRun(CreateTestRunRequest request);

    /** Link a platform dataset to a test run. */
    void attachDatasetToTestRun(String testRunId, String datasetId);

    /**
     * Push one entry to a test run. Pushes are not idempotent: pushing the same row twice creates
     * two entries.
     */
    void pushTestRunEntry(PushTestRunEntryRequest request);

    /** Signal that every entry of the test run has been pushed. */
    void markTestRunProcessed(String testRunId);

    /** Signal that the test run could not be completed on the client side. */
    void markTestRunFailed(String testRunId);

    TestRunStatus getTestRunStatus(String testRunId);

    TestRunResult getTestRunFinalResult(String testRunId);

    /** Run a prompt version against one data entry. */
    ExecutionResponse executePromptForData(ExecutePromptRequest request);

    /** Run a prompt chain version against one data entry. */
    ExecutionResponse executePromptChainForData(ExecutePromptChainRequest request);

    /** Run a workflow against one data entry. */
    ExecutionResponse executeWorkflowForData(ExecuteWorkflowRequest request);

    int getDatasetTotalRows(String datasetId);

    /** Fetch a dataset row by its zero-based index. Empty if the row does not exist. */
    Optional<DatasetRow> getDatasetRow(String datasetId, int rowIndex);

    /** Column name to column role (e.g. INPUT, EXPECTED_OUTPUT) of a platform dataset. */
    Map<String, String> getDatasetStructure(String datasetId);

    static MaximApiClient of(MaximConfig config) {
        return new HttpImpl(config);
    }

    @Slf4j
    class HttpImpl implements MaximApiClient {
        private static final Set<Integer> RETRYABLE_STATUS_CODES =
                Set.of(408, 429, 500, 502, 503, 504);
        private static final long MAX_BACKOFF_MILLIS = 16_000;

        private final MaximConfig config;
        private final HttpClient httpClient;
        private final ObjectMapper objectMapper;

        HttpImpl(MaximConfig config) {
            this(config, createDefaultHttpClient(config));
        }

        private HttpImpl(MaximConfig config, HttpClient httpClient) {
            this.config = config;
            this.httpClient = httpClient;
            this.objectMapper = MaximJsonMapper.get();
        }

        @Override
        public EvaluatorConfig fetchPlatformEvaluator(
                @Nonnull String name, @Nonnull String workspaceId) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(workspaceId, "workspaceId must not be null");
            var path =
                    "/api/sdk/v1/evaluators?name=%s&workspaceId=%s"
                            .formatted(encode(name), encode(workspaceId));
            return await(
                    getAsync(path, type(EvaluatorConfig.class)),
                    "fetch evaluator \"" + name + "\"");
        }

        @Override
        public TestRunHandle createTestRun(CreateTestRunRequest request) {
            return await(
                    postAsync("/api/sdk/v2/test-run/create", request, type(TestRunHandle.class)),
                    "create test run \"" + request.name() + "\"");
        }

        @Override
        public void attachDatasetToTestRun(String testRunId, String datasetId) {
            await(
                    postAsync(
                            "/api/sdk/v1/test-run/attach-dataset",
                            new AttachDatasetRequest(testRunId, datasetId),
                            type(Void.class)),
                    "attach dataset " + datasetId + " to test run " + testRunId);
        }

        @Override
        public void pushTestRunEntry(PushTestRunEntryRequest request) {
            await(
                    postAsync("/api/sdk/v1/test-run/push", request, type(Void.class)),
                    "push entry to test run " + request.testRun().id());
        }

        @Override
        public void markTestRunProcessed(String testRunId) {
            await(
                    postAsync(
                            "/api/sdk/v1/test-run/mark-processed",
                            new TestRunIdRequest(testRunId),
                            type(Void.class)),
                    "mark test run " + testRunId + " as processed");
        }

        @Override
        public void markTestRunFailed(String testRunId) {
            await(
                    postAsync(
                            "/api/sdk/v1/test-run/mark-failed",
                            new TestRunIdRequest(testRunId),
                            type(Void.class)),
                    "mark test run " + testRunId + " as failed");
        }

        @Override
        public TestRunStatus getTestRunStatus(String testRunId) {
            return await(
                    getAsync(
                            "/api/sdk/v1/test-run/status?testRunId=" + encode(testRunId),
                            type(TestRunStatus.class)),
                    "fetch status of test run " + testRunId);
        }

        @Override
        public TestRunResult getTestRunFinalResult(String testRunId) {
            return await(
                    getAsync(
                            "/api/sdk/v1/test-run/result?testRunId=" + encode(testRunId),
                            type(TestRunResult.class)),
                    "fetch result of test run " + testRunId);
        }

        @Override
        public ExecutionResponse executePromptForData(ExecutePromptRequest request) {
            return await(
                    postAsync(
                            "/api/sdk/v1/test-run/execute/prompt",
                            request,
                            type(ExecutionResponse.class)),
                    "execute prompt version " + request.promptVersionId());
        }

        @Override
        public ExecutionResponse executePromptChainForData(ExecutePromptChainRequest request) {
            return await(
                    postAsync(
                            "/api/sdk/v1/test-run/execute/prompt-chain",
                            request,
                            type(ExecutionResponse.class)),
                    "execute prompt chain version " + request.promptChainVersionId());
        }

        @Override
        public ExecutionResponse executeWorkflowForData(ExecuteWorkflowRequest request) {
            return await(
                    postAsync(
                            "/api/sdk/v1/test-run/execute/workflow",
                            request,
                            type(ExecutionResponse.class)),
                    "execute workflow " + request.workflowId());
        }

        @Override
        public int getDatasetTotalRows(String datasetId) {
            Integer total =
                    await(
                            getAsync(
                                    "/api/sdk/v1/datasets/total-rows?datasetId="
                                            + encode(datasetId),
                                    type(Integer.class)),
                            "fetch row count of dataset " + datasetId);
            if (total == null) {
                throw new ApiException("No row count returned for dataset " + datasetId);
            }
            return total;
        }

        @Override
        public Optional<DatasetRow> getDatasetRow(String datasetId, int rowIndex) {
            var path =
                    "/api/sdk/v2/datasets/row?datasetId=%s&row=%d"
                            .formatted(encode(datasetId), rowIndex);
            return await(
                    this.<DatasetRow>getAsync(path, type(DatasetRow.class))
                            .handle(
                                    (row, error) -> {
                                        if (error != null && isNotFound(error)) {
                                            return Optional.<DatasetRow>empty();
                                        }
                                        if (error != null) {
                                            throw new CompletionException(error);
                                        }
                                        return Optional.ofNullable(row);
                                    }),
                    "fetch row " + rowIndex + " of dataset " + datasetId);
        }

        @Override
        public Map<String, String> getDatasetStructure(String datasetId) {
            Map<String, String> structure =
                    await(
                            getAsync(
                                    "/api/sdk/v1/datasets/structure?datasetId="
                                            + encode(datasetId),
                                    objectMapper
                                            .getTypeFactory()
                                            .constructMapType(
                                                    LinkedHashMap.class,
                                                    String.class,
                                                    String.class)),
                            "fetch structure of dataset " + datasetId);
            return structure == null ? Map.of() : structure;
        }

        private JavaType type(Class<?> clazz) {
            return objectMapper.getTypeFactory().constructType(clazz);
        }

        private <T> CompletableFuture<T> getAsync(String path, JavaType responseType) {
            var request =
                    HttpRequest.newBuilder()
                            .uri(URI.create(config.baseUrl() + path))
                            .header("x-maxim-api-key", config.apiKey())
                            .header("Accept", "application/json")
                            .timeout(config.requestTimeout())
                            .GET()
                            .build();

            return sendAsync(request, responseType);
        }

        private <T> CompletableFuture<T> postAsync(
                String path, Object body, JavaType responseType) {
            try {
                var jsonBody = objectMapper.writeValueAsString(body);

                var request =
                        HttpRequest.newBuilder()
                                .uri(URI.create(config.baseUrl() + path))
                                .header("x-maxim-api-key", config.apiKey())
                                .header("Content-Type", "application/json")
                                .header("Accept", "application/json")
                                .timeout(config.requestTimeout())
                                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                                .build();

                return sendAsync(request, responseType);
            } catch (IOException e) {
                return CompletableFuture.failedFuture(
                        new ApiException("Failed to serialize request body", e));
            }
        }

        private <T> CompletableFuture<T> sendAsync(HttpRequest request, JavaType responseType) {
            if (config.debug()) {
                log.info("API Request: {} {}", request.method(), request.uri());
            } else {
                log.debug("API Request: {} {}", request.method(), request.uri());
            }

            return sendWithRetry(request, 0)
                    .thenApply(response -> handleResponse(response, responseType));
        }

        private CompletableFuture<HttpResponse<String>> sendWithRetry(
                HttpRequest request, int attempt) {
            return httpClient
                    .sendAsync(request, HttpResponse.BodyHandlers.ofString())
                    .handle(
                            (response, error) -> {
                                if (attempt < config.maxRetries()
                                        && isRetryable(response, error)) {
                                    long delayMillis = retryDelayMillis(attempt, response);
                                    log.warn(
                                            "Retrying {} {} in {} ms (attempt {} of {}): {}",
                                            request.method(),
                                            request.uri(),
                                            delayMillis,
                                            attempt + 1,
                                            config.maxRetries(),
                                            error != null
                                                    ? unwrap(error).toString()
                                                    : "status " + response.statusCode());
                                    return CompletableFuture.runAsync(
                                                    () -> {},
                                                    CompletableFuture.delayedExecutor(
                                                            delayMillis, TimeUnit.MILLISECONDS))
                                            .thenCompose(
                                                    unused -> sendWithRetry(request, attempt + 1));
                                }
                                if (error != null) {
                                    return CompletableFuture.<HttpResponse<String>>failedFuture(
                                            unwrap(error));
                                }
                                return CompletableFuture.completedFuture(response);
                            })
                    .thenCompose(Function.identity());
        }

        private static boolean isRetryable(
                @Nullable HttpResponse<String> response, @Nullable Throwable error) {
            if (error != null) {
                return unwrap(error) instanceof IOException;
            }
            return response != null && RETRYABLE_STATUS_CODES.contains(response.statusCode());
        }

        private static long retryDelayMillis(int attempt, @Nullable HttpResponse<String> response) {
            if (response != null) {
                var retryAfter = response.headers().firstValue("Retry-After");
                if (retryAfter.isPresent()) {
                    try {
                        return Math.max(0, Long.parseLong(retryAfter.get().trim()) * 1000);
                    } catch (NumberFormatException e) {
                        log.debug("Ignoring non-numeric Retry-After header: {}", retryAfter.get());
                    }
                }
            }
            return Math.min((long) Math.pow(2, attempt) * 1000, MAX_BACKOFF_MILLIS);
        }

        @SuppressWarnings("unchecked")
        private <T> T handleResponse(HttpResponse<String> response, JavaType responseType) {
            if (config.debug()) {
                log.info("API Response: {} - {}", response.statusCode(), response.body());
            } else {
                log.debug("API Response: {} - {}", response.statusCode(), response.body());
            }

            JsonNode body;
            try {
                var raw = response.body();
                body = raw == null || raw.isBlank() ? null : objectMapper.readTree(raw);
            } catch (IOException e) {
                if (response.statusCode() >= 200 && response.statusCode() < 300) {
                    log.warn("Failed to parse response body", e);
                    throw new ApiException("Failed to parse response body", e);
                }
                body = null;
            }

            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.warn(
                        "API request failed with status {}: {}",
                        response.statusCode(),
                        response.body());
                throw new ApiException(
                        response.statusCode(),
                        String.format(
                                "API request failed with status %d: %s",
                                response.statusCode(),
                                body != null && body.has("error")
                                        ? errorMessage(body.get("error"))
                                        : response.body()));
            }
            if (body != null && body.has("error")) {
                throw new ApiException(errorMessage(body.get("error")));
            }
            if (responseType.getRawClass() == Void.class || body == null) {
                return null;
            }
            var data = body.get("data");
            if (data == null || data.isNull()) {
                return null;
            }
            try {
                return (T) objectMapper.treeToValue(data, responseType);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Failed to parse response body", e);
                throw new ApiException("Failed to parse response body", e);
            }
        }

        private static String errorMessage(JsonNode error) {
            if (error.hasNonNull("message")) {
                return error.get("message").asText();
            }
            return error.toString();
        }

        private static <T> T await(CompletableFuture<T> future, String action) {
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ApiException("Interrupted while trying to " + action, e);
            } catch (ExecutionException e) {
                throw new ApiException("Failed to " + action, unwrap(e));
            }
        }

        private static Throwable unwrap(Throwable error) {
            Throwable cause = error;
            while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                    && cause.getCause() != null) {
                cause = cause.getCause();
            }
            return cause;
        }

        private static boolean isNotFound(Throwable error) {
            var cause = unwrap(error);
            return cause instanceof ApiException apiError
                    && apiError.statusCode().orElse(0) == 404;
        }

        private static String encode(String value) {
            return URLEncoder.encode(value, StandardCharsets.UTF_8);
        }

        private static HttpClient createDefaultHttpClient(MaximConfig config) {
            return HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        }
    }

    /**
     * Implementation for test doubling.
     *
     * <p>Records every call, serves datasets and evaluators registered up front, and replays a
     * script of statuses. Once the script is down to its last status that status repeats forever.
     * With no script, runs report COMPLETE with every pushed entry completed.
     */
    @Slf4j
    class InMemoryImpl implements MaximApiClient {
        private final Map<String, EvaluatorConfig> platformEvaluators = new ConcurrentHashMap<>();
        private final Map<String, InMemoryDataset> datasets = new ConcurrentHashMap<>();
        private final List<CreateTestRunRequest> createdRuns = new CopyOnWriteArrayList<>();
        private final List<PushTestRunEntryRequest> pushedEntries = new CopyOnWriteArrayList<>();
        private final List<String> processedRunIds = new CopyOnWriteArrayList<>();
        private final List<String> failedRunIds = new CopyOnWriteArrayList<>();
        private final Map<String, String> attachedDatasets = new ConcurrentHashMap<>();
        private final Deque<TestRunStatus> scriptedStatuses = new ConcurrentLinkedDeque<>();
        private final AtomicInteger runCounter = new AtomicInteger();
        private final AtomicInteger statusCalls = new AtomicInteger();
        private final AtomicInteger rowFetches = new AtomicInteger();
        private volatile Function<Object, ExecutionResponse> remoteExecutor =
                request -> new ExecutionResponse("", null, null, null, null);

        public InMemoryImpl addPlatformEvaluator(EvaluatorConfig evaluator) {
            platformEvaluators.put(evaluator.name(), evaluator);
            return this;
        }

        public InMemoryImpl addDataset(
                String datasetId, Map<String, String> structure, List<DatasetRow> rows) {
            datasets.put(datasetId, new InMemoryDataset(Map.copyOf(structure), List.copyOf(rows)));
            return this;
        }

        /** Statuses returned by successive status polls, in order. */
        public InMemoryImpl scriptStatuses(TestRunStatus... statuses) {
            scriptedStatuses.clear();
            scriptedStatuses.addAll(List.of(statuses));
            return this;
        }

        /** Handles every execute prompt/prompt chain/workflow request. */
        public InMemoryImpl onExecute(Function<Object, ExecutionResponse> remoteExecutor) {
            this.remoteExecutor = remoteExecutor;
            return this;
        }

        public List<CreateTestRunRequest> createdRuns() {
            return List.copyOf(createdRuns);
        }

        public List<PushTestRunEntryRequest> pushedEntries() {
            return List.copyOf(pushedEntries);
        }

        public List<String> processedRunIds() {
            return List.copyOf(processedRunIds);
        }

        public List<String> failedRunIds() {
            return List.copyOf(failedRunIds);
        }

        public Map<String, String> attachedDatasets() {
            return Map.copyOf(attachedDatasets);
        }

        public int statusCalls() {
            return statusCalls.get();
        }

        public int rowFetches() {
            return rowFetches.get();
        }

        @Override
        public EvaluatorConfig fetchPlatformEvaluator(
                @Nonnull String name, @Nonnull String workspaceId) {
            var evaluator = platformEvaluators.get(name);
            if (evaluator == null) {
                throw new ApiException("Evaluator not found: " + name);
            }
            return evaluator;
        }

        @Override
        public TestRunHandle createTestRun(CreateTestRunRequest request) {
            createdRuns.add(request);
            return new TestRunHandle(
                    "test-run-" + runCounter.incrementAndGet(),
                    request.workspaceId(),
                    request.evaluatorConfig(),
                    request.humanEvaluationConfig(),
                    null);
        }

        @Override
        public void attachDatasetToTestRun(String testRunId, String datasetId) {
            attachedDatasets.put(testRunId, datasetId);
        }

        @Override
        public void pushTestRunEntry(PushTestRunEntryRequest request) {
            pushedEntries.add(request);
        }

        @Override
        public void markTestRunProcessed(String testRunId) {
            processedRunIds.add(testRunId);
        }

        @Override
        public void markTestRunFailed(String testRunId) {
            failedRunIds.add(testRunId);
        }

        @Override
        public TestRunStatus getTestRunStatus(String testRunId) {
            statusCalls.incrementAndGet();
            if (scriptedStatuses.size() > 1) {
                return scriptedStatuses.poll();
            } else if (scriptedStatuses.size() == 1) {
                return scriptedStatuses.peek();
            }
            int pushed = pushedEntries.size();
            return new TestRunStatus(
                    new EntryStatus(pushed, 0, pushed, 0, 0, 0), RunState.COMPLETE);
        }

        @Override
        public TestRunResult getTestRunFinalResult(String testRunId) {
            var workspaceId =
                    createdRuns.isEmpty() ? "workspace" : createdRuns.get(0).workspaceId();
            var name = createdRuns.isEmpty() ? testRunId : createdRuns.get(0).name();
            return new TestRunResult(
                    "/workspace/%s/testrun/%s".formatted(workspaceId, testRunId),
                    List.of(new TestRunSummary(name, Map.of(), null, null, null)));
        }

        @Override
        public ExecutionResponse executePromptForData(ExecutePromptRequest request) {
            return remoteExecutor.apply(request);
        }

        @Override
        public ExecutionResponse executePromptChainForData(ExecutePromptChainRequest request) {
            return remoteExecutor.apply(request);
        }

        @Override
        public ExecutionResponse executeWorkflowForData(ExecuteWorkflowRequest request) {
            return remoteExecutor.apply(request);
        }

        @Override
        public int getDatasetTotalRows(String datasetId) {
            return dataset(datasetId).rows().size();
        }

        @Override
        public Optional<DatasetRow> getDatasetRow(String datasetId, int rowIndex) {
            rowFetches.incrementAndGet();
            var rows = dataset(datasetId).rows();
            if (rowIndex < 0 || rowIndex >= rows.size()) {
                return Optional.empty();
            }
            return Optional.of(rows.get(rowIndex));
        }

        @Override
        public Map<String, String> getDatasetStructure(String datasetId) {
            return dataset(datasetId).structure();
        }

        private InMemoryDataset dataset(String datasetId) {
            var dataset = datasets.get(datasetId);
            if (dataset == null) {
                throw new ApiException("Dataset not found: " + datasetId);
            }
            return dataset;
        }

        private record InMemoryDataset(Map<String, String> structure, List<DatasetRow> rows) {}
    }

    // Request/Response DTOs

    /** Descriptor of an evaluator as understood by the platform. */
    record EvaluatorConfig(
            String id,
            String name,
            /** Human, AI, Programmatic, Statistical, API or Local */
            String type,
            boolean builtin,
            @Nullable Boolean reversed,
            @Nullable Object config) {}

    record CreateTestRunRequest(
            String name,
            String workspaceId,
            String runType,
            List<EvaluatorConfig> evaluatorConfig,
            boolean requiresLocalRun,
            @Nullable String workflowId,
            @Nullable String promptVersionId,
            @Nullable String promptChainVersionId,
            @Nullable Object humanEvaluationConfig,
            @Nullable List<String> tags) {}

    /** A created test run. Every push references it. */
    record TestRunHandle(
            String id,
            String workspaceId,
            @Nullable Object evalConfig,
            @Nullable Object humanEvaluationConfig,
            @Nullable String parentTestRunId) {

        public TestRunReference reference(
                @Nullable String datasetId, @Nullable String datasetEntryId) {
            return new TestRunReference(
                    id,
                    workspaceId,
                    evalConfig,
                    humanEvaluationConfig,
                    parentTestRunId,
                    datasetId,
                    datasetEntryId);
        }
    }

    record TestRunReference(
            String id,
            String workspaceId,
            @Nullable Object evalConfig,
            @Nullable Object humanEvaluationConfig,
            @Nullable String parentTestRunId,
            @Nullable String datasetId,
            @Nullable String datasetEntryId) {}

    record TestRunIdRequest(String testRunId) {}

    record AttachDatasetRequest(String testRunId, String datasetId) {}

    record PushTestRunEntryRequest(
            TestRunReference testRun, @Nullable RunConfig runConfig, TestRunEntry entry) {}

    /** Usage and cost of producing one entry's output. */
    record RunConfig(@Nullable RunUsage usage, @Nullable Cost cost) {}

    record RunUsage(
            @JsonProperty("prompt_tokens") @Nullable Integer promptTokens,
            @JsonProperty("completion_tokens") @Nullable Integer completionTokens,
            @JsonProperty("total_tokens") @Nullable Integer totalTokens,
            @JsonProperty("latency") @Nullable Double latency) {}

    record TestRunEntry(
            @Nullable String input,
            @Nullable String output,
            @Nullable String expectedOutput,
            /** a string or a list of strings */
            @Nullable Object contextToEvaluate,
            @Nullable String scenario,
            @Nullable String expectedSteps,
            Map<String, Object> dataEntry,
            @Nullable List<LocalEvaluationResultEntry> localEvaluationResults) {}

    record LocalEvaluationResultEntry(
            String id, String name, Object result, @Nullable Object passFailCriteria) {}

    enum RunState {
        QUEUED,
        RUNNING,
        FAILED,
        COMPLETE,
        STOPPED
    }

    record EntryStatus(
            int total, int running, int completed, int failed, int queued, int stopped) {}

    record TestRunStatus(EntryStatus entryStatus, RunState testRunStatus) {}

    record TestRunResult(String link, List<TestRunSummary> result) {
        public TestRunResult withLink(String link) {
            return new TestRunResult(link, result);
        }
    }

    record TestRunSummary(
            String name,
            Map<String, MeanScore> individualEvaluatorMeanScore,
            @Nullable Object usage,
            @Nullable Object cost,
            @Nullable Object latency) {}

    record MeanScore(Object score, @Nullable Double outOf, @Nullable Boolean pass) {}

    record Usage(
            @Nullable Integer promptTokens,
            @Nullable Integer completionTokens,
            @Nullable Integer totalTokens,
            @Nullable Double latency) {
        public static Usage ofLatency(double latency) {
            return new Usage(null, null, null, latency);
        }
    }

    record Cost(double input, double output, double total) {}

    record ExecutePromptRequest(
            String promptVersionId,
            String input,
            Map<String, Object> dataEntry,
            @Nullable String contextToEvaluate) {}

    record ExecutePromptChainRequest(
            String promptChainVersionId,
            String input,
            Map<String, Object> dataEntry,
            @Nullable String contextToEvaluate) {}

    record ExecuteWorkflowRequest(
            String workflowId, Map<String, Object> dataEntry, @Nullable String contextToEvaluate) {}

    record ExecutionResponse(
            @Nullable String output,
            /** a string or a list of strings */
            @Nullable Object contextToEvaluate,
            @Nullable Usage usage,
            @Nullable Cost cost,
            @Nullable Double latency) {}

    record DatasetRow(Map<String, Object> data, @Nullable String id) {}
}
