package org.carma.influence.mechanism;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.carma.influence.config.HarnessConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Inference backend for OpenAI-compatible chat completion endpoints.
 *
 * Every request asks for {@code response_format = json_object} when the request is
 * JSON-only, and forwards temperature and seed. HTTP 408, 409, 429 and 5xx responses,
 * timeouts and transport errors are reported as transient; everything else is
 * permanent.
 *
 * Usage:
 * <pre>
 * InferenceBackend backend = OpenAiInferenceBackend.builder()
 *     .apiKey(System.getenv("OPENAI_API_KEY"))
 *     .model("gpt-4o")
 *     .timeout(Duration.ofSeconds(60))
 *     .build();
 * </pre>
 */
public class OpenAiInferenceBackend implements InferenceBackend {

    private static final Logger log = LoggerFactory.getLogger(OpenAiInferenceBackend.class);

    /**
     * Record of an invocation for monitoring.
     */
    public static class InvocationRecord {
        public final String role;
        public final String model;
        public final long timestampMs;
        public final long durationMs;
        public final InferenceResult.Status status;
        public final String error;

        public InvocationRecord(String role, String model, long durationMs,
                                InferenceResult.Status status, String error) {
            this.role = role;
            this.model = model;
            this.timestampMs = System.currentTimeMillis();
            this.durationMs = durationMs;
            this.status = status;
            this.error = error;
        }
    }

    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final boolean logRequests;
    private final HttpClient httpClient;
    private final ExecutorService executor;
    private final ObjectMapper mapper;
    private final List<InvocationRecord> invocationLog;

    private OpenAiInferenceBackend(Builder builder) {
        if (builder.apiKey == null || builder.apiKey.isBlank()) {
            throw new IllegalStateException("An API key is required for " + getClass().getSimpleName());
        }
        this.apiKey = builder.apiKey;
        this.baseUrl = stripTrailingSlash(builder.baseUrl);
        this.model = builder.model;
        this.timeout = builder.timeout;
        this.logRequests = builder.logRequests;
        this.mapper = new ObjectMapper();
        this.invocationLog = Collections.synchronizedList(new ArrayList<>());
        this.executor = Executors.newCachedThreadPool();
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .executor(executor)
            .build();
    }

    // ========================================================================
    // InferenceBackend Implementation
    // ========================================================================

    @Override
    public InferenceResult complete(InferenceRequest request) {
        long start = System.currentTimeMillis();
        InferenceResult result;
        try {
            result = execute(request, start);
        } catch (HttpTimeoutException e) {
            result = InferenceResult.transientFailure("timeout after " + timeout.toMillis() + "ms",
                System.currentTimeMillis() - start);
        } catch (IOException e) {
            result = InferenceResult.transientFailure("transport error: " + e.getMessage(),
                System.currentTimeMillis() - start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = InferenceResult.permanentFailure("interrupted", System.currentTimeMillis() - start);
        }

        if (logRequests) {
            invocationLog.add(new InvocationRecord(request.role().getKey(), model,
                result.getDurationMs(), result.getStatus(), result.getError()));
        }
        if (!result.isSuccess()) {
            log.debug("Inference call for {} failed: {}", request.role(), result);
        }
        return result;
    }

    @Override
    public String getName() {
        return "OpenAiInferenceBackend[" + model + "]";
    }

    @Override
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ========================================================================
    // HTTP Request Execution
    // ========================================================================

    private InferenceResult execute(InferenceRequest request, long start)
            throws IOException, InterruptedException {
        HttpRequest httpRequest = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/chat/completions"))
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + apiKey)
            .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(request)))
            .build();

        HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        long duration = System.currentTimeMillis() - start;
        int status = response.statusCode();

        if (isTransientStatus(status)) {
            return InferenceResult.transientFailure("HTTP " + status + ": " + abbreviate(response.body()), duration);
        }
        if (status >= 400) {
            return InferenceResult.permanentFailure("HTTP " + status + ": " + abbreviate(response.body()), duration);
        }
        return parseResponse(response.body(), duration);
    }

    String buildRequestBody(InferenceRequest request) throws JsonProcessingException {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.put("temperature", request.temperature());
        body.put("seed", request.seed());

        ArrayNode messages = body.putArray("messages");
        if (!request.systemMessage().isEmpty()) {
            messages.addObject()
                .put("role", "system")
                .put("content", request.systemMessage());
        }
        messages.addObject()
            .put("role", "user")
            .put("content", request.userMessage());

        if (request.jsonOnly()) {
            body.putObject("response_format").put("type", "json_object");
        }
        return mapper.writeValueAsString(body);
    }

    InferenceResult parseResponse(String responseBody, long durationMs) {
        JsonNode root;
        try {
            root = mapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            return InferenceResult.permanentFailure("unreadable response envelope: " + e.getOriginalMessage(),
                durationMs);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            return InferenceResult.permanentFailure("response has no choices[0].message.content", durationMs);
        }
        return InferenceResult.success(content.asText(), durationMs);
    }

    static boolean isTransientStatus(int status) {
        return status == 408 || status == 409 || status == 429 || status >= 500;
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 300 ? s : s.substring(0, 300) + "...";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // ========================================================================
    // Monitoring
    // ========================================================================

    public List<InvocationRecord> getInvocationLog() {
        return new ArrayList<>(invocationLog);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String apiKey;
        private String baseUrl = HarnessConfig.DEFAULT_BASE_URL;
        private String model = HarnessConfig.DEFAULT_MODEL;
        private Duration timeout = Duration.ofSeconds(60);
        private boolean logRequests = true;

        public Builder apiKey(String key) {
            this.apiKey = key;
            return this;
        }

        public Builder baseUrl(String url) {
            if (url != null && !url.isBlank()) {
                this.baseUrl = url;
            }
            return this;
        }

        public Builder model(String model) {
            if (model != null && !model.isBlank()) {
                this.model = model;
            }
            return this;
        }

        /**
         * Per-call timeout, also used as connect timeout.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logRequests(boolean log) {
            this.logRequests = log;
            return this;
        }

        /**
         * Take endpoint, credential, model and timeout from the harness configuration.
         */
        public Builder fromConfig(HarnessConfig.Inference inference) {
            return apiKey(inference.apiKey())
                .baseUrl(inference.baseUrl())
                .model(inference.model())
                .timeout(inference.timeout());
        }

        public OpenAiInferenceBackend build() {
            return new OpenAiInferenceBackend(this);
        }
    }

    @Override
    public String toString() {
        return String.format("OpenAiInferenceBackend[baseUrl=%s, model=%s, timeout=%s]", baseUrl, model, timeout);
    }
}
