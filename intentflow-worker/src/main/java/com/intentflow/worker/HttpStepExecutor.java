package com.intentflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Executor that forwards an action to an external collaborator over HTTP.
 *
 * Usage:
 * <pre>
 * registry.register(ActionCategory.OPEN, new HttpStepExecutor("http://cua-agent:9000", mapper));
 * </pre>
 *
 * The collaborator receives {@code POST {baseUrl}/actions/{actionName}} and answers with
 * the step output as JSON. 4xx responses are permanent failures; 5xx responses and
 * connection errors are retried.
 */
public class HttpStepExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(HttpStepExecutor.class);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpStepExecutor(String baseUrl, ObjectMapper objectMapper) {
        this(baseUrl, objectMapper, Duration.ofSeconds(30));
    }

    public HttpStepExecutor(String baseUrl, ObjectMapper objectMapper, Duration requestTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Override
    public JsonNode execute(StepContext context) throws StepExecutionException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("taskId", context.getTaskId().toString());
        body.put("stepId", context.getStepId());
        body.put("attempt", context.getAttemptNumber());
        body.put("compensation", context.isCompensation());
        body.put("idempotencyKey", context.getIdempotencyKey());
        body.put("roleScope", context.getRoleScope());
        body.put("target", context.getAction().target());
        body.put("sensitivity", context.getAction().sensitivity().name());
        body.set("parameters", objectMapper.valueToTree(context.getAction().parameters()));

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/actions/" + context.getAction().name()))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Idempotency-Key", context.getIdempotencyKey())
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.warn("Collaborator at {} unreachable: {}", baseUrl, e.getMessage());
            throw new StepExecutionException("COLLABORATOR_UNREACHABLE", e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepExecutionException("INTERRUPTED", "Interrupted while calling " + baseUrl, e, true);
        }

        int status = response.statusCode();
        if (status >= 400 && status < 500) {
            throw StepExecutionException.permanent("HTTP_" + status, response.body());
        }
        if (status >= 500) {
            throw StepExecutionException.transient_("HTTP_" + status, response.body());
        }
        if (response.body() == null || response.body().isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new StepExecutionException("MALFORMED_OUTPUT", e.getMessage(), e, false);
        }
    }
}
