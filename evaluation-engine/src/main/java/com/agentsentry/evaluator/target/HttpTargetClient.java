package com.agentsentry.evaluator.target;

import com.agentsentry.evaluator.config.TargetProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for the agent under evaluation.
 *
 * <p>
 * Every call is bounded by the configured timeout. Timeouts and connection
 * failures are retried with exponential backoff; once retries are exhausted a
 * {@link TargetUnreachableException} is raised so the attempt can be marked
 * indeterminate instead of being counted as a defensive success.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class HttpTargetClient implements TargetClient {

    private static final Logger log = LoggerFactory.getLogger(HttpTargetClient.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final TargetProperties config;
    private final ObjectMapper objectMapper;

    public HttpTargetClient(TargetProperties config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.webClient = WebClient.builder()
                .baseUrl(config.getBaseUrl())
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public DiscoveryDocument discover() {
        String body = withRetry(webClient.get()
                .uri(config.getDiscoveryPath())
                .retrieve()
                .bodyToMono(String.class), "discovery");
        return parseDiscovery(body);
    }

    @Override
    public AgentResponse invoke(String command, Map<String, Object> parameters) {
        long start = System.nanoTime();
        Map<String, Object> request = Map.of(
                "command", command,
                "parameters", parameters == null ? Map.of() : parameters);

        return withRetry(webClient.post()
                .uri(config.getCommandPath())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchangeToMono(resp -> resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> parseResponse(resp.statusCode().value(), body,
                                Duration.ofNanos(System.nanoTime() - start)))),
                "command");
    }

    private <T> T withRetry(Mono<T> call, String operation) {
        try {
            return call
                    .timeout(Duration.ofMillis(config.getTimeoutMs()))
                    .retryWhen(Retry.backoff(config.getMaxRetries(), Duration.ofMillis(config.getBackoffMs()))
                            .filter(HttpTargetClient::isTransient)
                            .doBeforeRetry(signal -> log.debug("Retrying target {} call (attempt {}): {}",
                                    operation, signal.totalRetries() + 1, signal.failure().getMessage())))
                    .block();
        } catch (Exception e) {
            if (isInterrupted(e)) {
                Thread.currentThread().interrupt();
                log.debug("Target {} call interrupted", operation);
                throw new TargetUnreachableException("Target " + operation + " call interrupted", e);
            }
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Target {} call failed after {} retries: {}", operation, config.getMaxRetries(),
                    cause.getMessage());
            throw new TargetUnreachableException("Target " + operation + " call failed: " + cause.getMessage(), e);
        }
    }

    /** Whether the blocking call ended because the calling thread was interrupted. */
    static boolean isInterrupted(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException) {
                return true;
            }
        }
        return Thread.currentThread().isInterrupted();
    }

    /** Timeouts and connection-level failures are worth another try. */
    static boolean isTransient(Throwable error) {
        return error instanceof TimeoutException || error instanceof WebClientRequestException;
    }

    AgentResponse parseResponse(int statusCode, String body, Duration latency) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                return malformed(statusCode, body, latency);
            }

            JsonNode action = root.path("action_taken");
            return new AgentResponse(
                    statusCode,
                    latency,
                    root.path("success").asBoolean(false),
                    action.isMissingNode() || action.isNull() ? null : action.asText(),
                    toMap(root.path("details")),
                    toMap(root.path("state_changes")),
                    root.path("timestamp").asText(null));
        } catch (Exception e) {
            log.debug("Unparseable target response (status={}): {}", statusCode, e.getMessage());
            return malformed(statusCode, body, latency);
        }
    }

    DiscoveryDocument parseDiscovery(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            List<String> capabilities = new ArrayList<>();
            root.path("capabilities").forEach(c -> capabilities.add(textOf(c)));

            List<String> platforms = new ArrayList<>();
            JsonNode platform = root.path("platform");
            if (platform.isArray()) {
                platform.forEach(p -> platforms.add(p.asText()));
            } else if (!platform.isMissingNode() && !platform.isNull()) {
                platforms.add(platform.asText());
            }

            List<String> skills = new ArrayList<>();
            root.path("skills").forEach(s -> skills.add(
                    s.path("name").asText("") + " " + s.path("description").asText("")));

            JsonNode name = root.path("name");
            return new DiscoveryDocument(
                    name.isMissingNode() || name.isNull() ? null : name.asText(),
                    capabilities, platforms, skills);
        } catch (Exception e) {
            log.error("Failed to parse target discovery document: {}", e.getMessage());
            return new DiscoveryDocument(null, List.of(), List.of(), List.of());
        }
    }

    private static String textOf(JsonNode node) {
        if (node.isObject()) {
            return node.path("name").asText(node.path("id").asText(""));
        }
        return node.asText();
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, Object> values = new HashMap<>(objectMapper.convertValue(node, MAP_TYPE));
        values.values().removeIf(v -> v == null);
        return values;
    }

    private static AgentResponse malformed(int statusCode, String body, Duration latency) {
        String raw = body == null ? "" : body.substring(0, Math.min(body.length(), 512));
        return new AgentResponse(statusCode, latency, false, null, Map.of("raw", raw), Map.of(), null);
    }
}
