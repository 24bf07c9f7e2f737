package com.agentsentry.evaluator.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the agent under evaluation.
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "sentry.target")
public class TargetProperties {

    @NotBlank
    private String baseUrl = "http://127.0.0.1:8001";
    @NotBlank
    private String discoveryPath = "/.well-known/agent-card.json";
    @NotBlank
    private String commandPath = "/command";
    @Min(100)
    private int timeoutMs = 10_000;
    @Min(0)
    private int maxRetries = 3;
    @Min(1)
    private int backoffMs = 200;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getDiscoveryPath() {
        return discoveryPath;
    }

    public void setDiscoveryPath(String discoveryPath) {
        this.discoveryPath = discoveryPath;
    }

    public String getCommandPath() {
        return commandPath;
    }

    public void setCommandPath(String commandPath) {
        this.commandPath = commandPath;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getBackoffMs() {
        return backoffMs;
    }

    public void setBackoffMs(int backoffMs) {
        this.backoffMs = backoffMs;
    }
}
