package com.example.OfferScan.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "offer.analysis")
public class AnalysisProperties {

    public static final String DEFAULT_BASE_URL = "https://mineru.net/api/v4";

    private String baseUrl = DEFAULT_BASE_URL;
    private String apiKey = "";
    private String organizationId;
    private String taskPath = "/extract/task";

    private Duration requestTimeout = Duration.ofSeconds(30);
    private int maxRetries = 2;
    private Duration retryBackoff = Duration.ofMillis(500);

    private Duration pollInterval = Duration.ofSeconds(2);
    private Duration maxPollDuration = Duration.ofMinutes(5);
    private int maxPollAttempts = 150;

    private long maxArchiveBytes = 50L * 1024 * 1024;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = (baseUrl == null || baseUrl.isBlank()) ? DEFAULT_BASE_URL : baseUrl.trim();
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = (organizationId == null || organizationId.isBlank()) ? null : organizationId.trim();
    }

    public String getTaskPath() {
        return taskPath;
    }

    public void setTaskPath(String taskPath) {
        this.taskPath = taskPath;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = Math.max(0, maxRetries);
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getMaxPollDuration() {
        return maxPollDuration;
    }

    public void setMaxPollDuration(Duration maxPollDuration) {
        this.maxPollDuration = maxPollDuration;
    }

    public int getMaxPollAttempts() {
        return maxPollAttempts;
    }

    public void setMaxPollAttempts(int maxPollAttempts) {
        this.maxPollAttempts = Math.max(1, maxPollAttempts);
    }

    public long getMaxArchiveBytes() {
        return maxArchiveBytes;
    }

    public void setMaxArchiveBytes(long maxArchiveBytes) {
        this.maxArchiveBytes = maxArchiveBytes;
    }
}
