package io.proofproxy.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.List;

/**
 * Proxy settings, as read from {@code proof-proxy.toml}.
 *
 * <ul>
 *   <li>workers: worker addresses registered at startup ({@code host:port} or a full url)</li>
 *   <li>queue_capacity: jobs waiting for a worker before submissions are rejected</li>
 *   <li>max_retries: re-dispatches allowed after the first attempt fails</li>
 *   <li>health_check_interval_ms: period of the probe cycle</li>
 *   <li>failure_threshold: consecutive failed probes that make a worker unhealthy</li>
 *   <li>job_deadline_ms: time a dispatched job may take before it counts as failed</li>
 *   <li>load_balancing: round_robin, least_recently_used or least_loaded</li>
 *   <li>connection_timeout_ms, probe_timeout_ms: worker transport timeouts</li>
 *   <li>max_requests_per_second: per-client submission limit, 0 disables it</li>
 *   <li>remove_after_failed_probes: drop a worker after this many failed probes, 0 keeps it</li>
 * </ul>
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@JsonPropertyOrder({"workers", "queue_capacity", "max_retries", "health_check_interval_ms", "failure_threshold",
        "job_deadline_ms", "load_balancing", "connection_timeout_ms", "probe_timeout_ms",
        "max_requests_per_second", "remove_after_failed_probes"})
public class ProxyConfig {
    public static final String DEFAULT_FILE_NAME = "proof-proxy.toml";

    @Singular
    @JsonProperty("workers")
    private final List<String> workers;

    @Builder.Default
    @JsonProperty("queue_capacity")
    private final int queueCapacity = 10;

    @Builder.Default
    @JsonProperty("max_retries")
    private final int maxRetries = 1;

    @Builder.Default
    @JsonProperty("health_check_interval_ms")
    private final long healthCheckIntervalMs = 10_000;

    @Builder.Default
    @JsonProperty("failure_threshold")
    private final int failureThreshold = 3;

    @Builder.Default
    @JsonProperty("job_deadline_ms")
    private final long jobDeadlineMs = 100_000;

    @Builder.Default
    @JsonProperty("load_balancing")
    private final LoadBalancingStrategy loadBalancing = LoadBalancingStrategy.ROUND_ROBIN;

    @Builder.Default
    @JsonProperty("connection_timeout_ms")
    private final long connectionTimeoutMs = 10_000;

    @Builder.Default
    @JsonProperty("probe_timeout_ms")
    private final long probeTimeoutMs = 5_000;

    @Builder.Default
    @JsonProperty("max_requests_per_second")
    private final int maxRequestsPerSecond = 5;

    @Builder.Default
    @JsonProperty("remove_after_failed_probes")
    private final int removeAfterFailedProbes = 0;

    public static ProxyConfig defaults() {
        return ProxyConfig.builder().build();
    }

    @JsonIgnore
    public Duration getHealthCheckInterval() {
        return Duration.ofMillis(healthCheckIntervalMs);
    }

    @JsonIgnore
    public Duration getJobDeadline() {
        return Duration.ofMillis(jobDeadlineMs);
    }

    @JsonIgnore
    public Duration getConnectionTimeout() {
        return Duration.ofMillis(connectionTimeoutMs);
    }

    @JsonIgnore
    public Duration getProbeTimeout() {
        return Duration.ofMillis(probeTimeoutMs);
    }

    /**
     * @return this instance
     * @throws IllegalArgumentException if a value is out of range
     */
    public ProxyConfig validate() {
        requirePositive("queue_capacity", queueCapacity);
        requireNonNegative("max_retries", maxRetries);
        requirePositive("health_check_interval_ms", healthCheckIntervalMs);
        requirePositive("failure_threshold", failureThreshold);
        requirePositive("job_deadline_ms", jobDeadlineMs);
        requirePositive("connection_timeout_ms", connectionTimeoutMs);
        requirePositive("probe_timeout_ms", probeTimeoutMs);
        requireNonNegative("max_requests_per_second", maxRequestsPerSecond);
        requireNonNegative("remove_after_failed_probes", removeAfterFailedProbes);
        if (removeAfterFailedProbes > 0 && removeAfterFailedProbes < failureThreshold) {
            throw new IllegalArgumentException("remove_after_failed_probes must not be below failure_threshold"
                    + " (current: " + removeAfterFailedProbes + " < " + failureThreshold + ")");
        }
        if (loadBalancing == null) {
            throw new IllegalArgumentException("load_balancing must be set");
        }
        return this;
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive (current: " + value + ")");
        }
    }

    private static void requireNonNegative(String key, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(key + " must not be negative (current: " + value + ")");
        }
    }
}
