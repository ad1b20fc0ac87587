package io.proofproxy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.io.Serializable;
import java.util.Map;

/**
 * Snapshot of the proxy's queue, worker pool and counters.
 */
@Getter
@AllArgsConstructor
public class ProxyStatus implements Serializable {
    @JsonProperty("queueSize")
    private final int queueSize;

    @JsonProperty("queueCapacity")
    private final int queueCapacity;

    @JsonProperty("workers")
    private final Map<WorkerStatus, Integer> workers;

    @JsonProperty("counters")
    private final Map<String, Double> counters;
}
