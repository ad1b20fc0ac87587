package io.proofproxy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.io.Serializable;
import java.net.URI;
import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a registered worker.
 */
@Getter
@AllArgsConstructor
public class WorkerInfo implements Serializable {
    @JsonProperty("workerId")
    private final String workerId;

    @JsonProperty("address")
    private final URI address;

    @JsonProperty("status")
    private final WorkerStatus status;

    @JsonProperty("lastHeartbeat")
    private final Instant lastHeartbeat;

    @JsonProperty("consecutiveFailures")
    private final int consecutiveFailures;

    @JsonProperty("currentJobId")
    private final UUID currentJobId;

    @JsonProperty("assignedJobs")
    private final long assignedJobs;
}
