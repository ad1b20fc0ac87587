package io.proofproxy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.io.Serializable;
import java.util.UUID;

/**
 * Proof job as it travels from a client to the proxy and from the proxy to a worker.
 * The payload is opaque to the proxy.
 */
@Getter
@AllArgsConstructor
public class ProofRequest implements Serializable {
    @JsonProperty("jobId")
    private final UUID jobId;

    @JsonProperty("payload")
    private final byte[] payload;
}
