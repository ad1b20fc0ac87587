package io.proofproxy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.io.Serializable;
import java.util.UUID;

/**
 * Outcome of a proof job: either the proof bytes or an error description.
 */
@Getter
@AllArgsConstructor
public class ProofResult implements Serializable {
    @JsonProperty("jobId")
    private final UUID jobId;

    @JsonProperty("success")
    private final boolean success;

    @JsonProperty("proof")
    private final byte[] proof;

    @JsonProperty("errorCode")
    private final ErrorCode errorCode;

    @JsonProperty("errorMessage")
    private final String errorMessage;

    @JsonProperty("retryCount")
    private final int retryCount;

    public static ProofResult success(UUID jobId, byte[] proof) {
        return new ProofResult(jobId, true, proof, null, null, 0);
    }

    public static ProofResult failure(UUID jobId, String errorMessage) {
        return new ProofResult(jobId, false, null, ErrorCode.WORKER_ERROR, errorMessage, 0);
    }

    public static ProofResult failure(UUID jobId, ErrorCode errorCode, String errorMessage, int retryCount) {
        return new ProofResult(jobId, false, null, errorCode, errorMessage, retryCount);
    }
}
