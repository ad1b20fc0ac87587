package io.proofproxy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.io.Serializable;
import java.util.UUID;

/**
 * Body of every non-2xx JSON response. Job fields are null for errors not tied to a job.
 */
@Getter
@AllArgsConstructor
public class ErrorResponse implements Serializable {
    @JsonProperty("error")
    private final ErrorCode error;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("jobId")
    private final UUID jobId;

    @JsonProperty("retryCount")
    private final Integer retryCount;

    public static ErrorResponse of(ErrorCode error, String message) {
        return new ErrorResponse(error, message, null, null);
    }
}
