package io.proofproxy.proxy.exception;

import io.proofproxy.model.ErrorCode;
import lombok.Getter;

import java.util.UUID;

/**
 * The queue was full when the job arrived or when it was due to be requeued.
 */
@Getter
public class AdmissionRejectedException extends ProxyException {
    private final UUID jobId;
    private final int retryCount;

    public AdmissionRejectedException(UUID jobId, int retryCount, int capacity) {
        super(ErrorCode.ADMISSION_REJECTED, "Too many requests in the queue (capacity " + capacity + ")");
        this.jobId = jobId;
        this.retryCount = retryCount;
    }
}
