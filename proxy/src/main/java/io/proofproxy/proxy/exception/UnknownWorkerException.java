package io.proofproxy.proxy.exception;

import io.proofproxy.model.ErrorCode;
import lombok.Getter;

@Getter
public class UnknownWorkerException extends ProxyException {
    private final String workerId;

    public UnknownWorkerException(String workerId) {
        super(ErrorCode.UNKNOWN_WORKER, "Unknown worker: " + workerId);
        this.workerId = workerId;
    }
}
