package io.proofproxy.proxy;

import io.proofproxy.model.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Why a dispatch attempt ended without a proof.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor
public class FailureCause {
    private final ErrorCode code;
    private final String message;

    public static FailureCause workerError(String message) {
        return new FailureCause(ErrorCode.WORKER_ERROR, message);
    }

    public static FailureCause transport(String message) {
        return new FailureCause(ErrorCode.TRANSPORT_ERROR, message);
    }

    public static FailureCause timeout(String workerId, long deadlineMs) {
        return new FailureCause(ErrorCode.JOB_TIMEOUT, "No result from " + workerId + " within " + deadlineMs + " ms");
    }

    public static FailureCause workerUnhealthy(String workerId) {
        return new FailureCause(ErrorCode.WORKER_UNHEALTHY, "Worker " + workerId + " became unhealthy");
    }

    public static FailureCause shutdown() {
        return new FailureCause(ErrorCode.PROXY_SHUTDOWN, "Proxy is shutting down");
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
