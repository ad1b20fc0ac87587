package io.proofproxy.model;

/**
 * Error taxonomy shared by the proxy, its clients and workers.
 */
public enum ErrorCode {
    ADMISSION_REJECTED, // queue full at submission or at retry requeue
    UNKNOWN_WORKER,     // operation on an unregistered worker id
    WORKER_UNHEALTHY,   // worker crossed the failed-probe threshold while holding a job
    JOB_TIMEOUT,        // deadline exceeded while dispatched
    RETRY_EXHAUSTED,    // terminal failure after max retries
    TRANSPORT_ERROR,    // communication failure with a worker
    WORKER_ERROR,       // worker answered with a failure result
    PROXY_SHUTDOWN,     // proxy stopped before the job finished
    WORKER_BUSY,
    RATE_LIMITED,
    INVALID_REQUEST,
    INTERNAL_ERROR
}
