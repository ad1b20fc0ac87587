package io.proofproxy.proxy;

import io.proofproxy.model.ErrorCode;
import io.proofproxy.model.JobState;
import io.proofproxy.proxy.exception.AdmissionRejectedException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides what happens to a dispatched job whose attempt failed.
 *
 * <p>While {@code retryCount < maxRetries} the job goes back to the queue ahead of fresh jobs; otherwise, or
 * when the queue has no room for it, the job fails and is handed to the {@link ResultRelay}.</p>
 */
@Slf4j
public class RetryCoordinator {

    public enum Decision {
        REQUEUED,
        FAILED
    }

    private final ReentrantLock lock;
    private final QueueManager queue;
    private final ResultRelay relay;
    private final ProxyMetrics metrics;
    private final int maxRetries;

    public RetryCoordinator(ReentrantLock lock, QueueManager queue, ResultRelay relay, ProxyMetrics metrics,
                            int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative (current: " + maxRetries + ")");
        }
        this.lock = lock;
        this.queue = queue;
        this.relay = relay;
        this.metrics = metrics;
        this.maxRetries = maxRetries;
    }

    public Decision onFailure(Job job, FailureCause cause) {
        lock.lock();
        try {
            if (job.getState() != JobState.DISPATCHED) {
                throw new IllegalStateException("Only dispatched jobs can fail an attempt: " + job);
            }
            if (job.getRetryCount() >= maxRetries) {
                job.fail(ErrorCode.RETRY_EXHAUSTED, cause);
                log.warn("Job {} failed after {} attempts, last failure: {}", job.getId(), job.getAttempts(), cause);
                return terminate(job);
            }

            job.requeue(cause);
            try {
                queue.requeueFront(job);
            } catch (AdmissionRejectedException e) {
                job.fail(ErrorCode.ADMISSION_REJECTED, cause);
                metrics.jobRejected();
                log.warn("Job {} could not be requeued, queue is full; last failure: {}", job.getId(), cause);
                return terminate(job);
            }
            metrics.jobRetried();
            log.info("Job {} requeued (retry {}/{}) after {}", job.getId(), job.getRetryCount(), maxRetries, cause);
            return Decision.REQUEUED;
        } finally {
            lock.unlock();
        }
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private Decision terminate(Job job) {
        metrics.jobFailed();
        relay.deliver(job);
        return Decision.FAILED;
    }
}
