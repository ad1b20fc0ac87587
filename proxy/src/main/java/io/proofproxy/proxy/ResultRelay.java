package io.proofproxy.proxy;

import io.proofproxy.model.ErrorCode;
import io.proofproxy.model.JobState;
import io.proofproxy.model.ProofResult;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Hands terminal jobs back to the clients that submitted them, at most once per job.
 * Results for clients that went away are dropped without error.
 */
@Slf4j
public class ResultRelay {
    private final ConcurrentMap<UUID, PendingResult> pending = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if a job with this id is still in flight
     */
    public PendingResult register(UUID jobId) {
        PendingResult result = new PendingResult(jobId);
        if (pending.putIfAbsent(jobId, result) != null) {
            throw new IllegalArgumentException("Job " + jobId + " is already in flight");
        }
        return result;
    }

    /**
     * Client side is gone: whatever the job produces will be discarded.
     */
    public void abandon(UUID jobId) {
        PendingResult result = pending.remove(jobId);
        if (result != null) {
            result.abandon();
            log.debug("Client of job {} went away", jobId);
        }
    }

    /**
     * @return true if a waiting client received the outcome
     */
    public boolean deliver(Job job) {
        if (!job.getState().isTerminal()) {
            throw new IllegalStateException("Cannot deliver non-terminal " + job);
        }
        PendingResult result = pending.remove(job.getId());
        if (result == null) {
            log.debug("No client waiting for {}, discarding result", job);
            return false;
        }
        boolean delivered = result.complete(toResult(job));
        if (!delivered) {
            log.debug("Client of {} disconnected before delivery, discarding result", job);
        }
        return delivered;
    }

    public int pendingCount() {
        return pending.size();
    }

    static ProofResult toResult(Job job) {
        if (job.getState() == JobState.COMPLETED) {
            return ProofResult.success(job.getId(), job.getProof());
        }
        ErrorCode code = job.getTerminalError() == null ? ErrorCode.RETRY_EXHAUSTED : job.getTerminalError();
        String message;
        if (code == ErrorCode.RETRY_EXHAUSTED) {
            message = "Job failed after " + job.getRetryCount() + " retries, last failure: " + job.getLastFailure();
        } else if (code == ErrorCode.PROXY_SHUTDOWN) {
            message = "Proxy shut down before the job finished, last failure: " + job.getLastFailure();
        } else {
            message = "Job could not be requeued, last failure: " + job.getLastFailure();
        }
        return ProofResult.failure(job.getId(), code, message, job.getRetryCount());
    }
}
