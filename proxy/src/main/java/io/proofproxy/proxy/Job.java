package io.proofproxy.proxy;

import io.opentelemetry.context.Context;
import io.proofproxy.model.ErrorCode;
import io.proofproxy.model.JobState;
import io.proofproxy.model.ProofRequest;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A proof job and its state machine.
 *
 * <pre>
 * QUEUED -> DISPATCHED -> COMPLETED
 *   ^           |
 *   +-- retry --+-> FAILED
 * QUEUED -> FAILED (requeue rejected)
 * </pre>
 *
 * <p>Not thread-safe; mutated only under the proxy's scheduling lock.</p>
 */
@Getter
public class Job {
    private final UUID id;
    private final byte[] payload;
    private final Instant arrivedAt;
    private final Duration deadline;
    private JobState state = JobState.QUEUED;
    private int retryCount;
    private int attempts;
    private String assignedWorkerId;
    private FailureCause lastFailure;
    private ErrorCode terminalError;
    private byte[] proof;
    // trace of the submit call, parent of every attempt span
    private Context traceContext = Context.root();

    public Job(UUID id, byte[] payload, Instant arrivedAt, Duration deadline) {
        this.id = id;
        this.payload = payload;
        this.arrivedAt = arrivedAt;
        this.deadline = deadline;
    }

    public ProofRequest toRequest() {
        return new ProofRequest(id, payload);
    }

    void traceUnder(Context traceContext) {
        this.traceContext = traceContext;
    }

    void dispatchTo(String workerId) {
        requireState(JobState.QUEUED, "dispatch");
        state = JobState.DISPATCHED;
        assignedWorkerId = workerId;
        attempts++;
    }

    void requeue(FailureCause cause) {
        requireState(JobState.DISPATCHED, "requeue");
        state = JobState.QUEUED;
        assignedWorkerId = null;
        lastFailure = cause;
        retryCount++;
    }

    void complete(byte[] proof) {
        requireState(JobState.DISPATCHED, "complete");
        state = JobState.COMPLETED;
        assignedWorkerId = null;
        this.proof = proof;
    }

    void fail(ErrorCode terminalError, FailureCause cause) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is already " + state);
        }
        state = JobState.FAILED;
        assignedWorkerId = null;
        lastFailure = cause;
        this.terminalError = terminalError;
    }

    /**
     * Drops the proof once it has been handed to the relay.
     */
    void releaseProof() {
        proof = null;
    }

    private void requireState(JobState expected, String transition) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + transition + " job " + id + " in state " + state);
        }
    }

    @Override
    public String toString() {
        return "Job{" + id + ", " + state + ", retries=" + retryCount + "}";
    }
}
