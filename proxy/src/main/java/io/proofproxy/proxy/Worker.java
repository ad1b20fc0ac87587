package io.proofproxy.proxy;

import io.proofproxy.model.WorkerInfo;
import io.proofproxy.model.WorkerStatus;
import lombok.Getter;

import java.net.URI;
import java.time.Instant;

/**
 * A backend worker with capacity for exactly one job.
 *
 * <p>Status changes go through {@link WorkerRegistry} only; not thread-safe.</p>
 */
@Getter
public class Worker {
    private final String id;
    private final URI address;
    private final long registrationOrder;
    private WorkerStatus status = WorkerStatus.IDLE;
    private Instant lastHeartbeat;
    private int consecutiveFailures;
    private Job currentJob;
    private long lastAssignedSeq;
    private long assignedJobs;

    Worker(String id, URI address, long registrationOrder, Instant registeredAt) {
        this.id = id;
        this.address = address;
        this.registrationOrder = registrationOrder;
        this.lastHeartbeat = registeredAt;
    }

    void assign(Job job, long assignmentSeq) {
        status = WorkerStatus.BUSY;
        currentJob = job;
        lastAssignedSeq = assignmentSeq;
        assignedJobs++;
    }

    Job release(WorkerStatus next) {
        Job job = currentJob;
        currentJob = null;
        status = next;
        return job;
    }

    void setStatus(WorkerStatus status) {
        this.status = status;
    }

    int recordProbeFailure() {
        return ++consecutiveFailures;
    }

    void recordProbeSuccess(Instant at) {
        consecutiveFailures = 0;
        lastHeartbeat = at;
    }

    public boolean isIdle() {
        return status == WorkerStatus.IDLE;
    }

    public WorkerInfo toInfo() {
        return new WorkerInfo(id, address, status, lastHeartbeat, consecutiveFailures,
                currentJob == null ? null : currentJob.getId(), assignedJobs);
    }

    @Override
    public String toString() {
        return "Worker{" + id + ", " + status + "}";
    }
}
