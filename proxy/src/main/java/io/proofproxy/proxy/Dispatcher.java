package io.proofproxy.proxy;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.proofproxy.model.ErrorCode;
import io.proofproxy.model.JobState;
import io.proofproxy.model.ProofRequest;
import io.proofproxy.model.ProofResult;
import io.proofproxy.model.WorkerStatus;
import io.proofproxy.proxy.exception.AdmissionRejectedException;
import io.proofproxy.proxy.exception.TransportException;
import io.proofproxy.proxy.transport.WorkerClient;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Matches jobs with idle workers.
 *
 * <p>A new job goes straight to the preferred idle worker, or to the queue when none is idle. A worker
 * that becomes idle takes the head of the queue. Each assignment then runs on its own task: it forwards
 * the job to the worker and waits for the answer outside the lock, racing a deadline timer.</p>
 *
 * <p>Every decision is taken under the scheduling lock shared with the registry and the queue. After
 * {@link #shutdown()} nothing is dispatched: queued jobs and failed attempts end with
 * {@code PROXY_SHUTDOWN} instead of being retried.</p>
 */
@Slf4j
public class Dispatcher implements WorkerEventListener {
    private static final Duration TRANSPORT_GRACE = Duration.ofSeconds(5);

    private final ReentrantLock lock;
    private final WorkerRegistry registry;
    private final QueueManager queue;
    private final RetryCoordinator retryCoordinator;
    private final ResultRelay relay;
    private final WorkerClient client;
    private final HealthMonitor healthMonitor;
    private final ExecutorService jobExecutor;
    private final ScheduledExecutorService timer;
    private final ProxyMetrics metrics;
    private final Tracer tracer;
    private final Clock clock;
    private final Duration jobDeadline;
    // written under the lock
    private volatile boolean closed;

    public Dispatcher(ReentrantLock lock, WorkerRegistry registry, QueueManager queue,
                      RetryCoordinator retryCoordinator, ResultRelay relay, WorkerClient client,
                      HealthMonitor healthMonitor, ExecutorService jobExecutor, ScheduledExecutorService timer,
                      ProxyMetrics metrics, Tracer tracer, Clock clock, Duration jobDeadline) {
        this.lock = lock;
        this.registry = registry;
        this.queue = queue;
        this.retryCoordinator = retryCoordinator;
        this.relay = relay;
        this.client = client;
        this.healthMonitor = healthMonitor;
        this.jobExecutor = jobExecutor;
        this.timer = timer;
        this.metrics = metrics;
        this.tracer = tracer;
        this.clock = clock;
        this.jobDeadline = jobDeadline;
    }

    /**
     * Accepts a job from a client.
     *
     * @return handle the client waits on
     * @throws AdmissionRejectedException if no worker is idle and the queue is full
     * @throws IllegalArgumentException if a job with the same id is still in flight
     * @throws IllegalStateException if the dispatcher has been shut down
     */
    public PendingResult submit(ProofRequest request) {
        if (closed) {
            throw new IllegalStateException("Proxy is shut down");
        }
        UUID jobId = request.getJobId() != null ? request.getJobId() : UUID.randomUUID();
        Job job = new Job(jobId, request.getPayload(), clock.instant(), jobDeadline);
        Span span = tracer.spanBuilder("proxy.submit")
                .setAttribute("job.id", jobId.toString())
                .setAttribute("job.payload_bytes", request.getPayload() == null ? 0 : request.getPayload().length)
                .startSpan();
        job.traceUnder(Context.current().with(span));

        lock.lock();
        try (Scope ignored = span.makeCurrent()) {
            PendingResult pending = relay.register(jobId);
            metrics.jobSubmitted();
            try {
                List<Worker> idle = registry.listIdle();
                if (!idle.isEmpty()) {
                    assign(job, idle.get(0));
                } else {
                    queue.enqueue(job);
                    span.setAttribute("job.queued", true);
                    log.info("Job {} queued, no idle worker ({} waiting)", jobId, queue.size());
                }
                return pending;
            } catch (AdmissionRejectedException e) {
                relay.abandon(jobId);
                metrics.jobRejected();
                span.setStatus(StatusCode.ERROR, e.getMessage());
                log.warn("Job {} rejected: {}", jobId, e.getMessage());
                throw e;
            }
        } catch (IllegalArgumentException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            lock.unlock();
            span.end();
        }
    }

    @Override
    public void onWorkerIdle(Worker worker) {
        lock.lock();
        try {
            if (closed || !worker.isIdle()) {
                return;
            }
            Optional<Job> next = queue.dequeue();
            next.ifPresent(job -> assign(job, worker));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onJobEvicted(Job job, RetryCoordinator.Decision decision) {
        if (decision == RetryCoordinator.Decision.REQUEUED) {
            dispatchPending();
        }
    }

    /**
     * Pairs queued jobs with idle workers until one side runs out.
     */
    public void dispatchPending() {
        lock.lock();
        try {
            if (closed) {
                failQueued();
                return;
            }
            while (!closed) {
                List<Worker> idle = registry.listIdle();
                if (idle.isEmpty()) {
                    return;
                }
                Optional<Job> next = queue.dequeue();
                if (next.isEmpty()) {
                    return;
                }
                assign(next.get(), idle.get(0));
            }
        } finally {
            lock.unlock();
        }
    }

    private void assign(Job job, Worker worker) {
        job.dispatchTo(worker.getId());
        registry.markBusy(worker.getId(), job);
        Span span = tracer.spanBuilder("proxy.dispatch_attempt")
                .setParent(job.getTraceContext())
                .setAttribute("job.id", job.getId().toString())
                .setAttribute("worker.id", worker.getId())
                .setAttribute("job.attempt", job.getAttempts())
                .setAttribute("job.retry_count", job.getRetryCount())
                .startSpan();
        Assignment assignment = new Assignment(job, worker.getId(), worker.getAddress(),
                worker.getLastAssignedSeq(), job.getAttempts(), span);
        log.info("Job {} dispatched to worker {} (attempt {})", job.getId(), worker.getId(), job.getAttempts());

        try {
            assignment.deadlineTimer = timer.schedule(() -> onDeadline(assignment),
                    job.getDeadline().toMillis(), TimeUnit.MILLISECONDS);
            jobExecutor.execute(() -> forward(assignment));
        } catch (RejectedExecutionException e) {
            log.error("Cannot start attempt for job {}, executor rejected it", job.getId());
            if (assignment.deadlineTimer != null) {
                assignment.deadlineTimer.cancel(false);
            }
            span.setStatus(StatusCode.ERROR, "Proxy is shutting down");
            span.end();
            // the executor only rejects once it is shut down
            closed = true;
            failOnShutdown(job, FailureCause.shutdown());
            releaseWorker(assignment);
            failQueued();
        }
    }

    /**
     * Stops dispatching. Queued jobs fail right away; attempts in flight still deliver a proof, but a
     * failed one is not retried.
     */
    public void shutdown() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            int queued = queue.size();
            failQueued();
            log.info("Dispatcher stopped, {} queued job(s) failed", queued);
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        return closed;
    }

    private void forward(Assignment assignment) {
        Job job = assignment.job;
        ProofResult result = null;
        FailureCause failure = null;
        try (Scope ignored = assignment.span.makeCurrent()) {
            result = client.prove(assignment.workerAddress, job.toRequest(), job.getDeadline().plus(TRANSPORT_GRACE));
            if (!job.getId().equals(result.getJobId())) {
                failure = FailureCause.transport("Worker answered for job " + result.getJobId());
            } else if (!result.isSuccess()) {
                failure = FailureCause.workerError(result.getErrorMessage());
            }
        } catch (TransportException e) {
            failure = FailureCause.transport(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error forwarding job {} to {}", job.getId(), assignment.workerId, e);
            failure = FailureCause.transport("Unexpected error: " + e.getMessage());
        }
        finishAttempt(assignment, result, failure);
    }

    private void finishAttempt(Assignment assignment, ProofResult result, FailureCause failure) {
        lock.lock();
        try {
            if (assignment.deadlineTimer != null) {
                assignment.deadlineTimer.cancel(false);
            }
            Job job = assignment.job;
            endAttemptSpan(assignment, failure);
            if (assignment.isCurrent()) {
                if (failure == null) {
                    job.complete(result.getProof());
                    metrics.jobCompleted();
                    log.info("Job {} completed by worker {} after {} attempt(s)",
                            job.getId(), assignment.workerId, job.getAttempts());
                    relay.deliver(job);
                    job.releaseProof();
                } else {
                    log.warn("Job {} failed on worker {}: {}", job.getId(), assignment.workerId, failure);
                    if (closed) {
                        failOnShutdown(job, failure);
                    } else if (retryCoordinator.onFailure(job, failure) == RetryCoordinator.Decision.REQUEUED) {
                        // other idle workers get the retry before the failing one is released
                        dispatchPending();
                    }
                }
            } else {
                log.debug("Discarding stale answer from {} for {} (attempt {})",
                        assignment.workerId, job, assignment.attempt);
            }
            releaseWorker(assignment);
        } finally {
            lock.unlock();
        }
    }

    private void onDeadline(Assignment assignment) {
        lock.lock();
        try {
            if (!assignment.isCurrent()) {
                return;
            }
            Job job = assignment.job;
            FailureCause cause = FailureCause.timeout(assignment.workerId, job.getDeadline().toMillis());
            log.warn("Job {} exceeded its deadline on worker {}", job.getId(), assignment.workerId);
            assignment.span.addEvent("deadline_exceeded");
            assignment.span.setStatus(StatusCode.ERROR, cause.getMessage());
            metrics.jobTimedOut();
            // the worker stays busy until its call returns
            registry.detachJob(assignment.workerId);
            if (closed) {
                failOnShutdown(job, cause);
                return;
            }
            retryCoordinator.onFailure(job, cause);
            dispatchPending();
        } finally {
            lock.unlock();
        }
        healthMonitor.probeNow(assignment.workerId);
    }

    private void endAttemptSpan(Assignment assignment, FailureCause failure) {
        Span span = assignment.span;
        if (!assignment.isCurrent()) {
            span.setAttribute("attempt.stale", true);
        }
        if (failure != null) {
            span.setAttribute("error.code", failure.getCode().name());
            span.setStatus(StatusCode.ERROR, failure.getMessage());
        }
        span.end();
    }

    private void failQueued() {
        for (Optional<Job> next = queue.dequeue(); next.isPresent(); next = queue.dequeue()) {
            failOnShutdown(next.get(), FailureCause.shutdown());
        }
    }

    private void failOnShutdown(Job job, FailureCause cause) {
        job.fail(ErrorCode.PROXY_SHUTDOWN, cause);
        metrics.jobFailed();
        log.warn("Job {} failed, proxy is shutting down", job.getId());
        relay.deliver(job);
    }

    private void releaseWorker(Assignment assignment) {
        Optional<Worker> worker = registry.find(assignment.workerId);
        if (worker.isEmpty()) {
            return;
        }
        WorkerStatus status = worker.get().getStatus();
        boolean occupiedByThisAttempt = worker.get().getLastAssignedSeq() == assignment.assignmentSeq
                && (status == WorkerStatus.BUSY || status == WorkerStatus.DRAINING);
        if (occupiedByThisAttempt) {
            registry.markIdle(assignment.workerId);
        }
    }

    private static final class Assignment {
        private final Job job;
        private final String workerId;
        private final URI workerAddress;
        private final long assignmentSeq;
        private final int attempt;
        private final Span span;
        private ScheduledFuture<?> deadlineTimer;

        private Assignment(Job job, String workerId, URI workerAddress, long assignmentSeq, int attempt,
                           Span span) {
            this.job = job;
            this.workerId = workerId;
            this.workerAddress = workerAddress;
            this.assignmentSeq = assignmentSeq;
            this.attempt = attempt;
            this.span = span;
        }

        private boolean isCurrent() {
            return job.getState() == JobState.DISPATCHED
                    && job.getAttempts() == attempt
                    && workerId.equals(job.getAssignedWorkerId());
        }
    }
}
