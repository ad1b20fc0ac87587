package io.proofproxy.proxy;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.proofproxy.config.ProxyConfig;
import io.proofproxy.model.WorkerStatus;
import io.proofproxy.proxy.exception.TransportException;
import io.proofproxy.proxy.transport.WorkerClient;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Probes every worker on a fixed interval.
 *
 * <p>{@code failure_threshold} consecutive failed probes make a worker UNHEALTHY (evicting its job); one
 * successful probe resets the counter and brings an UNHEALTHY worker back to IDLE. A worker with a probe
 * already in flight is skipped. Probes run on their own pool, outside the scheduling lock.</p>
 */
@Slf4j
public class HealthMonitor {
    private final ReentrantLock lock;
    private final WorkerRegistry registry;
    private final WorkerClient client;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService probeExecutor;
    private final ProxyMetrics metrics;
    private final Tracer tracer;
    private final Duration interval;
    private final Duration probeTimeout;
    private final int failureThreshold;
    private final int removeAfterFailedProbes;
    private final Set<String> probesInFlight = ConcurrentHashMap.newKeySet();
    private ScheduledFuture<?> cycle;

    public HealthMonitor(ReentrantLock lock, WorkerRegistry registry, WorkerClient client, ProxyConfig config,
                         ScheduledExecutorService scheduler, ExecutorService probeExecutor, ProxyMetrics metrics,
                         Tracer tracer) {
        this.lock = lock;
        this.registry = registry;
        this.client = client;
        this.scheduler = scheduler;
        this.probeExecutor = probeExecutor;
        this.metrics = metrics;
        this.tracer = tracer;
        this.interval = config.getHealthCheckInterval();
        this.probeTimeout = config.getProbeTimeout();
        this.failureThreshold = config.getFailureThreshold();
        this.removeAfterFailedProbes = config.getRemoveAfterFailedProbes();
    }

    public synchronized void start() {
        if (cycle != null) {
            return;
        }
        long periodMs = interval.toMillis();
        cycle = scheduler.scheduleAtFixedRate(this::runScheduledCycle, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Health monitor started, probing every {} ms", periodMs);
    }

    public synchronized void stop() {
        if (cycle != null) {
            cycle.cancel(false);
            cycle = null;
        }
    }

    /**
     * Probes all registered workers and returns once every probe has been applied.
     */
    public void runProbeCycle() {
        List<CompletableFuture<Void>> probes = new ArrayList<>();
        for (Worker worker : registry.all()) {
            probes.add(probeAsync(worker.getId(), worker.getAddress()));
        }
        CompletableFuture.allOf(probes.toArray(new CompletableFuture[0])).join();
    }

    /**
     * Out-of-cycle probe, used when a job on this worker missed its deadline.
     */
    public CompletableFuture<Void> probeNow(String workerId) {
        Optional<Worker> worker = registry.find(workerId);
        if (worker.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return probeAsync(workerId, worker.get().getAddress());
    }

    private void runScheduledCycle() {
        try {
            runProbeCycle();
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            log.error("Health check cycle failed", e);
        }
    }

    private CompletableFuture<Void> probeAsync(String workerId, URI address) {
        if (!probesInFlight.add(workerId)) {
            log.debug("Probe of {} already in flight, skipping", workerId);
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> probe(workerId, address), probeExecutor)
                .whenComplete((ignored, error) -> {
                    probesInFlight.remove(workerId);
                    if (error != null) {
                        log.error("Probe of {} failed unexpectedly", workerId, error);
                    }
                });
    }

    private void probe(String workerId, URI address) {
        Span span = tracer.spanBuilder("proxy.health_check")
                .setAttribute("worker.id", workerId)
                .startSpan();
        try {
            boolean healthy;
            try {
                client.probe(address, probeTimeout);
                healthy = true;
            } catch (TransportException e) {
                log.debug("Probe of {} failed: {}", workerId, e.getMessage());
                span.setStatus(StatusCode.ERROR, e.getMessage());
                healthy = false;
            }
            span.setAttribute("worker.healthy", healthy);
            applyProbeResult(workerId, healthy);
        } finally {
            span.end();
        }
    }

    void applyProbeResult(String workerId, boolean healthy) {
        lock.lock();
        try {
            Optional<Worker> found = registry.find(workerId);
            if (found.isEmpty()) {
                return;
            }
            Worker worker = found.get();
            if (healthy) {
                boolean recovering = worker.getStatus() == WorkerStatus.UNHEALTHY;
                registry.recordProbeSuccess(workerId);
                if (recovering) {
                    log.info("Worker {} recovered", workerId);
                    registry.markIdle(workerId);
                }
                return;
            }

            int failures = registry.recordProbeFailure(workerId);
            log.warn("Worker {} failed health check ({}/{})", workerId, failures, failureThreshold);
            if (failures >= failureThreshold && worker.getStatus() != WorkerStatus.UNHEALTHY) {
                metrics.workerUnhealthy();
                registry.markUnhealthy(workerId);
            }
            if (removeAfterFailedProbes > 0 && failures >= removeAfterFailedProbes
                    && registry.find(workerId).isPresent()) {
                log.warn("Removing worker {} after {} failed probes", workerId, failures);
                registry.deregister(workerId);
            }
        } finally {
            lock.unlock();
        }
    }
}
