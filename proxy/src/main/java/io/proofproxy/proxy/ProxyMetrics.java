package io.proofproxy.proxy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.proofproxy.model.WorkerStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counters and gauges of the proxy, registered in a Micrometer {@link MeterRegistry}.
 */
public class ProxyMetrics {
    public static final String JOBS_SUBMITTED = "proxy.jobs.submitted";
    public static final String JOBS_COMPLETED = "proxy.jobs.completed";
    public static final String JOBS_FAILED = "proxy.jobs.failed";
    public static final String JOBS_RETRIED = "proxy.jobs.retried";
    public static final String JOBS_TIMED_OUT = "proxy.jobs.timed_out";
    public static final String QUEUE_REJECTED = "proxy.queue.rejected";
    public static final String RATE_LIMITED = "proxy.requests.rate_limited";
    public static final String WORKERS_UNHEALTHY = "proxy.workers.unhealthy_transitions";

    private final MeterRegistry registry;
    private final Counter submitted;
    private final Counter completed;
    private final Counter failed;
    private final Counter retried;
    private final Counter timedOut;
    private final Counter rejected;
    private final Counter rateLimited;
    private final Counter unhealthy;

    public ProxyMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.submitted = registry.counter(JOBS_SUBMITTED);
        this.completed = registry.counter(JOBS_COMPLETED);
        this.failed = registry.counter(JOBS_FAILED);
        this.retried = registry.counter(JOBS_RETRIED);
        this.timedOut = registry.counter(JOBS_TIMED_OUT);
        this.rejected = registry.counter(QUEUE_REJECTED);
        this.rateLimited = registry.counter(RATE_LIMITED);
        this.unhealthy = registry.counter(WORKERS_UNHEALTHY);
    }

    public void bindQueue(QueueManager queue) {
        Gauge.builder("proxy.queue.size", queue, QueueManager::size).register(registry);
    }

    public void bindWorkers(WorkerRegistry workers) {
        for (WorkerStatus status : WorkerStatus.values()) {
            Gauge.builder("proxy.workers", workers, w -> w.countByStatus().get(status))
                    .tag("status", status.name().toLowerCase())
                    .register(registry);
        }
    }

    public void jobSubmitted() {
        submitted.increment();
    }

    public void jobCompleted() {
        completed.increment();
    }

    public void jobFailed() {
        failed.increment();
    }

    public void jobRetried() {
        retried.increment();
    }

    public void jobTimedOut() {
        timedOut.increment();
    }

    public void jobRejected() {
        rejected.increment();
    }

    public void requestRateLimited() {
        rateLimited.increment();
    }

    public void workerUnhealthy() {
        unhealthy.increment();
    }

    public Map<String, Double> counters() {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Counter counter : List.of(submitted, completed, failed, retried, timedOut, rejected, rateLimited,
                unhealthy)) {
            values.put(counter.getId().getName(), counter.count());
        }
        return values;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
