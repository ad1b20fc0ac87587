package io.proofproxy.proxy;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.proofproxy.config.ProxyConfig;
import io.proofproxy.model.ProofRequest;
import io.proofproxy.model.ProxyStatus;
import io.proofproxy.model.WorkerInfo;
import io.proofproxy.proxy.balancing.LoadBalancingPolicy;
import io.proofproxy.proxy.transport.WorkerClient;
import io.proofproxy.telemetry.TracingSetup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Assembles the dispatch components around one scheduling lock and owns their threads.
 */
@Slf4j
@Getter
public class ProofProxy implements AutoCloseable {
    private final ProxyConfig config;
    private final ProxyMetrics metrics;
    private final QueueManager queue;
    private final ResultRelay relay;
    private final RetryCoordinator retryCoordinator;
    private final WorkerRegistry registry;
    private final HealthMonitor healthMonitor;
    private final Dispatcher dispatcher;
    private final ExecutorService jobExecutor;
    private final ExecutorService probeExecutor;
    private final ScheduledExecutorService scheduler;

    public ProofProxy(ProxyConfig config, WorkerClient client, MeterRegistry meterRegistry, Clock clock) {
        this(config, client, meterRegistry, OpenTelemetry.noop(), clock);
    }

    public ProofProxy(ProxyConfig config, WorkerClient client, MeterRegistry meterRegistry,
                      OpenTelemetry openTelemetry, Clock clock) {
        this.config = config.validate();
        ReentrantLock lock = new ReentrantLock();
        this.metrics = new ProxyMetrics(meterRegistry);
        this.queue = new QueueManager(lock, config.getQueueCapacity());
        this.relay = new ResultRelay();
        this.retryCoordinator = new RetryCoordinator(lock, queue, relay, metrics, config.getMaxRetries());
        this.registry = new WorkerRegistry(lock, LoadBalancingPolicy.of(config.getLoadBalancing()),
                retryCoordinator, clock);

        this.jobExecutor = Executors.newCachedThreadPool();
        this.probeExecutor = Executors.newCachedThreadPool();
        this.scheduler = Executors.newScheduledThreadPool(2);

        Tracer tracer = openTelemetry.getTracer(TracingSetup.INSTRUMENTATION_NAME);
        this.healthMonitor = new HealthMonitor(lock, registry, client, config, scheduler, probeExecutor, metrics,
                tracer);
        this.dispatcher = new Dispatcher(lock, registry, queue, retryCoordinator, relay, client, healthMonitor,
                jobExecutor, scheduler, metrics, tracer, clock, config.getJobDeadline());
        registry.addListener(dispatcher);
        metrics.bindQueue(queue);
        metrics.bindWorkers(registry);
    }

    /**
     * Registers the configured workers and starts health monitoring.
     */
    public void start() {
        for (String address : config.getWorkers()) {
            URI uri = toWorkerUri(address);
            registerWorker(workerIdOf(uri), uri);
        }
        healthMonitor.start();
        log.info("Proof proxy started with {} worker(s), queue capacity {}, max retries {}, {} balancing",
                registry.size(), queue.capacity(), config.getMaxRetries(), config.getLoadBalancing().configValue());
    }

    public PendingResult submit(ProofRequest request) {
        return dispatcher.submit(request);
    }

    public Worker registerWorker(String workerId, URI address) {
        return registry.register(workerId, address);
    }

    public void deregisterWorker(String workerId) {
        registry.deregister(workerId);
    }

    public List<WorkerInfo> workers() {
        return registry.snapshot();
    }

    public ProxyStatus status() {
        return new ProxyStatus(queue.size(), queue.capacity(), registry.countByStatus(), metrics.counters());
    }

    @Override
    public void close() {
        healthMonitor.stop();
        dispatcher.shutdown();
        scheduler.shutdownNow();
        probeExecutor.shutdownNow();
        jobExecutor.shutdown();
        try {
            if (!jobExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                jobExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            jobExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Proof proxy stopped");
    }

    /**
     * Accepts {@code host:port} or a full http(s) url.
     *
     * @throws IllegalArgumentException if the address has no host or port
     */
    public static URI toWorkerUri(String address) {
        String trimmed = address.trim();
        URI uri = URI.create(trimmed.contains("://") ? trimmed : "http://" + trimmed);
        if (uri.getHost() == null || uri.getPort() < 0) {
            throw new IllegalArgumentException("Worker address must be host:port, got: " + address);
        }
        return uri;
    }

    public static String workerIdOf(URI address) {
        return address.getHost() + ":" + address.getPort();
    }
}
