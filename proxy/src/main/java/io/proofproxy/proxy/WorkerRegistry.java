package io.proofproxy.proxy;

import io.proofproxy.model.WorkerInfo;
import io.proofproxy.model.WorkerStatus;
import io.proofproxy.proxy.balancing.LoadBalancingPolicy;
import io.proofproxy.proxy.exception.UnknownWorkerException;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Known workers and their status. Every status transition goes through here.
 *
 * <pre>
 * IDLE --markBusy--> BUSY --markIdle--> IDLE
 *  any --markUnhealthy--> UNHEALTHY --markIdle (successful probe)--> IDLE
 * BUSY --deregister--> DRAINING --markIdle--> removed
 * </pre>
 */
@Slf4j
public class WorkerRegistry {
    private final ReentrantLock lock;
    private final LoadBalancingPolicy policy;
    private final RetryCoordinator retryCoordinator;
    private final Clock clock;
    private final Map<String, Worker> workers = new LinkedHashMap<>();
    private final List<WorkerEventListener> listeners = new CopyOnWriteArrayList<>();
    private long registrationSeq;
    private long assignmentSeq;

    public WorkerRegistry(ReentrantLock lock, LoadBalancingPolicy policy, RetryCoordinator retryCoordinator,
                          Clock clock) {
        this.lock = lock;
        this.policy = policy;
        this.retryCoordinator = retryCoordinator;
        this.clock = clock;
    }

    public void addListener(WorkerEventListener listener) {
        listeners.add(listener);
    }

    /**
     * Adds an idle worker.
     *
     * @throws IllegalArgumentException if the id is already registered
     */
    public Worker register(String id, URI address) {
        lock.lock();
        try {
            if (workers.containsKey(id)) {
                throw new IllegalArgumentException("Worker " + id + " is already registered");
            }
            Worker worker = new Worker(id, address, ++registrationSeq, clock.instant());
            workers.put(id, worker);
            log.info("Worker registered: {} at {}", id, address);
            fireIdle(worker);
            return worker;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a worker. A busy worker is drained: it keeps its job and is removed once the job ends.
     */
    public void deregister(String id) {
        lock.lock();
        try {
            Worker worker = get(id);
            if (worker.getStatus() == WorkerStatus.BUSY) {
                worker.setStatus(WorkerStatus.DRAINING);
                log.info("Worker {} draining, will be removed after its current job", id);
                return;
            }
            if (worker.getStatus() == WorkerStatus.DRAINING) {
                return;
            }
            workers.remove(id);
            log.info("Worker deregistered: {}", id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return idle workers, most preferred first according to the load-balancing policy
     */
    public List<Worker> listIdle() {
        lock.lock();
        try {
            List<Worker> idle = workers.values().stream()
                    .filter(Worker::isIdle)
                    .collect(Collectors.toList());
            return idle.isEmpty() ? idle : policy.order(idle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands a job to an idle worker.
     *
     * @throws UnknownWorkerException if the id is not registered
     * @throws IllegalStateException if the worker is not idle
     */
    public Worker markBusy(String id, Job job) {
        lock.lock();
        try {
            Worker worker = get(id);
            if (!worker.isIdle()) {
                throw new IllegalStateException("Worker " + id + " is " + worker.getStatus() + ", cannot take " + job);
            }
            worker.assign(job, ++assignmentSeq);
            policy.selected(worker);
            return worker;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a worker to the idle pool: after its job ended, or after recovering from UNHEALTHY.
     * A draining worker is removed instead.
     */
    public void markIdle(String id) {
        lock.lock();
        try {
            Worker worker = get(id);
            switch (worker.getStatus()) {
                case IDLE:
                    return;
                case DRAINING:
                    worker.release(WorkerStatus.DRAINING);
                    workers.remove(id);
                    log.info("Worker {} drained and removed", id);
                    return;
                default:
                    worker.release(WorkerStatus.IDLE);
                    log.debug("Worker {} is idle", id);
                    fireIdle(worker);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes a worker out of the idle pool. A job it holds is evicted and handed to the retry coordinator.
     */
    public void markUnhealthy(String id) {
        lock.lock();
        try {
            Worker worker = get(id);
            if (worker.getStatus() == WorkerStatus.UNHEALTHY) {
                return;
            }
            boolean draining = worker.getStatus() == WorkerStatus.DRAINING;
            Job evicted = worker.release(WorkerStatus.UNHEALTHY);
            log.warn("Worker {} marked unhealthy after {} failed probes", id, worker.getConsecutiveFailures());
            if (draining) {
                workers.remove(id);
                log.info("Draining worker {} removed", id);
            }
            if (evicted != null) {
                log.warn("Evicting {} from unhealthy worker {}", evicted, id);
                RetryCoordinator.Decision decision =
                        retryCoordinator.onFailure(evicted, FailureCause.workerUnhealthy(id));
                for (WorkerEventListener listener : listeners) {
                    listener.onJobEvicted(evicted, decision);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets the job a worker holds while the worker stays busy, used when a job's deadline passes but the
     * worker is still computing it.
     */
    public void detachJob(String id) {
        lock.lock();
        try {
            Worker worker = get(id);
            WorkerStatus status = worker.getStatus();
            worker.release(status);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return consecutive failed probes including this one
     */
    public int recordProbeFailure(String id) {
        lock.lock();
        try {
            return get(id).recordProbeFailure();
        } finally {
            lock.unlock();
        }
    }

    public void recordProbeSuccess(String id) {
        lock.lock();
        try {
            get(id).recordProbeSuccess(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Worker> find(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(workers.get(id));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws UnknownWorkerException if the id is not registered
     */
    public Worker get(String id) {
        lock.lock();
        try {
            Worker worker = workers.get(id);
            if (worker == null) {
                throw new UnknownWorkerException(id);
            }
            return worker;
        } finally {
            lock.unlock();
        }
    }

    public List<Worker> all() {
        lock.lock();
        try {
            return new ArrayList<>(workers.values());
        } finally {
            lock.unlock();
        }
    }

    public List<WorkerInfo> snapshot() {
        lock.lock();
        try {
            return List.copyOf(workers.values().stream().map(Worker::toInfo).collect(Collectors.toList()));
        } finally {
            lock.unlock();
        }
    }

    public Map<WorkerStatus, Integer> countByStatus() {
        lock.lock();
        try {
            Map<WorkerStatus, Integer> counts = new EnumMap<>(WorkerStatus.class);
            for (WorkerStatus status : WorkerStatus.values()) {
                counts.put(status, 0);
            }
            workers.values().forEach(w -> counts.merge(w.getStatus(), 1, Integer::sum));
            return counts;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return workers.size();
        } finally {
            lock.unlock();
        }
    }

    private void fireIdle(Worker worker) {
        for (WorkerEventListener listener : listeners) {
            listener.onWorkerIdle(worker);
        }
    }
}
