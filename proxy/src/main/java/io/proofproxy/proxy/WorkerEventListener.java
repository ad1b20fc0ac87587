package io.proofproxy.proxy;

/**
 * Registry events the dispatcher reacts to. Fired while the scheduling lock is held.
 */
public interface WorkerEventListener {

    /**
     * A worker was registered, finished its job or recovered.
     */
    void onWorkerIdle(Worker worker);

    /**
     * A job was taken away from a worker that became unhealthy and has already been through
     * the {@link RetryCoordinator}.
     */
    void onJobEvicted(Job job, RetryCoordinator.Decision decision);
}
