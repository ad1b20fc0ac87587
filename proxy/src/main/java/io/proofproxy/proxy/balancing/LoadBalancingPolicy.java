package io.proofproxy.proxy.balancing;

import io.proofproxy.config.LoadBalancingStrategy;
import io.proofproxy.proxy.Worker;

import java.util.List;

/**
 * Orders idle workers by preference. Implementations must be deterministic: the same registry state and
 * the same history of selections always give the same order.
 *
 * <p>Called under the scheduling lock only.</p>
 */
public interface LoadBalancingPolicy {

    /**
     * @param idleWorkers idle workers in registration order
     * @return the same workers, most preferred first
     */
    List<Worker> order(List<Worker> idleWorkers);

    /**
     * Notified after a worker has been handed a job.
     */
    default void selected(Worker worker) {
    }

    static LoadBalancingPolicy of(LoadBalancingStrategy strategy) {
        switch (strategy) {
            case ROUND_ROBIN:
                return new RoundRobinPolicy();
            case LEAST_RECENTLY_USED:
                return new LeastRecentlyUsedPolicy();
            case LEAST_LOADED:
                return new LeastLoadedPolicy();
            default:
                throw new IllegalArgumentException("Unsupported strategy: " + strategy);
        }
    }
}
