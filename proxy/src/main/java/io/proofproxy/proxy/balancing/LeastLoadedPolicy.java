package io.proofproxy.proxy.balancing;

import io.proofproxy.proxy.Worker;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prefers the worker that has been assigned the fewest jobs so far, ties by registration order.
 * With capacity one per worker, load is measured over the worker's lifetime rather than in flight.
 */
public class LeastLoadedPolicy implements LoadBalancingPolicy {

    @Override
    public List<Worker> order(List<Worker> idleWorkers) {
        return idleWorkers.stream()
                .sorted(Comparator.comparingLong(Worker::getAssignedJobs)
                        .thenComparingLong(Worker::getRegistrationOrder))
                .collect(Collectors.toList());
    }
}
