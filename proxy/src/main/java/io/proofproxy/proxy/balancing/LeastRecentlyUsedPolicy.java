package io.proofproxy.proxy.balancing;

import io.proofproxy.proxy.Worker;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prefers the worker whose last assignment is oldest; never-used workers first, ties by registration order.
 */
public class LeastRecentlyUsedPolicy implements LoadBalancingPolicy {

    @Override
    public List<Worker> order(List<Worker> idleWorkers) {
        return idleWorkers.stream()
                .sorted(Comparator.comparingLong(Worker::getLastAssignedSeq)
                        .thenComparingLong(Worker::getRegistrationOrder))
                .collect(Collectors.toList());
    }
}
