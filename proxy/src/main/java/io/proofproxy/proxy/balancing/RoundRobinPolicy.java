package io.proofproxy.proxy.balancing;

import io.proofproxy.proxy.Worker;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks the workers in registration order, starting after the one selected last.
 */
public class RoundRobinPolicy implements LoadBalancingPolicy {
    private long lastSelectedOrder = -1;

    @Override
    public List<Worker> order(List<Worker> idleWorkers) {
        int start = 0;
        while (start < idleWorkers.size() && idleWorkers.get(start).getRegistrationOrder() <= lastSelectedOrder) {
            start++;
        }
        List<Worker> ordered = new ArrayList<>(idleWorkers.size());
        ordered.addAll(idleWorkers.subList(start, idleWorkers.size()));
        ordered.addAll(idleWorkers.subList(0, start));
        return ordered;
    }

    @Override
    public void selected(Worker worker) {
        lastSelectedOrder = worker.getRegistrationOrder();
    }
}
