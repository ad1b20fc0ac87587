package io.proofproxy.proxy;

import io.proofproxy.model.JobState;
import io.proofproxy.proxy.exception.AdmissionRejectedException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of jobs waiting for a worker.
 *
 * <p>A full queue rejects new work with {@link AdmissionRejectedException} instead of buffering it.
 * Retried jobs are kept ahead of fresh ones, the most retried first and by arrival among equals. Fresh
 * jobs go to the tail.</p>
 */
@Slf4j
public class QueueManager {
    private final ReentrantLock lock;
    private final int capacity;
    private final LinkedList<Job> queue = new LinkedList<>();

    public QueueManager(ReentrantLock lock, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.lock = lock;
        this.capacity = capacity;
    }

    /**
     * Appends a fresh job.
     *
     * @throws AdmissionRejectedException if the queue is at capacity
     */
    public void enqueue(Job job) {
        lock.lock();
        try {
            admit(job);
            queue.addLast(job);
            log.debug("Queued {} ({}/{})", job, queue.size(), capacity);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts a retried job ahead of every fresh job. It goes behind queued jobs with a higher retry count,
     * and behind those with the same retry count that arrived no later than it did.
     *
     * @throws AdmissionRejectedException if the queue is at capacity
     */
    public void requeueFront(Job job) {
        lock.lock();
        try {
            admit(job);
            ListIterator<Job> it = queue.listIterator();
            int position = 0;
            while (it.hasNext()) {
                if (!runsBefore(it.next(), job)) {
                    it.previous();
                    break;
                }
                position++;
            }
            it.add(job);
            log.debug("Requeued {} at position {} ({}/{})", job, position, queue.size(), capacity);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Job> dequeue() {
        lock.lock();
        try {
            return Optional.ofNullable(queue.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public List<Job> snapshot() {
        lock.lock();
        try {
            return List.copyOf(new ArrayList<>(queue));
        } finally {
            lock.unlock();
        }
    }

    private static boolean runsBefore(Job queued, Job retried) {
        if (queued.getRetryCount() != retried.getRetryCount()) {
            return queued.getRetryCount() > retried.getRetryCount();
        }
        return !queued.getArrivedAt().isAfter(retried.getArrivedAt());
    }

    private void admit(Job job) {
        if (job.getState() != JobState.QUEUED) {
            throw new IllegalStateException("Only queued jobs can enter the queue: " + job);
        }
        if (queue.size() >= capacity) {
            throw new AdmissionRejectedException(job.getId(), job.getRetryCount(), capacity);
        }
    }
}
