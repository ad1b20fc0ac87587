package io.proofproxy.proxy;

import io.proofproxy.model.ProofResult;
import lombok.Getter;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The waiting client's side of a job: completed exactly once by {@link ResultRelay}.
 */
public class PendingResult {
    @Getter
    private final UUID jobId;
    private final CompletableFuture<ProofResult> future = new CompletableFuture<>();
    private final AtomicBoolean abandoned = new AtomicBoolean();

    PendingResult(UUID jobId) {
        this.jobId = jobId;
    }

    public ProofResult await() throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Result future for job " + jobId + " failed", e.getCause());
        }
    }

    public ProofResult await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            return future.get(timeout, unit);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Result future for job " + jobId + " failed", e.getCause());
        }
    }

    public boolean isDone() {
        return future.isDone();
    }

    public boolean isAbandoned() {
        return abandoned.get();
    }

    boolean complete(ProofResult result) {
        if (abandoned.get()) {
            return false;
        }
        return future.complete(result);
    }

    void abandon() {
        abandoned.set(true);
        future.cancel(false);
    }
}
