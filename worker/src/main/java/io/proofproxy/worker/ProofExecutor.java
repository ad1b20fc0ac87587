package io.proofproxy.worker;

import lombok.extern.slf4j.Slf4j;
import io.proofproxy.model.ProofRequest;
import io.proofproxy.model.ProofResult;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one proof at a time. A second request while a proof is running is refused, not queued:
 * queuing is the proxy's job.
 */
@Slf4j
public class ProofExecutor {
    private final ProofGenerator generator;
    private final AtomicReference<UUID> activeJob = new AtomicReference<>();

    public ProofExecutor(ProofGenerator generator) {
        this.generator = generator;
    }

    /**
     * Executes the job on the calling thread.
     *
     * @return the result, or empty if another job is already running
     */
    public Optional<ProofResult> tryExecute(ProofRequest request) {
        if (!activeJob.compareAndSet(null, request.getJobId())) {
            log.warn("Refusing job {}: job {} is still running", request.getJobId(), activeJob.get());
            return Optional.empty();
        }
        try {
            return Optional.of(execute(request));
        } finally {
            activeJob.set(null);
        }
    }

    public Optional<UUID> getActiveJob() {
        return Optional.ofNullable(activeJob.get());
    }

    private ProofResult execute(ProofRequest request) {
        long started = System.nanoTime();
        log.info("Proving job {}", request.getJobId());
        try {
            byte[] proof = generator.prove(request.getPayload());
            if (proof == null) {
                return ProofResult.failure(request.getJobId(), "Proof generator returned no proof");
            }
            log.info("Job {} proved in {} ms, proof size {} bytes",
                    request.getJobId(), (System.nanoTime() - started) / 1_000_000, proof.length);
            return ProofResult.success(request.getJobId(), proof);
        } catch (Exception e) {
            log.error("Proof generation failed for job {}", request.getJobId(), e);
            return ProofResult.failure(request.getJobId(), "Proof generation failed: " + e.getMessage());
        }
    }
}
