package io.proofproxy.proxy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.proofproxy.config.ProxyConfig;
import io.proofproxy.model.ErrorCode;
import io.proofproxy.model.ProofRequest;
import io.proofproxy.model.ProofResult;
import io.proofproxy.model.WorkerStatus;
import io.proofproxy.proxy.exception.AdmissionRejectedException;
import io.proofproxy.proxy.exception.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DispatcherTest {
    private static final URI W1 = URI.create("http://localhost:9001");
    private static final URI W2 = URI.create("http://localhost:9002");

    private final FakeWorkerClient client = new FakeWorkerClient();
    private ProofProxy proxy;

    @AfterEach
    void tearDown() {
        client.releaseAll();
        if (proxy != null) {
            proxy.close();
        }
    }

    @Test
    void submit_TwoIdleWorkers_BothJobsDispatchedImmediately() throws Exception {
        // given
        proxy = newProxy(ProxyConfig.builder().queueCapacity(2).build());
        CountDownLatch gate1 = client.blockOn(W1);
        CountDownLatch gate2 = client.blockOn(W2);
        proxy.registerWorker("w1", W1);
        proxy.registerWorker("w2", W2);

        // when
        PendingResult first = proxy.submit(request(1));
        PendingResult second = proxy.submit(request(2));

        // then
        assertThat(proxy.getQueue().size()).isZero();
        assertThat(proxy.getRegistry().countByStatus()).containsEntry(WorkerStatus.BUSY, 2);

        gate1.countDown();
        gate2.countDown();
        assertThat(first.await(5, TimeUnit.SECONDS).isSuccess()).isTrue();
        assertThat(second.await(5, TimeUnit.SECONDS).isSuccess()).isTrue();
    }

    @Test
    void submit_OneWorkerQueueOfOne_ThirdJobRejected() throws Exception {
        // given
        proxy = newProxy(ProxyConfig.builder().queueCapacity(1).build());
        CountDownLatch gate = client.blockOn(W1);
        proxy.registerWorker("w1", W1);

        // when
        PendingResult first = proxy.submit(request(1));
        PendingResult second = proxy.submit(request(2));

        // then
        assertThat(proxy.getQueue().size()).isEqualTo(1);
        assertThatThrownBy(() -> proxy.submit(request(3)))
                .isInstanceOf(AdmissionRejectedException.class)
                .hasMessage("Too many requests in the queue (capacity 1)");
        assertThat(proxy.getMetrics().counters()).containsEntry(ProxyMetrics.QUEUE_REJECTED, 1.0);

        gate.countDown();
        assertThat(first.await(5, TimeUnit.SECONDS).isSuccess()).isTrue();
        assertThat(second.await(5, TimeUnit.SECONDS).isSuccess()).isTrue();
        assertThat(client.calls()).hasSize(2);
    }

    @Test
    void submit_WorkerFailsEveryJob_RetryExhaustedAfterMaxRetriesPlusOneAttempts() throws Exception {
        // given
        proxy = newProxy(ProxyConfig.builder().maxRetries(2).build());
        client.failEveryJob(W1);
        proxy.registerWorker("w1", W1);

        // when
        ProofResult result = proxy.submit(request(1)).await(5, TimeUnit.SECONDS);

        // then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.RETRY_EXHAUSTED);
        assertThat(result.getRetryCount()).isEqualTo(2);
        assertThat(result.getErrorMessage()).contains("constraint system unsatisfied");
        assertThat(client.calls()).containsExactly("localhost:9001", "localhost:9001", "localhost:9001");
        assertThat(proxy.getMetrics().counters())
                .containsEntry(ProxyMetrics.JOBS_RETRIED, 2.0)
                .containsEntry(ProxyMetrics.JOBS_FAILED, 1.0);
    }

    @Test
    void submit_TransportFailure_RetriedOnAnotherIdleWorker() throws Exception {
        // given
        proxy = newProxy(ProxyConfig.builder().maxRetries(1).build());
        client.on(W1, request -> {
            throw new TransportException("Connection refused", null);
        });
        proxy.registerWorker("w1", W1);
        proxy.registerWorker("w2", W2);

        // when
        ProofResult result = proxy.submit(new ProofRequest(UUID.randomUUID(), new byte[]{1, 2, 3}))
                .await(5, TimeUnit.SECONDS);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getProof()).isEqualTo(new byte[]{3, 2, 1});
        assertThat(client.calls()).containsExactly("localhost:9001", "localhost:9002");
    }

    @Test
    void submit_WorkerMissesDeadline_JobRetriedElsewhereAndWorkerKeptBusyUntilItAnswers() throws Exception {
        // given
        proxy = newProxy(ProxyConfig.builder().jobDeadlineMs(300).build());
        CountDownLatch slow = client.blockOn(W1);
        proxy.registerWorker("w1", W1);
        proxy.registerWorker("w2", W2);

        // when
        ProofResult result = proxy.submit(request(1)).await(5, TimeUnit.SECONDS);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(client.calls()).containsExactly("localhost:9001", "localhost:9002");
        assertThat(proxy.getMetrics().counters()).containsEntry(ProxyMetrics.JOBS_TIMED_OUT, 1.0);
        assertThat(proxy.getRegistry().get("w1").getStatus()).isEqualTo(WorkerStatus.BUSY);
        assertThat(proxy.getRegistry().get("w1").getCurrentJob()).isNull();

        slow.countDown();
        awaitTrue(() -> proxy.getRegistry().get("w1").isIdle(), "slow worker released");
        assertThat(proxy.getMetrics().counters()).containsEntry(ProxyMetrics.JOBS_COMPLETED, 1.0);
    }

    @Test
    void submit_SameJobIdInFlight_ThrowsException() {
        proxy = newProxy(ProxyConfig.defaults());
        client.blockOn(W1);
        proxy.registerWorker("w1", W1);
        UUID jobId = UUID.randomUUID();
        proxy.submit(new ProofRequest(jobId, new byte[]{1}));

        assertThatThrownBy(() -> proxy.submit(new ProofRequest(jobId, new byte[]{1})))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void submit_NoJobId_GeneratesOne() throws Exception {
        proxy = newProxy(ProxyConfig.defaults());
        proxy.registerWorker("w1", W1);

        PendingResult pending = proxy.submit(new ProofRequest(null, new byte[]{1}));

        assertThat(pending.getJobId()).isNotNull();
        assertThat(pending.await(5, TimeUnit.SECONDS).getJobId()).isEqualTo(pending.getJobId());
    }

    @Test
    void registerWorker_JobsQueued_NewWorkerTakesQueueHead() throws Exception {
        // given
        proxy = newProxy(ProxyConfig.defaults());
        PendingResult queued = proxy.submit(request(1));
        assertThat(proxy.getQueue().size()).isEqualTo(1);

        // when
        proxy.registerWorker("w1", W1);

        // then
        assertThat(queued.await(5, TimeUnit.SECONDS).isSuccess()).isTrue();
        assertThat(proxy.getQueue().size()).isZero();
    }

    @Test
    void deregisterWorker_BusyWorker_FinishesJobThenRemoved() throws Exception {
        // given
        proxy = newProxy(ProxyConfig.defaults());
        CountDownLatch gate = client.blockOn(W1);
        proxy.registerWorker("w1", W1);
        PendingResult pending = proxy.submit(request(1));

        // when
        proxy.deregisterWorker("w1");

        // then
        assertThat(proxy.getRegistry().get("w1").getStatus()).isEqualTo(WorkerStatus.DRAINING);
        gate.countDown();
        assertThat(pending.await(5, TimeUnit.SECONDS).isSuccess()).isTrue();
        awaitTrue(() -> proxy.getRegistry().find("w1").isEmpty(), "drained worker removed");
    }

    @Test
    void submit_TwoJobsMissDeadlinesInTurn_RetriesKeepArrivalOrderAheadOfFreshJob() throws Exception {
        // given
        proxy = newProxy(ProxyConfig.builder().jobDeadlineMs(300).queueCapacity(5).build());
        client.blockOn(W1);
        client.blockOn(W2);
        proxy.registerWorker("w1", W1);
        proxy.registerWorker("w2", W2);

        // when
        PendingResult first = proxy.submit(request(1));
        Thread.sleep(50);
        PendingResult second = proxy.submit(request(2));
        PendingResult fresh = proxy.submit(request(3));
        awaitTrue(() -> proxy.getMetrics().counters().get(ProxyMetrics.JOBS_TIMED_OUT) == 2.0,
                "both dispatched jobs timed out");

        // then
        List<Job> queued = proxy.getQueue().snapshot();
        assertThat(queued).extracting(Job::getId)
                .containsExactly(first.getJobId(), second.getJobId(), fresh.getJobId());
        assertThat(queued).extracting(Job::getRetryCount).containsExactly(1, 1, 0);
    }

    @Test
    void submit_ClientAbandonsJob_WorkerStillReleasedAndTakesNextJob() throws Exception {
        // given
        proxy = newProxy(ProxyConfig.defaults());
        CountDownLatch gate = client.blockOn(W1);
        proxy.registerWorker("w1", W1);
        PendingResult abandoned = proxy.submit(request(1));
        PendingResult next = proxy.submit(request(2));
        assertThat(proxy.getQueue().size()).isEqualTo(1);

        // when
        proxy.getRelay().abandon(abandoned.getJobId());
        gate.countDown();

        // then
        assertThat(next.await(5, TimeUnit.SECONDS).isSuccess()).isTrue();
        awaitTrue(() -> proxy.getRegistry().get("w1").isIdle(), "worker back to idle");
        assertThat(abandoned.isAbandoned()).isTrue();
        assertThat(client.calls()).containsExactly("localhost:9001", "localhost:9001");
        assertThat(proxy.getMetrics().counters()).containsEntry(ProxyMetrics.JOBS_COMPLETED, 2.0);
    }

    @Test
    void shutdown_JobQueued_QueuedJobFailsOnceAndRunningJobStillCompletes() throws Exception {
        // given
        proxy = newProxy(ProxyConfig.builder().maxRetries(3).build());
        CountDownLatch gate = client.blockOn(W1);
        proxy.registerWorker("w1", W1);
        PendingResult running = proxy.submit(request(1));
        PendingResult queued = proxy.submit(request(2));

        // when
        proxy.getDispatcher().shutdown();

        // then
        ProofResult failed = queued.await(5, TimeUnit.SECONDS);
        assertThat(failed.getErrorCode()).isEqualTo(ErrorCode.PROXY_SHUTDOWN);
        assertThat(failed.getRetryCount()).isZero();
        assertThat(proxy.getQueue().size()).isZero();

        gate.countDown();
        assertThat(running.await(5, TimeUnit.SECONDS).isSuccess()).isTrue();
        awaitTrue(() -> proxy.getRegistry().get("w1").isIdle(), "worker released");
        assertThat(client.calls()).containsExactly("localhost:9001");
    }

    @Test
    void shutdown_AttemptFailsAfterwards_JobNotRetried() throws Exception {
        // given
        proxy = newProxy(ProxyConfig.builder().maxRetries(3).build());
        CountDownLatch gate = new CountDownLatch(1);
        client.on(W1, request -> {
            try {
                gate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ProofResult.failure(request.getJobId(), "constraint system unsatisfied");
        });
        proxy.registerWorker("w1", W1);
        proxy.registerWorker("w2", W2);
        PendingResult pending = proxy.submit(request(1));

        // when
        proxy.getDispatcher().shutdown();
        gate.countDown();

        // then
        ProofResult result = pending.await(5, TimeUnit.SECONDS);
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.PROXY_SHUTDOWN);
        assertThat(result.getErrorMessage()).contains("constraint system unsatisfied");
        assertThat(client.calls()).containsExactly("localhost:9001");
        assertThat(proxy.getMetrics().counters()).containsEntry(ProxyMetrics.JOBS_RETRIED, 0.0);
    }

    @Test
    void submit_ExecutorShutDown_JobFailsOnceWithoutBurningRetries() throws Exception {
        // given
        proxy = newProxy(ProxyConfig.builder().maxRetries(3).build());
        proxy.registerWorker("w1", W1);
        proxy.getJobExecutor().shutdown();

        // when
        ProofResult result = proxy.submit(request(1)).await(5, TimeUnit.SECONDS);

        // then
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.PROXY_SHUTDOWN);
        assertThat(result.getRetryCount()).isZero();
        assertThat(client.calls()).isEmpty();
        assertThat(proxy.getRegistry().get("w1").isIdle()).isTrue();
        assertThat(proxy.getMetrics().counters())
                .containsEntry(ProxyMetrics.JOBS_RETRIED, 0.0)
                .containsEntry(ProxyMetrics.JOBS_FAILED, 1.0);
        assertThat(proxy.getDispatcher().isShutdown()).isTrue();
    }

    @Test
    void close_JobQueued_FailsWithProxyShutdownAndLaterSubmitRejected() throws Exception {
        // given
        proxy = newProxy(ProxyConfig.defaults());
        PendingResult queued = proxy.submit(request(1));

        // when
        proxy.close();

        // then
        assertThat(queued.await(5, TimeUnit.SECONDS).getErrorCode()).isEqualTo(ErrorCode.PROXY_SHUTDOWN);
        assertThatThrownBy(() -> proxy.submit(request(2)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Proxy is shut down");
    }

    private ProofProxy newProxy(ProxyConfig config) {
        return new ProofProxy(config, client, new SimpleMeterRegistry(), Clock.systemUTC());
    }

    private static ProofRequest request(int payload) {
        return new ProofRequest(UUID.randomUUID(), new byte[]{(byte) payload});
    }

    static void awaitTrue(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Timed out waiting for: " + description);
            }
            Thread.sleep(10);
        }
    }
}
