package io.proofproxy.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.proofproxy.common.JacksonConfig;
import io.proofproxy.common.ProxyClient;
import io.proofproxy.config.ProxyConfig;
import io.proofproxy.model.ProofRequest;
import io.proofproxy.model.ProofResult;
import io.proofproxy.proxy.ProofProxy;
import io.proofproxy.proxy.transport.HttpWorkerClient;
import io.proofproxy.worker.WorkerServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ProxyServerTest {

    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
    private final HttpClient httpClient = HttpClient.newHttpClient();
    private WorkerServer worker;
    private ProofProxy proxy;
    private ProxyServer server;

    @BeforeEach
    void setUp() throws Exception {
        worker = new WorkerServer("test-worker", new InetSocketAddress("127.0.0.1", 0), payload -> {
            byte[] proof = new byte[payload.length + 1];
            System.arraycopy(payload, 0, proof, 1, payload.length);
            proof[0] = (byte) 0xAB;
            return proof;
        });
        worker.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (proxy != null) {
            proxy.close();
        }
        worker.stop();
    }

    @Test
    void submit_IdleWorker_Returns200WithProof() throws Exception {
        // given
        startProxy(ProxyConfig.defaults(), RateLimiter.unlimited());
        proxy.registerWorker("w1", workerUri());
        UUID jobId = UUID.randomUUID();

        // when
        HttpResponse<String> response = post("/api/proofs", new ProofRequest(jobId, new byte[]{1, 2}));

        // then
        assertThat(response.statusCode()).isEqualTo(200);
        ProofResult result = objectMapper.readValue(response.body(), ProofResult.class);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getJobId()).isEqualTo(jobId);
        assertThat(result.getProof()).isEqualTo(new byte[]{(byte) 0xAB, 1, 2});
    }

    @Test
    void submit_QueueFull_Returns503() throws Exception {
        // given
        startProxy(ProxyConfig.builder().queueCapacity(1).build(), RateLimiter.unlimited());
        CompletableFuture<HttpResponse<String>> queued = postAsync("/api/proofs",
                new ProofRequest(UUID.randomUUID(), new byte[]{1}));
        awaitQueueSize(1);

        // when
        HttpResponse<String> rejected = post("/api/proofs", new ProofRequest(UUID.randomUUID(), new byte[]{2}));

        // then
        assertThat(rejected.statusCode()).isEqualTo(503);
        JsonNode error = objectMapper.readTree(rejected.body());
        assertThat(error.get("error").asText()).isEqualTo("ADMISSION_REJECTED");
        assertThat(error.get("message").asText()).isEqualTo("Too many requests in the queue (capacity 1)");

        proxy.registerWorker("w1", workerUri());
        assertThat(queued.get(5, TimeUnit.SECONDS).statusCode()).isEqualTo(200);
    }

    @Test
    void submit_OverRateLimit_Returns429() throws Exception {
        // given
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        startProxy(ProxyConfig.defaults(), new FixedWindowRateLimiter(1, clock));
        proxy.registerWorker("w1", workerUri());
        post("/api/proofs", new ProofRequest(UUID.randomUUID(), new byte[]{1}));

        // when
        HttpResponse<String> response = post("/api/proofs", new ProofRequest(UUID.randomUUID(), new byte[]{1}));

        // then
        assertThat(response.statusCode()).isEqualTo(429);
        assertThat(response.headers().firstValue("X-Rate-Limit-Limit")).hasValue("1");
        assertThat(proxy.getMetrics().counters()).containsEntry("proxy.requests.rate_limited", 1.0);
    }

    @Test
    void submit_MalformedBody_Returns400() throws Exception {
        startProxy(ProxyConfig.defaults(), RateLimiter.unlimited());

        HttpResponse<String> response = send(HttpRequest.newBuilder(proxyUri("/api/proofs"))
                .POST(HttpRequest.BodyPublishers.ofString("{not json")).build());

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(objectMapper.readTree(response.body()).get("error").asText()).isEqualTo("INVALID_REQUEST");
    }

    @Test
    void submit_WrongMethod_Returns405() throws Exception {
        startProxy(ProxyConfig.defaults(), RateLimiter.unlimited());

        HttpResponse<String> response = send(HttpRequest.newBuilder(proxyUri("/api/proofs")).GET().build());

        assertThat(response.statusCode()).isEqualTo(405);
    }

    @Test
    void registerAndDeregister_ThroughProxyClient_WorkerCountUpdated() throws Exception {
        // given
        startProxy(ProxyConfig.defaults(), RateLimiter.unlimited());
        ProxyClient proxyClient = new ProxyClient(proxyUri("/"));

        // when
        boolean registered = proxyClient.registerWorker("w1", workerUri());

        // then
        assertThat(registered).isTrue();
        HttpResponse<String> workers = send(HttpRequest.newBuilder(proxyUri("/api/workers")).GET().build());
        JsonNode list = objectMapper.readTree(workers.body());
        assertThat(list).hasSize(1);
        assertThat(list.get(0).get("workerId").asText()).isEqualTo("w1");
        assertThat(list.get(0).get("status").asText()).isEqualTo("IDLE");

        assertThat(proxyClient.registerWorker("w1", workerUri())).isFalse();
        assertThat(proxyClient.deregisterWorker("w1")).isTrue();
        assertThat(proxy.getRegistry().size()).isZero();
    }

    @Test
    void register_WorkerCountHeader_ReflectsRegistry() throws Exception {
        startProxy(ProxyConfig.defaults(), RateLimiter.unlimited());
        proxy.registerWorker("w0", URI.create("http://127.0.0.1:1"));

        HttpResponse<String> response = post("/api/workers/register",
                objectMapper.createObjectNode().put("address", workerUri().toString()));

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("X-Worker-Count")).hasValue("2");
        assertThat(objectMapper.readTree(response.body()).get("workerId").asText())
                .isEqualTo("127.0.0.1:" + worker.getPort());
    }

    @Test
    void deregister_UnknownWorker_Returns404() throws Exception {
        startProxy(ProxyConfig.defaults(), RateLimiter.unlimited());

        HttpResponse<String> response = post("/api/workers/deregister",
                objectMapper.createObjectNode().put("workerId", "missing"));

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(objectMapper.readTree(response.body()).get("error").asText()).isEqualTo("UNKNOWN_WORKER");
    }

    @Test
    void status_ReportsQueueAndWorkers() throws Exception {
        startProxy(ProxyConfig.builder().queueCapacity(3).build(), RateLimiter.unlimited());
        proxy.registerWorker("w1", workerUri());

        HttpResponse<String> response = send(HttpRequest.newBuilder(proxyUri("/api/status")).GET().build());

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode status = objectMapper.readTree(response.body());
        assertThat(status.get("queueCapacity").asInt()).isEqualTo(3);
        assertThat(status.get("workers").get("IDLE").asInt()).isEqualTo(1);
    }

    private void startProxy(ProxyConfig config, RateLimiter rateLimiter) throws Exception {
        proxy = new ProofProxy(config, new HttpWorkerClient(Duration.ofSeconds(2)), new SimpleMeterRegistry(),
                Clock.systemUTC());
        server = new ProxyServer(new InetSocketAddress("127.0.0.1", 0), proxy, rateLimiter);
        server.start();
    }

    private URI workerUri() {
        return URI.create("http://127.0.0.1:" + worker.getPort());
    }

    private URI proxyUri(String path) {
        return URI.create("http://127.0.0.1:" + server.getPort() + path);
    }

    private HttpResponse<String> post(String path, Object body) throws Exception {
        return send(jsonPost(path, body));
    }

    private CompletableFuture<HttpResponse<String>> postAsync(String path, Object body) throws Exception {
        return httpClient.sendAsync(jsonPost(path, body), HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest jsonPost(String path, Object body) throws Exception {
        return HttpRequest.newBuilder(proxyUri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)))
                .build();
    }

    private HttpResponse<String> send(HttpRequest request) throws Exception {
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private void awaitQueueSize(int size) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (proxy.getQueue().size() != size) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Queue never reached size " + size);
            }
            Thread.sleep(10);
        }
    }
}
