package io.proofproxy.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.proofproxy.common.HttpExchanges;
import io.proofproxy.common.JacksonConfig;
import io.proofproxy.model.ErrorCode;
import io.proofproxy.model.ErrorResponse;
import io.proofproxy.model.ProofRequest;
import io.proofproxy.model.ProofResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP host for a {@link ProofGenerator}.
 *
 * <p>{@code POST /api/proofs/prove} runs the proof synchronously and answers with a {@link ProofResult};
 * {@code 409} if a proof is already running. {@code GET /health} stays responsive while proving.</p>
 */
@Slf4j
public class WorkerServer {
    private final String workerId;
    private final InetSocketAddress bindAddress;
    private final ProofExecutor proofExecutor;
    private final ObjectMapper objectMapper;
    private ExecutorService requestExecutor;
    private HttpServer httpServer;
    private volatile boolean running = false;

    public WorkerServer(String workerId, InetSocketAddress bindAddress, ProofGenerator generator) {
        this.workerId = workerId;
        this.bindAddress = bindAddress;
        this.proofExecutor = new ProofExecutor(generator);
        this.objectMapper = JacksonConfig.createObjectMapper();
    }

    public synchronized void start() throws IOException {
        if (running) {
            log.warn("Worker server is already running");
            return;
        }

        httpServer = HttpServer.create(bindAddress, 0);
        httpServer.createContext("/api/proofs/prove", HttpExchanges.guarded(this::handleProve, objectMapper));
        httpServer.createContext("/health", HttpExchanges.guarded(this::handleHealth, objectMapper));
        requestExecutor = Executors.newCachedThreadPool();
        httpServer.setExecutor(requestExecutor);
        httpServer.start();
        running = true;
        log.info("Worker {} listening on port {}", workerId, getPort());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        httpServer.stop(0);
        requestExecutor.shutdownNow();
        log.info("Worker {} stopped", workerId);
    }

    public int getPort() {
        return httpServer.getAddress().getPort();
    }

    private void handleProve(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.requireMethod(exchange, "POST", objectMapper)) {
            return;
        }

        ProofRequest request;
        try {
            request = objectMapper.readValue(exchange.getRequestBody(), ProofRequest.class);
        } catch (IOException e) {
            log.warn("Malformed proof request: {}", e.getMessage());
            HttpExchanges.sendError(exchange, 400,
                    ErrorResponse.of(ErrorCode.INVALID_REQUEST, "Invalid request: " + e.getMessage()), objectMapper);
            return;
        }
        if (request.getJobId() == null || request.getPayload() == null) {
            HttpExchanges.sendError(exchange, 400,
                    ErrorResponse.of(ErrorCode.INVALID_REQUEST, "jobId and payload are required"), objectMapper);
            return;
        }

        Optional<ProofResult> result = proofExecutor.tryExecute(request);
        if (result.isEmpty()) {
            HttpExchanges.sendError(exchange, 409,
                    ErrorResponse.of(ErrorCode.WORKER_BUSY, "Worker " + workerId + " is busy"), objectMapper);
            return;
        }
        HttpExchanges.sendJson(exchange, 200, result.get(), objectMapper);
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.requireMethod(exchange, "GET", objectMapper)) {
            return;
        }
        String state = proofExecutor.getActiveJob().isPresent() ? "busy" : "idle";
        HttpExchanges.sendJson(exchange, 200, Map.of("status", "ok", "workerId", workerId, "state", state), objectMapper);
    }
}
