package io.proofproxy.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.proofproxy.common.HttpExchanges;
import io.proofproxy.common.JacksonConfig;
import io.proofproxy.model.ErrorCode;
import io.proofproxy.model.ErrorResponse;
import io.proofproxy.model.ProofRequest;
import io.proofproxy.model.ProofResult;
import io.proofproxy.model.WorkerDeregistrationRequest;
import io.proofproxy.model.WorkerRegistrationRequest;
import io.proofproxy.proxy.PendingResult;
import io.proofproxy.proxy.ProofProxy;
import io.proofproxy.proxy.exception.AdmissionRejectedException;
import io.proofproxy.proxy.exception.UnknownWorkerException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP front end of the proxy.
 *
 * <p>A submission holds its connection until the job reaches a terminal state, so requests are served from
 * a cached pool rather than the server's single default thread.</p>
 */
@Slf4j
public class ProxyServer {
    private final InetSocketAddress bindAddress;
    private final ProofProxy proxy;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private ExecutorService requestExecutor;
    private HttpServer httpServer;

    public ProxyServer(InetSocketAddress bindAddress, ProofProxy proxy, RateLimiter rateLimiter) {
        this.bindAddress = bindAddress;
        this.proxy = proxy;
        this.rateLimiter = rateLimiter;
        this.objectMapper = JacksonConfig.createObjectMapper();
    }

    /**
     * @throws IOException if the address cannot be bound
     */
    public void start() throws IOException {
        httpServer = HttpServer.create(bindAddress, 0);

        // Job submission, answered with the proof once the job ends
        httpServer.createContext("/api/proofs", HttpExchanges.guarded(this::handleSubmit, objectMapper));

        // Worker administration
        httpServer.createContext("/api/workers/register", HttpExchanges.guarded(this::handleRegister, objectMapper));
        httpServer.createContext("/api/workers/deregister", HttpExchanges.guarded(this::handleDeregister, objectMapper));
        httpServer.createContext("/api/workers", HttpExchanges.guarded(this::handleGetWorkers, objectMapper));

        httpServer.createContext("/api/status", HttpExchanges.guarded(this::handleStatus, objectMapper));
        httpServer.createContext("/health", HttpExchanges.guarded(this::handleHealth, objectMapper));

        requestExecutor = Executors.newCachedThreadPool();
        httpServer.setExecutor(requestExecutor);
        httpServer.start();
        log.info("Proxy server listening on {}", httpServer.getAddress());
    }

    public void stop() {
        if (httpServer != null) {
            httpServer.stop(0);
            requestExecutor.shutdownNow();
            log.info("Proxy server stopped");
        }
    }

    public int getPort() {
        return httpServer.getAddress().getPort();
    }

    private void handleSubmit(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.requireMethod(exchange, "POST", objectMapper)) {
            return;
        }

        String client = exchange.getRemoteAddress().getAddress().getHostAddress();
        if (!rateLimiter.tryAcquire(client)) {
            proxy.getMetrics().requestRateLimited();
            exchange.getResponseHeaders().set("X-Rate-Limit-Limit", String.valueOf(rateLimiter.getLimit()));
            exchange.getResponseHeaders().set("X-Rate-Limit-Remaining", "0");
            exchange.getResponseHeaders().set("X-Rate-Limit-Reset", "1");
            HttpExchanges.sendError(exchange, 429,
                    ErrorResponse.of(ErrorCode.RATE_LIMITED, "Too many requests"), objectMapper);
            return;
        }

        ProofRequest request;
        try {
            request = objectMapper.readValue(exchange.getRequestBody(), ProofRequest.class);
        } catch (IOException e) {
            sendBadRequest(exchange, "Invalid request: " + e.getMessage());
            return;
        }
        if (request.getPayload() == null) {
            sendBadRequest(exchange, "payload is required");
            return;
        }

        PendingResult pending;
        try {
            pending = proxy.submit(request);
        } catch (AdmissionRejectedException e) {
            HttpExchanges.sendError(exchange, 503, new ErrorResponse(ErrorCode.ADMISSION_REJECTED, e.getMessage(),
                    e.getJobId(), e.getRetryCount()), objectMapper);
            return;
        } catch (IllegalArgumentException e) {
            HttpExchanges.sendError(exchange, 409,
                    ErrorResponse.of(ErrorCode.INVALID_REQUEST, e.getMessage()), objectMapper);
            return;
        } catch (IllegalStateException e) {
            HttpExchanges.sendError(exchange, 503,
                    ErrorResponse.of(ErrorCode.PROXY_SHUTDOWN, e.getMessage()), objectMapper);
            return;
        }

        ProofResult result;
        try {
            result = pending.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            proxy.getRelay().abandon(pending.getJobId());
            log.debug("Stopped waiting for job {}", pending.getJobId());
            return;
        }

        try {
            HttpExchanges.sendJson(exchange, statusOf(result), result, objectMapper);
        } catch (IOException e) {
            log.info("Client of job {} disconnected before delivery: {}", result.getJobId(), e.getMessage());
        }
    }

    private void handleRegister(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.requireMethod(exchange, "POST", objectMapper)) {
            return;
        }
        try {
            WorkerRegistrationRequest request = objectMapper.readValue(
                    exchange.getRequestBody(), WorkerRegistrationRequest.class);
            if (request.getAddress() == null) {
                sendBadRequest(exchange, "address is required");
                return;
            }
            URI address = ProofProxy.toWorkerUri(request.getAddress().toString());
            String workerId = request.getWorkerId() != null ? request.getWorkerId() : ProofProxy.workerIdOf(address);
            proxy.registerWorker(workerId, address);
            sendWorkerCount(exchange, Map.of("status", "registered", "workerId", workerId));
        } catch (IOException | IllegalArgumentException e) {
            sendBadRequest(exchange, "Invalid request: " + e.getMessage());
        }
    }

    private void handleDeregister(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.requireMethod(exchange, "POST", objectMapper)) {
            return;
        }
        try {
            WorkerDeregistrationRequest request = objectMapper.readValue(
                    exchange.getRequestBody(), WorkerDeregistrationRequest.class);
            if (request.getWorkerId() == null) {
                sendBadRequest(exchange, "workerId is required");
                return;
            }
            proxy.deregisterWorker(request.getWorkerId());
            sendWorkerCount(exchange, Map.of("status", "deregistered", "workerId", request.getWorkerId()));
        } catch (UnknownWorkerException e) {
            HttpExchanges.sendError(exchange, 404, ErrorResponse.of(ErrorCode.UNKNOWN_WORKER, e.getMessage()),
                    objectMapper);
        } catch (IOException e) {
            sendBadRequest(exchange, "Invalid request: " + e.getMessage());
        }
    }

    private void handleGetWorkers(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.requireMethod(exchange, "GET", objectMapper)) {
            return;
        }
        HttpExchanges.sendJson(exchange, 200, proxy.workers(), objectMapper);
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.requireMethod(exchange, "GET", objectMapper)) {
            return;
        }
        HttpExchanges.sendJson(exchange, 200, proxy.status(), objectMapper);
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        HttpExchanges.sendResponse(exchange, 200, "{\"status\":\"ok\"}");
    }

    private void sendWorkerCount(HttpExchange exchange, Object body) throws IOException {
        exchange.getResponseHeaders().set("X-Worker-Count", String.valueOf(proxy.getRegistry().size()));
        HttpExchanges.sendJson(exchange, 200, body, objectMapper);
    }

    private void sendBadRequest(HttpExchange exchange, String message) throws IOException {
        HttpExchanges.sendError(exchange, 400, ErrorResponse.of(ErrorCode.INVALID_REQUEST, message), objectMapper);
    }

    private static int statusOf(ProofResult result) {
        if (result.isSuccess()) {
            return 200;
        }
        ErrorCode code = result.getErrorCode();
        return code == ErrorCode.ADMISSION_REJECTED || code == ErrorCode.PROXY_SHUTDOWN ? 503 : 502;
    }
}
