package io.proofproxy.proxy.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.proofproxy.common.JacksonConfig;
import io.proofproxy.model.ProofRequest;
import io.proofproxy.model.ProofResult;
import io.proofproxy.proxy.exception.TransportException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * JSON over HTTP: {@code POST /api/proofs/prove} and {@code GET /health} on the worker.
 */
@Slf4j
public class HttpWorkerClient implements WorkerClient {
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public HttpWorkerClient(Duration connectTimeout) {
        this.objectMapper = JacksonConfig.createObjectMapper();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public ProofResult prove(URI worker, ProofRequest request, Duration timeout) throws TransportException {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(request);
        } catch (IOException e) {
            throw new TransportException("Cannot encode job " + request.getJobId(), e);
        }

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(worker.resolve("/api/proofs/prove"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .timeout(timeout)
                .build();

        HttpResponse<byte[]> response = send(worker, httpRequest);
        if (response.statusCode() != 200) {
            throw new TransportException("Worker " + worker + " answered " + response.statusCode()
                    + " to job " + request.getJobId(), null);
        }
        try {
            ProofResult result = objectMapper.readValue(response.body(), ProofResult.class);
            log.debug("Worker {} answered job {}: success={}", worker, request.getJobId(), result.isSuccess());
            return result;
        } catch (IOException e) {
            throw new TransportException("Malformed result from " + worker, e);
        }
    }

    @Override
    public void probe(URI worker, Duration timeout) throws TransportException {
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(worker.resolve("/health"))
                .GET()
                .timeout(timeout)
                .build();

        HttpResponse<byte[]> response = send(worker, httpRequest);
        if (response.statusCode() != 200) {
            throw new TransportException("Worker " + worker + " health check answered " + response.statusCode(), null);
        }
    }

    private HttpResponse<byte[]> send(URI worker, HttpRequest request) throws TransportException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new TransportException("Timed out talking to " + worker, e, true);
        } catch (IOException e) {
            throw new TransportException("Cannot reach " + worker + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while talking to " + worker, e);
        }
    }
}
