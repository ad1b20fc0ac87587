package io.proofproxy.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.proofproxy.model.WorkerDeregistrationRequest;
import io.proofproxy.model.WorkerRegistrationRequest;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Admin client of a running proxy: adds and removes workers.
 * Used by workers registering themselves and by the {@code add-workers}/{@code remove-workers} commands.
 */
@Slf4j
public class ProxyClient {
    private final URI proxyBaseUrl;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public ProxyClient(URI proxyBaseUrl) {
        this.proxyBaseUrl = proxyBaseUrl;
        this.objectMapper = JacksonConfig.createObjectMapper();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    public boolean registerWorker(String workerId, URI workerAddress) {
        try {
            WorkerRegistrationRequest request = new WorkerRegistrationRequest(workerId, workerAddress);
            HttpResponse<String> response = post("/api/workers/register", objectMapper.writeValueAsString(request));

            if (response.statusCode() == 200) {
                log.info("Registered worker {} at {} with proxy {}", workerId, workerAddress, proxyBaseUrl);
                return true;
            }
            log.error("Proxy refused registration of {}: {}", workerId, response.body());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.error("Error registering worker {}", workerId, e);
            return false;
        }
    }

    public boolean deregisterWorker(String workerId) {
        try {
            String body = objectMapper.writeValueAsString(new WorkerDeregistrationRequest(workerId));
            return post("/api/workers/deregister", body).statusCode() == 200;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.error("Error deregistering worker {}", workerId, e);
            return false;
        }
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(proxyBaseUrl.resolve(path))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(10))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
    }
}
