package io.proofproxy;

import io.proofproxy.common.ProxyClient;
import io.proofproxy.worker.ProofGenerator;
import io.proofproxy.worker.WorkerServer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Starts a worker: {@code WorkerMain [port] [proxy-url] [worker-host]}.
 * With a proxy url the worker registers itself on startup and deregisters on shutdown.
 *
 * <p>No proof backend ships with this module. To plug one in, implement {@link ProofGenerator} with a
 * public no-arg constructor, list its class name in
 * {@code META-INF/services/io.proofproxy.worker.ProofGenerator} inside your jar, and start
 * {@code WorkerMain} with that jar on the classpath. The first implementation found is used; without one
 * the worker exits with status 1.</p>
 */
@Slf4j
public class WorkerMain {
    private static final int DEFAULT_WORKER_PORT = 8083;

    public static void main(String[] args) {
        int workerPort = DEFAULT_WORKER_PORT;
        if (args.length > 0) {
            try {
                workerPort = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                log.error("Invalid worker port number, using default: {}", DEFAULT_WORKER_PORT);
            }
        }
        String host = args.length > 2 ? args[2] : "localhost";
        String workerId = host + ":" + workerPort;

        Optional<ProofGenerator> generator = loadGenerator();
        if (generator.isEmpty()) {
            log.error("No {} implementation found on the classpath", ProofGenerator.class.getName());
            System.exit(1);
            return;
        }

        WorkerServer server = new WorkerServer(workerId, new InetSocketAddress(workerPort), generator.get());
        ProxyClient proxyClient = args.length > 1 ? new ProxyClient(URI.create(args[1])) : null;

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            if (proxyClient != null) {
                proxyClient.deregisterWorker(workerId);
            }
            server.stop();
        }));

        try {
            server.start();
            if (proxyClient != null && !proxyClient.registerWorker(workerId, URI.create("http://" + workerId))) {
                log.error("Failed to register worker, stopping");
                server.stop();
                System.exit(1);
                return;
            }
            Thread.currentThread().join();
        } catch (IOException e) {
            log.error("Failed to start worker server", e);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Worker interrupted", e);
        }
    }

    static Optional<ProofGenerator> loadGenerator() {
        return ServiceLoader.load(ProofGenerator.class).findFirst();
    }
}
