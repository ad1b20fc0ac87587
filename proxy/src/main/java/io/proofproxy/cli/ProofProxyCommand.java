package io.proofproxy.cli;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.proofproxy.common.ProxyClient;
import io.proofproxy.config.ConfigLoader;
import io.proofproxy.config.ProxyConfig;
import io.proofproxy.proxy.ProofProxy;
import io.proofproxy.proxy.transport.HttpWorkerClient;
import io.proofproxy.server.FixedWindowRateLimiter;
import io.proofproxy.server.ProxyServer;
import io.proofproxy.server.RateLimiter;
import io.proofproxy.telemetry.TracingSetup;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Slf4j
@Command(
        name = "proof-proxy",
        mixinStandardHelpOptions = true,
        description = "Dispatch proxy for proof generation workers",
        subcommands = {
                ProofProxyCommand.InitCommand.class,
                ProofProxyCommand.StartProxyCommand.class,
                ProofProxyCommand.AddWorkersCommand.class,
                ProofProxyCommand.RemoveWorkersCommand.class
        }
)
public final class ProofProxyCommand implements Runnable {

    @Override
    public void run() {
        System.out.println("Use a subcommand: init, start-proxy, add-workers, remove-workers");
    }

    /**
     * Parses {@code host:port}; a bare {@code :port} or {@code port} binds all interfaces.
     *
     * @throws IllegalArgumentException if the port is missing or out of range
     */
    static InetSocketAddress parseListenAddress(String address) {
        String value = address.trim();
        int colon = value.lastIndexOf(':');
        String host = colon < 0 ? "" : value.substring(0, colon);
        String portText = colon < 0 ? value : value.substring(colon + 1);
        int port;
        try {
            port = Integer.parseInt(portText);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid listen address: " + address);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        return host.isEmpty() ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    }

    @Command(name = "init", description = "Write a default configuration file")
    static final class InitCommand implements Callable<Integer> {
        @Option(names = {"--config"}, description = "Configuration file", defaultValue = ProxyConfig.DEFAULT_FILE_NAME)
        Path configFile;

        @Option(names = {"--force"}, description = "Overwrite an existing file")
        boolean force;

        @Override
        public Integer call() {
            try {
                new ConfigLoader().write(ProxyConfig.defaults(), configFile, force);
                System.out.println("Configuration written to: " + configFile.toAbsolutePath());
                return 0;
            } catch (FileAlreadyExistsException e) {
                System.err.println("Configuration file already exists: " + e.getFile() + " (use --force)");
                return 1;
            } catch (IOException e) {
                log.error("Failed to write configuration to {}", configFile, e);
                return 1;
            }
        }
    }

    @Command(name = "start-proxy", description = "Start the proxy and block until terminated")
    static final class StartProxyCommand implements Callable<Integer> {
        @Option(names = {"--config"}, description = "Configuration file", defaultValue = ProxyConfig.DEFAULT_FILE_NAME)
        Path configFile;

        @Option(names = {"--otlp-endpoint"}, defaultValue = "${env:OTEL_EXPORTER_OTLP_ENDPOINT}",
                description = "OTLP/gRPC collector for traces, e.g. http://localhost:4317 (default: tracing off)")
        String otlpEndpoint;

        @Parameters(index = "0", description = "Listen address, host:port")
        String listenAddress;

        @Override
        public Integer call() {
            InetSocketAddress bindAddress;
            ProxyConfig config;
            OpenTelemetrySdk tracing;
            try {
                bindAddress = parseListenAddress(listenAddress);
                config = new ConfigLoader().load(configFile);
                tracing = otlpEndpoint == null || otlpEndpoint.isBlank() ? null : TracingSetup.otlp(otlpEndpoint);
            } catch (IOException | IllegalArgumentException e) {
                log.error("Invalid startup parameters: {}", e.getMessage());
                return 1;
            }

            ProofProxy proxy = new ProofProxy(config, new HttpWorkerClient(config.getConnectionTimeout()),
                    new SimpleMeterRegistry(), tracing != null ? tracing : OpenTelemetry.noop(), Clock.systemUTC());
            RateLimiter rateLimiter = config.getMaxRequestsPerSecond() > 0
                    ? new FixedWindowRateLimiter(config.getMaxRequestsPerSecond(), Clock.systemUTC())
                    : RateLimiter.unlimited();
            ProxyServer server = new ProxyServer(bindAddress, proxy, rateLimiter);
            try {
                proxy.start();
                server.start();
            } catch (IOException | IllegalArgumentException e) {
                log.error("Failed to start proxy on {}", listenAddress, e);
                proxy.close();
                stopTracing(tracing);
                return 1;
            }

            CountDownLatch terminated = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutting down...");
                server.stop();
                proxy.close();
                stopTracing(tracing);
                terminated.countDown();
            }));

            try {
                terminated.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Proxy interrupted", e);
            }
            return 0;
        }

        private static void stopTracing(OpenTelemetrySdk tracing) {
            if (tracing != null) {
                TracingSetup.shutdown(tracing);
            }
        }
    }

    @Command(name = "add-workers", description = "Register workers with a running proxy")
    static final class AddWorkersCommand implements Callable<Integer> {
        @Option(names = {"--proxy"}, description = "Proxy url", defaultValue = "http://localhost:8082")
        URI proxyUrl;

        @Parameters(arity = "1..*", description = "Worker addresses, host:port")
        List<String> workers;

        @Override
        public Integer call() {
            ProxyClient client = new ProxyClient(proxyUrl);
            int failures = 0;
            for (String address : workers) {
                URI uri;
                try {
                    uri = ProofProxy.toWorkerUri(address);
                } catch (IllegalArgumentException e) {
                    System.err.println(e.getMessage());
                    failures++;
                    continue;
                }
                if (client.registerWorker(ProofProxy.workerIdOf(uri), uri)) {
                    System.out.println("Added worker " + address);
                } else {
                    System.err.println("Failed to add worker " + address);
                    failures++;
                }
            }
            return failures == 0 ? 0 : 1;
        }
    }

    @Command(name = "remove-workers", description = "Deregister workers from a running proxy")
    static final class RemoveWorkersCommand implements Callable<Integer> {
        @Option(names = {"--proxy"}, description = "Proxy url", defaultValue = "http://localhost:8082")
        URI proxyUrl;

        @Parameters(arity = "1..*", description = "Worker ids, host:port")
        List<String> workers;

        @Override
        public Integer call() {
            ProxyClient client = new ProxyClient(proxyUrl);
            int failures = 0;
            for (String workerId : workers) {
                if (client.deregisterWorker(workerId.trim())) {
                    System.out.println("Removed worker " + workerId);
                } else {
                    System.err.println("Failed to remove worker " + workerId);
                    failures++;
                }
            }
            return failures == 0 ? 0 : 1;
        }
    }
}
