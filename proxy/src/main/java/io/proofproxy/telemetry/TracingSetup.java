package io.proofproxy.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * Builds the OpenTelemetry SDK used by {@code start-proxy}.
 *
 * <p>Spans are exported over OTLP/gRPC in batches. Every root trace is sampled; a child follows the
 * sampling decision of its remote parent. The resource names the service and its version.</p>
 */
@Slf4j
public final class TracingSetup {
    public static final String SERVICE_NAME = "proof-proxy";
    public static final String INSTRUMENTATION_NAME = "io.proofproxy.proxy";

    static final AttributeKey<String> SERVICE_NAME_KEY = AttributeKey.stringKey("service.name");
    static final AttributeKey<String> SERVICE_VERSION_KEY = AttributeKey.stringKey("service.version");

    private TracingSetup() {
    }

    /**
     * @param endpoint collector url, e.g. {@code http://localhost:4317}
     */
    public static OpenTelemetrySdk otlp(String endpoint) {
        OtlpGrpcSpanExporter exporter = OtlpGrpcSpanExporter.builder()
                .setEndpoint(endpoint)
                .build();
        log.info("Exporting traces to {}", endpoint);
        return create(BatchSpanProcessor.builder(exporter).build());
    }

    static OpenTelemetrySdk create(SpanProcessor processor) {
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .setResource(resource())
                .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(1.0)))
                .addSpanProcessor(processor)
                .build();
        return OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
    }

    static Resource resource() {
        return Resource.getDefault().merge(Resource.create(Attributes.of(
                SERVICE_NAME_KEY, SERVICE_NAME,
                SERVICE_VERSION_KEY, version())));
    }

    static String version() {
        String version = TracingSetup.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }

    /**
     * Flushes pending spans and stops the exporter.
     */
    public static void shutdown(OpenTelemetrySdk sdk) {
        CompletableResultCode result = sdk.getSdkTracerProvider().shutdown().join(5, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
            log.warn("Trace exporter did not shut down cleanly, some spans may be lost");
        }
    }
}
