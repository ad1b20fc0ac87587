package io.proofproxy.telemetry;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TracingSetupTest {

    private final InMemorySpanExporter exporter = InMemorySpanExporter.create();
    private final OpenTelemetrySdk sdk = TracingSetup.create(SimpleSpanProcessor.create(exporter));

    @AfterEach
    void tearDown() {
        TracingSetup.shutdown(sdk);
    }

    @Test
    void create_RootSpan_SampledWithServiceResource() {
        // given
        Tracer tracer = sdk.getTracer(TracingSetup.INSTRUMENTATION_NAME);

        // when
        tracer.spanBuilder("proxy.submit").startSpan().end();

        // then
        assertThat(exporter.getFinishedSpanItems()).hasSize(1);
        SpanData span = exporter.getFinishedSpanItems().get(0);
        assertThat(span.getResource().getAttribute(TracingSetup.SERVICE_NAME_KEY)).isEqualTo("proof-proxy");
        assertThat(span.getResource().getAttribute(TracingSetup.SERVICE_VERSION_KEY)).isEqualTo("dev");
    }

    @Test
    void create_UnsampledRemoteParent_ChildNotRecorded() {
        // given
        SpanContext parent = SpanContext.createFromRemoteParent("0af7651916cd43dd8448eb211c80319c",
                "b7ad6b7169203331", TraceFlags.getDefault(), TraceState.getDefault());
        Tracer tracer = sdk.getTracer(TracingSetup.INSTRUMENTATION_NAME);

        // when
        Span child = tracer.spanBuilder("proxy.submit")
                .setParent(Context.root().with(Span.wrap(parent)))
                .startSpan();
        child.end();

        // then
        assertThat(child.getSpanContext().isSampled()).isFalse();
        assertThat(exporter.getFinishedSpanItems()).isEmpty();
        assertThat(sdk.getSdkTracerProvider().getSampler().getDescription()).startsWith("ParentBased");
    }

    @Test
    void version_RunFromClassesDirectory_FallsBackToDev() {
        assertThat(TracingSetup.version()).isEqualTo("dev");
    }
}
