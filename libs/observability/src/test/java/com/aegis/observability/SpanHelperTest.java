package com.aegis.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SpanHelper}: span lifecycle, incident attributes and error recording.
 * Spans are collected with {@link InMemorySpanExporter}.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        OpenTelemetrySdk otelSdk = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
        spanHelper = new SpanHelper(otelSdk.getTracer("test-tracer"));
    }

    @AfterEach
    void cleanup() {
        IncidentContextHolder.clear();
        spanExporter.reset();
    }

    @Test
    @DisplayName("should reject null tracer")
    void shouldRejectNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Test
    @DisplayName("should end the span with OK status and return the result")
    void shouldReturnResult() {
        Integer result = spanHelper.inSpan("governor.status", () -> 42);

        assertThat(result).isEqualTo(42);
        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getName()).isEqualTo("governor.status");
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
    }

    @Test
    @DisplayName("should attach incident attributes from the current context")
    void shouldAttachIncidentAttributes() {
        IncidentContextHolder.set(new IncidentContext("corr-7", "checkout", "db-1", "evt-3"));

        spanHelper.inSpan("governor.handleFailure", () -> "ok");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getAttributes().get(AttributeKey.stringKey(SpanHelper.ATTR_CORRELATION_ID)))
                .isEqualTo("corr-7");
        assertThat(span.getAttributes().get(AttributeKey.stringKey(SpanHelper.ATTR_SERVICE)))
                .isEqualTo("checkout");
        assertThat(span.getAttributes().get(AttributeKey.stringKey(SpanHelper.ATTR_FAILURE_EVENT_ID)))
                .isEqualTo("evt-3");
    }

    @Test
    @DisplayName("should record exceptions and rethrow them")
    void shouldRecordException() {
        assertThatThrownBy(() -> spanHelper.inSpan("governor.fail", () -> {
            throw new IllegalStateException("check failed");
        })).isInstanceOf(IllegalStateException.class);

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getEvents()).anyMatch(e -> e.getName().equals("exception"));
    }
}
