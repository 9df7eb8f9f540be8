package com.bastion.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Uses {@link InMemorySpanExporter} directly for reliable span collection in nested classes.
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
        spanHelper = SpanHelper.of(OpenTelemetrySdk.builder().setTracerProvider(tracerProvider).build());
    }

    @AfterEach
    void cleanup() {
        MDC.clear();
        spanExporter.reset();
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject a null tracer")
        void shouldRejectNullTracer() {
            assertThatThrownBy(() -> new SpanHelper(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("tracer");
        }

        @Test
        @DisplayName("noop should run work without recording")
        void noop() throws Exception {
            assertThat(SpanHelper.noop().withSpan("op", () -> 42)).isEqualTo(42);
            assertThat(spanExporter.getFinishedSpanItems()).isEmpty();
        }
    }

    @Nested
    @DisplayName("withSpan")
    class WithSpan {

        @Test
        @DisplayName("should record a span with kind and attributes")
        void recordsSpan() throws Exception {
            String result = spanHelper.withSpan("bastion.exchange.assume_role", SpanKind.CLIENT,
                    Map.of("bastion.role", "Reader"), () -> "done");

            assertThat(result).isEqualTo("done");
            List<SpanData> spans = spanExporter.getFinishedSpanItems();
            assertThat(spans).hasSize(1);
            SpanData span = spans.get(0);
            assertThat(span.getName()).isEqualTo("bastion.exchange.assume_role");
            assertThat(span.getKind()).isEqualTo(SpanKind.CLIENT);
            assertThat(span.getAttributes().get(AttributeKey.stringKey("bastion.role"))).isEqualTo("Reader");
            assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        }

        @Test
        @DisplayName("should attach request and subject ids from the MDC")
        void mdcAttributes() throws Exception {
            MDC.put(LogContextKeys.REQUEST_ID, "req-1");
            MDC.put(LogContextKeys.SUBJECT_ID, "user-001");

            spanHelper.withSpan("op", () -> null);

            SpanData span = spanExporter.getFinishedSpanItems().get(0);
            assertThat(span.getAttributes().get(AttributeKey.stringKey(SpanHelper.ATTR_REQUEST_ID)))
                    .isEqualTo("req-1");
            assertThat(span.getAttributes().get(AttributeKey.stringKey(SpanHelper.ATTR_SUBJECT_ID)))
                    .isEqualTo("user-001");
        }

        @Test
        @DisplayName("should mark the span as failed and rethrow")
        void recordsFailure() {
            assertThatThrownBy(() -> spanHelper.withSpan("op", () -> {
                throw new IllegalStateException("refused");
            })).isInstanceOf(IllegalStateException.class).hasMessage("refused");

            SpanData span = spanExporter.getFinishedSpanItems().get(0);
            assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
            assertThat(span.getEvents()).anyMatch(event -> event.getName().equals("exception"));
        }

        @Test
        @DisplayName("the runnable variant should run the task in a span")
        void runnable() {
            AtomicBoolean ran = new AtomicBoolean();

            spanHelper.withSpan("op", () -> ran.set(true));

            assertThat(ran).isTrue();
            assertThat(spanExporter.getFinishedSpanItems()).hasSize(1);
        }
    }
}
