package com.bastion.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags every span with the request
 * and subject ids found in the SLF4J MDC.
 * <p>
 * Does not configure the SDK; the gateway passes whatever {@link OpenTelemetry} it was given
 * (the no-op instance by default).
 */
public final class SpanHelper {

    public static final String ATTR_REQUEST_ID = "request.id";
    public static final String ATTR_SUBJECT_ID = "enduser.id";

    private static final String INSTRUMENTATION_NAME = "com.bastion";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
    }

    public static SpanHelper of(OpenTelemetry openTelemetry) {
        return new SpanHelper(openTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    public <T> T withSpan(String spanName, Callable<T> callable) throws Exception {
        return withSpan(spanName, SpanKind.INTERNAL, Map.of(), callable);
    }

    /**
     * Executes {@code callable} inside a new span. The span ends when the callable returns or
     * throws; a thrown exception is recorded on the span and rethrown unchanged.
     *
     * @param spanName   name for the span
     * @param kind       span kind (INTERNAL, SERVER, CLIENT, PRODUCER, CONSUMER)
     * @param attributes additional span attributes
     * @param callable   the work to execute within the span
     */
    public <T> T withSpan(String spanName, SpanKind kind, Map<String, String> attributes,
                          Callable<T> callable) throws Exception {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        String requestId = MDC.get(LogContextKeys.REQUEST_ID);
        if (requestId != null) {
            span.setAttribute(ATTR_REQUEST_ID, requestId);
        }
        String subjectId = MDC.get(LogContextKeys.SUBJECT_ID);
        if (subjectId != null) {
            span.setAttribute(ATTR_SUBJECT_ID, subjectId);
        }

        try (Scope ignored = span.makeCurrent()) {
            T result = callable.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Void variant. Checked exceptions cannot occur; runtime exceptions propagate unchanged.
     */
    public void withSpan(String spanName, Runnable runnable) {
        try {
            withSpan(spanName, () -> {
                runnable.run();
                return null;
            });
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected checked exception in span", e);
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}
