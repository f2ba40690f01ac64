package com.lexigraph.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Tracing for one lexigraph process, and the span names its components share.
 * <p>
 * The exporter is chosen from {@code OTEL_DISABLED} and {@code OTEL_EXPORTER_TYPE}
 * (environment first, then system property):
 * <ul>
 *   <li>{@code logging} (default): each span is written through java.util.logging
 *       when it ends, which suits a short-lived dictionary build</li>
 *   <li>{@code otlp}: spans are batched to {@code OTEL_EXPORTER_OTLP_ENDPOINT}</li>
 * </ul>
 * Spans carry {@code service.name=lexigraph} and the {@code lexigraph.component}
 * that started the process, e.g. {@code dawg-builder}.
 */
public final class TracingService implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    public static final String BUILD_SPAN = "build-dawg";
    public static final String EXPAND_SPAN = "expand-rack";
    public static final String MATCH_SPAN = "match-pattern";
    public static final String ANALYZE_SPAN = "analyze-rack";
    public static final String MANUAL_RELOAD_SPAN = "manual-reload";
    public static final String UPDATE_CHECK_SPAN = "check-for-lexicon-updates";
    public static final String LOAD_SPAN = "load-new-automaton";

    static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    static final AttributeKey<String> COMPONENT = AttributeKey.stringKey("lexigraph.component");

    private static final String INSTRUMENTATION_NAME = "com.lexigraph";
    private static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";

    /**
     * Where finished spans go.
     */
    public enum Exporter {
        NONE, LOGGING, OTLP;

        static Exporter fromEnvironment() {
            return parse(getEnvOrProperty("OTEL_DISABLED", "false"), getEnvOrProperty("OTEL_EXPORTER_TYPE", "logging"));
        }

        static Exporter parse(String disabled, String type) {
            if (Boolean.parseBoolean(disabled)) {
                return NONE;
            }
            if (type == null || type.isBlank()) {
                return LOGGING;
            }
            switch (type.trim().toLowerCase(Locale.ROOT)) {
                case "otlp":
                    return OTLP;
                case "logging":
                    return LOGGING;
                case "none":
                    return NONE;
                default:
                    logger.warning("Unknown exporter type '" + type + "', using logging");
                    return LOGGING;
            }
        }
    }

    private final String component;
    private final Exporter exporter;
    private final SdkTracerProvider tracerProvider;
    private final Tracer tracer;

    private TracingService(String component, Exporter exporter, SdkTracerProvider tracerProvider, Tracer tracer) {
        this.component = component;
        this.exporter = exporter;
        this.tracerProvider = tracerProvider;
        this.tracer = tracer;
    }

    /**
     * Span name of one dictionary build stage, e.g. {@code build-minimizing}.
     */
    public static String stageSpan(String stage) {
        return "build-" + stage.toLowerCase(Locale.ROOT);
    }

    /**
     * Starts tracing for a component with the exporter configured in the environment.
     */
    public static TracingService start(String component) {
        return start(component, Exporter.fromEnvironment());
    }

    public static TracingService start(String component, Exporter exporter) {
        if (exporter == Exporter.NONE) {
            logger.fine(() -> "Tracing disabled for " + component);
            return new TracingService(component, exporter, null, OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
        }
        Resource resource = Resource.getDefault().merge(
                Resource.create(Attributes.of(SERVICE_NAME, "lexigraph", COMPONENT, component)));
        SdkTracerProvider provider = SdkTracerProvider.builder()
                .setResource(resource)
                .addSpanProcessor(spanProcessor(exporter))
                .build();
        logger.info("Tracing " + component + " with " + exporter.name().toLowerCase(Locale.ROOT) + " exporter");
        return new TracingService(component, exporter, provider, provider.get(INSTRUMENTATION_NAME));
    }

    private static SpanProcessor spanProcessor(Exporter exporter) {
        if (exporter == Exporter.OTLP) {
            String endpoint = getEnvOrProperty("OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_OTLP_ENDPOINT);
            return BatchSpanProcessor.builder(OtlpGrpcSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build()).build();
        }
        return SimpleSpanProcessor.create(LoggingSpanExporter.create());
    }

    public Tracer getTracer() {
        return tracer;
    }

    public String getComponent() {
        return component;
    }

    public Exporter getExporter() {
        return exporter;
    }

    /**
     * Flushes pending spans and stops the exporter.
     */
    @Override
    public void close() {
        if (tracerProvider == null) {
            return;
        }
        CompletableResultCode result = tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
            logger.warning("Spans of " + component + " may not have been exported before shutdown");
        }
    }

    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
