/**
 * <strong>Purpose:</strong> OpenTelemetry implementation of the dispatch metrics port.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for concurrent dispatch.
 * <p><strong>Observability:</strong> Exports over OTLP/gRPC unless {@code otel.metrics.exporter=none}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.patmat.infrastructure.metrics;
