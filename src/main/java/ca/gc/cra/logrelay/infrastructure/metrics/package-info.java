/**
 * OpenTelemetry implementation of {@link ca.gc.cra.logrelay.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; updates are lock-free.</p>
 * <p><strong>Metrics:</strong> Exported over OTLP/gRPC every 30 seconds, or dropped when the exporter is
 * {@code none}.</p>
 * <p><strong>Security:</strong> Endpoint credentials are redacted before logging.</p>
 */
package ca.gc.cra.logrelay.infrastructure.metrics;
