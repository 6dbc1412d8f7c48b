/**
 * Ports connecting ingestion targets to transports, sinks, clocks, and metrics.
 * <p><strong>Role:</strong> Hexagonal boundary; adapters implement these interfaces and targets depend only on
 * them.</p>
 * <p><strong>Concurrency:</strong> Implementations document their own guarantees; most are called from several
 * worker threads.</p>
 * <p><strong>Metrics:</strong> {@link ca.gc.cra.logrelay.application.port.MetricsPort} is the single metrics
 * seam.</p>
 * <p><strong>Security:</strong> Push request bodies and headers are untrusted input.</p>
 */
package ca.gc.cra.logrelay.application.port;
