/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound payloads before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Keeps entry lines bounded and endpoint credentials out of logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logrelay.logging;
