/**
 * Coordination helpers shared by ingestion targets.
 * <p><strong>Concurrency:</strong> Every type here is thread-safe.</p>
 */
package ca.gc.cra.logrelay.application.util;
