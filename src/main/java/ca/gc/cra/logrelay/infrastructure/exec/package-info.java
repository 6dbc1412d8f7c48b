/**
 * Executor factories for target tasks, sink workers, and HTTP request workers.
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 * <p><strong>Security:</strong> Thread names carry job names only, never payload data.</p>
 */
package ca.gc.cra.logrelay.infrastructure.exec;
