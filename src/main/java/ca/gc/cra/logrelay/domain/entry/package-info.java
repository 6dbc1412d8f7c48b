/**
 * <strong>Purpose:</strong> Log entry value objects shared by translators, targets, and sinks.
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 * <p><strong>Security:</strong> Entries carry raw log text; loggers truncate lines via {@code ca.gc.cra.logrelay.logging.Logs}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logrelay.domain.entry;
