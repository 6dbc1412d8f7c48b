package ca.gc.cra.logrelay.application.target;

import ca.gc.cra.logrelay.domain.entry.LabelSet;
import java.util.Map;

/**
 * <strong>What:</strong> Common surface of every running ingestion source.
 * <p><strong>Why:</strong> The relay manages push and pull targets uniformly without seeing mode-specific state.</p>
 * <p><strong>Role:</strong> Facade implemented by {@link PushTarget} and {@link PullTarget}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Report identity (type, static labels) and a readiness flag.</li>
 *   <li>Expose read-only details for status output.</li>
 *   <li>Release every owned resource on {@link #stop()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All methods may be called from any thread; {@link #stop()} is idempotent.</p>
 *
 * @since 0.1.0
 */
public interface Target {
  /**
   * Returns the target kind.
   *
   * @return type
   */
  TargetType type();

  /**
   * Returns the static labels attached to every entry.
   *
   * @return static labels
   */
  LabelSet labels();

  /**
   * Returns labels discovered for the target itself. gcplog targets discover none.
   *
   * @return discovered labels
   */
  LabelSet discoveredLabels();

  /**
   * Returns whether the target is ready. Per-message failures do not affect readiness; they are visible through
   * error counters.
   *
   * @return readiness flag
   */
  boolean ready();

  /**
   * Returns descriptive details such as listen address or subscription.
   *
   * @return unmodifiable details
   */
  Map<String, String> details();

  /**
   * Stops the target and every resource it owns, returning once background work has quiesced. Idempotent.
   *
   * @throws TargetStopException if a resource failed to release; the others are still released
   */
  void stop();
}
