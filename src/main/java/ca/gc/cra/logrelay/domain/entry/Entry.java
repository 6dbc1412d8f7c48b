package ca.gc.cra.logrelay.domain.entry;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Normalized log line produced by the ingestion targets.
 * <p><strong>Why:</strong> The downstream pipeline consumes one transport-neutral shape regardless of push or pull delivery.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param labels labels describing the stream this line belongs to; never {@code null}
 * @param timestamp instant the line is attributed to; never {@code null}
 * @param line decoded log text; never {@code null}
 * @since 0.1.0
 */
public record Entry(LabelSet labels, Instant timestamp, String line) {

  /**
   * Validates the record components.
   *
   * @throws NullPointerException if any component is {@code null}
   */
  public Entry {
    Objects.requireNonNull(labels, "labels");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(line, "line");
  }
}
