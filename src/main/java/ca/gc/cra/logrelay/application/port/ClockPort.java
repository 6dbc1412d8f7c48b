package ca.gc.cra.logrelay.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock instants to the entry translator.
 * <p><strong>Why:</strong> Entries that do not use the incoming publish time are stamped at translation; tests
 * inject a fixed clock to make that deterministic.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; push workers and pull consumers read the
 * clock concurrently.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return current wall-clock instant; subject to system clock adjustments
   */
  Instant now();

  /**
   * Returns the current time in epoch seconds.
   *
   * @return seconds since 1970-01-01T00:00:00Z
   */
  default long nowEpochSeconds() {
    return now().getEpochSecond();
  }

  /** Default {@link ClockPort} backed by {@link Instant#now()}. */
  ClockPort SYSTEM = Instant::now;
}
