package ca.gc.cra.logrelay.api;

/**
 * <strong>What:</strong> Process exit codes returned by the relay CLI.
 * <p><strong>Why:</strong> Lets supervisors tell bad arguments and bad configuration apart from runtime failures.</p>
 * <p><strong>Thread-safety:</strong> Immutable enum.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Clean shutdown, help output, or a successful dry run. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Configuration file or listener socket could not be opened. */
  IO_ERROR(3),
  /** Configuration was missing or invalid. */
  CONFIG_ERROR(4),
  /** A target failed at runtime or did not stop cleanly. */
  RUNTIME_FAILURE(5),
  /** Interrupted while waiting for shutdown. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
