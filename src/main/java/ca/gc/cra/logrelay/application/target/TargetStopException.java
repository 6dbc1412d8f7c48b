package ca.gc.cra.logrelay.application.target;

/**
 * Raised when a target could not release one of its resources during stop. The remaining resources have been
 * released by the time it is thrown.
 *
 * @since 0.1.0
 */
public class TargetStopException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception.
   *
   * @param message description naming the target
   * @param cause first failure observed
   */
  public TargetStopException(String message, Throwable cause) {
    super(message, cause);
  }
}
