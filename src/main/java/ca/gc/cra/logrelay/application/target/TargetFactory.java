package ca.gc.cra.logrelay.application.target;

import ca.gc.cra.logrelay.config.TargetConfig;
import java.io.IOException;

/**
 * Creates started targets from job configuration.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TargetFactory {
  /**
   * Creates and starts a target.
   *
   * @param config job configuration
   * @return running target
   * @throws IOException if a listener or subscription cannot be opened
   * @throws IllegalArgumentException if the configuration is invalid for the target
   */
  Target create(TargetConfig config) throws IOException;
}
