package ca.gc.cra.logrelay.application.target;

import ca.gc.cra.logrelay.config.TargetConfig;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the targets of one relay run.
 *
 * <p>Targets are created in configuration order. If one fails to start, the targets already created are stopped
 * and the failure is rethrown. {@link #stop()} stops every target even when some fail, then rethrows the first
 * failure.</p>
 *
 * @since 0.1.0
 */
public final class TargetManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TargetManager.class);

  private final Map<String, Target> targets;

  private TargetManager(Map<String, Target> targets) {
    this.targets = Collections.unmodifiableMap(targets);
  }

  /**
   * Creates and starts one target per configuration.
   *
   * @param configs job configurations; job names must be unique
   * @param factory target factory
   * @return manager holding the running targets
   * @throws IOException if a target cannot open its listener or subscription
   * @throws IllegalArgumentException if job names repeat or a configuration is rejected
   */
  public static TargetManager start(List<TargetConfig> configs, TargetFactory factory) throws IOException {
    Objects.requireNonNull(configs, "configs");
    Objects.requireNonNull(factory, "factory");
    Set<String> names = new HashSet<>();
    for (TargetConfig config : configs) {
      if (!names.add(config.jobName())) {
        throw new IllegalArgumentException("duplicate job_name: " + config.jobName());
      }
    }

    Map<String, Target> created = new LinkedHashMap<>();
    for (TargetConfig config : configs) {
      try {
        created.put(config.jobName(), factory.create(config));
        log.info("Started {} target {}", config.subscriptionType(), config.jobName());
      } catch (IOException | RuntimeException ex) {
        log.error("Failed to start target {}; stopping {} started targets", config.jobName(), created.size());
        for (Map.Entry<String, Target> entry : created.entrySet()) {
          try {
            entry.getValue().stop();
          } catch (RuntimeException stopFailure) {
            ex.addSuppressed(stopFailure);
          }
        }
        throw ex;
      }
    }
    return new TargetManager(created);
  }

  /**
   * Returns the running targets in configuration order.
   *
   * @return unmodifiable list
   */
  public List<Target> targets() {
    return List.copyOf(targets.values());
  }

  /**
   * Returns the target for a job.
   *
   * @param jobName job name
   * @return target or {@code null}
   */
  public Target target(String jobName) {
    return targets.get(jobName);
  }

  /**
   * Returns the job names in configuration order.
   *
   * @return job names
   */
  public List<String> jobNames() {
    return new ArrayList<>(targets.keySet());
  }

  /**
   * Returns whether at least one target is ready.
   *
   * @return aggregate readiness
   */
  public boolean ready() {
    for (Target target : targets.values()) {
      if (target.ready()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Stops every target.
   *
   * @throws TargetStopException the first failure, with later failures suppressed
   */
  public void stop() {
    RuntimeException failure = null;
    for (Map.Entry<String, Target> entry : targets.entrySet()) {
      try {
        entry.getValue().stop();
      } catch (RuntimeException ex) {
        log.error("Failed to stop target {}", entry.getKey(), ex);
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
