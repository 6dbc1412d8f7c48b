package ca.gc.cra.logrelay.api;

import ca.gc.cra.logrelay.application.target.TargetManager;
import ca.gc.cra.logrelay.application.target.TargetStopException;
import ca.gc.cra.logrelay.application.util.CancellationSignal;
import ca.gc.cra.logrelay.config.CompositionRoot;
import ca.gc.cra.logrelay.config.RelayConfig;
import ca.gc.cra.logrelay.config.RelayConfigLoader;
import ca.gc.cra.logrelay.config.SubscriptionType;
import ca.gc.cra.logrelay.config.TargetConfig;
import ca.gc.cra.logrelay.logging.LoggingConfigurator;
import ca.gc.cra.logrelay.logging.Logs;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the relay: loads the YAML config, starts every target, and stops them on SIGTERM or SIGINT.
 *
 * @since 0.1.0
 */
public final class RelayCli {
  private static final Logger log = LoggerFactory.getLogger(RelayCli.class);
  private static final long SHUTDOWN_HOOK_WAIT_SECONDS = 30L;
  private static final String SUMMARY_USAGE =
      "usage: logrelay config=PATH [metricsExporter=otlp|none] [otelEndpoint=URL] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      logrelay: Pub/Sub log ingestion relay

      Usage:
        logrelay config=PATH [options]

      Required:
        config=PATH                 YAML file with sink and targets sections

      Optional:
        metricsExporter=otlp|none   Metrics exporter (overrides metrics.exporter)
        otelEndpoint=URL            OTLP endpoint (overrides metrics.endpoint)
        --dry-run                   Validate the config and print the targets without starting them
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Environment:
        PUBSUB_EMULATOR_HOST        Route pull targets to a Pub/Sub emulator
      """;

  private RelayCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs until the JVM receives a termination signal.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    return run(args, new CancellationSignal(), true);
  }

  /**
   * Runs until {@code shutdown} is cancelled.
   *
   * @param args raw CLI arguments
   * @param shutdown signal that ends the run
   * @param installShutdownHook whether to cancel {@code shutdown} from a JVM shutdown hook
   * @return exit code
   */
  static ExitCode run(String[] args, CancellationSignal shutdown, boolean installShutdownHook) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }
    for (String flag : input.flags()) {
      if (!flag.equals("--help") && !flag.equals("--verbose") && !flag.equals("--dry-run")) {
        log.error("Unknown flag: {}", flag);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
    }

    Path configPath;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      TelemetryConfigurator.configureFromArgs(kv);
      String raw = kv.remove("config");
      if (raw == null) {
        throw new IllegalArgumentException("config=PATH is required");
      }
      if (!kv.isEmpty()) {
        throw new IllegalArgumentException("unknown argument(s): " + kv.keySet());
      }
      configPath = Path.of(raw);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    RelayConfig config;
    try {
      config = RelayConfigLoader.load(configPath);
      TelemetryConfigurator.configureFromFile(config);
    } catch (IOException ex) {
      log.error("Unable to read config {}: {}", configPath, ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid config {}: {}", configPath, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    if (input.hasFlag("--dry-run")) {
      CliPrinter.printLines(dryRunPlan(config));
      return ExitCode.SUCCESS;
    }
    return serve(config, shutdown, installShutdownHook);
  }

  private static ExitCode serve(RelayConfig config, CancellationSignal shutdown, boolean installShutdownHook) {
    CountDownLatch stopped = new CountDownLatch(1);
    Thread hook = null;
    if (installShutdownHook) {
      hook = new Thread(() -> {
        shutdown.cancel();
        try {
          if (!stopped.await(SHUTDOWN_HOOK_WAIT_SECONDS, TimeUnit.SECONDS)) {
            log.warn("Targets did not stop within {}s of the termination signal", SHUTDOWN_HOOK_WAIT_SECONDS);
          }
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      }, "logrelay-shutdown");
      Runtime.getRuntime().addShutdownHook(hook);
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      TargetManager manager;
      try {
        manager = root.startTargets();
      } catch (IOException ex) {
        log.error("Failed to start targets: {}", ex.getMessage(), ex);
        return ExitCode.IO_ERROR;
      } catch (IllegalArgumentException ex) {
        log.error("Invalid target configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      }
      log.info("Relay running with {} target(s): {}", manager.targets().size(), manager.jobNames());

      ExitCode exit = ExitCode.SUCCESS;
      try {
        shutdown.awaitCancelled();
        log.info("Shutdown requested; stopping targets");
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while running; stopping targets");
        exit = ExitCode.INTERRUPTED;
      }
      try {
        manager.stop();
      } catch (TargetStopException ex) {
        log.error("Targets did not stop cleanly", ex);
        exit = ExitCode.RUNTIME_FAILURE;
      }
      return exit;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      stopped.countDown();
      if (hook != null && !shutdown.isCancelled()) {
        removeHook(hook);
      }
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook left in place");
    }
  }

  static List<String> dryRunPlan(RelayConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("Relay dry-run: no targets will be started.");
    lines.add(" Sink             : " + config.sink().type().name().toLowerCase(Locale.ROOT)
        + config.sink().kafkaBootstrap().map(b -> " (" + b + ", topic " + config.sink().topic() + ")").orElse(""));
    lines.add(" Queue capacity   : " + config.sink().queueCapacity());
    lines.add(" Metrics exporter : " + config.metricsExporter().orElse("<default>"));
    lines.add(" Metrics endpoint : " + config.metricsEndpoint().map(Logs::redactUserInfo).orElse("<default>"));
    for (TargetConfig target : config.targets()) {
      lines.add(" Target           : " + target.jobName() + " " + describe(target));
    }
    lines.add(" Re-run without --dry-run to start the relay.");
    return lines;
  }

  private static String describe(TargetConfig target) {
    if (target.subscriptionType() == SubscriptionType.PUSH) {
      return "push " + target.server().listenAddress() + ":" + target.server().listenPort() + target.server().path();
    }
    return "pull projects/" + target.projectId() + "/subscriptions/" + target.subscription()
        + target.emulatorHost().map(h -> " via emulator " + h).orElse("");
  }
}
