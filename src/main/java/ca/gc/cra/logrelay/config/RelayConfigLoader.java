package ca.gc.cra.logrelay.config;

import ca.gc.cra.logrelay.domain.entry.LabelSet;
import ca.gc.cra.logrelay.domain.relabel.RelabelRule;
import ca.gc.cra.logrelay.validation.Numbers;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the relay YAML document into a validated {@link RelayConfig}.
 *
 * <p>Keys use snake case. Unknown keys are ignored; missing keys take their documented defaults.</p>
 */
public final class RelayConfigLoader {

  private RelayConfigLoader() {}

  /**
   * Loads configuration from {@code path}.
   *
   * @param path location of the YAML document
   * @return validated configuration
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is invalid
   */
  public static RelayConfig load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  /**
   * Parses configuration from a YAML string.
   *
   * @param yaml YAML document
   * @return validated configuration
   * @throws IllegalArgumentException when the document is invalid
   */
  public static RelayConfig parse(String yaml) {
    Objects.requireNonNull(yaml, "yaml");
    return parse(new StringReader(yaml), "<inline>");
  }

  private static RelayConfig parse(Reader reader, String source) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + source, ex);
    }
    if (document == null) {
      throw new IllegalArgumentException("config " + source + " is empty");
    }
    Map<String, Object> root = asMap(document, "root");

    Map<String, Object> metrics = optionalMap(root.get("metrics"), "metrics");
    Optional<String> exporter = optionalString(metrics.get("exporter"));
    Optional<String> endpoint = optionalString(metrics.get("endpoint"));

    SinkConfig sink = parseSink(optionalMap(root.get("sink"), "sink"));

    List<TargetConfig> targets = new ArrayList<>();
    List<Object> targetNodes = asList(root.get("targets"), "targets");
    for (int i = 0; i < targetNodes.size(); i++) {
      targets.add(parseTarget(asMap(targetNodes.get(i), "targets[" + i + "]"), "targets[" + i + "]"));
    }
    if (targets.isEmpty()) {
      throw new IllegalArgumentException("targets must contain at least one job");
    }
    return new RelayConfig(exporter, endpoint, sink, targets);
  }

  private static SinkConfig parseSink(Map<String, Object> section) {
    return new SinkConfig(
        SinkConfig.Type.fromString(stringValue(section.get("type"))),
        optionalString(section.get("kafka_bootstrap")),
        optionalString(section.get("topic")).orElse(SinkConfig.DEFAULT_TOPIC),
        (int) longValue(section.get("queue_capacity"), "sink.queue_capacity", SinkConfig.DEFAULT_QUEUE_CAPACITY));
  }

  private static TargetConfig parseTarget(Map<String, Object> node, String context) {
    String jobName = stringValue(node.get("job_name"));
    if (jobName == null) {
      throw new IllegalArgumentException(context + ".job_name is required");
    }
    String prefix = "targets[" + jobName + "].gcplog";
    Map<String, Object> gcplog = asMap(node.get("gcplog"), prefix);
    SubscriptionType type = SubscriptionType.fromString(stringValue(gcplog.get("subscription_type")));
    ServerOptions server = null;
    if (type == SubscriptionType.PUSH) {
      server = parseServer(optionalMap(gcplog.get("server"), prefix + ".server"), prefix + ".server");
    }

    return new TargetConfig(
        jobName,
        type,
        parseLabels(optionalMap(gcplog.get("labels"), prefix + ".labels"), prefix + ".labels"),
        booleanValue(gcplog.get("use_incoming_timestamp"), prefix + ".use_incoming_timestamp"),
        parseRelabelRules(node.get("relabel_configs"), "targets[" + jobName + "].relabel_configs"),
        stringValue(gcplog.get("project_id")),
        stringValue(gcplog.get("subscription")),
        optionalString(gcplog.get("emulator_host")),
        longValue(gcplog.get("max_outstanding_messages"), prefix + ".max_outstanding_messages",
            TargetConfig.DEFAULT_MAX_OUTSTANDING_MESSAGES),
        (int) longValue(gcplog.get("parallel_pull_count"), prefix + ".parallel_pull_count",
            TargetConfig.DEFAULT_PARALLEL_PULL_COUNT),
        server);
  }

  private static ServerOptions parseServer(Map<String, Object> section, String context) {
    Object grace = section.get("graceful_shutdown_timeout");
    Duration gracefulShutdown = grace == null
        ? ServerOptions.DEFAULT_GRACEFUL_SHUTDOWN
        : Numbers.parseDuration(context + ".graceful_shutdown_timeout", grace.toString());
    return new ServerOptions(
        optionalString(section.get("http_listen_address")).orElse(ServerOptions.DEFAULT_LISTEN_ADDRESS),
        (int) longValue(section.get("http_listen_port"), context + ".http_listen_port",
            ServerOptions.DEFAULT_LISTEN_PORT),
        optionalString(section.get("http_path")).orElse(ServerOptions.DEFAULT_PATH),
        (int) longValue(section.get("worker_threads"), context + ".worker_threads",
            ServerOptions.DEFAULT_WORKER_THREADS),
        (int) longValue(section.get("max_body_bytes"), context + ".max_body_bytes",
            ServerOptions.DEFAULT_MAX_BODY_BYTES),
        gracefulShutdown);
  }

  private static LabelSet parseLabels(Map<String, Object> section, String context) {
    LabelSet.Builder builder = LabelSet.builder();
    for (Map.Entry<String, Object> entry : section.entrySet()) {
      if (!LabelSet.isValidName(entry.getKey())) {
        throw new IllegalArgumentException(context + " has invalid label name '" + entry.getKey() + "'");
      }
      builder.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue().toString());
    }
    return builder.build();
  }

  private static List<RelabelRule> parseRelabelRules(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    List<Object> items = asList(node, context);
    List<RelabelRule> rules = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      String itemContext = context + "[" + i + "]";
      Map<String, Object> rule = asMap(items.get(i), itemContext);
      List<String> sourceLabels = new ArrayList<>();
      Object sources = rule.get("source_labels");
      if (sources != null) {
        for (Object source : asList(sources, itemContext + ".source_labels")) {
          sourceLabels.add(String.valueOf(source));
        }
      }
      try {
        rules.add(RelabelRule.compile(
            sourceLabels,
            rawString(rule.get("separator")),
            rawString(rule.get("regex")),
            longValue(rule.get("modulus"), itemContext + ".modulus", 0),
            stringValue(rule.get("target_label")),
            rawString(rule.get("replacement")),
            stringValue(rule.get("action"))));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(itemContext + ": " + ex.getMessage(), ex);
      }
    }
    return rules;
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Map<String, Object> optionalMap(Object node, String context) {
    return node == null ? Map.of() : asMap(node, context);
  }

  private static List<Object> asList(Object node, String context) {
    if (node == null) {
      throw new IllegalArgumentException(context + " is required");
    }
    if (!(node instanceof List<?> raw)) {
      throw new IllegalArgumentException(context + " must be a list");
    }
    return new ArrayList<>(raw);
  }

  private static String rawString(Object value) {
    return value == null ? null : value.toString();
  }

  private static String stringValue(Object value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.toString().trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static Optional<String> optionalString(Object value) {
    return Optional.ofNullable(stringValue(value));
  }

  private static long longValue(Object value, String context, long defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.longValue();
    }
    return Numbers.parseLong(context, value.toString());
  }

  private static boolean booleanValue(Object value, String context) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean bool) {
      return bool;
    }
    String text = value.toString().trim();
    if ("true".equalsIgnoreCase(text)) {
      return true;
    }
    if ("false".equalsIgnoreCase(text)) {
      return false;
    }
    throw new IllegalArgumentException(context + " must be true or false (was " + text + ")");
  }
}
