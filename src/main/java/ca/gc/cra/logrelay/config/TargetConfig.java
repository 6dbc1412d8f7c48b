package ca.gc.cra.logrelay.config;

import ca.gc.cra.logrelay.application.translate.TranslationSettings;
import ca.gc.cra.logrelay.domain.entry.LabelSet;
import ca.gc.cra.logrelay.domain.relabel.RelabelRule;
import ca.gc.cra.logrelay.validation.Net;
import ca.gc.cra.logrelay.validation.Numbers;
import ca.gc.cra.logrelay.validation.Strings;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable configuration of one gcplog scrape job.
 * <p><strong>Why:</strong> Bundles everything a push or pull target needs so targets never read global state.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Require project and subscription ids for pull targets.</li>
 *   <li>Carry listener options for push targets.</li>
 *   <li>Expose the translation settings shared by both modes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param jobName scrape job name, unique per relay
 * @param subscriptionType delivery mode
 * @param staticLabels labels attached to every entry
 * @param useIncomingTimestamp whether entries use the message publish time
 * @param relabelRules rules applied to every entry
 * @param projectId cloud project id; required for pull
 * @param subscription subscription id; required for pull
 * @param emulatorHost optional Pub/Sub emulator {@code host:port}
 * @param maxOutstandingMessages flow-control limit for pull
 * @param parallelPullCount number of streaming pull connections
 * @param server listener options for push
 * @since 0.1.0
 */
public record TargetConfig(
    String jobName,
    SubscriptionType subscriptionType,
    LabelSet staticLabels,
    boolean useIncomingTimestamp,
    List<RelabelRule> relabelRules,
    String projectId,
    String subscription,
    Optional<String> emulatorHost,
    long maxOutstandingMessages,
    int parallelPullCount,
    ServerOptions server) {

  public static final long DEFAULT_MAX_OUTSTANDING_MESSAGES = 1000;
  public static final int DEFAULT_PARALLEL_PULL_COUNT = 1;

  public TargetConfig {
    jobName = Strings.requireNonBlank("job_name", jobName);
    subscriptionType = Objects.requireNonNullElse(subscriptionType, SubscriptionType.PULL);
    staticLabels = Objects.requireNonNullElse(staticLabels, LabelSet.empty());
    relabelRules = List.copyOf(Objects.requireNonNullElse(relabelRules, List.of()));
    emulatorHost = Objects.requireNonNullElse(emulatorHost, Optional.<String>empty())
        .map(host -> Net.validateHostPort("emulator_host", host));
    Numbers.requireRange("max_outstanding_messages", maxOutstandingMessages, 1, Integer.MAX_VALUE);
    Numbers.requireRange("parallel_pull_count", parallelPullCount, 1, 64);
    server = Objects.requireNonNullElse(server, ServerOptions.defaults());
    if (subscriptionType == SubscriptionType.PULL) {
      projectId = Strings.requireResourceId("project_id", projectId);
      subscription = Strings.requireResourceId("subscription", subscription);
    } else {
      projectId = Objects.requireNonNullElse(Strings.trimToNull(projectId), "");
      subscription = Objects.requireNonNullElse(Strings.trimToNull(subscription), "");
    }
  }

  /**
   * Pull target configuration with default flow control.
   *
   * @param jobName job name
   * @param projectId project id
   * @param subscription subscription id
   * @param staticLabels static labels
   * @return configuration
   */
  public static TargetConfig pull(String jobName, String projectId, String subscription, LabelSet staticLabels) {
    return new TargetConfig(
        jobName,
        SubscriptionType.PULL,
        staticLabels,
        false,
        List.of(),
        projectId,
        subscription,
        Optional.empty(),
        DEFAULT_MAX_OUTSTANDING_MESSAGES,
        DEFAULT_PARALLEL_PULL_COUNT,
        null);
  }

  /**
   * Push target configuration.
   *
   * @param jobName job name
   * @param server listener options
   * @param staticLabels static labels
   * @return configuration
   */
  public static TargetConfig push(String jobName, ServerOptions server, LabelSet staticLabels) {
    return new TargetConfig(
        jobName,
        SubscriptionType.PUSH,
        staticLabels,
        false,
        List.of(),
        null,
        null,
        Optional.empty(),
        DEFAULT_MAX_OUTSTANDING_MESSAGES,
        DEFAULT_PARALLEL_PULL_COUNT,
        server);
  }

  /**
   * Returns a copy with other translation options.
   *
   * @param useIncomingTimestamp whether entries use the publish time
   * @param rules relabel rules
   * @return updated configuration
   */
  public TargetConfig withTranslation(boolean useIncomingTimestamp, List<RelabelRule> rules) {
    return new TargetConfig(
        jobName,
        subscriptionType,
        staticLabels,
        useIncomingTimestamp,
        rules,
        projectId,
        subscription,
        emulatorHost,
        maxOutstandingMessages,
        parallelPullCount,
        server);
  }

  /**
   * Translation settings derived from this job.
   *
   * @return settings
   */
  public TranslationSettings translationSettings() {
    return new TranslationSettings(staticLabels, useIncomingTimestamp, relabelRules);
  }
}
