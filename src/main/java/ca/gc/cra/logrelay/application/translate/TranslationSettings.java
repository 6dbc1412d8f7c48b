package ca.gc.cra.logrelay.application.translate;

import ca.gc.cra.logrelay.domain.entry.LabelSet;
import ca.gc.cra.logrelay.domain.relabel.RelabelRule;
import java.util.List;
import java.util.Objects;

/**
 * Per-target translation options.
 *
 * @param staticLabels labels attached to every entry; win over discovered labels on collision
 * @param useIncomingTimestamp whether to stamp entries with the message publish time
 * @param relabelRules rules applied in order after merging labels
 * @since 0.1.0
 */
public record TranslationSettings(
    LabelSet staticLabels, boolean useIncomingTimestamp, List<RelabelRule> relabelRules) {

  public TranslationSettings {
    Objects.requireNonNull(staticLabels, "staticLabels");
    relabelRules = List.copyOf(Objects.requireNonNull(relabelRules, "relabelRules"));
  }

  /**
   * Settings with the given static labels, wall-clock timestamps, and no rules.
   *
   * @param staticLabels static labels
   * @return settings
   */
  public static TranslationSettings of(LabelSet staticLabels) {
    return new TranslationSettings(staticLabels, false, List.of());
  }
}
