package ca.gc.cra.logrelay.domain.relabel;

import ca.gc.cra.logrelay.domain.entry.LabelSet;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * <strong>What:</strong> One compiled relabel rule.
 * <p><strong>Why:</strong> Lets operators derive, rename, or filter labels before entries reach the sink.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the compiled {@link Pattern} is safe to share.</p>
 *
 * @param sourceLabels labels whose values are joined with {@code separator} to form the match input
 * @param separator separator placed between source label values
 * @param regex anchored pattern matched against the joined values (or label names for label* actions)
 * @param modulus modulus for {@link RelabelAction#HASHMOD}; ignored otherwise
 * @param targetLabel label written by replace-style actions; may contain {@code $n} references for replace
 * @param replacement replacement template with {@code $n}, {@code ${n}}, and {@code ${name}} references
 * @param action rule action
 * @since 0.1.0
 */
public record RelabelRule(
    List<String> sourceLabels,
    String separator,
    Pattern regex,
    long modulus,
    String targetLabel,
    String replacement,
    RelabelAction action) {

  public static final String DEFAULT_SEPARATOR = ";";
  public static final String DEFAULT_REGEX = "(.*)";
  public static final String DEFAULT_REPLACEMENT = "$1";

  /**
   * Validates the rule components.
   *
   * @throws IllegalArgumentException if the action requirements are not met
   */
  public RelabelRule {
    sourceLabels = List.copyOf(Objects.requireNonNull(sourceLabels, "sourceLabels"));
    Objects.requireNonNull(separator, "separator");
    Objects.requireNonNull(regex, "regex");
    Objects.requireNonNull(replacement, "replacement");
    Objects.requireNonNull(action, "action");
    targetLabel = targetLabel == null ? "" : targetLabel;
    if (action.requiresTargetLabel() && targetLabel.isEmpty()) {
      throw new IllegalArgumentException("relabel action " + action + " requires target_label");
    }
    if (action.writesLiteralTargetLabel() && !LabelSet.isValidName(targetLabel)) {
      throw new IllegalArgumentException("relabel action " + action + " has invalid target_label: " + targetLabel);
    }
    if (action == RelabelAction.HASHMOD && modulus <= 0) {
      throw new IllegalArgumentException("relabel action HASHMOD requires a positive modulus");
    }
  }

  /**
   * Compiles a rule from raw configuration values, applying Prometheus defaults for absent fields.
   *
   * @param sourceLabels source label names; {@code null} means none
   * @param separator separator; {@code null} selects {@code ;}
   * @param regex unanchored expression; {@code null} selects {@code (.*)}
   * @param modulus hashmod modulus; {@code 0} when unused
   * @param targetLabel target label; may be {@code null}
   * @param replacement replacement template; {@code null} selects {@code $1}
   * @param action action name; {@code null} selects {@code replace}
   * @return compiled rule
   * @throws IllegalArgumentException if the regex does not compile or the rule is inconsistent
   */
  public static RelabelRule compile(
      List<String> sourceLabels,
      String separator,
      String regex,
      long modulus,
      String targetLabel,
      String replacement,
      String action) {
    String expression = regex == null ? DEFAULT_REGEX : regex;
    Pattern pattern;
    try {
      pattern = Pattern.compile("^(?:" + expression + ")$");
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException("invalid relabel regex: " + expression, ex);
    }
    return new RelabelRule(
        sourceLabels == null ? List.of() : sourceLabels,
        separator == null ? DEFAULT_SEPARATOR : separator,
        pattern,
        modulus,
        targetLabel,
        replacement == null ? DEFAULT_REPLACEMENT : replacement,
        RelabelAction.from(action));
  }
}
