package ca.gc.cra.logrelay.domain.relabel;

import ca.gc.cra.logrelay.domain.entry.LabelSet;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Applies {@link RelabelRule}s to a {@link LabelSet}.
 * <p>Stateless and thread-safe. Rules run in order; a {@code keep}/{@code drop} decision ends
 * processing and yields {@link Optional#empty()}.</p>
 *
 * @since 0.1.0
 */
public final class Relabeler {

  private Relabeler() {}

  /**
   * Rewrites {@code labels} with every rule in order.
   *
   * @param labels input labels; must not be {@code null}
   * @param rules ordered rules; must not be {@code null}
   * @return rewritten labels, or empty when a rule dropped the series
   */
  public static Optional<LabelSet> process(LabelSet labels, List<RelabelRule> rules) {
    Objects.requireNonNull(labels, "labels");
    Objects.requireNonNull(rules, "rules");
    if (rules.isEmpty()) {
      return Optional.of(labels);
    }
    LabelSet.Builder builder = labels.toBuilder();
    for (RelabelRule rule : rules) {
      if (!apply(builder, rule)) {
        return Optional.empty();
      }
    }
    return Optional.of(builder.build());
  }

  private static boolean apply(LabelSet.Builder builder, RelabelRule rule) {
    String value = joinSourceValues(builder, rule);
    switch (rule.action()) {
      case DROP -> {
        return !rule.regex().matcher(value).matches();
      }
      case KEEP -> {
        return rule.regex().matcher(value).matches();
      }
      case REPLACE -> replace(builder, rule, value);
      case HASHMOD -> builder.put(rule.targetLabel(), Long.toString(hashMod(value, rule.modulus())));
      case LOWERCASE -> builder.put(rule.targetLabel(), value.toLowerCase(Locale.ROOT));
      case UPPERCASE -> builder.put(rule.targetLabel(), value.toUpperCase(Locale.ROOT));
      case LABELMAP -> {
        for (String name : builder.names()) {
          Matcher matcher = rule.regex().matcher(name);
          if (matcher.matches()) {
            String mapped = expand(matcher, rule.replacement());
            if (LabelSet.isValidName(mapped)) {
              builder.put(mapped, builder.get(name));
            }
          }
        }
      }
      case LABELDROP -> {
        for (String name : builder.names()) {
          if (rule.regex().matcher(name).matches()) {
            builder.remove(name);
          }
        }
      }
      case LABELKEEP -> {
        for (String name : builder.names()) {
          if (!rule.regex().matcher(name).matches()) {
            builder.remove(name);
          }
        }
      }
      default -> throw new IllegalStateException("unhandled relabel action " + rule.action());
    }
    return true;
  }

  private static void replace(LabelSet.Builder builder, RelabelRule rule, String value) {
    Matcher matcher = rule.regex().matcher(value);
    if (!matcher.matches()) {
      return;
    }
    String target = expand(matcher, rule.targetLabel());
    if (!LabelSet.isValidName(target)) {
      return;
    }
    String result = expand(matcher, rule.replacement());
    if (result.isEmpty()) {
      builder.remove(target);
    } else {
      builder.put(target, result);
    }
  }

  private static String joinSourceValues(LabelSet.Builder builder, RelabelRule rule) {
    List<String> sources = rule.sourceLabels();
    if (sources.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < sources.size(); i++) {
      if (i > 0) {
        sb.append(rule.separator());
      }
      String value = builder.get(sources.get(i));
      sb.append(value == null ? "" : value);
    }
    return sb.toString();
  }

  /**
   * Expands {@code $n}, {@code ${n}}, {@code $name}, {@code ${name}}, and {@code $$} in a template.
   * Unknown groups expand to the empty string.
   */
  static String expand(Matcher matcher, String template) {
    if (template.indexOf('$') < 0) {
      return template;
    }
    StringBuilder out = new StringBuilder(template.length() + 16);
    int i = 0;
    while (i < template.length()) {
      char c = template.charAt(i);
      if (c != '$' || i + 1 >= template.length()) {
        out.append(c);
        i++;
        continue;
      }
      char next = template.charAt(i + 1);
      if (next == '$') {
        out.append('$');
        i += 2;
        continue;
      }
      String name;
      if (next == '{') {
        int close = template.indexOf('}', i + 2);
        if (close < 0) {
          out.append(c);
          i++;
          continue;
        }
        name = template.substring(i + 2, close);
        i = close + 1;
      } else {
        int end = i + 1;
        while (end < template.length() && isNameChar(template.charAt(end))) {
          end++;
        }
        if (end == i + 1) {
          out.append(c);
          i++;
          continue;
        }
        name = template.substring(i + 1, end);
        i = end;
      }
      out.append(group(matcher, name));
    }
    return out.toString();
  }

  private static String group(Matcher matcher, String name) {
    if (name.isEmpty()) {
      return "";
    }
    if (name.chars().allMatch(Character::isDigit)) {
      int index = Integer.parseInt(name);
      if (index > matcher.groupCount()) {
        return "";
      }
      String value = matcher.group(index);
      return value == null ? "" : value;
    }
    try {
      String value = matcher.group(name);
      return value == null ? "" : value;
    } catch (IllegalArgumentException noSuchGroup) {
      // unknown named group expands to nothing, as in the Prometheus template language
      return "";
    }
  }

  private static boolean isNameChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  static long hashMod(String value, long modulus) {
    byte[] digest = md5(value.getBytes(StandardCharsets.UTF_8));
    long sum = ByteBuffer.wrap(digest, digest.length - Long.BYTES, Long.BYTES).getLong();
    return Long.remainderUnsigned(sum, modulus);
  }

  private static byte[] md5(byte[] input) {
    try {
      return MessageDigest.getInstance("MD5").digest(input);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("MD5 digest unavailable", ex);
    }
  }
}
