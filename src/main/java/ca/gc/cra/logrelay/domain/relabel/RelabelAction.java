package ca.gc.cra.logrelay.domain.relabel;

import java.util.Locale;

/**
 * Actions supported by {@link RelabelRule}, mirroring the Prometheus relabel vocabulary.
 *
 * @since 0.1.0
 */
public enum RelabelAction {
  /** Writes the expanded replacement into the target label when the regex matches. */
  REPLACE,
  /** Drops the entry unless the joined source values match. */
  KEEP,
  /** Drops the entry when the joined source values match. */
  DROP,
  /** Writes {@code md5(value) mod modulus} into the target label. */
  HASHMOD,
  /** Copies every label whose name matches to a name built from the replacement. */
  LABELMAP,
  /** Removes every label whose name matches. */
  LABELDROP,
  /** Removes every label whose name does not match. */
  LABELKEEP,
  /** Writes the lower-cased joined source values into the target label. */
  LOWERCASE,
  /** Writes the upper-cased joined source values into the target label. */
  UPPERCASE;

  /**
   * Parses a configuration token such as {@code "labeldrop"}.
   *
   * @param raw action name; {@code null} or blank selects {@link #REPLACE}
   * @return matching action
   * @throws IllegalArgumentException when the action is unknown
   */
  public static RelabelAction from(String raw) {
    if (raw == null || raw.isBlank()) {
      return REPLACE;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown relabel action: " + raw, ex);
    }
  }

  boolean requiresTargetLabel() {
    return switch (this) {
      case REPLACE, HASHMOD, LOWERCASE, UPPERCASE -> true;
      default -> false;
    };
  }

  /** Actions whose target label is used as written, without {@code $n} expansion. */
  boolean writesLiteralTargetLabel() {
    return switch (this) {
      case HASHMOD, LOWERCASE, UPPERCASE -> true;
      default -> false;
    };
  }
}
