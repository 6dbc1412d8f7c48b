package ca.gc.cra.logrelay.domain.entry;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Immutable set of {@code name=value} labels attached to log entries.
 * <p><strong>Why:</strong> Gives translators, relabel rules, and sinks one canonical label representation.</p>
 * <p><strong>Role:</strong> Domain value object.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep labels unique by name and ordered lexicographically by name.</li>
 *   <li>Validate label names against {@code [a-zA-Z_][a-zA-Z0-9_]*}.</li>
 *   <li>Render a stable fingerprint used as a partitioning key downstream.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads.</p>
 *
 * @since 0.1.0
 */
public final class LabelSet {
  /** Prefix reserved for labels discovered from the transport; stripped before entries leave the translator. */
  public static final String INTERNAL_PREFIX = "__";

  private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
  private static final LabelSet EMPTY = new LabelSet(new TreeMap<>());

  private final SortedMap<String, String> labels;

  private LabelSet(SortedMap<String, String> labels) {
    this.labels = Collections.unmodifiableSortedMap(labels);
  }

  /**
   * Returns the shared empty label set.
   *
   * @return empty label set
   */
  public static LabelSet empty() {
    return EMPTY;
  }

  /**
   * Creates a label set from the supplied map.
   *
   * @param labels name to value mapping; must not be {@code null}
   * @return immutable label set
   * @throws IllegalArgumentException if a name is invalid or a value is {@code null}
   */
  public static LabelSet of(Map<String, String> labels) {
    Objects.requireNonNull(labels, "labels");
    Builder builder = builder();
    labels.forEach(builder::put);
    return builder.build();
  }

  /**
   * Convenience factory for a single label.
   *
   * @param name label name
   * @param value label value
   * @return immutable label set holding one label
   */
  public static LabelSet of(String name, String value) {
    return builder().put(name, value).build();
  }

  /**
   * Creates an empty builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder(new TreeMap<>());
  }

  /**
   * Reports whether {@code name} is a syntactically valid label name.
   *
   * @param name candidate name; {@code null} is invalid
   * @return {@code true} when the name matches {@code [a-zA-Z_][a-zA-Z0-9_]*}
   */
  public static boolean isValidName(String name) {
    return name != null && NAME_PATTERN.matcher(name).matches();
  }

  /**
   * Returns a builder seeded with this set's labels.
   *
   * @return builder containing a copy of the labels
   */
  public Builder toBuilder() {
    return new Builder(new TreeMap<>(labels));
  }

  /**
   * Returns the value for {@code name}.
   *
   * @param name label name
   * @return label value, or {@code null} when absent
   */
  public String get(String name) {
    return labels.get(name);
  }

  /**
   * Returns the value for {@code name}, or the empty string when absent (Prometheus semantics).
   *
   * @param name label name
   * @return label value or {@code ""}
   */
  public String getOrEmpty(String name) {
    return labels.getOrDefault(name, "");
  }

  public boolean contains(String name) {
    return labels.containsKey(name);
  }

  public int size() {
    return labels.size();
  }

  public boolean isEmpty() {
    return labels.isEmpty();
  }

  public Set<String> names() {
    return labels.keySet();
  }

  /**
   * Returns an unmodifiable, name-ordered view of the labels.
   *
   * @return label map view
   */
  public Map<String, String> asMap() {
    return labels;
  }

  /**
   * Returns a copy of this set without labels that start with {@link #INTERNAL_PREFIX}.
   *
   * @return label set holding only public labels
   */
  public LabelSet withoutInternal() {
    Builder builder = builder();
    labels.forEach((name, value) -> {
      if (!name.startsWith(INTERNAL_PREFIX)) {
        builder.put(name, value);
      }
    });
    return builder.build();
  }

  /**
   * Renders the labels as {@code {a="x", b="y"}}; stable for equal sets.
   *
   * @return fingerprint string
   */
  public String fingerprint() {
    StringBuilder sb = new StringBuilder(16 + labels.size() * 24).append('{');
    boolean first = true;
    for (Map.Entry<String, String> label : labels.entrySet()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(label.getKey()).append("=\"");
      appendEscaped(sb, label.getValue());
      sb.append('"');
    }
    return sb.append('}').toString();
  }

  private static void appendEscaped(StringBuilder sb, String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '"' -> sb.append("\\\"");
        case '\n' -> sb.append("\\n");
        default -> sb.append(c);
      }
    }
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof LabelSet that && labels.equals(that.labels);
  }

  @Override
  public int hashCode() {
    return labels.hashCode();
  }

  @Override
  public String toString() {
    return fingerprint();
  }

  /**
   * Mutable builder for {@link LabelSet}; not thread-safe.
   */
  public static final class Builder {
    private final SortedMap<String, String> labels;

    private Builder(SortedMap<String, String> labels) {
      this.labels = labels;
    }

    /**
     * Sets a label, replacing any previous value.
     *
     * @param name label name; must be valid
     * @param value label value; must not be {@code null}
     * @return this builder
     */
    public Builder put(String name, String value) {
      if (!isValidName(name)) {
        throw new IllegalArgumentException("invalid label name: " + name);
      }
      labels.put(name, Objects.requireNonNull(value, () -> "value for label " + name));
      return this;
    }

    /**
     * Copies every label of {@code other}, overriding existing names.
     *
     * @param other labels to merge
     * @return this builder
     */
    public Builder putAll(LabelSet other) {
      labels.putAll(other.labels);
      return this;
    }

    public Builder remove(String name) {
      labels.remove(name);
      return this;
    }

    public String get(String name) {
      return labels.get(name);
    }

    public boolean contains(String name) {
      return labels.containsKey(name);
    }

    /**
     * Returns the label names currently held, as a snapshot.
     *
     * @return copy of the names
     */
    public Set<String> names() {
      return Set.copyOf(labels.keySet());
    }

    public LabelSet build() {
      if (labels.isEmpty()) {
        return EMPTY;
      }
      return new LabelSet(new TreeMap<>(labels));
    }
  }
}
