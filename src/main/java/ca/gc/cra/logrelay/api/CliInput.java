package ca.gc.cra.logrelay.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * CLI arguments split into flags and {@code key=value} pairs.
 */
final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_FLAGS.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(List.copyOf(kv), Set.copyOf(flags));
  }

  String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  boolean help() {
    return flags.contains("--help");
  }

  boolean verbose() {
    return flags.contains("--verbose");
  }

  boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  Set<String> flags() {
    return flags;
  }
}
