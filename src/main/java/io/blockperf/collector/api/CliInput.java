package io.blockperf.collector.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line arguments split into bare flags ({@code --dry-run}) and {@code key=value} settings.
 *
 * <p>Help and verbose flags are recognised in their short and long spellings and normalized to {@code --help} and
 * {@code --verbose}. Any other token starting with {@code -} and containing no {@code =} is a flag; everything else
 * is left for {@link CliArgsParser}.</p>
 */
public final class CliInput {
  private static final Map<String, String> ALIASES = Map.of(
      "-h", "--help",
      "help", "--help",
      "--help", "--help",
      "-v", "--verbose",
      "--debug", "--verbose",
      "--verbose", "--verbose");

  private final List<String> settings;
  private final Set<String> flags;

  private CliInput(List<String> settings, Set<String> flags) {
    this.settings = List.copyOf(settings);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Splits raw arguments.
   *
   * @param args raw arguments; {@code null} and blank entries are skipped
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        String lower = arg.toLowerCase(Locale.ROOT);
        String alias = ALIASES.get(lower);
        if (alias != null) {
          flags.add(alias);
        } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
          flags.add(lower);
        } else {
          settings.add(arg);
        }
      }
    }
    return new CliInput(settings, flags);
  }

  /** Tokens left for {@code key=value} parsing (the first may be a command name). */
  public String[] keyValueArgs() {
    return settings.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Tests for a flag, ignoring case.
   *
   * @param flag flag such as {@code --dry-run}
   * @return {@code true} when supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns flags other than the ones listed.
   *
   * @param known flags the caller understands, besides help and verbose
   * @return unrecognised flags in command-line order
   */
  public List<String> unknownFlags(String... known) {
    Set<String> accepted = new LinkedHashSet<>(Arrays.asList(known));
    accepted.add("--help");
    accepted.add("--verbose");
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!accepted.contains(flag)) {
        unknown.add(flag);
      }
    }
    return unknown;
  }
}
