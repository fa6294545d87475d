package ca.gc.cra.xssbench.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parsed representation of CLI arguments split into flags and {@code key=value} tokens.
 *
 * <p>Any token starting with {@code -} and lacking {@code =} is a flag; flags are case-insensitive and stored
 * lowercase. {@code --help}, {@code -h} and {@code help} collapse to {@code --help}; {@code --verbose},
 * {@code -v} and {@code --debug} collapse to {@code --verbose}.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> tokens;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(List<String> tokens, Set<String> flags, boolean help, boolean verbose) {
    this.tokens = tokens;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments into flag and token partitions.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(List.of(), Set.of(), false, false);
    }

    List<String> tokens = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        tokens.add(arg);
      }
    }
    return new CliInput(List.copyOf(tokens), Set.copyOf(flags), help, verbose);
  }

  /**
   * Returns the non-flag tokens in their original order.
   *
   * @return copy of the tokens intended for {@code key=value} parsing or command dispatch
   */
  public String[] keyValueArgs() {
    return tokens.toArray(String[]::new);
  }

  /**
   * Returns the first non-flag token, which the dispatcher reads as the command name.
   *
   * @return command token, or {@code null} when none was given
   */
  public String firstToken() {
    return tokens.isEmpty() ? null : tokens.get(0);
  }

  /**
   * Rebuilds an argument array without the first token, keeping the flags, for delegation to a subcommand.
   *
   * @return remaining tokens followed by the normalized flags
   */
  public String[] withoutFirstToken() {
    List<String> rest = new ArrayList<>(tokens.subList(Math.min(1, tokens.size()), tokens.size()));
    rest.addAll(flags);
    return rest.toArray(String[]::new);
  }

  /**
   * Indicates whether a help flag was supplied.
   *
   * @return {@code true} if help output was requested
   */
  public boolean help() {
    return help;
  }

  /**
   * Indicates whether verbose logging was requested.
   *
   * @return {@code true} when --verbose (or equivalent) was present
   */
  public boolean verbose() {
    return verbose;
  }

  /**
   * Checks whether a normalized flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Lists supplied flags that a command does not understand.
   *
   * @param accepted flags the command handles, besides {@code --help} and {@code --verbose}
   * @return unknown flags in sorted order; empty when all are accepted
   */
  public Set<String> unknownFlags(Set<String> accepted) {
    Set<String> unknown = new TreeSet<>(flags);
    unknown.removeAll(Arrays.asList("--help", "--verbose"));
    unknown.removeAll(accepted);
    return unknown;
  }
}
