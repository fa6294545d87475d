package ca.gc.cra.xssbench.api;

import ca.gc.cra.xssbench.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 *
 * <p>List-valued keys may be repeated ({@code vectors=a.json vectors=b.json}); their values are joined with
 * commas. Repeating any other key is an error. Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Converts command-line arguments into a mutable map; no key may repeat.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map keyed by the argument prefix prior to the first {@code '='}
   */
  public static Map<String, String> toMap(String[] args) {
    return toMap(args, Set.of());
  }

  /**
   * Converts command-line arguments into a mutable map split on the first {@code '='}.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @param listKeys keys whose repeated occurrences are joined with commas
   * @return mutable map in first-seen key order
   * @throws IllegalArgumentException when an argument is malformed or a scalar key repeats
   */
  public static Map<String, String> toMap(String[] args, Set<String> listKeys) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      validateKey(key);
      validateValue(key, value);
      String previous = map.get(key);
      if (previous == null) {
        map.put(key, value);
      } else if (listKeys.contains(key)) {
        map.put(key, previous.isEmpty() ? value : previous + "," + value);
      } else {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }

  private static void validateKey(String key) {
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
  }

  private static void validateValue(String key, String value) {
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
    }
    // Blank values reset a key to its default.
    if (!value.isEmpty()) {
      Strings.requireNonBlank(key, value);
    }
  }
}
