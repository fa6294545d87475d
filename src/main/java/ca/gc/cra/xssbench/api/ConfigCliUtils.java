package ca.gc.cra.xssbench.api;

import java.util.Map;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the YAML location given as {@code config=}.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when none was given
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Folds a boolean CLI flag into the map, so {@code --fail-fast} and {@code failFast=true} mean the same.
   *
   * @param input parsed CLI input
   * @param args mutable CLI map
   * @param flag flag name such as {@code --fail-fast}
   * @param key configuration key such as {@code failFast}
   */
  static void applyFlag(CliInput input, Map<String, String> args, String flag, String key) {
    if (input.hasFlag(flag)) {
      args.put(key, "true");
    }
  }
}
