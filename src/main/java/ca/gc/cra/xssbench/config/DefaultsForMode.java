package ca.gc.cra.xssbench.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each benchmark command.
 *
 * <p>The defaults are also the set of keys a command accepts; {@link ConfigMerger} rejects anything else.</p>
 */
public final class DefaultsForMode {
  /** Mode name of the benchmark run command. */
  public static final String RUN = "run";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target command, currently only {@code run}
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case RUN -> buildRunDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRunDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("vectors", "");
    map.put("sanitizers", "");
    map.put("browser", "all");
    map.put("timeoutMs", "");
    map.put("workers", Integer.toString(BenchConfig.DEFAULT_WORKERS));
    map.put("workerTaskTimeoutSec", Long.toString(BenchConfig.DEFAULT_WORKER_TASK_TIMEOUT_SEC));
    map.put("progressEvery", Integer.toString(BenchConfig.DEFAULT_PROGRESS_EVERY));
    map.put("failFast", "false");
    map.put("noProgress", "false");
    map.put("jsonOut", "");
    map.put("headless", "true");
    map.put("actionTimeoutMs", Long.toString(BenchConfig.DEFAULT_ACTION_TIMEOUT_MS));
    map.put("dryRun", "false");
    return map;
  }
}
