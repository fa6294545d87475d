package ca.gc.cra.xssbench.config;

import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import ca.gc.cra.xssbench.validation.Numbers;
import ca.gc.cra.xssbench.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Captures configuration for one benchmark run.
 * <p><strong>Why:</strong> Consolidates CLI arguments, the YAML file and embedded defaults so a run is fully
 * described before any browser starts.</p>
 * <p><strong>Role:</strong> Configuration aggregate for the {@code run} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse numeric, boolean and list values from the merged flat map.</li>
 *   <li>Enforce ranges so the orchestrator never sees a negative timeout or zero workers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param vectorFiles explicit vector files; empty means every {@code *.json} under {@link #vectorDirectory()}
 * @param sanitizers sanitizer names; empty selects the catalog defaults
 * @param browsers engines to run in
 * @param timeoutMs fixed per-case wait window; empty selects the adaptive window
 * @param workers requested worker threads; more than one selects parallel mode
 * @param workerTaskTimeoutSec parallel stall window in seconds; {@code 0} disables the watchdog
 * @param progressEvery progress cadence in cases; {@code 1} prints one character per case, {@code 0} disables
 * @param failFast stop at the first executed case
 * @param noProgress suppress progress output entirely
 * @param jsonOut optional JSON results destination
 * @param headless launch browsers without a visible window
 * @param actionTimeoutMs cap for browser navigation, click and evaluation calls
 * @param dryRun validate and print the plan without launching browsers
 * @since 0.1.0
 */
public record BenchConfig(
    List<Path> vectorFiles,
    List<String> sanitizers,
    List<BrowserEngine> browsers,
    OptionalLong timeoutMs,
    int workers,
    long workerTaskTimeoutSec,
    int progressEvery,
    boolean failFast,
    boolean noProgress,
    Optional<Path> jsonOut,
    boolean headless,
    long actionTimeoutMs,
    boolean dryRun) {

  static final int DEFAULT_WORKERS = 1;
  static final long DEFAULT_WORKER_TASK_TIMEOUT_SEC = 3_600;
  static final int DEFAULT_PROGRESS_EVERY = 25;
  static final long DEFAULT_ACTION_TIMEOUT_MS = 5_000;

  static final int MAX_WORKERS = 256;
  static final long MAX_TIMEOUT_MS = 600_000;
  static final long MAX_WORKER_TASK_TIMEOUT_SEC = 7 * 24 * 3_600;
  static final int MAX_PROGRESS_EVERY = 1_000_000;

  private static final Path DEFAULT_VECTOR_DIRECTORY = Path.of("vectors");

  public BenchConfig {
    vectorFiles = List.copyOf(Objects.requireNonNull(vectorFiles, "vectorFiles"));
    sanitizers = List.copyOf(Objects.requireNonNull(sanitizers, "sanitizers"));
    browsers = List.copyOf(Objects.requireNonNull(browsers, "browsers"));
    timeoutMs = Objects.requireNonNullElse(timeoutMs, OptionalLong.empty());
    jsonOut = Objects.requireNonNullElse(jsonOut, Optional.empty());
    if (browsers.isEmpty()) {
      throw new IllegalArgumentException("browser must name at least one engine");
    }
    if (timeoutMs.isPresent()) {
      Numbers.requireRange("timeoutMs", timeoutMs.getAsLong(), 0, MAX_TIMEOUT_MS);
    }
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    Numbers.requireRange("workerTaskTimeoutSec", workerTaskTimeoutSec, 0, MAX_WORKER_TASK_TIMEOUT_SEC);
    Numbers.requireRange("progressEvery", progressEvery, 0, MAX_PROGRESS_EVERY);
    Numbers.requireRange("actionTimeoutMs", actionTimeoutMs, 1, MAX_TIMEOUT_MS);
  }

  /**
   * Builds a configuration from a merged flat map, as produced by {@link ConfigMerger}.
   *
   * @param input key/value configuration; missing keys fall back to the embedded defaults
   * @return validated configuration
   * @throws IllegalArgumentException when a value cannot be parsed or is out of range
   */
  public static BenchConfig fromMap(Map<String, String> input) {
    Objects.requireNonNull(input, "input");
    Map<String, String> defaults = DefaultsForMode.asFlatMap(DefaultsForMode.RUN);

    List<Path> vectorFiles = new ArrayList<>();
    for (String entry : Strings.splitCsv("vectors", value(input, defaults, "vectors"))) {
      vectorFiles.add(toPath("vectors", entry));
    }
    List<String> sanitizers = Strings.splitCsv("sanitizers", value(input, defaults, "sanitizers"));
    List<BrowserEngine> browsers = BrowserEngine.parseList(value(input, defaults, "browser"));

    String timeout = value(input, defaults, "timeoutMs");
    OptionalLong timeoutMs = timeout.isBlank()
        ? OptionalLong.empty()
        : OptionalLong.of(Numbers.parseRange("timeoutMs", timeout, 0, MAX_TIMEOUT_MS));

    String jsonOutRaw = value(input, defaults, "jsonOut");
    Optional<Path> jsonOut = jsonOutRaw.isBlank()
        ? Optional.empty()
        : Optional.of(toPath("jsonOut", jsonOutRaw.trim()));

    return new BenchConfig(
        vectorFiles,
        sanitizers,
        browsers,
        timeoutMs,
        (int) Numbers.parseRange("workers", value(input, defaults, "workers"), 1, MAX_WORKERS),
        Numbers.parseRange("workerTaskTimeoutSec", value(input, defaults, "workerTaskTimeoutSec"),
            0, MAX_WORKER_TASK_TIMEOUT_SEC),
        (int) Numbers.parseRange("progressEvery", value(input, defaults, "progressEvery"), 0, MAX_PROGRESS_EVERY),
        parseBoolean("failFast", value(input, defaults, "failFast")),
        parseBoolean("noProgress", value(input, defaults, "noProgress")),
        jsonOut,
        parseBoolean("headless", value(input, defaults, "headless")),
        Numbers.parseRange("actionTimeoutMs", value(input, defaults, "actionTimeoutMs"), 1, MAX_TIMEOUT_MS),
        parseBoolean("dryRun", value(input, defaults, "dryRun")));
  }

  /**
   * Directory searched for vector files when none are listed.
   *
   * @return {@code ./vectors}
   */
  public Path vectorDirectory() {
    return DEFAULT_VECTOR_DIRECTORY;
  }

  /**
   * Progress cadence actually applied, folding {@link #noProgress()} in.
   *
   * @return {@code 0} when progress is suppressed, otherwise {@link #progressEvery()}
   */
  public int effectiveProgressEvery() {
    return noProgress ? 0 : progressEvery;
  }

  private static String value(Map<String, String> input, Map<String, String> defaults, String key) {
    String raw = input.get(key);
    return raw == null ? defaults.getOrDefault(key, "") : raw;
  }

  private static Path toPath(String key, String raw) {
    try {
      return Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " contains an invalid path: " + raw, ex);
    }
  }

  private static boolean parseBoolean(String key, String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0", "" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw.trim() + "')");
    };
  }
}
