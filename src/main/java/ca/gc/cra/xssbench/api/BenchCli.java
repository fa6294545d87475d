package ca.gc.cra.xssbench.api;

import ca.gc.cra.xssbench.application.bench.BenchRequest;
import ca.gc.cra.xssbench.application.port.BrowserLaunchException;
import ca.gc.cra.xssbench.application.port.ClockPort;
import ca.gc.cra.xssbench.config.BenchConfig;
import ca.gc.cra.xssbench.config.CompositionRoot;
import ca.gc.cra.xssbench.config.ConfigMerger;
import ca.gc.cra.xssbench.config.DefaultsForMode;
import ca.gc.cra.xssbench.config.YamlConfigLoader;
import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;
import ca.gc.cra.xssbench.domain.bench.BenchSummary;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import ca.gc.cra.xssbench.domain.vector.Vector;
import ca.gc.cra.xssbench.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for running the sanitizer benchmark.
 *
 * @since 0.1.0
 */
public final class BenchCli {
  private static final Logger log = LoggerFactory.getLogger(BenchCli.class);
  private static final Set<String> FLAGS = Set.of("--fail-fast", "--no-progress", "--dry-run");
  private static final Set<String> LIST_KEYS = Set.of("vectors", "sanitizers");
  private static final String SUMMARY_USAGE =
      "usage: xssbench run [vectors=FILE,...] [sanitizers=NAME,...] [browser=chromium|firefox|webkit|all] "
          + "[timeoutMs=N] [workers=N] [workerTaskTimeoutSec=N] [progressEvery=N] [jsonOut=PATH] "
          + "[config=PATH.yaml] [--fail-fast] [--no-progress] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      xssbench run: execute XSS vectors in real browsers against one or more sanitizers

      Usage:
        xssbench run vectors=./vectors/core.json sanitizers=noop,jsoup browser=chromium [options]

      Inputs:
        vectors=FILE,...         Vector JSON files (default: every *.json under ./vectors)
        sanitizers=NAME,...      Sanitizers to test (default: noop,jsoup; see 'xssbench sanitizers')
        browser=ENGINE           chromium, firefox, webkit or all (default all)
        config=PATH.yaml         YAML file with 'common' and 'run' sections; CLI values win

      Run control:
        timeoutMs=N              Fixed per-case wait window; omit for the adaptive window
        workers=N                Worker threads; more than 1 selects parallel mode (default 1)
        workerTaskTimeoutSec=N   Parallel stall window in seconds, 0 disables (default 3600)
        actionTimeoutMs=N        Cap for browser navigation, click and evaluation (default 5000)
        headless=true|false      Run browsers headless (default true)
        --fail-fast              Stop at the first executed case and print it
        --dry-run                Validate inputs and print the plan without launching browsers

      Output:
        progressEvery=N          Progress cadence on stderr; 1 prints one character per case, 0 disables
        --no-progress            Suppress progress output
        jsonOut=PATH             Write all results as JSON; a directory gets results.json
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Exit codes:
        0 no execution, 1 execution detected, 2 invalid arguments or error/lossy cases,
        3 I/O failure, 5 runtime failure (e.g. browser not installed), 130 interrupted
      """;

  private BenchCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the benchmark with Playwright-backed adapters.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::new);
  }

  /**
   * Executes the benchmark with adapters supplied by {@code roots}.
   *
   * @param args raw CLI arguments
   * @param roots builds the composition root for the validated configuration
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args, Function<BenchConfig, CompositionRoot> roots) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for run CLI");
    }
    Set<String> unknownFlags = input.unknownFlags(FLAGS);
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flag(s): {}", String.join(", ", unknownFlags));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs(), LIST_KEYS));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    ConfigCliUtils.applyFlag(input, kv, "--fail-fast", "failFast");
    ConfigCliUtils.applyFlag(input, kv, "--no-progress", "noProgress");
    ConfigCliUtils.applyFlag(input, kv, "--dry-run", "dryRun");

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = Optional.of(YamlConfigLoader.load(yamlPath));
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> configInputs;
    String metricsExporter;
    BenchConfig config;
    try {
      Map<String, String> defaults = DefaultsForMode.asFlatMap(DefaultsForMode.RUN);
      configInputs = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig(DefaultsForMode.RUN, yamlConfig, kv, defaults, log::warn));
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = BenchConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid run arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (Boolean.parseBoolean(configInputs.get("verbose")) && !input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    try (CompositionRoot root = roots.apply(config)) {
      return execute(config, root, metricsExporter);
    }
  }

  private static ExitCode execute(BenchConfig config, CompositionRoot root, String metricsExporter) {
    BenchRequest request;
    List<Path> files;
    try {
      files = root.vectorFiles();
      if (files.isEmpty()) {
        log.error("No vector files found. Pass vectors=FILE,... or run from a directory containing {}/*.json",
            config.vectorDirectory());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      List<Vector> vectors = root.loadVectors(files);
      List<Sanitizer> sanitizers = root.selectSanitizers();
      request = root.benchRequest(vectors, sanitizers);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid run input: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read vector files", ex);
      return ExitCode.IO_ERROR;
    }

    if (config.dryRun()) {
      printDryRunPlan(config, request, files, metricsExporter);
      return ExitCode.SUCCESS;
    }

    log.info("Configured run: vectors={}, sanitizers={}, browsers={}, workers={}, metricsExporter={}",
        request.vectors().size(), names(request.sanitizers()), request.browsers(), request.effectiveWorkers(),
        metricsExporter);
    BenchSummary summary;
    try {
      summary = root.orchestrator().run(
          request, new ProgressPrinter(config.effectiveProgressEvery(), ClockPort.SYSTEM));
    } catch (BrowserLaunchException ex) {
      log.error("{}. Install the engine with: {}", ex.getMessage(), installHint(ex));
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Benchmark interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in benchmark", ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    Optional<BenchCaseResult> firstHit = summary.firstExecuted();
    if (config.failFast() && firstHit.isPresent()) {
      ReportPrinter.failFast(firstHit.get()).forEach(CliPrinter::errPrintln);
      return ExitCode.EXECUTION_DETECTED;
    }

    ReportPrinter.report(summary).forEach(CliPrinter::println);

    if (config.jsonOut().isPresent()) {
      try {
        Path written = root.resultsWriter().write(summary, config.jsonOut().get());
        log.debug("JSON results at {}", written);
      } catch (IOException ex) {
        log.error("Unable to write JSON results to {}", config.jsonOut().get(), ex);
        return ExitCode.IO_ERROR;
      }
    }
    return exitCodeFor(summary);
  }

  /**
   * Maps run totals to the process status; errors and lossy cases outrank executions.
   *
   * @param summary finished run
   * @return exit code
   */
  static ExitCode exitCodeFor(BenchSummary summary) {
    if (summary.totalErrors() > 0 || summary.totalLossy() > 0) {
      return ExitCode.CASE_FAILURES;
    }
    return summary.totalExecuted() > 0 ? ExitCode.EXECUTION_DETECTED : ExitCode.SUCCESS;
  }

  private static void printDryRunPlan(
      BenchConfig config, BenchRequest request, List<Path> files, String metricsExporter) {
    CliPrinter.printLines(
        "Run dry-run: no browsers will be launched.",
        " Vector files      : " + files.stream().map(Path::toString).collect(Collectors.joining(", ")),
        " Vectors           : " + request.vectors().size(),
        " Sanitizers        : " + names(request.sanitizers()),
        " Browsers          : " + request.browsers().stream().map(BrowserEngine::wireName)
            .collect(Collectors.joining(", ")),
        " Planned cases     : " + request.totalCases(),
        " Mode              : " + (request.parallel() ? "parallel" : "sequential"),
        " Workers           : " + request.effectiveWorkers(),
        " Vectors per task  : " + (request.parallel() ? Integer.toString(request.vectorsPerTask()) : "-"),
        " Timeout           : " + (request.timeoutMs().isPresent()
            ? request.timeoutMs().getAsLong() + " ms" : "adaptive"),
        " Fail fast         : " + request.failFast(),
        " JSON output       : " + config.jsonOut().map(Path::toString).orElse("<none>"),
        " Metrics exporter  : " + metricsExporter,
        " Re-run without --dry-run to execute the benchmark.");
  }

  static String installHint(BrowserLaunchException ex) {
    return "mvn exec:java -e -Dexec.mainClass=com.microsoft.playwright.CLI -Dexec.args=\"install "
        + ex.engine().wireName() + "\"";
  }

  private static String names(List<Sanitizer> sanitizers) {
    return sanitizers.stream().map(Sanitizer::name).collect(Collectors.joining(", "));
  }
}
