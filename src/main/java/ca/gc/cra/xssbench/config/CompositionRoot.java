package ca.gc.cra.xssbench.config;

import ca.gc.cra.xssbench.application.bench.BenchRequest;
import ca.gc.cra.xssbench.application.bench.BenchmarkOrchestrator;
import ca.gc.cra.xssbench.application.harness.SessionSettings;
import ca.gc.cra.xssbench.application.port.ClockPort;
import ca.gc.cra.xssbench.application.port.HarnessFactory;
import ca.gc.cra.xssbench.application.port.MetricsPort;
import ca.gc.cra.xssbench.application.port.SanitizerCatalog;
import ca.gc.cra.xssbench.application.port.VectorSource;
import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import ca.gc.cra.xssbench.domain.vector.Vector;
import ca.gc.cra.xssbench.infrastructure.browser.PlaywrightBrowserLauncher;
import ca.gc.cra.xssbench.infrastructure.browser.PlaywrightHarnessFactory;
import ca.gc.cra.xssbench.infrastructure.corpus.VectorFileLoader;
import ca.gc.cra.xssbench.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.xssbench.infrastructure.report.JsonResultsWriter;
import ca.gc.cra.xssbench.infrastructure.sanitizer.BuiltinSanitizers;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the benchmark use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps the translation from {@link BenchConfig} to Playwright, Jackson, jsoup and
 * OpenTelemetry adapters in one place, so tests can substitute any of them.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve vector files and sanitizer names into domain objects.</li>
 *   <li>Build the orchestrator with one Playwright harness factory per worker.</li>
 *   <li>Own the metrics adapter and release it on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Build on the CLI thread; the harness factory supplier is safe to call from
 * worker threads because each call creates an independent launcher.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final long POLL_INTERVAL_MS = SessionSettings.DEFAULT_POLL_INTERVAL_MS;

  private final BenchConfig config;
  private final MetricsPort metrics;
  private final AutoCloseable metricsLifecycle;
  private final VectorSource vectorSource;
  private final SanitizerCatalog sanitizers;
  private final Supplier<HarnessFactory> harnessFactories;

  /**
   * Creates a composition root backed by Playwright and an OpenTelemetry metrics adapter configured from the
   * {@code otel.*} system properties.
   *
   * @param config run configuration
   */
  public CompositionRoot(BenchConfig config) {
    this(config, new OpenTelemetryMetricsAdapter());
  }

  private CompositionRoot(BenchConfig config, OpenTelemetryMetricsAdapter metrics) {
    this(config, metrics, metrics, new VectorFileLoader(), new BuiltinSanitizers(),
        playwrightFactories(config, metrics));
  }

  /**
   * Creates a composition root with explicit adapters.
   *
   * @param config run configuration
   * @param metrics metrics adapter handed to every use case
   * @param metricsLifecycle closed together with this root; may be {@code null}
   * @param vectorSource corpus loader
   * @param sanitizers sanitizer catalog
   * @param harnessFactories creates one harness factory per worker
   */
  public CompositionRoot(
      BenchConfig config,
      MetricsPort metrics,
      AutoCloseable metricsLifecycle,
      VectorSource vectorSource,
      SanitizerCatalog sanitizers,
      Supplier<HarnessFactory> harnessFactories) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.metricsLifecycle = metricsLifecycle;
    this.vectorSource = Objects.requireNonNull(vectorSource, "vectorSource");
    this.sanitizers = Objects.requireNonNull(sanitizers, "sanitizers");
    this.harnessFactories = Objects.requireNonNull(harnessFactories, "harnessFactories");
  }

  private static Supplier<HarnessFactory> playwrightFactories(BenchConfig config, MetricsPort metrics) {
    SessionSettings settings = new SessionSettings(config.actionTimeoutMs(), POLL_INTERVAL_MS);
    return () -> new PlaywrightHarnessFactory(
        new PlaywrightBrowserLauncher(config.headless()), settings, metrics, ClockPort.SYSTEM);
  }

  /**
   * Resolves the vector files of this run.
   *
   * @return the configured files, or every {@code *.json} under the vector directory
   * @throws IOException when the vector directory cannot be listed
   */
  public List<Path> vectorFiles() throws IOException {
    if (!config.vectorFiles().isEmpty()) {
      return config.vectorFiles();
    }
    return VectorFileLoader.discover(config.vectorDirectory());
  }

  /**
   * Loads the corpus.
   *
   * @param files vector files
   * @return vectors in file order
   * @throws IOException when a file cannot be read
   */
  public List<Vector> loadVectors(List<Path> files) throws IOException {
    return vectorSource.load(files);
  }

  /**
   * Resolves the configured sanitizer names.
   *
   * @return selected sanitizers, or the catalog defaults when none are configured
   */
  public List<Sanitizer> selectSanitizers() {
    return config.sanitizers().isEmpty() ? sanitizers.defaults() : sanitizers.select(config.sanitizers());
  }

  /**
   * Builds the orchestrator input for a loaded corpus.
   *
   * @param vectors loaded vectors
   * @param selected sanitizers under test
   * @return benchmark request
   */
  public BenchRequest benchRequest(List<Vector> vectors, List<Sanitizer> selected) {
    return new BenchRequest(
        vectors,
        selected,
        config.browsers(),
        config.timeoutMs(),
        config.workers(),
        config.failFast(),
        config.progressEvery(),
        config.workerTaskTimeoutSec());
  }

  /**
   * Builds the benchmark orchestrator.
   *
   * @return orchestrator wired to the configured harness factories
   */
  public BenchmarkOrchestrator orchestrator() {
    return new BenchmarkOrchestrator(harnessFactories, metrics, ClockPort.SYSTEM);
  }

  /**
   * Supplies the JSON results writer.
   *
   * @return writer for {@code jsonOut}
   */
  public JsonResultsWriter resultsWriter() {
    return new JsonResultsWriter();
  }

  /**
   * Supplies the sanitizer catalog.
   *
   * @return catalog used to resolve names
   */
  public SanitizerCatalog sanitizerCatalog() {
    return sanitizers;
  }

  /**
   * Supplies the metrics implementation used across use cases.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /** Flushes and releases the metrics adapter. */
  @Override
  public void close() {
    if (metricsLifecycle == null) {
      return;
    }
    try {
      metricsLifecycle.close();
    } catch (Exception ex) {
      log.warn("Failed to close metrics adapter", ex);
    }
  }
}
