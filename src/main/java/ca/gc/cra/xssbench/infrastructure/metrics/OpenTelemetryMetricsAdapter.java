package ca.gc.cra.xssbench.infrastructure.metrics;

import ca.gc.cra.xssbench.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Forwards benchmark counters and latency observations to OpenTelemetry.
 *
 * <p>Instruments are created lazily per metric key and cached. The original key is attached as the
 * {@code xssbench.metric.key} attribute because instrument names are lower-cased. Keys ending in
 * {@code Ms} are recorded with unit {@code ms}.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("xssbench.metric.key");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter configured from the {@code otel.*} system properties.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), k ->
        new Instrument<>(meter.counterBuilder(instrumentName(k)).setUnit("1")
            .setDescription("xssbench counter " + k).build(), Attributes.of(METRIC_KEY, k)));
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), k ->
        new Instrument<>(meter.histogramBuilder(instrumentName(k)).ofLongs().setUnit(unitOf(k))
            .setDescription("xssbench observation " + k).build(), Attributes.of(METRIC_KEY, k)));
    histogram.instrument().record(value, histogram.attributes());
  }

  /** Pushes buffered points to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes and shuts down the meter provider. */
  @Override
  public void close() {
    bootstrap.close();
  }

  static String instrumentName(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    if (lower.isEmpty()) {
      return "xssbench.metric";
    }
    StringBuilder out = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      out.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      out.append(Character.isLetterOrDigit(c) || c == '.' || c == '_' || c == '-' ? c : '_');
    }
    return out.toString();
  }

  private static String unitOf(String key) {
    return key.endsWith("Ms") ? "ms" : "1";
  }

  private record Instrument<T>(T instrument, Attributes attributes) {}
}
