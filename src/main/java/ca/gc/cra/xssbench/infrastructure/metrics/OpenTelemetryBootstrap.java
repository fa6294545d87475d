package ca.gc.cra.xssbench.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for a benchmark run.
 *
 * <p>Settings come from the {@code otel.*} system properties the CLI sets, falling back to the standard
 * {@code OTEL_*} environment variables. Unlike a long-running service, a benchmark exports nothing unless
 * asked to, so the exporter defaults to {@code none}.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.xssbench";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);
  private static final long FLUSH_TIMEOUT_SECONDS = 5;
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize() {
    try {
      TelemetrySettings settings = TelemetrySettings.fromSystem();
      if (!settings.otlp()) {
        log.debug("OpenTelemetry metrics export disabled");
        return BootstrapResult.noop();
      }
      MetricReader reader = PeriodicMetricReader.builder(
              OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      log.info("OpenTelemetry metrics exporting to {} every {}s", settings.endpoint(),
          EXPORT_INTERVAL.toSeconds());
      return BootstrapResult.active(build(reader, settings.resourceAttributes()));
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without export", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return BootstrapResult.active(build(Objects.requireNonNull(reader, "reader"), Attributes.empty()));
  }

  private static SdkMeterProvider build(MetricReader reader, Attributes extra) {
    String version = serviceVersion();
    AttributesBuilder attributes = Attributes.builder()
        .put(SERVICE_NAME, "xssbench")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version)
        .put(SERVICE_INSTANCE_ID, ManagementFactory.getRuntimeMXBean().getName());
    Resource resource = Resource.getDefault()
        .merge(Resource.create(attributes.build()))
        .merge(Resource.create(extra));
    return SdkMeterProvider.builder().setResource(resource).registerMetricReader(reader).build();
  }

  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null || raw.isBlank()) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      int eq = entry.indexOf('=');
      String key = eq < 0 ? "" : entry.substring(0, eq).trim();
      String value = eq < 0 ? "" : entry.substring(eq + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        if (!entry.isBlank()) {
          log.warn("Ignoring malformed resource attribute '{}'", entry.trim());
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/ca.gc.cra/xssbench/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("pom.properties unreadable; using development version", ex);
    }
    return "0.0.0-dev";
  }

  private static String firstNonBlank(String... candidates) {
    for (String candidate : candidates) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate.trim();
      }
    }
    return "";
  }

  /**
   * Export settings resolved from system properties and environment.
   *
   * @param otlp whether the OTLP exporter is enabled
   * @param endpoint OTLP gRPC endpoint
   * @param resourceAttributes extra resource attributes
   */
  record TelemetrySettings(boolean otlp, String endpoint, Attributes resourceAttributes) {
    static TelemetrySettings fromSystem() {
      String exporter = firstNonBlank(
          System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), "none")
          .toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        log.warn("Unknown metrics exporter '{}'; export disabled", exporter);
      }
      String endpoint = firstNonBlank(
          System.getProperty("otel.exporter.otlp.endpoint"),
          System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      String attributes = firstNonBlank(
          System.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"));
      return new TelemetrySettings(exporter.equals("otlp"), endpoint, parseResourceAttributes(attributes));
    }
  }

  /** Meter plus the provider that must be flushed and shut down when the run ends. */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static BootstrapResult active(SdkMeterProvider provider) {
      Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
          .setInstrumentationVersion(serviceVersion())
          .build();
      return new BootstrapResult(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        await(provider.shutdown(), "shutdown");
      } catch (RuntimeException ex) {
        log.warn("OpenTelemetry meter provider did not shut down cleanly", ex);
      }
    }

    private static void await(CompletableResultCode result, String operation) {
      result.join(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics {} did not complete within {}s", operation, FLUSH_TIMEOUT_SECONDS);
      }
    }
  }
}
