package ca.gc.cra.xssbench.api;

import ca.gc.cra.xssbench.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the telemetry keys out of the merged configuration and into the {@code otel.*} system properties read
 * by the OpenTelemetry metrics bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;
  static final String EXPORTER_NONE = "none";
  static final String EXPORTER_OTLP = "otlp";

  private TelemetryConfigurator() {}

  /**
   * Applies and removes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}.
   *
   * @param args mutable configuration map
   * @return exporter in effect, {@code otlp} or {@code none}
   * @throws IllegalArgumentException when a telemetry value is invalid
   */
  static String configureMetrics(Map<String, String> args) {
    String exporter = trimToEmpty(args.remove("metricsExporter")).toLowerCase(Locale.ROOT);
    if (exporter.isEmpty()) {
      exporter = EXPORTER_NONE;
    }
    if (!exporter.equals(EXPORTER_OTLP) && !exporter.equals(EXPORTER_NONE)) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
    System.setProperty("otel.metrics.exporter", exporter);

    String endpoint = trimToEmpty(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      if (exporter.equals(EXPORTER_NONE)) {
        log.warn("otelEndpoint is ignored while metricsExporter=none");
      }
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String resourceAttributes = trimToEmpty(args.remove("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring OTEL_RESOURCE_ATTRIBUTES override");
      System.setProperty("otel.resource.attributes", resourceAttributes);
    }
    return exporter;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trimToEmpty(String value) {
    return value == null ? "" : value.trim();
  }
}
