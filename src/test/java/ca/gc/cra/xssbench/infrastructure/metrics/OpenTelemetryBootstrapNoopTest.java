package ca.gc.cra.xssbench.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void noopAdapterAcceptsRecordings() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.clearProperty("otel.metrics.exporter");

    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter()) {
      adapter.increment("bench.case.pass");
      adapter.observe("bench.case.latencyMs", 12);
      adapter.forceFlush();
    }
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("team=appsec, broken, =x,env = ci");

    assertEquals(2, attributes.size());
    assertEquals("appsec", attributes.get(AttributeKey.stringKey("team")));
    assertEquals("ci", attributes.get(AttributeKey.stringKey("env")));
  }
}
