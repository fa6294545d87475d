package ca.gc.cra.xssbench.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void runDefaultsIncludeCommonKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("run");

    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("false", defaults.get("verbose"));
    assertEquals("all", defaults.get("browser"));
    assertEquals("1", defaults.get("workers"));
    assertEquals("3600", defaults.get("workerTaskTimeoutSec"));
    assertEquals("25", defaults.get("progressEvery"));
    assertEquals("true", defaults.get("headless"));
    assertEquals("", defaults.get("timeoutMs"));
  }

  @Test
  void modeIsCaseInsensitive() {
    assertEquals(DefaultsForMode.asFlatMap("run"), DefaultsForMode.asFlatMap(" RUN "));
  }

  @Test
  void defaultsParseIntoValidConfig() {
    BenchConfig config = BenchConfig.fromMap(DefaultsForMode.asFlatMap("run"));

    assertTrue(config.vectorFiles().isEmpty());
    assertEquals(1, config.workers());
  }

  @Test
  void unknownModeIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> DefaultsForMode.asFlatMap("capture"));
    assertEquals("Unsupported mode: capture", ex.getMessage());
  }
}
