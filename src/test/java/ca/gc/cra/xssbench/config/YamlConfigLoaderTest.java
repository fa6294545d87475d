package ca.gc.cra.xssbench.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  private Path yaml(String name, String content) throws IOException {
    return Files.writeString(tempDir.resolve(name), content);
  }

  @Test
  void topLevelKeysAreRunOptions() throws IOException {
    Path file = yaml("xssbench.yaml", """
        browser: chromium
        workers: 4
        verbose: true
        """);

    Map<String, String> options = YamlConfigLoader.load(file);

    assertEquals(Map.of("browser", "chromium", "workers", "4", "verbose", "true"), options);
    assertEquals(List.of("browser", "workers", "verbose"), List.copyOf(options.keySet()));
  }

  @Test
  void runBlockWinsOverTopLevel() throws IOException {
    Path file = yaml("override.yaml", """
        run:
          verbose: false
        verbose: true
        metricsExporter: none
        """);

    Map<String, String> options = YamlConfigLoader.load(file);

    assertEquals("false", options.get("verbose"));
    assertEquals("none", options.get("metricsExporter"));
    assertEquals(2, options.size());
  }

  @Test
  void sequencesBecomeCommaSeparated() throws IOException {
    Path file = yaml("lists.yaml", """
        run:
          vectors: [vectors/a.json, vectors/b.json]
          sanitizers:
            - noop
            - jsoup
          jsonOut:
        """);

    Map<String, String> options = YamlConfigLoader.load(file);

    assertEquals("vectors/a.json,vectors/b.json", options.get("vectors"));
    assertEquals("noop,jsoup", options.get("sanitizers"));
    assertEquals("", options.get("jsonOut"));
  }

  @Test
  void listEntriesMustNotContainCommas() throws IOException {
    Path file = yaml("comma.yaml", """
        sanitizers: ["noop,jsoup"]
        """);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file));
    assertEquals("YAML list entries for option sanitizers must not contain commas", ex.getMessage());
  }

  @Test
  void nestedMappingIsNotAnOption() throws IOException {
    Path file = yaml("nested.yaml", """
        otel:
          endpoint: http://collector:4317
        """);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file));
    assertEquals("YAML option otel must be a scalar or a list", ex.getMessage());
  }

  @Test
  void scalarRunBlockIsRejected() throws IOException {
    Path file = yaml("scalar.yaml", "run: chromium\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file));
    assertEquals("run block must be a mapping", ex.getMessage());
  }

  @Test
  void nonMappingDocumentIsRejected() throws IOException {
    Path file = yaml("list.yaml", "- workers\n- 4\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file));
    assertEquals("YAML config must be a mapping of run options", ex.getMessage());
  }

  @Test
  void malformedYamlIsReported() throws IOException {
    Path file = yaml("broken.yaml", "run: [unclosed\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file));
    assertTrue(ex.getMessage().startsWith("Failed to parse YAML config at "));
  }

  @Test
  void emptyDocumentYieldsNoOptions() throws IOException {
    assertEquals(Map.of(), YamlConfigLoader.load(yaml("empty.yaml", "")));
  }

  @Test
  void missingFileIsAnIoError() {
    assertThrows(NoSuchFileException.class, () -> YamlConfigLoader.load(tempDir.resolve("absent.yaml")));
  }
}
