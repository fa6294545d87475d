package ca.gc.cra.xssbench.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@code run} options from a YAML file.
 *
 * <p>Options sit at the top level of the document. A {@code run:} block may repeat any of them and wins over
 * the top level:</p>
 * <pre>
 * workers: 4
 * sanitizers: [noop, jsoup]
 * run:
 *   failFast: true
 * </pre>
 *
 * <p>Values come back as the strings a {@code key=value} argument would carry. A list of scalars becomes a
 * comma-separated value and an empty value becomes {@code ""}.</p>
 */
public final class YamlConfigLoader {
  static final String RUN_BLOCK = "run";

  private YamlConfigLoader() {}

  /**
   * Parses {@code path} into run options.
   *
   * @param path YAML file
   * @return option values keyed by option name, in document order
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML or not shaped as run options
   */
  public static Map<String, String> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Map.of();
    }
    if (!(document instanceof Map<?, ?> top)) {
      throw new IllegalArgumentException("YAML config must be a mapping of run options");
    }

    Map<String, String> options = new LinkedHashMap<>();
    Map<?, ?> runBlock = null;
    for (Map.Entry<?, ?> entry : top.entrySet()) {
      String key = optionName(entry.getKey());
      if (key.equals(RUN_BLOCK)) {
        if (!(entry.getValue() instanceof Map<?, ?> block)) {
          throw new IllegalArgumentException("run block must be a mapping");
        }
        runBlock = block;
      } else {
        options.put(key, optionValue(key, entry.getValue()));
      }
    }
    if (runBlock != null) {
      for (Map.Entry<?, ?> entry : runBlock.entrySet()) {
        String key = optionName(entry.getKey());
        options.put(key, optionValue(key, entry.getValue()));
      }
    }
    return options;
  }

  private static String optionName(Object key) {
    if (!(key instanceof String name) || name.isBlank()) {
      throw new IllegalArgumentException("YAML option names must be non-blank strings (was " + key + ")");
    }
    return name.trim();
  }

  private static String optionValue(String key, Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Map<?, ?>) {
      throw new IllegalArgumentException("YAML option " + key + " must be a scalar or a list");
    }
    if (!(value instanceof List<?> items)) {
      return value.toString();
    }
    List<String> parts = new ArrayList<>(items.size());
    for (Object item : items) {
      if (item == null || item instanceof Map<?, ?> || item instanceof List<?>) {
        throw new IllegalArgumentException("YAML list for option " + key + " must contain only scalars");
      }
      String part = item.toString();
      if (part.indexOf(',') >= 0) {
        throw new IllegalArgumentException("YAML list entries for option " + key + " must not contain commas");
      }
      parts.add(part);
    }
    return String.join(",", parts);
  }
}
