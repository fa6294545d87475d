package ca.gc.cra.xssbench.infrastructure.corpus;

import ca.gc.cra.xssbench.application.port.VectorSource;
import ca.gc.cra.xssbench.domain.vector.ExpectedTag;
import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import ca.gc.cra.xssbench.domain.vector.Vector;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads vector corpus files into immutable {@link Vector} records.
 * <p><strong>Formats:</strong> a legacy top-level array of vectors, or an object
 * {@code {schema, meta, options, vectors}} with schema {@value #SCHEMA}.</p>
 * <p><strong>Validation:</strong>
 * <ul>
 *   <li>{@code id}, {@code description} and {@code payload_html} are required.</li>
 *   <li>{@code payload_context} defaults to {@code html}; a list expands into one vector per context.</li>
 *   <li>{@code expected_tags} is forbidden for {@code href} and {@code js*} contexts and required for all
 *       others, unless the file sets {@code options.expected_tags} to {@code ignore}.</li>
 *   <li>{@code (id, payload_context)} pairs must be unique across every file of one load.</li>
 * </ul>
 * Every violation raises {@link IllegalArgumentException} naming the file and vector.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class VectorFileLoader implements VectorSource {
  private static final Logger log = LoggerFactory.getLogger(VectorFileLoader.class);
  static final String SCHEMA = "xssbench.vectorfile.v1";

  private final JsonSupport json = new JsonSupport();

  @Override
  public List<Vector> load(List<Path> files) throws IOException {
    List<Vector> vectors = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (Path file : files) {
      Object root;
      try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
        root = json.parse(reader, file.toString());
      }
      int before = vectors.size();
      for (Vector vector : parseFile(root, file.toString())) {
        if (!seen.add(vector.key())) {
          throw new IllegalArgumentException("Duplicate vector id+context: " + vector.key() + " (" + file + ")");
        }
        vectors.add(vector);
      }
      log.debug("Loaded {} vectors from {}", vectors.size() - before, file);
    }
    log.info("Loaded {} vectors from {} file(s)", vectors.size(), files.size());
    return List.copyOf(vectors);
  }

  /**
   * Lists every {@code *.json} file directly inside {@code directory}, sorted by name.
   *
   * @param directory corpus directory
   * @return vector files; empty when the directory does not exist
   * @throws IOException when the directory cannot be listed
   */
  public static List<Path> discover(Path directory) throws IOException {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    try (Stream<Path> entries = Files.list(directory)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(path -> path.getFileName().toString().endsWith(".json"))
          .sorted()
          .toList();
    }
  }

  List<Vector> parseFile(Object root, String source) {
    List<?> items;
    boolean ignoreExpectedTags = false;
    if (root instanceof Map<?, ?> document) {
      Object schema = document.get("schema");
      if (schema != null && !SCHEMA.equals(schema)) {
        throw new IllegalArgumentException(source + ": unsupported schema '" + schema + "' (expected " + SCHEMA + ")");
      }
      if (!document.containsKey("vectors")) {
        throw new IllegalArgumentException("Vector file object must contain a 'vectors' key: " + source);
      }
      ignoreExpectedTags = expectedTagsIgnored(document.get("options"), source);
      if (!(document.get("vectors") instanceof List<?> list)) {
        throw new IllegalArgumentException(source + ": 'vectors' must be a JSON array");
      }
      items = list;
    } else if (root instanceof List<?> list) {
      items = list;
    } else {
      throw new IllegalArgumentException(
          "Vector file must contain a JSON list, or an object with 'vectors': " + source);
    }

    List<Vector> out = new ArrayList<>();
    for (Object item : items) {
      if (!(item instanceof Map<?, ?> fields)) {
        throw new IllegalArgumentException("Vector items must be JSON objects: " + source);
      }
      out.addAll(parseVector(fields, source, ignoreExpectedTags));
    }
    return out;
  }

  private static boolean expectedTagsIgnored(Object options, String source) {
    if (options == null) {
      return false;
    }
    if (!(options instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(source + ": 'options' must be a JSON object");
    }
    Object mode = map.get("expected_tags");
    if (mode == null) {
      return false;
    }
    if (!"ignore".equals(mode)) {
      throw new IllegalArgumentException(source + ": options.expected_tags must be \"ignore\" (was " + mode + ")");
    }
    return true;
  }

  private static List<Vector> parseVector(Map<?, ?> fields, String source, boolean ignoreExpectedTags) {
    List<String> missing = new ArrayList<>();
    for (String key : List.of("description", "id", "payload_html")) {
      if (!fields.containsKey(key) || fields.get(key) == null) {
        missing.add(key);
      }
    }
    if (!missing.isEmpty()) {
      throw new IllegalArgumentException("Vector missing keys " + missing + ": " + source);
    }
    String id = scalar(fields.get("id"), "id", source);
    String description = scalar(fields.get("description"), "description", source);
    String payload = scalar(fields.get("payload_html"), "payload_html", source);

    List<Vector> out = new ArrayList<>();
    for (PayloadContext context : contexts(fields.get("payload_context"), id, source)) {
      Optional<List<ExpectedTag>> expected = Optional.empty();
      boolean shapeless = context.isNonMarkupSink();
      if (fields.containsKey("expected_tags")) {
        if (shapeless) {
          throw new IllegalArgumentException(source + ": vector '" + id + "' must not declare expected_tags for "
              + context.wireName() + " context");
        }
        if (!ignoreExpectedTags) {
          expected = Optional.of(expectedTags(fields.get("expected_tags"), id, source));
        }
      } else if (!shapeless && !ignoreExpectedTags) {
        throw new IllegalArgumentException(source + ": vector '" + id + "' (" + context.wireName()
            + ") is missing expected_tags");
      }
      out.add(new Vector(id, description, payload, context, expected));
    }
    return out;
  }

  private static List<PayloadContext> contexts(Object raw, String id, String source) {
    if (raw == null) {
      return List.of(PayloadContext.HTML);
    }
    try {
      if (raw instanceof String single) {
        return List.of(PayloadContext.fromWireName(single));
      }
      if (raw instanceof List<?> list) {
        if (list.isEmpty()) {
          throw new IllegalArgumentException("payload_context list must be non-empty");
        }
        List<PayloadContext> contexts = new ArrayList<>(list.size());
        for (Object entry : list) {
          if (!(entry instanceof String name)) {
            throw new IllegalArgumentException("payload_context list must contain only strings");
          }
          contexts.add(PayloadContext.fromWireName(name));
        }
        return contexts;
      }
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(source + ": vector '" + id + "': " + ex.getMessage(), ex);
    }
    throw new IllegalArgumentException(source + ": vector '" + id
        + "': payload_context must be a string or list of strings");
  }

  private static List<ExpectedTag> expectedTags(Object raw, String id, String source) {
    if (!(raw instanceof List<?> list)) {
      throw new IllegalArgumentException(source + ": vector '" + id + "': expected_tags must be an array");
    }
    List<ExpectedTag> tags = new ArrayList<>(list.size());
    for (Object entry : list) {
      if (!(entry instanceof String text)) {
        throw new IllegalArgumentException(source + ": vector '" + id + "': expected_tags entries must be strings");
      }
      try {
        tags.add(ExpectedTag.parse(text));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(source + ": vector '" + id + "': " + ex.getMessage(), ex);
      }
    }
    return tags;
  }

  private static String scalar(Object value, String key, String source) {
    if (value instanceof String || value instanceof Number || value instanceof Boolean) {
      return value.toString();
    }
    throw new IllegalArgumentException(source + ": '" + key + "' must be a string");
  }
}
