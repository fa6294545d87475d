package ca.gc.cra.xssbench.infrastructure.report;

import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;
import ca.gc.cra.xssbench.domain.bench.BenchSummary;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a {@link BenchSummary} as a JSON document with sorted keys and two-space indentation.
 *
 * @since 0.1.0
 */
public final class JsonResultsWriter {
  private static final Logger log = LoggerFactory.getLogger(JsonResultsWriter.class);
  static final String DEFAULT_FILE_NAME = "results.json";

  private final JsonFactory factory = JsonFactory.builder().build();

  /**
   * Resolves where the results file goes. A directory, or a path without a file extension, gets
   * {@value #DEFAULT_FILE_NAME} appended.
   *
   * @param requested path given by the user
   * @return file path
   */
  public static Path resolveTarget(Path requested) {
    if (Files.isDirectory(requested)) {
      return requested.resolve(DEFAULT_FILE_NAME);
    }
    Path name = requested.getFileName();
    if (name == null || !name.toString().contains(".")) {
      return requested.resolve(DEFAULT_FILE_NAME);
    }
    return requested;
  }

  /**
   * Writes the summary, creating parent directories as needed.
   *
   * @param summary run summary
   * @param requested path given by the user
   * @return file actually written
   * @throws IOException when the file cannot be written
   */
  public Path write(BenchSummary summary, Path requested) throws IOException {
    Path target = resolveTarget(requested).toAbsolutePath();
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
      write(summary, writer);
    }
    log.info("Wrote {} results to {}", summary.totalCases(), target);
    return target;
  }

  /**
   * Streams the summary to {@code writer}; the writer is left open.
   *
   * @param summary run summary
   * @param writer destination
   * @throws IOException when writing fails
   */
  public void write(BenchSummary summary, Writer writer) throws IOException {
    DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
    try (JsonGenerator gen = factory.createGenerator(writer)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      gen.setPrettyPrinter(new DefaultPrettyPrinter()
          .withObjectIndenter(indenter)
          .withArrayIndenter(indenter));
      gen.writeStartObject();
      gen.writeArrayFieldStart("results");
      for (BenchCaseResult result : summary.results()) {
        writeResult(gen, result);
      }
      gen.writeEndArray();
      gen.writeNumberField("total_cases", summary.totalCases());
      gen.writeNumberField("total_errors", summary.totalErrors());
      gen.writeNumberField("total_executed", summary.totalExecuted());
      gen.writeNumberField("total_external", summary.totalExternal());
      gen.writeNumberField("total_lossy", summary.totalLossy());
      gen.writeNumberField("total_skipped", summary.totalSkipped());
      gen.writeEndObject();
    }
    writer.write('\n');
    writer.flush();
  }

  private static void writeResult(JsonGenerator gen, BenchCaseResult result) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("browser", result.browser().wireName());
    gen.writeStringField("details", result.details());
    gen.writeBooleanField("executed", result.executed());
    gen.writeBooleanField("lossy", result.lossy());
    gen.writeStringField("lossy_details", result.lossyDetails());
    gen.writeStringField("outcome", result.outcome().wireName());
    gen.writeStringField("payload_context", result.payloadContext().wireName());
    gen.writeStringField("rendered_html", result.renderedHtml());
    gen.writeStringField("run_payload_context", result.runPayloadContext().wireName());
    gen.writeStringField("sanitized_html", result.sanitizedHtml());
    gen.writeStringField("sanitizer", result.sanitizer());
    gen.writeStringField("sanitizer_input_html", result.sanitizerInputHtml());
    gen.writeStringField("vector_id", result.vectorId());
    gen.writeEndObject();
  }
}
