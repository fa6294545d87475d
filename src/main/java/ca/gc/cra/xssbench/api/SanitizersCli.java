package ca.gc.cra.xssbench.api;

import ca.gc.cra.xssbench.application.port.SanitizerCatalog;
import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import ca.gc.cra.xssbench.infrastructure.sanitizer.BuiltinSanitizers;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lists the sanitizers a run can select.
 *
 * @since 0.1.0
 */
public final class SanitizersCli {
  private static final String HELP_TEXT = """
      xssbench sanitizers: list available sanitizers

      Usage:
        xssbench sanitizers

      Prints one line per sanitizer: name, description and supported payload contexts.
      """;

  private SanitizersCli() {}

  static ExitCode run(String[] args) {
    return run(args, new BuiltinSanitizers());
  }

  static ExitCode run(String[] args, SanitizerCatalog catalog) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.keyValueArgs().length > 0 || !input.unknownFlags(Set.of()).isEmpty()) {
      CliPrinter.println("usage: xssbench sanitizers");
      return ExitCode.INVALID_ARGS;
    }
    catalog.all().stream()
        .sorted(Comparator.comparing(Sanitizer::name))
        .forEach(sanitizer -> CliPrinter.println(sanitizer.name() + ": " + sanitizer.description()
            + " [contexts: " + contexts(sanitizer) + "]"));
    return ExitCode.SUCCESS;
  }

  private static String contexts(Sanitizer sanitizer) {
    return sanitizer.supportedContexts()
        .map(set -> set.stream().sorted().map(PayloadContext::wireName).collect(Collectors.joining(", ")))
        .orElse("all");
  }
}
