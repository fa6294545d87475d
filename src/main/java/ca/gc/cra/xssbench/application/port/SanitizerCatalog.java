package ca.gc.cra.xssbench.application.port;

import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import java.util.List;

/**
 * Registry of sanitizers available to a benchmark.
 *
 * @since 0.1.0
 */
public interface SanitizerCatalog {
  /**
   * Lists every registered sanitizer.
   *
   * @return sanitizers in registration order
   */
  List<Sanitizer> all();

  /**
   * Lists the sanitizers run when none are named.
   *
   * @return default selection
   */
  List<Sanitizer> defaults();

  /**
   * Resolves sanitizers by name.
   *
   * @param names sanitizer names
   * @return sanitizers in the order requested
   * @throws IllegalArgumentException when a name is unknown
   */
  List<Sanitizer> select(List<String> names);
}
