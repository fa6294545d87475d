package ca.gc.cra.xssbench.application.port;

import ca.gc.cra.xssbench.domain.vector.Vector;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads the vector corpus.
 *
 * @since 0.1.0
 */
public interface VectorSource {
  /**
   * Loads and validates every vector in {@code files}.
   *
   * @param files vector files, loaded in order
   * @return vectors with unique {@code (id, context)} pairs
   * @throws IOException when a file cannot be read
   * @throws IllegalArgumentException when a file is malformed or contains duplicates
   */
  List<Vector> load(List<Path> files) throws IOException;
}
