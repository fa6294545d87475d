package ca.gc.cra.xssbench.domain.bench;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Browser engines a benchmark can run against.
 *
 * @since 0.1.0
 */
public enum BrowserEngine {
  CHROMIUM("chromium"),
  FIREFOX("firefox"),
  WEBKIT("webkit");

  private final String wireName;

  BrowserEngine(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the lowercase name used in configuration and reports.
   *
   * @return engine name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a single engine name.
   *
   * @param raw engine name; case-insensitive
   * @return matching engine
   * @throws IllegalArgumentException when the name is unknown
   */
  public static BrowserEngine fromWireName(String raw) {
    Objects.requireNonNull(raw, "browser");
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (BrowserEngine engine : values()) {
      if (engine.wireName.equals(normalized)) {
        return engine;
      }
    }
    throw new IllegalArgumentException(
        "browser must be chromium, firefox, webkit or all (was '" + raw + "')");
  }

  /**
   * Parses {@code all} or a comma-separated engine list, dropping duplicates.
   *
   * @param raw configuration value
   * @return engines in the order given
   */
  public static List<BrowserEngine> parseList(String raw) {
    if (raw == null || raw.isBlank() || raw.trim().equalsIgnoreCase("all")) {
      return List.of(values());
    }
    Set<BrowserEngine> engines = new LinkedHashSet<>();
    for (String token : raw.split(",")) {
      if (!token.isBlank()) {
        engines.add(fromWireName(token));
      }
    }
    if (engines.isEmpty()) {
      throw new IllegalArgumentException("browser must name at least one engine");
    }
    return List.copyOf(new ArrayList<>(engines));
  }

  @Override
  public String toString() {
    return wireName;
  }
}
