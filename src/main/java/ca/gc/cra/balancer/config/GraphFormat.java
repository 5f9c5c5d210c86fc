package ca.gc.cra.balancer.config;

import java.util.Locale;

/**
 * Serialization formats a designed balancer graph can be rendered to.
 *
 * @since 0.1.0
 */
public enum GraphFormat {
  /** Graphviz DOT source. */
  DOT(".dot"),
  /** JSON document with {@code nodes} and {@code edges} arrays. */
  JSON(".json");

  private final String extension;

  GraphFormat(String extension) {
    this.extension = extension;
  }

  /**
   * File extension, including the leading dot.
   *
   * @return extension such as {@code .dot}
   */
  public String extension() {
    return extension;
  }

  /**
   * Parses a user-supplied format name.
   *
   * @param raw format name, case-insensitive
   * @param defaultValue value used when {@code raw} is blank
   * @return parsed format
   * @throws IllegalArgumentException if the name is unknown
   */
  public static GraphFormat parse(String raw, GraphFormat defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "dot", "graphviz", "gv" -> DOT;
      case "json" -> JSON;
      default -> throw new IllegalArgumentException("format must be 'dot' or 'json' (was '" + raw + "')");
    };
  }
}
