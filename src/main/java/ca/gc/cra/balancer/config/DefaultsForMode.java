package ca.gc.cra.balancer.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each balancer CLI command.
 *
 * <p>{@code inputs} and {@code outputs} have no defaults; a design run must always name its flows.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode target CLI command ({@code design})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the command is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    if (!normalized.equals("design")) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    defaults.putAll(buildDesignDefaults());
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildDesignDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("format", "dot");
    map.put("out", DesignConfig.STDOUT);
    map.put("target", "");
    map.put("pretty", "false");
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }
}
