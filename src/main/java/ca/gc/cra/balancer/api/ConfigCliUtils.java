package ca.gc.cra.balancer.api;

import java.util.Map;

/**
 * Helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /** Removes and returns the {@code config} (or {@code --config}) entry, or {@code null}. */
  static String extractConfigPath(Map<String, String> args) {
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /** Reads a boolean, treating a missing or blank value as {@code false}. */
  static boolean parseBoolean(Map<String, String> map, String key) {
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
