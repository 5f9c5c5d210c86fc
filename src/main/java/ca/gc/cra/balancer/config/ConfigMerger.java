package ca.gc.cra.balancer.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    if ("design".equalsIgnoreCase(mode)) {
      validateDesign(merged);
    }
    return Map.copyOf(merged);
  }

  private static void validateDesign(Map<String, String> effective) {
    GraphFormat format = GraphFormat.parse(effective.get("format"), GraphFormat.DOT);
    String out = trim(effective.get("out")).toLowerCase(Locale.ROOT);
    for (GraphFormat other : GraphFormat.values()) {
      if (other != format && out.endsWith(other.extension())) {
        throw new IllegalArgumentException(
            "out has a " + other.extension() + " extension but format is " + format.name().toLowerCase(Locale.ROOT));
      }
    }
    if (Boolean.parseBoolean(trim(effective.get("pretty"))) && format != GraphFormat.JSON) {
      throw new IllegalArgumentException("pretty=true requires format=json");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
