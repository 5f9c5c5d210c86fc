package ca.gc.cra.balancer.config;

import ca.gc.cra.balancer.domain.flow.FlowApportioner;
import ca.gc.cra.balancer.domain.flow.FlowSpec;
import ca.gc.cra.balancer.validation.Numbers;
import ca.gc.cra.balancer.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Typed settings for one balancer design run.
 * <p><strong>Role:</strong> Adapter configuration aggregate built from the merged defaults, YAML and CLI map.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inputRates input flow rates in order; may be fractional
 * @param outputRates output flow rates in order; may be fractional
 * @param target optional whole-number total used to apportion fractional rates
 * @param format rendering format
 * @param output destination file; empty writes to standard output
 * @param pretty whether JSON output is indented
 * @since 0.1.0
 * @see FlowApportioner
 */
public record DesignConfig(
    List<Double> inputRates,
    List<Double> outputRates,
    OptionalLong target,
    GraphFormat format,
    Optional<Path> output,
    boolean pretty) {

  /** Value of {@code out} that selects standard output. */
  public static final String STDOUT = "-";

  /**
   * Normalizes and validates the settings.
   *
   * @throws IllegalArgumentException if a rate list is empty or {@code target} is negative
   */
  public DesignConfig {
    inputRates = List.copyOf(Objects.requireNonNull(inputRates, "inputRates"));
    outputRates = List.copyOf(Objects.requireNonNull(outputRates, "outputRates"));
    target = Objects.requireNonNullElse(target, OptionalLong.empty());
    format = Objects.requireNonNullElse(format, GraphFormat.DOT);
    output = Objects.requireNonNullElse(output, Optional.empty());
    if (inputRates.isEmpty()) {
      throw new IllegalArgumentException("inputs must list at least one flow");
    }
    if (outputRates.isEmpty()) {
      throw new IllegalArgumentException("outputs must list at least one flow");
    }
    if (target.isPresent()) {
      Numbers.requireRange("target", target.getAsLong(), 0, Integer.MAX_VALUE);
    }
  }

  /**
   * Creates a configuration from CLI-style key/value pairs.
   *
   * @param options merged key/value pairs; {@code inputs} and {@code outputs} are required
   * @return populated configuration
   * @throws IllegalArgumentException when values are missing or invalid
   */
  public static DesignConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String inputsRaw = options.get("inputs");
    if (inputsRaw == null || inputsRaw.isBlank()) {
      throw new IllegalArgumentException("inputs is required (e.g. inputs=480,480,480)");
    }
    String outputsRaw = options.get("outputs");
    if (outputsRaw == null || outputsRaw.isBlank()) {
      throw new IllegalArgumentException("outputs is required (e.g. outputs=45,45,45)");
    }
    List<Double> inputs = Numbers.parseRateList("inputs", inputsRaw);
    List<Double> outputs = Numbers.parseRateList("outputs", outputsRaw);

    OptionalLong target = OptionalLong.empty();
    String targetRaw = options.get("target");
    if (targetRaw != null && !targetRaw.isBlank()) {
      try {
        target = OptionalLong.of(Long.parseLong(targetRaw.trim()));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("target must be a whole number (was " + targetRaw + ")", ex);
      }
    }

    GraphFormat format = GraphFormat.parse(options.get("format"), GraphFormat.DOT);
    Optional<Path> output = parseOutput(options.get("out"));
    boolean pretty = Boolean.parseBoolean(Objects.requireNonNullElse(options.get("pretty"), "false").trim());
    return new DesignConfig(inputs, outputs, target, format, output, pretty);
  }

  /**
   * Whether fractional rates or an explicit target require apportioning before design.
   *
   * @return {@code true} when the flows are not already whole numbers used as given
   */
  public boolean apportioned() {
    return target.isPresent() || !Numbers.allWhole(inputRates) || !Numbers.allWhole(outputRates);
  }

  /**
   * Builds the integer flow specification handed to the designer.
   *
   * <p>Whole-number rates without a target are used as given, so unequal totals surface as an
   * infeasible request. Otherwise both sides are apportioned to {@code target}, or to the
   * largest whole total both sides can carry.</p>
   *
   * @return flow specification
   * @throws IllegalArgumentException if apportioning is impossible (for example all rates are zero)
   */
  public FlowSpec toFlowSpec() {
    if (!apportioned()) {
      return new FlowSpec(toInts(inputRates), toInts(outputRates));
    }
    long total = target.isPresent()
        ? target.getAsLong()
        : FlowApportioner.commonTotal(inputRates, outputRates);
    return new FlowSpec(
        FlowApportioner.apportion(inputRates, total),
        FlowApportioner.apportion(outputRates, total));
  }

  private static List<Integer> toInts(List<Double> rates) {
    List<Integer> values = new ArrayList<>(rates.size());
    for (double rate : rates) {
      values.add((int) rate);
    }
    return values;
  }

  private static Optional<Path> parseOutput(String raw) {
    if (raw == null || raw.isBlank() || raw.trim().equals(STDOUT)) {
      return Optional.empty();
    }
    String value = Strings.requireNonBlank("out", raw);
    try {
      return Optional.of(Path.of(value).toAbsolutePath().normalize());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("out is not a valid path: " + value, ex);
    }
  }
}
