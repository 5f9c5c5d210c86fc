package ca.gc.cra.balancer.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> Numeric parsing and validation helpers for flow rates supplied on the command line.
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no logs; throws {@link IllegalArgumentException} when validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a comma-separated list of non-negative rates such as {@code 480,480,480} or {@code 7.5,2.5}.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw comma-separated list; must contain at least one entry
   * @return parsed rates in order
   * @throws IllegalArgumentException if the list is blank, has empty entries, or holds negative or non-finite numbers
   */
  public static List<Double> parseRateList(String name, String raw) {
    String list = Strings.requireNonBlank(name, raw);
    List<Double> rates = new ArrayList<>();
    for (String token : list.split(",", -1)) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        throw new IllegalArgumentException(Strings.message(name, "contains an empty entry"));
      }
      double value;
      try {
        value = Double.parseDouble(trimmed);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(Strings.message(name, "entry is not a number: " + trimmed), ex);
      }
      if (!Double.isFinite(value) || value < 0) {
        throw new IllegalArgumentException(Strings.message(name, "entries must be finite and >= 0 (was " + trimmed + ")"));
      }
      rates.add(value);
    }
    return List.copyOf(rates);
  }

  /**
   * Reports whether every rate is a whole number that fits in an {@code int}.
   *
   * @param rates parsed rates
   * @return {@code true} if no apportioning is needed
   */
  public static boolean allWhole(List<Double> rates) {
    for (double rate : rates) {
      if (rate != Math.rint(rate) || rate > Integer.MAX_VALUE) {
        return false;
      }
    }
    return true;
  }
}
