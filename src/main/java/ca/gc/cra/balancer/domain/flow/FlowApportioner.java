package ca.gc.cra.balancer.domain.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts fractional flow rates into whole-number flows that sum exactly to a target total.
 *
 * <p>Every entry except the last receives the truncated proportional share
 * {@code floor(rate * target / sum)}; the last entry absorbs the remainder. Planners that work in
 * fractional items-per-minute use this before calling the designer, which only accepts integers.</p>
 *
 * @since 0.1.0
 */
public final class FlowApportioner {
  private FlowApportioner() {
    // Utility
  }

  /**
   * Apportions {@code targetTotal} across {@code rates}.
   *
   * @param rates non-negative, finite rates; at least one must be positive
   * @param targetTotal whole-number total to distribute; must be non-negative
   * @return integer flows in the same order as {@code rates}, summing to {@code targetTotal}
   * @throws IllegalArgumentException if the rates are empty, negative, non-finite or all zero, or
   *     if a share does not fit in an {@code int}
   */
  public static List<Integer> apportion(List<Double> rates, long targetTotal) {
    Objects.requireNonNull(rates, "rates");
    if (rates.isEmpty()) {
      throw new IllegalArgumentException("rates must not be empty");
    }
    if (targetTotal < 0) {
      throw new IllegalArgumentException("targetTotal must be non-negative (was " + targetTotal + ")");
    }
    double sourceTotal = 0.0;
    for (int i = 0; i < rates.size(); i++) {
      double rate = Objects.requireNonNull(rates.get(i), "rates[" + i + "]");
      if (!Double.isFinite(rate) || rate < 0.0) {
        throw new IllegalArgumentException("rates[" + i + "] must be finite and non-negative (was " + rate + ")");
      }
      sourceTotal += rate;
    }
    if (sourceTotal <= 0.0) {
      throw new IllegalArgumentException("rates must contain at least one positive value");
    }

    List<Integer> result = new ArrayList<>(rates.size());
    long remaining = targetTotal;
    for (int i = 0; i < rates.size(); i++) {
      long share;
      if (i == rates.size() - 1) {
        share = remaining;
      } else {
        share = (long) (rates.get(i) * targetTotal / sourceTotal);
        remaining -= share;
      }
      if (share > Integer.MAX_VALUE) {
        throw new IllegalArgumentException("apportioned flow " + share + " exceeds integer range");
      }
      result.add((int) share);
    }
    return List.copyOf(result);
  }

  /**
   * Largest whole total both sides can carry: the smaller of the two truncated sums.
   *
   * @param inputs fractional input rates
   * @param outputs fractional output rates
   * @return common integer total
   */
  public static long commonTotal(List<Double> inputs, List<Double> outputs) {
    return Math.min(truncatedSum(inputs), truncatedSum(outputs));
  }

  private static long truncatedSum(List<Double> values) {
    double sum = 0.0;
    for (Double value : Objects.requireNonNull(values, "values")) {
      sum += Objects.requireNonNull(value, "value");
    }
    return (long) sum;
  }
}
