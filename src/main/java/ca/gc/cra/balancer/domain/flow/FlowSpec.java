package ca.gc.cra.balancer.domain.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Ordered input and output flow magnitudes handed to the balancer designer.
 * <p><strong>Why:</strong> Order drives both the greedy assignment and the {@code I<n>}/{@code O<n>} numbering of
 * the rendered graph, so the lists are kept exactly as supplied.</p>
 * <p><strong>Role:</strong> Domain value object consumed by {@code NetworkAssembler}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; lists are copied on construction.</p>
 *
 * @param inputs input magnitudes in caller order; each must be non-negative
 * @param outputs output magnitudes in caller order; each must be non-negative
 * @since 0.1.0
 */
public record FlowSpec(List<Integer> inputs, List<Integer> outputs) {

  /**
   * Copies and validates the supplied magnitudes.
   *
   * @throws NullPointerException if either list or any element is {@code null}
   * @throws IllegalArgumentException if any magnitude is negative
   */
  public FlowSpec {
    inputs = copyNonNegative("inputs", inputs);
    outputs = copyNonNegative("outputs", outputs);
  }

  /**
   * Convenience factory for array call sites.
   *
   * @param inputs input magnitudes
   * @param outputs output magnitudes
   * @return validated specification
   */
  public static FlowSpec of(int[] inputs, int[] outputs) {
    Objects.requireNonNull(inputs, "inputs");
    Objects.requireNonNull(outputs, "outputs");
    List<Integer> in = new ArrayList<>(inputs.length);
    for (int value : inputs) {
      in.add(value);
    }
    List<Integer> out = new ArrayList<>(outputs.length);
    for (int value : outputs) {
      out.add(value);
    }
    return new FlowSpec(in, out);
  }

  /**
   * Returns the sum of all inputs.
   *
   * @return input total computed in {@code long} arithmetic
   */
  public long inputTotal() {
    return total(inputs);
  }

  /**
   * Returns the sum of all outputs.
   *
   * @return output total computed in {@code long} arithmetic
   */
  public long outputTotal() {
    return total(outputs);
  }

  /**
   * Ensures the inputs can be redistributed into the outputs.
   *
   * @return this specification for fluent call sites
   * @throws InfeasibleFlowException when the totals differ
   */
  public FlowSpec requireBalanced() {
    long in = inputTotal();
    long out = outputTotal();
    if (in != out) {
      throw new InfeasibleFlowException(in, out);
    }
    return this;
  }

  private static long total(List<Integer> values) {
    long sum = 0L;
    for (int value : values) {
      sum += value;
    }
    return sum;
  }

  private static List<Integer> copyNonNegative(String name, List<Integer> values) {
    Objects.requireNonNull(values, name);
    for (int i = 0; i < values.size(); i++) {
      Integer value = Objects.requireNonNull(values.get(i), name + "[" + i + "]");
      if (value < 0) {
        throw new IllegalArgumentException(
            name + "[" + i + "] must be non-negative (was " + value + ")");
      }
    }
    return List.copyOf(values);
  }
}
