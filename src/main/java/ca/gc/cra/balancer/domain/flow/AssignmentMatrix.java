package ca.gc.cra.balancer.domain.flow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Sparse relation recording how much each input contributes to each output.
 * <p><strong>Role:</strong> Output of {@link FlowAssigner}; input to the device tree builders.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built; safe to share.</p>
 *
 * <p>Only strictly positive amounts are stored. Row iteration follows the order in which the
 * assigner matched outputs, which is ascending output index.</p>
 *
 * @since 0.1.0
 */
public final class AssignmentMatrix {
  private final List<Map<Integer, Integer>> rows;
  private final int outputCount;

  private AssignmentMatrix(List<Map<Integer, Integer>> rows, int outputCount) {
    this.rows = rows;
    this.outputCount = outputCount;
  }

  /**
   * Number of inputs the matrix was built for.
   *
   * @return input count, including inputs with no assignments
   */
  public int inputCount() {
    return rows.size();
  }

  /**
   * Number of outputs the matrix was built for.
   *
   * @return output count, including outputs with no assignments
   */
  public int outputCount() {
    return outputCount;
  }

  /**
   * Returns the amount assigned from {@code input} to {@code output}.
   *
   * @param input input index
   * @param output output index
   * @return assigned amount, or {@code 0} when the pair carries no flow
   * @throws IndexOutOfBoundsException if {@code input} is out of range
   */
  public int amount(int input, int output) {
    Integer value = rows.get(input).get(output);
    return value == null ? 0 : value;
  }

  /**
   * Returns the outputs fed by {@code input}.
   *
   * @param input input index
   * @return unmodifiable map of output index to amount, in assignment order
   */
  public Map<Integer, Integer> row(int input) {
    return rows.get(input);
  }

  /**
   * Returns the inputs feeding {@code output}.
   *
   * @param output output index
   * @return unmodifiable map of input index to amount, in input order
   */
  public Map<Integer, Integer> column(int output) {
    Map<Integer, Integer> column = new LinkedHashMap<>();
    for (int input = 0; input < rows.size(); input++) {
      Integer value = rows.get(input).get(output);
      if (value != null) {
        column.put(input, value);
      }
    }
    return Collections.unmodifiableMap(column);
  }

  /**
   * Total number of non-zero cells.
   *
   * @return number of (input, output) pairs carrying flow
   */
  public int entryCount() {
    int count = 0;
    for (Map<Integer, Integer> row : rows) {
      count += row.size();
    }
    return count;
  }

  /**
   * Sum of the amounts leaving {@code input}.
   *
   * @param input input index
   * @return row total
   */
  public long rowTotal(int input) {
    long sum = 0L;
    for (int value : rows.get(input).values()) {
      sum += value;
    }
    return sum;
  }

  /**
   * Sum of the amounts reaching {@code output}.
   *
   * @param output output index
   * @return column total
   */
  public long columnTotal(int output) {
    long sum = 0L;
    for (Map<Integer, Integer> row : rows) {
      Integer value = row.get(output);
      if (value != null) {
        sum += value;
      }
    }
    return sum;
  }

  @Override
  public String toString() {
    return "AssignmentMatrix" + rows;
  }

  static Builder builder(int inputCount, int outputCount) {
    return new Builder(inputCount, outputCount);
  }

  /** Mutable accumulator used by {@link FlowAssigner} while matching. */
  static final class Builder {
    private final List<Map<Integer, Integer>> rows;
    private final int outputCount;

    private Builder(int inputCount, int outputCount) {
      this.rows = new ArrayList<>(inputCount);
      for (int i = 0; i < inputCount; i++) {
        rows.add(new LinkedHashMap<>());
      }
      this.outputCount = outputCount;
    }

    Builder put(int input, int output, int amount) {
      if (amount <= 0) {
        throw new IllegalStateException(
            "assignment amount must be positive (input " + input + ", output " + output + ")");
      }
      Objects.checkIndex(output, outputCount);
      Integer previous = rows.get(input).putIfAbsent(output, amount);
      if (previous != null) {
        throw new IllegalStateException(
            "input " + input + " already assigned to output " + output);
      }
      return this;
    }

    AssignmentMatrix build() {
      List<Map<Integer, Integer>> frozen = new ArrayList<>(rows.size());
      for (Map<Integer, Integer> row : rows) {
        frozen.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
      }
      return new AssignmentMatrix(List.copyOf(frozen), outputCount);
    }
  }
}
