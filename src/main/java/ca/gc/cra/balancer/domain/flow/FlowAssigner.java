package ca.gc.cra.balancer.domain.flow;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Greedy first-available matcher deciding which inputs feed which outputs.
 * <p><strong>Role:</strong> First stage of balancer synthesis; produces the {@link AssignmentMatrix}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Single pass, {@code O(inputs + outputs)} queue operations.</p>
 *
 * <p>Outputs are served in order from a queue of inputs kept in input order. A partially
 * consumed input returns to the front of the queue so it keeps feeding the next output before
 * any later input is touched.</p>
 *
 * @implNote Zero-magnitude inputs are drained without recording a cell and zero-magnitude outputs
 * receive no cells, so the matrix only ever holds positive amounts.
 * @since 0.1.0
 */
public final class FlowAssigner {
  private FlowAssigner() {
    // Utility
  }

  /**
   * Assigns inputs to outputs.
   *
   * @param inputs input magnitudes in order; must be non-negative
   * @param outputs output magnitudes in order; must be non-negative
   * @return the assignment matrix
   * @throws IllegalStateException if the inputs run out before the outputs are satisfied, which
   *     only happens when the caller skipped the balance check
   */
  public static AssignmentMatrix assign(List<Integer> inputs, List<Integer> outputs) {
    Objects.requireNonNull(inputs, "inputs");
    Objects.requireNonNull(outputs, "outputs");
    AssignmentMatrix.Builder matrix = AssignmentMatrix.builder(inputs.size(), outputs.size());

    Deque<Slot> available = new ArrayDeque<>(inputs.size());
    for (int i = 0; i < inputs.size(); i++) {
      available.addLast(new Slot(i, inputs.get(i)));
    }

    for (int out = 0; out < outputs.size(); out++) {
      int remaining = outputs.get(out);
      while (remaining > 0) {
        Slot slot = available.pollFirst();
        if (slot == null) {
          throw new IllegalStateException(
              "inputs exhausted with " + remaining + " still required by output " + out);
        }
        if (slot.flow() <= remaining) {
          if (slot.flow() > 0) {
            matrix.put(slot.input(), out, slot.flow());
          }
          remaining -= slot.flow();
        } else {
          matrix.put(slot.input(), out, remaining);
          available.addFirst(new Slot(slot.input(), slot.flow() - remaining));
          remaining = 0;
        }
      }
    }
    return matrix.build();
  }

  /**
   * Convenience overload taking a validated specification.
   *
   * @param spec balanced flow specification
   * @return the assignment matrix
   */
  public static AssignmentMatrix assign(FlowSpec spec) {
    Objects.requireNonNull(spec, "spec");
    return assign(spec.inputs(), spec.outputs());
  }

  private record Slot(int input, int flow) {}
}
