package ca.gc.cra.balancer.domain.graph;

import java.util.Objects;

/**
 * Directed, flow-labelled arc between two nodes of a {@link BalancerGraph}.
 *
 * @param source id of the emitting node
 * @param target id of the receiving node
 * @param flow amount carried along the arc; non-negative
 * @since 0.1.0
 */
public record GraphEdge(String source, String target, long flow) {

  /**
   * Validates the edge fields.
   *
   * @throws NullPointerException if an endpoint is {@code null}
   * @throws IllegalArgumentException if {@code flow} is negative
   */
  public GraphEdge {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    if (flow < 0) {
      throw new IllegalArgumentException("flow must be non-negative (was " + flow + ")");
    }
  }

  /**
   * Text written on the arc when rendered.
   *
   * @return decimal flow
   */
  public String label() {
    return Long.toString(flow);
  }
}
