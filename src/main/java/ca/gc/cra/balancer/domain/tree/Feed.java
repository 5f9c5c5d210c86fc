package ca.gc.cra.balancer.domain.tree;

import ca.gc.cra.balancer.domain.graph.GraphNode;
import java.util.Objects;

/**
 * Materialized node that emits a stream at a given rate.
 *
 * <p>Returned by split trees to say which node feeds each destination, and consumed by merge
 * trees as their source streams.</p>
 *
 * @param node emitting node
 * @param flow rate carried by the stream; non-negative
 * @since 0.1.0
 */
public record Feed(GraphNode node, long flow) {

  /**
   * Validates the feed.
   *
   * @throws NullPointerException if {@code node} is {@code null}
   * @throws IllegalArgumentException if {@code flow} is negative
   */
  public Feed {
    Objects.requireNonNull(node, "node");
    if (flow < 0) {
      throw new IllegalArgumentException("flow must be non-negative (was " + flow + ")");
    }
  }
}
