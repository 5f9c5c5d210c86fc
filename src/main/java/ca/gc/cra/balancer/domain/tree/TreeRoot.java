package ca.gc.cra.balancer.domain.tree;

import ca.gc.cra.balancer.domain.graph.GraphNode;
import java.util.Map;
import java.util.Objects;

/**
 * Root of a partial split tree while destinations are being grouped under splitters.
 *
 * <p>A {@link Leaf} is a destination that no device emits to yet; a {@link Device} is a splitter
 * already placed, together with every destination underneath it.</p>
 */
sealed interface TreeRoot permits TreeRoot.Leaf, TreeRoot.Device {

  /**
   * Total flow passing through this root.
   *
   * @return flow
   */
  long flow();

  /**
   * Destinations reached through this root, with their flows.
   *
   * @return destination index to flow
   */
  Map<Integer, Long> destinations();

  /** Destination not yet backed by a materialized device. */
  record Leaf(int destination, long flow) implements TreeRoot {
    @Override
    public Map<Integer, Long> destinations() {
      return Map.of(destination, flow);
    }
  }

  /** Splitter placed during grouping, with the destinations it ultimately serves. */
  record Device(GraphNode node, Map<Integer, Long> destinations) implements TreeRoot {
    public Device {
      Objects.requireNonNull(node, "node");
      destinations = Map.copyOf(destinations);
    }

    @Override
    public long flow() {
      long sum = 0L;
      for (long value : destinations.values()) {
        sum += value;
      }
      return sum;
    }
  }
}
