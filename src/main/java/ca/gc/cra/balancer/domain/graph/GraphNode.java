package ca.gc.cra.balancer.domain.graph;

import java.util.Objects;

/**
 * <strong>What:</strong> Immutable node of a balancer graph.
 * <p><strong>Role:</strong> Domain value held by {@link BalancerGraph}; created once and never mutated.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param id stable identifier such as {@code I0}, {@code O4}, {@code S2} or {@code M7}
 * @param kind node kind carrying the rendering hints
 * @param label display label; empty for devices
 * @since 0.1.0
 */
public record GraphNode(String id, NodeKind kind, String label) {

  /**
   * Validates the node fields.
   *
   * @throws NullPointerException if any field is {@code null}
   * @throws IllegalArgumentException if {@code id} is blank
   */
  public GraphNode {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(label, "label");
    if (id.isBlank()) {
      throw new IllegalArgumentException("id must not be blank");
    }
  }

  /**
   * Creates the node for input {@code index}.
   *
   * @param index zero-based input position
   * @return node {@code I<index>} labelled {@code Input <index>}
   */
  public static GraphNode input(int index) {
    return new GraphNode(id(NodeKind.INPUT, index), NodeKind.INPUT, "Input " + index);
  }

  /**
   * Creates the node for output {@code index}.
   *
   * @param index zero-based output position
   * @return node {@code O<index>} labelled {@code Output <index>}
   */
  public static GraphNode output(int index) {
    return new GraphNode(id(NodeKind.OUTPUT, index), NodeKind.OUTPUT, "Output " + index);
  }

  /**
   * Creates a splitter node.
   *
   * @param number device number drawn from the per-design counter
   * @return node {@code S<number>}
   */
  public static GraphNode splitter(int number) {
    return new GraphNode(id(NodeKind.SPLITTER, number), NodeKind.SPLITTER, "");
  }

  /**
   * Creates a merger node.
   *
   * @param number device number drawn from the per-design counter
   * @return node {@code M<number>}
   */
  public static GraphNode merger(int number) {
    return new GraphNode(id(NodeKind.MERGER, number), NodeKind.MERGER, "");
  }

  private static String id(NodeKind kind, int number) {
    if (number < 0) {
      throw new IllegalArgumentException("node number must be non-negative (was " + number + ")");
    }
    return kind.idPrefix() + Integer.toString(number);
  }
}
