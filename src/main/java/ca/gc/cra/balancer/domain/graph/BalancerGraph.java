package ca.gc.cra.balancer.domain.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Complete, immutable result of one balancer design: nodes, flow-labelled edges and the
 * layout direction.
 * <p><strong>Why:</strong> Embedders (planners splicing one balancer per material into a larger diagram) work on
 * this structured value instead of re-parsing rendered text.</p>
 * <p><strong>Role:</strong> Domain value returned by {@code NetworkAssembler} and consumed by renderers.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads.</p>
 *
 * <p>Nodes and edges keep their creation order, which makes two designs of the same input
 * byte-for-byte comparable.</p>
 *
 * @since 0.1.0
 */
public final class BalancerGraph {
  /** Left-to-right layout used for every balancer graph. */
  public static final String RANK_DIR = "LR";

  private final List<GraphNode> nodes;
  private final List<GraphEdge> edges;
  private final Map<String, GraphNode> nodesById;

  private BalancerGraph(List<GraphNode> nodes, List<GraphEdge> edges) {
    this.nodes = List.copyOf(nodes);
    this.edges = List.copyOf(edges);
    Map<String, GraphNode> index = new HashMap<>();
    for (GraphNode node : this.nodes) {
      index.put(node.id(), node);
    }
    this.nodesById = Map.copyOf(index);
  }

  /**
   * Starts an empty graph.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * All nodes in creation order.
   *
   * @return unmodifiable node list
   */
  public List<GraphNode> nodes() {
    return nodes;
  }

  /**
   * All edges in creation order.
   *
   * @return unmodifiable edge list
   */
  public List<GraphEdge> edges() {
    return edges;
  }

  /**
   * Layout direction hint.
   *
   * @return always {@value #RANK_DIR}
   */
  public String rankDir() {
    return RANK_DIR;
  }

  /**
   * Looks up a node by id.
   *
   * @param id node id
   * @return the node, if present
   */
  public Optional<GraphNode> node(String id) {
    return Optional.ofNullable(nodesById.get(id));
  }

  /**
   * Nodes of a given kind, in creation order.
   *
   * @param kind node kind
   * @return matching nodes
   */
  public List<GraphNode> nodesOf(NodeKind kind) {
    List<GraphNode> result = new ArrayList<>();
    for (GraphNode node : nodes) {
      if (node.kind() == kind) {
        result.add(node);
      }
    }
    return List.copyOf(result);
  }

  /**
   * Number of splitter devices.
   *
   * @return splitter count
   */
  public int splitterCount() {
    return nodesOf(NodeKind.SPLITTER).size();
  }

  /**
   * Number of merger devices.
   *
   * @return merger count
   */
  public int mergerCount() {
    return nodesOf(NodeKind.MERGER).size();
  }

  /**
   * Sum of the flow on edges entering {@code id}.
   *
   * @param id node id
   * @return inbound flow; {@code 0} when the node has no inbound edges
   */
  public long inflowTo(String id) {
    long sum = 0L;
    for (GraphEdge edge : edges) {
      if (edge.target().equals(id)) {
        sum += edge.flow();
      }
    }
    return sum;
  }

  /**
   * Sum of the flow on edges leaving {@code id}.
   *
   * @param id node id
   * @return outbound flow; {@code 0} when the node has no outbound edges
   */
  public long outflowFrom(String id) {
    long sum = 0L;
    for (GraphEdge edge : edges) {
      if (edge.source().equals(id)) {
        sum += edge.flow();
      }
    }
    return sum;
  }

  /**
   * Renames the graph so it can be spliced into a larger diagram.
   *
   * <p>Input and output nodes take the embedder's names (which also become their labels);
   * splitter and merger ids become {@code <namespace>_<id>}. Edge flows are preserved.</p>
   *
   * @param namespace prefix for device ids, typically a material name; must not be blank
   * @param inputNames one name per input node, in input order
   * @param outputNames one name per output node, in output order
   * @return renamed copy of this graph
   * @throws IllegalArgumentException if the name counts do not match, a name is blank, or the
   *     renaming produces duplicate ids
   */
  public BalancerGraph embed(String namespace, List<String> inputNames, List<String> outputNames) {
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(inputNames, "inputNames");
    Objects.requireNonNull(outputNames, "outputNames");
    if (namespace.isBlank()) {
      throw new IllegalArgumentException("namespace must not be blank");
    }
    List<GraphNode> inputs = nodesOf(NodeKind.INPUT);
    List<GraphNode> outputs = nodesOf(NodeKind.OUTPUT);
    requireCount("inputNames", inputNames, inputs.size());
    requireCount("outputNames", outputNames, outputs.size());

    Map<String, String> renames = new LinkedHashMap<>();
    for (int i = 0; i < inputs.size(); i++) {
      renames.put(inputs.get(i).id(), requireName("inputNames", i, inputNames.get(i)));
    }
    for (int i = 0; i < outputs.size(); i++) {
      renames.put(outputs.get(i).id(), requireName("outputNames", i, outputNames.get(i)));
    }
    String prefix = namespace.trim() + "_";
    for (GraphNode node : nodes) {
      if (node.kind().isDevice()) {
        renames.put(node.id(), prefix + node.id());
      }
    }
    Set<String> distinct = new HashSet<>(renames.values());
    if (distinct.size() != renames.size()) {
      throw new IllegalArgumentException("embedding produces duplicate node ids: " + renames.values());
    }

    Builder builder = builder();
    for (GraphNode node : nodes) {
      String renamed = renames.get(node.id());
      String label = node.kind().isDevice() ? node.label() : renamed;
      builder.addNode(new GraphNode(renamed, node.kind(), label));
    }
    for (GraphEdge edge : edges) {
      builder.addEdge(renames.get(edge.source()), renames.get(edge.target()), edge.flow());
    }
    return builder.build();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof BalancerGraph that)) {
      return false;
    }
    return nodes.equals(that.nodes) && edges.equals(that.edges);
  }

  @Override
  public int hashCode() {
    return Objects.hash(nodes, edges);
  }

  @Override
  public String toString() {
    return "BalancerGraph{nodes=" + nodes.size() + ", edges=" + edges.size()
        + ", splitters=" + splitterCount() + ", mergers=" + mergerCount() + "}";
  }

  private static void requireCount(String name, List<String> names, int expected) {
    if (names.size() != expected) {
      throw new IllegalArgumentException(
          name + " must contain " + expected + " entries (was " + names.size() + ")");
    }
  }

  private static String requireName(String list, int index, String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException(list + "[" + index + "] must not be blank");
    }
    return name.trim();
  }

  /**
   * Accumulates nodes and edges during one design call.
   *
   * <p>Not thread-safe; owned by a single design invocation. Edges may only reference nodes that
   * were added earlier, and node ids must be unique.</p>
   */
  public static final class Builder {
    private final List<GraphNode> nodes = new ArrayList<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private final Set<String> ids = new HashSet<>();

    private Builder() {}

    /**
     * Adds a node.
     *
     * @param node node to add
     * @return the added node
     * @throws IllegalStateException if a node with the same id already exists
     */
    public GraphNode addNode(GraphNode node) {
      Objects.requireNonNull(node, "node");
      if (!ids.add(node.id())) {
        throw new IllegalStateException("duplicate node id " + node.id());
      }
      nodes.add(node);
      return node;
    }

    /**
     * Adds a flow-labelled edge between two existing nodes.
     *
     * @param source emitting node id
     * @param target receiving node id
     * @param flow carried amount
     * @return the added edge
     * @throws IllegalStateException if either endpoint is unknown
     */
    public GraphEdge addEdge(String source, String target, long flow) {
      if (!ids.contains(source)) {
        throw new IllegalStateException("edge source " + source + " is not a known node");
      }
      if (!ids.contains(target)) {
        throw new IllegalStateException("edge target " + target + " is not a known node");
      }
      GraphEdge edge = new GraphEdge(source, target, flow);
      edges.add(edge);
      return edge;
    }

    /**
     * Adds a flow-labelled edge between two existing nodes.
     *
     * @param source emitting node
     * @param target receiving node
     * @param flow carried amount
     * @return the added edge
     */
    public GraphEdge addEdge(GraphNode source, GraphNode target, long flow) {
      return addEdge(source.id(), target.id(), flow);
    }

    /**
     * Freezes the accumulated nodes and edges.
     *
     * @return immutable graph
     */
    public BalancerGraph build() {
      return new BalancerGraph(nodes, edges);
    }
  }
}
