package ca.gc.cra.balancer.domain.network;

import ca.gc.cra.balancer.domain.flow.AssignmentMatrix;
import ca.gc.cra.balancer.domain.flow.FlowAssigner;
import ca.gc.cra.balancer.domain.flow.FlowSpec;
import ca.gc.cra.balancer.domain.graph.BalancerGraph;
import ca.gc.cra.balancer.domain.graph.GraphNode;
import ca.gc.cra.balancer.domain.tree.DeviceCounter;
import ca.gc.cra.balancer.domain.tree.DeviceTreeSynthesizer;
import ca.gc.cra.balancer.domain.tree.Feed;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Designs a complete balancer network for one set of inputs and outputs.
 * <p><strong>Role:</strong> Domain service composing {@link FlowAssigner} and {@link DeviceTreeSynthesizer}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject infeasible specifications before any node exists.</li>
 *   <li>Create every input and output node, used or not.</li>
 *   <li>Build one split tree per feeding input and one merge tree per multiply-fed output.</li>
 *   <li>Own the device counter so splitter and merger ids never collide within a design.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; every call allocates its own graph and counter, so concurrent
 * designs need no coordination.</p>
 *
 * @since 0.1.0
 */
public final class NetworkAssembler {

  /** Creates an assembler. */
  public NetworkAssembler() {}

  /**
   * Designs the network for the given magnitudes.
   *
   * @param inputs input magnitudes in order
   * @param outputs output magnitudes in order
   * @return the complete graph
   * @throws ca.gc.cra.balancer.domain.flow.InfeasibleFlowException if the totals differ
   * @throws IllegalArgumentException if a magnitude is negative
   */
  public BalancerGraph design(List<Integer> inputs, List<Integer> outputs) {
    return design(new FlowSpec(inputs, outputs));
  }

  /**
   * Designs the network for {@code spec}.
   *
   * @param spec flow specification
   * @return the complete graph
   * @throws ca.gc.cra.balancer.domain.flow.InfeasibleFlowException if the totals differ
   */
  public BalancerGraph design(FlowSpec spec) {
    Objects.requireNonNull(spec, "spec").requireBalanced();
    AssignmentMatrix matrix = FlowAssigner.assign(spec);

    BalancerGraph.Builder graph = BalancerGraph.builder();
    List<GraphNode> inputNodes = new ArrayList<>(spec.inputs().size());
    for (int i = 0; i < spec.inputs().size(); i++) {
      inputNodes.add(graph.addNode(GraphNode.input(i)));
    }
    List<GraphNode> outputNodes = new ArrayList<>(spec.outputs().size());
    for (int j = 0; j < spec.outputs().size(); j++) {
      outputNodes.add(graph.addNode(GraphNode.output(j)));
    }

    DeviceTreeSynthesizer trees = new DeviceTreeSynthesizer(graph, new DeviceCounter());

    List<Map<Integer, Feed>> feedsByInput = new ArrayList<>(inputNodes.size());
    for (int i = 0; i < inputNodes.size(); i++) {
      Map<Integer, Integer> row = matrix.row(i);
      if (row.isEmpty()) {
        feedsByInput.add(Map.of());
        continue;
      }
      Map<Integer, Long> destinations = new LinkedHashMap<>();
      row.forEach((output, amount) -> destinations.put(output, amount.longValue()));
      feedsByInput.add(trees.buildSplitTree(inputNodes.get(i), destinations));
    }

    for (int j = 0; j < outputNodes.size(); j++) {
      List<Feed> contributors = new ArrayList<>();
      for (Map<Integer, Feed> feeds : feedsByInput) {
        Feed feed = feeds.get(j);
        if (feed != null) {
          contributors.add(feed);
        }
      }
      connectOutput(graph, trees, outputNodes.get(j), contributors);
    }
    return graph.build();
  }

  private static void connectOutput(
      BalancerGraph.Builder graph, DeviceTreeSynthesizer trees, GraphNode output, List<Feed> contributors) {
    if (contributors.isEmpty()) {
      return;
    }
    if (contributors.size() == 1) {
      Feed only = contributors.get(0);
      graph.addEdge(only.node(), output, only.flow());
      return;
    }
    GraphNode merged = trees.buildMergeTree(contributors);
    long total = 0L;
    for (Feed feed : contributors) {
      total += feed.flow();
    }
    graph.addEdge(merged, output, total);
  }
}
