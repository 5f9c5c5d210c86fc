package ca.gc.cra.balancer.domain.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class BalancerGraphTest {

  @Test
  void embedRenamesEndpointsAndPrefixesDevices() {
    BalancerGraph embedded = splitToThree().embed("iron", List.of("Smelter"), List.of("A", "B", "C"));

    assertEquals(List.of(
        new GraphNode("Smelter", NodeKind.INPUT, "Smelter"),
        new GraphNode("A", NodeKind.OUTPUT, "A"),
        new GraphNode("B", NodeKind.OUTPUT, "B"),
        new GraphNode("C", NodeKind.OUTPUT, "C"),
        new GraphNode("iron_S0", NodeKind.SPLITTER, "")), embedded.nodes());
    assertEquals(List.of(
        new GraphEdge("Smelter", "iron_S0", 90),
        new GraphEdge("iron_S0", "A", 30),
        new GraphEdge("iron_S0", "B", 30),
        new GraphEdge("iron_S0", "C", 30)), embedded.edges());
  }

  @Test
  void embedTrimsNames() {
    BalancerGraph embedded = splitToThree().embed(" copper ", List.of(" in "), List.of("x", "y", "z"));

    assertTrue(embedded.node("in").isPresent());
    assertTrue(embedded.node("copper_S0").isPresent());
  }

  @Test
  void embedRejectsMismatchedNameCounts() {
    BalancerGraph graph = splitToThree();

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> graph.embed("ns", List.of("in"), List.of("a", "b")));
    assertEquals("outputNames must contain 3 entries (was 2)", ex.getMessage());
    assertThrows(IllegalArgumentException.class,
        () -> graph.embed("ns", List.of(), List.of("a", "b", "c")));
  }

  @Test
  void embedRejectsBlankNames() {
    BalancerGraph graph = splitToThree();

    assertThrows(IllegalArgumentException.class,
        () -> graph.embed(" ", List.of("in"), List.of("a", "b", "c")));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> graph.embed("ns", List.of("in"), List.of("a", "", "c")));
    assertEquals("outputNames[1] must not be blank", ex.getMessage());
  }

  @Test
  void embedRejectsDuplicateIds() {
    BalancerGraph graph = splitToThree();

    assertThrows(IllegalArgumentException.class,
        () -> graph.embed("ns", List.of("in"), List.of("a", "a", "c")));
    assertThrows(IllegalArgumentException.class,
        () -> graph.embed("ns", List.of("ns_S0"), List.of("a", "b", "c")));
  }

  @Test
  void builderRejectsDuplicateNodes() {
    BalancerGraph.Builder builder = BalancerGraph.builder();
    builder.addNode(GraphNode.input(0));

    assertThrows(IllegalStateException.class, () -> builder.addNode(GraphNode.input(0)));
  }

  @Test
  void builderRejectsEdgesToUnknownNodes() {
    BalancerGraph.Builder builder = BalancerGraph.builder();
    builder.addNode(GraphNode.input(0));

    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> builder.addEdge("I0", "O0", 5));
    assertEquals("edge target O0 is not a known node", ex.getMessage());
    assertThrows(IllegalStateException.class, () -> builder.addEdge("S9", "I0", 5));
  }

  @Test
  void statisticsCountDevicesAndFlows() {
    BalancerGraph graph = splitToThree();

    assertEquals(1, graph.splitterCount());
    assertEquals(0, graph.mergerCount());
    assertEquals(90L, graph.outflowFrom("I0"));
    assertEquals(90L, graph.inflowTo("S0"));
    assertEquals(30L, graph.inflowTo("O2"));
    assertEquals(0L, graph.inflowTo("I0"));
    assertEquals(List.of(GraphNode.output(0), GraphNode.output(1), GraphNode.output(2)),
        graph.nodesOf(NodeKind.OUTPUT));
    assertEquals("BalancerGraph{nodes=5, edges=4, splitters=1, mergers=0}", graph.toString());
  }

  @Test
  void equalityFollowsNodesAndEdges() {
    assertEquals(splitToThree(), splitToThree());
    assertEquals(splitToThree().hashCode(), splitToThree().hashCode());
    assertNotEquals(splitToThree(), splitToThree().embed("ns", List.of("in"), List.of("a", "b", "c")));
  }

  @Test
  void edgesRejectNegativeFlow() {
    assertThrows(IllegalArgumentException.class, () -> new GraphEdge("I0", "O0", -1));
    assertEquals("12", new GraphEdge("I0", "O0", 12).label());
  }

  @Test
  void nodeFactoriesFollowNamingScheme() {
    assertEquals(new GraphNode("I3", NodeKind.INPUT, "Input 3"), GraphNode.input(3));
    assertEquals(new GraphNode("O1", NodeKind.OUTPUT, "Output 1"), GraphNode.output(1));
    assertEquals("S7", GraphNode.splitter(7).id());
    assertEquals("M2", GraphNode.merger(2).id());
    assertThrows(IllegalArgumentException.class, () -> GraphNode.merger(-1));
  }

  private static BalancerGraph splitToThree() {
    BalancerGraph.Builder builder = BalancerGraph.builder();
    GraphNode input = builder.addNode(GraphNode.input(0));
    GraphNode splitter = GraphNode.splitter(0);
    for (int j = 0; j < 3; j++) {
      builder.addNode(GraphNode.output(j));
    }
    builder.addNode(splitter);
    builder.addEdge(input, splitter, 90);
    for (int j = 0; j < 3; j++) {
      builder.addEdge("S0", "O" + j, 30);
    }
    return builder.build();
  }
}
