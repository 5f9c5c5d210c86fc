package ca.gc.cra.balancer.domain.network;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.balancer.domain.flow.FlowSpec;
import ca.gc.cra.balancer.domain.flow.InfeasibleFlowException;
import ca.gc.cra.balancer.domain.graph.BalancerGraph;
import ca.gc.cra.balancer.domain.graph.GraphEdge;
import ca.gc.cra.balancer.domain.graph.GraphNode;
import ca.gc.cra.balancer.domain.graph.NodeKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class NetworkAssemblerTest {
  private final NetworkAssembler assembler = new NetworkAssembler();

  @Test
  void infeasibleRequestIsRejected() {
    InfeasibleFlowException ex = assertThrows(InfeasibleFlowException.class,
        () -> assembler.design(List.of(100, 50), List.of(120)));
    assertEquals(150L, ex.inputTotal());
    assertEquals(120L, ex.outputTotal());
  }

  @Test
  void matchingSingleInputAndOutputAreConnectedDirectly() {
    BalancerGraph graph = assembler.design(List.of(100), List.of(100));

    assertEquals(List.of(GraphNode.input(0), GraphNode.output(0)), graph.nodes());
    assertEquals(List.of(new GraphEdge("I0", "O0", 100)), graph.edges());
    assertEquals(BalancerGraph.RANK_DIR, graph.rankDir());
  }

  @Test
  void oneInputSplitsEvenlyAcrossThreeOutputs() {
    BalancerGraph graph = assembler.design(List.of(90), List.of(30, 30, 30));

    assertEquals(1, graph.splitterCount());
    assertEquals(0, graph.mergerCount());
    assertEquals(List.of(
        new GraphEdge("I0", "S0", 90),
        new GraphEdge("S0", "O0", 30),
        new GraphEdge("S0", "O1", 30),
        new GraphEdge("S0", "O2", 30)), graph.edges());
  }

  @Test
  void threeInputsMergeIntoOneOutput() {
    BalancerGraph graph = assembler.design(List.of(30, 30, 30), List.of(90));

    assertEquals(0, graph.splitterCount());
    assertEquals(1, graph.mergerCount());
    assertEquals(List.of(
        new GraphEdge("I2", "M0", 30),
        new GraphEdge("I1", "M0", 30),
        new GraphEdge("I0", "M0", 30),
        new GraphEdge("M0", "O0", 90)), graph.edges());
  }

  @Test
  void splittersAndMergersShareDeviceNumbering() {
    BalancerGraph graph = assembler.design(List.of(5, 10), List.of(7, 8));

    assertEquals(List.of("I0", "I1", "O0", "O1", "S0", "M1"), ids(graph));
    assertEquals(List.of(
        new GraphEdge("I1", "S0", 10),
        new GraphEdge("I0", "M1", 5),
        new GraphEdge("S0", "M1", 2),
        new GraphEdge("M1", "O0", 7),
        new GraphEdge("S0", "O1", 8)), graph.edges());
  }

  @Test
  void mixedScenarioUsesSixteenSplittersAndTwoMergers() {
    List<Integer> outputs = Collections.nCopies(32, 45);
    BalancerGraph graph = assembler.design(List.of(480, 480, 480), outputs);

    assertEquals(16, graph.splitterCount());
    assertEquals(2, graph.mergerCount());
    for (int j = 0; j < outputs.size(); j++) {
      assertEquals(45L, graph.inflowTo("O" + j), "output " + j);
    }
    assertConserved(graph, List.of(480, 480, 480), outputs);
  }

  @Test
  void fanOutUsesMinimalSplitters() {
    for (int n = 2; n <= 11; n++) {
      BalancerGraph graph = assembler.design(List.of(12 * n), Collections.nCopies(n, 12));

      assertEquals(n / 2, graph.splitterCount(), "n=" + n);
      assertEquals(0, graph.mergerCount(), "n=" + n);
    }
  }

  @Test
  void fanInUsesMinimalMergers() {
    for (int n = 2; n <= 11; n++) {
      BalancerGraph graph = assembler.design(Collections.nCopies(n, 12), List.of(12 * n));

      assertEquals(n / 2, graph.mergerCount(), "n=" + n);
      assertEquals(0, graph.splitterCount(), "n=" + n);
    }
  }

  @Test
  void flowIsConservedAtEveryNode() {
    List<Integer> inputs = List.of(17, 3, 29, 11, 40);
    List<Integer> outputs = List.of(8, 25, 1, 19, 33, 14);

    assertConserved(assembler.design(inputs, outputs), inputs, outputs);
  }

  @Test
  void zeroFlowsCreateNodesWithoutEdges() {
    BalancerGraph graph = assembler.design(List.of(0, 10), List.of(10, 0));

    assertEquals(List.of("I0", "I1", "O0", "O1"), ids(graph));
    assertEquals(List.of(new GraphEdge("I1", "O0", 10)), graph.edges());
  }

  @Test
  void emptySpecificationProducesEmptyGraph() {
    BalancerGraph graph = assembler.design(List.of(), List.of());

    assertTrue(graph.nodes().isEmpty());
    assertTrue(graph.edges().isEmpty());
  }

  @Test
  void designIsDeterministic() {
    FlowSpec spec = new FlowSpec(List.of(480, 480, 480), Collections.nCopies(32, 45));

    assertEquals(assembler.design(spec), assembler.design(spec));
    assertEquals(assembler.design(spec), new NetworkAssembler().design(spec));
  }

  @Test
  void concurrentDesignsDoNotInterfere() throws Exception {
    FlowSpec spec = new FlowSpec(List.of(480, 480, 480), Collections.nCopies(32, 45));
    BalancerGraph expected = assembler.design(spec);

    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<BalancerGraph>> futures = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        futures.add(pool.submit(() -> assembler.design(spec)));
      }
      for (Future<BalancerGraph> future : futures) {
        assertEquals(expected, future.get(10, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }
  }

  private static void assertConserved(BalancerGraph graph, List<Integer> inputs, List<Integer> outputs) {
    for (int i = 0; i < inputs.size(); i++) {
      assertEquals(inputs.get(i).longValue(), graph.outflowFrom("I" + i), "input " + i);
      assertEquals(0L, graph.inflowTo("I" + i), "input " + i);
    }
    for (int j = 0; j < outputs.size(); j++) {
      assertEquals(outputs.get(j).longValue(), graph.inflowTo("O" + j), "output " + j);
      assertEquals(0L, graph.outflowFrom("O" + j), "output " + j);
    }
    for (GraphNode node : graph.nodes()) {
      if (node.kind().isDevice()) {
        assertEquals(graph.inflowTo(node.id()), graph.outflowFrom(node.id()), node.id());
        long inbound = graph.edges().stream().filter(e -> e.target().equals(node.id())).count();
        long outbound = graph.edges().stream().filter(e -> e.source().equals(node.id())).count();
        if (node.kind() == NodeKind.SPLITTER) {
          assertEquals(1L, inbound, node.id());
          assertTrue(outbound >= 2 && outbound <= 3, node.id());
        } else {
          assertEquals(1L, outbound, node.id());
          assertTrue(inbound >= 2 && inbound <= 3, node.id());
        }
      }
    }
  }

  private static List<String> ids(BalancerGraph graph) {
    List<String> ids = new ArrayList<>();
    for (GraphNode node : graph.nodes()) {
      ids.add(node.id());
    }
    return ids;
  }
}
