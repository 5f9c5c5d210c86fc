package ca.gc.cra.balancer.infrastructure.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.balancer.config.GraphFormat;
import ca.gc.cra.balancer.domain.graph.BalancerGraph;
import ca.gc.cra.balancer.domain.network.NetworkAssembler;
import java.util.List;
import org.junit.jupiter.api.Test;

class GraphvizDotRendererTest {
  private final GraphvizDotRenderer renderer = new GraphvizDotRenderer();

  @Test
  void rendersSplitterNetwork() {
    BalancerGraph graph = new NetworkAssembler().design(List.of(90), List.of(30, 30, 30));

    String expected = "digraph {\n"
        + "\trankdir=LR\n"
        + "\tI0 [label=\"Input 0\" fillcolor=lightgreen shape=box style=filled]\n"
        + "\tO0 [label=\"Output 0\" fillcolor=lightblue shape=box style=filled]\n"
        + "\tO1 [label=\"Output 1\" fillcolor=lightblue shape=box style=filled]\n"
        + "\tO2 [label=\"Output 2\" fillcolor=lightblue shape=box style=filled]\n"
        + "\tS0 [label=\"\" fillcolor=lightyellow shape=diamond style=filled]\n"
        + "\tI0 -> S0 [label=90]\n"
        + "\tS0 -> O0 [label=30]\n"
        + "\tS0 -> O1 [label=30]\n"
        + "\tS0 -> O2 [label=30]\n"
        + "}\n";
    assertEquals(expected, renderer.render(graph));
  }

  @Test
  void mergersUseCoralDiamonds() {
    String dot = renderer.render(new NetworkAssembler().design(List.of(30, 30, 30), List.of(90)));

    assertTrue(dot.contains("\tM0 [label=\"\" fillcolor=lightcoral shape=diamond style=filled]\n"), dot);
    assertTrue(dot.contains("\tM0 -> O0 [label=90]\n"), dot);
  }

  @Test
  void embeddedNamesAreQuotedWhenNeeded() {
    BalancerGraph graph = new NetworkAssembler().design(List.of(20), List.of(10, 10))
        .embed("iron ore", List.of("Mine-1"), List.of("Smelter \"A\"", "plate_line"));

    String dot = renderer.render(graph);

    assertTrue(dot.contains("\t\"Mine-1\" [label=\"Mine-1\" fillcolor=lightgreen"), dot);
    assertTrue(dot.contains("\t\"Smelter \\\"A\\\"\" [label="), dot);
    assertTrue(dot.contains("\tplate_line [label=\"plate_line\""), dot);
    assertTrue(dot.contains("\t\"Mine-1\" -> \"iron ore_S0\" [label=20]\n"), dot);
  }

  @Test
  void emptyGraphStillDeclaresLayout() {
    assertEquals("digraph {\n\trankdir=LR\n}\n", renderer.render(BalancerGraph.builder().build()));
    assertSame(GraphFormat.DOT, renderer.format());
  }
}
