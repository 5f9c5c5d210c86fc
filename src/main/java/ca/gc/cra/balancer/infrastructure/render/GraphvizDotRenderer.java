package ca.gc.cra.balancer.infrastructure.render;

import ca.gc.cra.balancer.application.port.GraphRenderer;
import ca.gc.cra.balancer.config.GraphFormat;
import ca.gc.cra.balancer.domain.graph.BalancerGraph;
import ca.gc.cra.balancer.domain.graph.GraphEdge;
import ca.gc.cra.balancer.domain.graph.GraphNode;
import java.util.Objects;

/**
 * Renders balancer graphs as Graphviz DOT source.
 *
 * <p>Output shape:</p>
 * <pre>
 * digraph {
 * 	rankdir=LR
 * 	I0 [label="Input 0" fillcolor=lightgreen shape=box style=filled]
 * 	S0 [label="" fillcolor=lightyellow shape=diamond style=filled]
 * 	I0 -&gt; S0 [label=90]
 * }
 * </pre>
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class GraphvizDotRenderer implements GraphRenderer {

  @Override
  public GraphFormat format() {
    return GraphFormat.DOT;
  }

  @Override
  public String render(BalancerGraph graph) {
    Objects.requireNonNull(graph, "graph");
    StringBuilder dot = new StringBuilder(64 + graph.nodes().size() * 72 + graph.edges().size() * 24);
    dot.append("digraph {\n");
    dot.append('\t').append("rankdir=").append(graph.rankDir()).append('\n');
    for (GraphNode node : graph.nodes()) {
      dot.append('\t').append(id(node.id()))
          .append(" [label=").append(quote(node.label()))
          .append(" fillcolor=").append(node.kind().fillColor())
          .append(" shape=").append(node.kind().shape())
          .append(" style=filled]\n");
    }
    for (GraphEdge edge : graph.edges()) {
      dot.append('\t').append(id(edge.source()))
          .append(" -> ").append(id(edge.target()))
          .append(" [label=").append(edge.label()).append("]\n");
    }
    dot.append("}\n");
    return dot.toString();
  }

  // Embedded graphs can carry arbitrary names; bare ids are only safe for [A-Za-z0-9_].
  private static String id(String raw) {
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (!(Character.isLetterOrDigit(c) && c < 0x80) && c != '_') {
        return quote(raw);
      }
    }
    if (Character.isDigit(raw.charAt(0))) {
      return quote(raw);
    }
    return raw;
  }

  private static String quote(String raw) {
    StringBuilder sb = new StringBuilder(raw.length() + 2).append('"');
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        default -> sb.append(c);
      }
    }
    return sb.append('"').toString();
  }
}
