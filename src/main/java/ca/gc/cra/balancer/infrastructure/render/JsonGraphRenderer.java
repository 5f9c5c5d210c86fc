package ca.gc.cra.balancer.infrastructure.render;

import ca.gc.cra.balancer.application.port.GraphRenderer;
import ca.gc.cra.balancer.config.GraphFormat;
import ca.gc.cra.balancer.domain.graph.BalancerGraph;
import ca.gc.cra.balancer.domain.graph.GraphEdge;
import ca.gc.cra.balancer.domain.graph.GraphNode;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders balancer graphs as JSON for programmatic embedders.
 *
 * <p>Document layout:</p>
 * <pre>
 * {"rankdir":"LR",
 *  "nodes":[{"id":"I0","kind":"input","label":"Input 0","shape":"box","fillcolor":"lightgreen"}, ...],
 *  "edges":[{"source":"I0","target":"S0","flow":90}, ...],
 *  "splitters":1,"mergers":0}
 * </pre>
 *
 * @since 0.1.0
 */
public final class JsonGraphRenderer implements GraphRenderer {
  private final JsonFactory jsonFactory;
  private final boolean pretty;

  /** Creates a compact renderer. */
  public JsonGraphRenderer() {
    this(false);
  }

  /**
   * Creates a renderer.
   *
   * @param pretty whether to indent the output
   */
  public JsonGraphRenderer(boolean pretty) {
    this.jsonFactory = new JsonFactory();
    this.pretty = pretty;
  }

  @Override
  public GraphFormat format() {
    return GraphFormat.JSON;
  }

  @Override
  public String render(BalancerGraph graph) {
    Objects.requireNonNull(graph, "graph");
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      gen.writeStartObject();
      gen.writeStringField("rankdir", graph.rankDir());
      gen.writeArrayFieldStart("nodes");
      for (GraphNode node : graph.nodes()) {
        writeNode(gen, node);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("edges");
      for (GraphEdge edge : graph.edges()) {
        gen.writeStartObject();
        gen.writeStringField("source", edge.source());
        gen.writeStringField("target", edge.target());
        gen.writeNumberField("flow", edge.flow());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeNumberField("splitters", graph.splitterCount());
      gen.writeNumberField("mergers", graph.mergerCount());
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render balancer graph as JSON", ex);
    }
    return out.toString();
  }

  private static void writeNode(JsonGenerator gen, GraphNode node) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("id", node.id());
    gen.writeStringField("kind", node.kind().name().toLowerCase(Locale.ROOT));
    gen.writeStringField("label", node.label());
    gen.writeStringField("shape", node.kind().shape());
    gen.writeStringField("fillcolor", node.kind().fillColor());
    gen.writeEndObject();
  }
}
