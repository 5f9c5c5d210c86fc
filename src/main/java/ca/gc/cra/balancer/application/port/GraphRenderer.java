package ca.gc.cra.balancer.application.port;

import ca.gc.cra.balancer.config.GraphFormat;
import ca.gc.cra.balancer.domain.graph.BalancerGraph;

/**
 * <strong>What:</strong> Port turning a designed {@link BalancerGraph} into text.
 * <p><strong>Role:</strong> Implemented by infrastructure renderers (Graphviz DOT, JSON).</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless and safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface GraphRenderer {
  /**
   * Format produced by this renderer.
   *
   * @return output format
   */
  GraphFormat format();

  /**
   * Renders the graph.
   *
   * @param graph graph to render; must not be {@code null}
   * @return rendered document
   */
  String render(BalancerGraph graph);
}
