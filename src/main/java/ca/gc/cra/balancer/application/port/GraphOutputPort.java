package ca.gc.cra.balancer.application.port;

import ca.gc.cra.balancer.config.GraphFormat;
import java.io.IOException;
import java.util.Objects;

/**
 * <strong>What:</strong> Output port receiving rendered balancer graphs.
 * <p><strong>Why:</strong> Decouples rendering from delivery so the CLI can target files or stdout.</p>
 * <p><strong>Role:</strong> Application port implemented by output adapters.</p>
 * <p><strong>Thread-safety:</strong> Implementations document their own contract; most expect single-threaded writes.</p>
 *
 * @since 0.1.0
 */
public interface GraphOutputPort extends AutoCloseable {
  /**
   * Delivers a rendered graph.
   *
   * @param rendered rendered document; must not be {@code null}
   * @throws IOException if delivery fails
   */
  void write(RenderedGraph rendered) throws IOException;

  /**
   * Flushes and releases resources.
   *
   * @throws IOException if shutdown fails
   */
  @Override
  default void close() throws IOException {}

  /**
   * Rendered document plus the format it was produced in.
   *
   * @param format rendering format
   * @param content rendered text
   * @since 0.1.0
   */
  record RenderedGraph(GraphFormat format, String content) {
    /**
     * Validates the rendered graph.
     *
     * @throws NullPointerException if a field is {@code null}
     */
    public RenderedGraph {
      Objects.requireNonNull(format, "format");
      Objects.requireNonNull(content, "content");
    }
  }
}
