package ca.gc.cra.balancer.infrastructure.output;

import ca.gc.cra.balancer.application.port.GraphOutputPort;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Objects;

/**
 * Writes rendered balancer graphs to a console writer, normally the CLI's stdout writer.
 *
 * @since 0.1.0
 */
public final class ConsoleGraphOutputAdapter implements GraphOutputPort {
  private final PrintWriter writer;

  /**
   * Creates an adapter bound to {@code writer}.
   *
   * @param writer destination writer
   */
  public ConsoleGraphOutputAdapter(PrintWriter writer) {
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  @Override
  public void write(RenderedGraph rendered) throws IOException {
    Objects.requireNonNull(rendered, "rendered");
    writer.print(rendered.content());
    if (!rendered.content().endsWith("\n")) {
      writer.println();
    }
    writer.flush();
    if (writer.checkError()) {
      throw new IOException("Failed to write balancer graph to console");
    }
  }
}
