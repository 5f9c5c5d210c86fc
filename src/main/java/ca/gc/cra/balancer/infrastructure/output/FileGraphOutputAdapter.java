package ca.gc.cra.balancer.infrastructure.output;

import ca.gc.cra.balancer.application.port.GraphOutputPort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Writes rendered balancer graphs to a file.
 * <p>Synchronized to avoid clashing writes when the adapter is shared.</p>
 *
 * @since 0.1.0
 */
public final class FileGraphOutputAdapter implements GraphOutputPort {
  private final Path file;
  private final boolean allowOverwrite;

  /**
   * Creates a file-backed output adapter.
   *
   * @param file target file; parent directories are created on first write
   * @param allowOverwrite whether an existing file may be replaced
   * @throws NullPointerException if {@code file} is {@code null}
   */
  public FileGraphOutputAdapter(Path file, boolean allowOverwrite) {
    this.file = Objects.requireNonNull(file, "file");
    this.allowOverwrite = allowOverwrite;
  }

  /**
   * Writes the rendered graph to the configured file.
   *
   * @param rendered rendered graph; must not be {@code null}
   * @throws IOException if the file exists and overwriting is disabled, or if writing fails
   */
  @Override
  public synchronized void write(RenderedGraph rendered) throws IOException {
    Objects.requireNonNull(rendered, "rendered");
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null && !Files.exists(parent)) {
      Files.createDirectories(parent);
    }
    if (allowOverwrite) {
      Files.writeString(file, rendered.content(), StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    } else {
      // CREATE_NEW fails with FileAlreadyExistsException rather than clobbering a previous design.
      Files.writeString(file, rendered.content(), StandardCharsets.UTF_8,
          StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }
  }

  /**
   * Target file.
   *
   * @return path written by this adapter
   */
  public Path file() {
    return file;
  }
}
