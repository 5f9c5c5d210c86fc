package ca.gc.cra.balancer.validation;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the rendered graph's destination file.
 * <p><strong>Role:</strong> Runs before the design so bad destinations fail fast with CLI guidance.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlink is never silently overwritten.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} can receive a rendered graph.
   *
   * @param path candidate output file; must not be {@code null}
   * @param allowOverwrite whether an existing regular file may be replaced
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path names a directory, an existing file without overwrite permission,
   *         or sits under a non-writable existing ancestor
   */
  public static Path validateOutputFile(Path path, boolean allowOverwrite) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0 || Strings.containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("out must name a file, not a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            "file " + normalized + " already exists; re-run with --allow-overwrite to replace it");
      }
      if (!Files.isRegularFile(normalized, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("out is not a regular file: " + normalized);
      }
    }
    Path ancestor = normalized.getParent();
    while (ancestor != null && !Files.exists(ancestor, LinkOption.NOFOLLOW_LINKS)) {
      ancestor = ancestor.getParent();
    }
    if (ancestor == null) {
      throw new IllegalArgumentException("no existing ancestor for " + normalized);
    }
    if (!Files.isDirectory(ancestor) || !Files.isWritable(ancestor)) {
      throw new IllegalArgumentException("directory is not writable: " + ancestor);
    }
    return normalized;
  }
}
