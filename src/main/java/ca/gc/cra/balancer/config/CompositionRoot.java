package ca.gc.cra.balancer.config;

import ca.gc.cra.balancer.application.pipeline.BalancerDesignUseCase;
import ca.gc.cra.balancer.application.port.GraphOutputPort;
import ca.gc.cra.balancer.application.port.GraphRenderer;
import ca.gc.cra.balancer.application.port.MetricsPort;
import ca.gc.cra.balancer.domain.network.NetworkAssembler;
import ca.gc.cra.balancer.infrastructure.output.ConsoleGraphOutputAdapter;
import ca.gc.cra.balancer.infrastructure.output.FileGraphOutputAdapter;
import ca.gc.cra.balancer.infrastructure.render.GraphvizDotRenderer;
import ca.gc.cra.balancer.infrastructure.render.JsonGraphRenderer;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires balancer ports and adapters for a design run.
 * <p><strong>Role:</strong> Composition root invoked by the CLI once configuration is resolved.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the renderer for the configured {@link GraphFormat}.</li>
 *   <li>Select file or console output.</li>
 *   <li>Share one {@link MetricsPort} across the use case.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct on a single thread; produced objects are thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final DesignConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a composition root.
   *
   * @param config resolved design configuration
   * @param metrics metrics adapter used by the use case
   * @throws NullPointerException if any argument is {@code null}
   */
  public CompositionRoot(DesignConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds the design use case.
   *
   * @return use case bound to the configured renderer and metrics
   */
  public BalancerDesignUseCase designUseCase() {
    return new BalancerDesignUseCase(new NetworkAssembler(), renderer(), metrics);
  }

  /**
   * Renderer for the configured format.
   *
   * @return DOT or JSON renderer
   */
  public GraphRenderer renderer() {
    return switch (config.format()) {
      case DOT -> new GraphvizDotRenderer();
      case JSON -> new JsonGraphRenderer(config.pretty());
    };
  }

  /**
   * Output port for the configured destination.
   *
   * @param allowOverwrite whether an existing output file may be replaced
   * @param console writer used when no output file is configured
   * @return file adapter when {@code out} names a file, otherwise a console adapter
   */
  public GraphOutputPort outputPort(boolean allowOverwrite, PrintWriter console) {
    if (config.output().isPresent()) {
      Path file = config.output().get();
      return new FileGraphOutputAdapter(file, allowOverwrite);
    }
    return new ConsoleGraphOutputAdapter(console);
  }

  /**
   * Metrics implementation shared by use cases.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }
}
