package ca.gc.cra.balancer.application.pipeline;

import ca.gc.cra.balancer.application.port.GraphOutputPort;
import ca.gc.cra.balancer.application.port.GraphOutputPort.RenderedGraph;
import ca.gc.cra.balancer.application.port.GraphRenderer;
import ca.gc.cra.balancer.application.port.MetricsPort;
import ca.gc.cra.balancer.domain.flow.FlowSpec;
import ca.gc.cra.balancer.domain.flow.InfeasibleFlowException;
import ca.gc.cra.balancer.domain.graph.BalancerGraph;
import ca.gc.cra.balancer.domain.network.NetworkAssembler;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs one balancer design end to end: design, render, deliver.
 * <p><strong>Role:</strong> Application-layer use case invoked by the CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Delegate synthesis to {@link NetworkAssembler}.</li>
 *   <li>Emit {@code balancer.design.*} metrics and log a summary per design.</li>
 *   <li>Render with the configured {@link GraphRenderer} and hand the result to a {@link GraphOutputPort}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent {@link #design(FlowSpec)} calls when the metrics port
 * is; each design is independent.</p>
 * <p><strong>Observability:</strong> Counters {@code balancer.design.requests}, {@code balancer.design.infeasible};
 * observations {@code balancer.design.splitters}, {@code balancer.design.mergers},
 * {@code balancer.design.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class BalancerDesignUseCase {
  private static final Logger log = LoggerFactory.getLogger(BalancerDesignUseCase.class);
  private static final String METRICS_PREFIX = "balancer.design";

  private final NetworkAssembler assembler;
  private final GraphRenderer renderer;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param assembler network designer
   * @param renderer renderer for the configured output format
   * @param metrics metrics sink
   * @throws NullPointerException if any argument is {@code null}
   */
  public BalancerDesignUseCase(NetworkAssembler assembler, GraphRenderer renderer, MetricsPort metrics) {
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Designs the network for {@code spec}.
   *
   * @param spec flow specification
   * @return designed graph
   * @throws InfeasibleFlowException if the totals differ
   */
  public BalancerGraph design(FlowSpec spec) {
    Objects.requireNonNull(spec, "spec");
    metrics.increment(METRICS_PREFIX + ".requests");
    long started = System.nanoTime();
    BalancerGraph graph;
    try {
      graph = assembler.design(spec);
    } catch (InfeasibleFlowException ex) {
      metrics.increment(METRICS_PREFIX + ".infeasible");
      log.warn("Rejected infeasible balancer request: inputTotal={}, outputTotal={}",
          ex.inputTotal(), ex.outputTotal());
      throw ex;
    }
    long elapsed = System.nanoTime() - started;
    metrics.observe(METRICS_PREFIX + ".latencyNanos", elapsed);
    metrics.observe(METRICS_PREFIX + ".splitters", graph.splitterCount());
    metrics.observe(METRICS_PREFIX + ".mergers", graph.mergerCount());
    log.info("Designed balancer for {} inputs -> {} outputs (total {}): {} splitters, {} mergers",
        spec.inputs().size(), spec.outputs().size(), spec.inputTotal(),
        graph.splitterCount(), graph.mergerCount());
    if (log.isDebugEnabled()) {
      log.debug("Balancer graph edges: {}", graph.edges());
    }
    return graph;
  }

  /**
   * Designs, renders and delivers the network for {@code spec}.
   *
   * @param spec flow specification
   * @param output destination for the rendered graph; not closed by this method
   * @return the designed graph
   * @throws IOException if delivery fails
   * @throws InfeasibleFlowException if the totals differ
   */
  public BalancerGraph run(FlowSpec spec, GraphOutputPort output) throws IOException {
    Objects.requireNonNull(output, "output");
    BalancerGraph graph = design(spec);
    RenderedGraph rendered = new RenderedGraph(renderer.format(), renderer.render(graph));
    try {
      output.write(rendered);
    } catch (IOException ex) {
      metrics.increment(METRICS_PREFIX + ".output.error");
      throw ex;
    }
    log.debug("Rendered balancer graph as {} ({} chars)", rendered.format(), rendered.content().length());
    return graph;
  }
}
