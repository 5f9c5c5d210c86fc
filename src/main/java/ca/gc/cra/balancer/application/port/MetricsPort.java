package ca.gc.cra.balancer.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for balancer designs.
 * <p><strong>Why:</strong> Lets the design use case record counters and observations without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent designs.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code balancer.design.splitters}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code balancer.design.requests}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (device count, nanoseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
