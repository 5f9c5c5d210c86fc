/**
 * Metrics adapters bridging {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for concurrent designs.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code balancer.design.*} namespace.</p>
 */
package ca.gc.cra.balancer.infrastructure.metrics;
