/**
 * Ports through which the design use case renders graphs, delivers them, and reports metrics.
 * <p><strong>Role:</strong> Hexagonal boundary; adapters live under {@code infrastructure}.</p>
 */
package ca.gc.cra.balancer.application.port;
