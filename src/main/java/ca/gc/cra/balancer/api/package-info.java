/**
 * CLI entry points for designing balancer networks.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and invokes
 * the design use case.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded.</p>
 */
package ca.gc.cra.balancer.api;
