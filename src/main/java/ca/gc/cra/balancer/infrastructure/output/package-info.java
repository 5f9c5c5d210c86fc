/**
 * Output adapters delivering rendered graphs to files or the console.
 */
package ca.gc.cra.balancer.infrastructure.output;
