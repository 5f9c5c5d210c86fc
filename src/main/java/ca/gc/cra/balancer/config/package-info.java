/**
 * Configuration aggregates and composition root wiring for the balancer CLI.
 * <p><strong>Role:</strong> Merges defaults, YAML and CLI settings and selects renderer and output adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates paths via {@code ca.gc.cra.balancer.validation} before anything is written.</p>
 */
package ca.gc.cra.balancer.config;
