/**
 * Renderers turning a {@code BalancerGraph} into Graphviz DOT or JSON text.
 */
package ca.gc.cra.balancer.infrastructure.render;
