/**
 * Immutable graph model of a designed balancer: endpoint and device nodes joined by flow-labelled edges.
 */
package ca.gc.cra.balancer.domain.graph;
