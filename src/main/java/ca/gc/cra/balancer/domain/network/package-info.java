/**
 * Top-level network design combining flow assignment with split and merge trees.
 */
package ca.gc.cra.balancer.domain.network;
