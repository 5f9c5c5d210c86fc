/**
 * Synthesis of fan-out splitter trees and fan-in merger trees from 2-way and 3-way devices.
 */
package ca.gc.cra.balancer.domain.tree;
