/**
 * Flow specifications and the greedy assignment of input flow to outputs.
 *
 * <p>{@link ca.gc.cra.balancer.domain.flow.FlowAssigner} walks inputs and outputs in order, so the
 * resulting {@link ca.gc.cra.balancer.domain.flow.AssignmentMatrix} touches at most
 * {@code inputs + outputs - 1} cells.</p>
 */
package ca.gc.cra.balancer.domain.flow;
