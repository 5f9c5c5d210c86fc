/**
 * Application use cases that orchestrate a balancer design run.
 */
package ca.gc.cra.balancer.application.pipeline;
