/**
 * Broker runtime package.
 *
 * <p>{@link io.snapbridge.runtime.SnapBridgeRuntime} owns one explicitly constructed
 * broker: session registry, correlation table, dispatcher, channel hub and liveness
 * sweeper, started and stopped together.
 */
package io.snapbridge.runtime;
