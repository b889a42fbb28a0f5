/**
 * Execution-history based reliability tracking.
 *
 * <p>{@link com.ryuqq.multistate.adapter.inmemory.reliability.InMemoryReliabilityTracker}
 * turns recorded executions into dynamic transition costs for the path finder.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
package com.ryuqq.multistate.adapter.inmemory.reliability;
