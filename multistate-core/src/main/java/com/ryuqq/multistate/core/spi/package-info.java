/**
 * Service Provider Interfaces consumed by the executor and the path finder.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.multistate.core.spi.CostProvider} - Dynamic transition cost for pathfinding</li>
 *   <li>{@link com.ryuqq.multistate.core.spi.CallbackRegistry} - Externally registered outgoing/incoming actions</li>
 *   <li>{@link com.ryuqq.multistate.core.spi.ExecutionRecorder} - Per-run execution report (id, success, elapsed)</li>
 *   <li>{@link com.ryuqq.multistate.core.spi.GroupResolver} - State to group lookup</li>
 * </ul>
 *
 * <h2>Default Implementations</h2>
 * <p>The {@code noop} sub-package provides pass-through implementations used
 * when no collaborator is configured.</p>
 *
 * @since 1.0.0
 * @author MultiState Team
 */
package com.ryuqq.multistate.core.spi;
