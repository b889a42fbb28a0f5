/**
 * No-op SPI implementations.
 *
 * <p>Used as defaults by {@code TransitionExecutor} and {@code MultiTargetPathFinder}
 * when no collaborator is supplied.</p>
 *
 * @since 1.0.0
 * @author MultiState Team
 */
package com.ryuqq.multistate.core.spi.noop;
