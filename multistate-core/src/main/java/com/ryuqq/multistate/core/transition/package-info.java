/**
 * Transition declaration and execution result package.
 *
 * <p>A {@link com.ryuqq.multistate.core.transition.Transition} describes a delta over
 * the set of active states. It is evaluated by the executor (side-effecting phases)
 * and by the path finder (pure projection) with the same set algebra.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.multistate.core.transition.Transition} - Declarative state-set delta</li>
 *   <li>{@link com.ryuqq.multistate.core.transition.Action} - Outgoing/incoming action</li>
 *   <li>{@link com.ryuqq.multistate.core.transition.TransitionPhase} - Ordered execution phases</li>
 *   <li>{@link com.ryuqq.multistate.core.transition.PhaseResult} - Per-phase outcome</li>
 *   <li>{@link com.ryuqq.multistate.core.transition.TransitionResult} - Whole-run outcome and delta</li>
 *   <li>{@link com.ryuqq.multistate.core.transition.VisibilityDirective} - Source visibility directive</li>
 * </ul>
 *
 * <h2>Set Algebra</h2>
 * <pre>
 * canFire(C)  = fromStates = ∅ ∨ fromStates ∩ C ≠ ∅
 * project(C)  = (C − statesToExit) ∪ statesToActivate
 * </pre>
 *
 * @since 1.0.0
 * @author MultiState Team
 */
package com.ryuqq.multistate.core.transition;
