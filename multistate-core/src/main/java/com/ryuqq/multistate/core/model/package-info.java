/**
 * Multi-state data model package.
 *
 * <p>States are identity-by-id entities that may be active simultaneously. Groups
 * bundle states that must activate and deactivate as one unit.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.multistate.core.model.Element} - Atomic named unit owned by states</li>
 *   <li>{@link com.ryuqq.multistate.core.model.State} - Concurrently activatable state</li>
 *   <li>{@link com.ryuqq.multistate.core.model.StateGroup} - Atomic group of states</li>
 *   <li>{@link com.ryuqq.multistate.core.model.StateRegistry} - Id registry and group membership</li>
 *   <li>{@link com.ryuqq.multistate.core.model.ConfigurationException} - Registration conflict</li>
 * </ul>
 *
 * <h2>Group Atomicity</h2>
 * <pre>
 * ∀ g ∈ Groups, ∀ configuration C:  g ⊆ C  ∨  g ∩ C = ∅
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * StateRegistry registry = new StateRegistry();
 * State toolbar = registry.registerState(State.of("toolbar", "Toolbar"));
 * State sidebar = registry.registerState(State.of("sidebar", "Sidebar"));
 * registry.registerGroup(StateGroup.of("workspace", "Workspace", toolbar, sidebar));
 *
 * // Throws ConfigurationException: toolbar is already in "workspace"
 * registry.registerGroup(StateGroup.of("chrome", "Chrome", toolbar));
 * </pre>
 *
 * @since 1.0.0
 * @author MultiState Team
 */
package com.ryuqq.multistate.core.model;
