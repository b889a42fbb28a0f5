package com.ryuqq.multistate.adapter.inmemory.callback;

import com.ryuqq.multistate.core.spi.CallbackRegistry;
import com.ryuqq.multistate.core.transition.Action;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CallbackRegistry} SPI.
 *
 * <p>Callbacks registered here take precedence over the inline actions declared on a
 * Transition. Registrations can be changed at any time; an executor picks up whatever
 * is registered when the corresponding phase runs.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Outgoing:</strong> ConcurrentHashMap&lt;transitionId, Action&gt;</li>
 *   <li><strong>Incoming:</strong> ConcurrentHashMap&lt;(transitionId, stateId), Action&gt;</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryCallbackRegistry callbacks = new InMemoryCallbackRegistry();
 * callbacks.registerOutgoing("login", () -&gt; authClient.submit());
 * callbacks.registerIncoming("login", "dashboard", Action.of(dashboard::load));
 *
 * TransitionResult result = executor.execute(login, active, callbacks);
 * </pre>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public class InMemoryCallbackRegistry implements CallbackRegistry {

    private final Map<String, Action> outgoing = new ConcurrentHashMap<>();
    private final Map<IncomingKey, Action> incoming = new ConcurrentHashMap<>();

    /**
     * Registers the outgoing action of a transition, replacing any previous one.
     *
     * @param transitionId the transition id
     * @param action the action to run in the OUTGOING phase
     * @throws IllegalArgumentException if any argument is null
     */
    public void registerOutgoing(String transitionId, Action action) {
        if (transitionId == null) {
            throw new IllegalArgumentException("transitionId cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        outgoing.put(transitionId, action);
    }

    /**
     * Registers the incoming action run when {@code stateId} is activated by {@code transitionId}.
     *
     * @param transitionId the transition id
     * @param stateId the activated state id
     * @param action the action to run in the INCOMING phase
     * @throws IllegalArgumentException if any argument is null
     */
    public void registerIncoming(String transitionId, String stateId, Action action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        incoming.put(new IncomingKey(transitionId, stateId), action);
    }

    public boolean unregisterOutgoing(String transitionId) {
        return transitionId != null && outgoing.remove(transitionId) != null;
    }

    public boolean unregisterIncoming(String transitionId, String stateId) {
        if (transitionId == null || stateId == null) {
            return false;
        }
        return incoming.remove(new IncomingKey(transitionId, stateId)) != null;
    }

    @Override
    public Optional<Action> outgoing(String transitionId) {
        if (transitionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(outgoing.get(transitionId));
    }

    @Override
    public Optional<Action> incoming(String transitionId, String stateId) {
        if (transitionId == null || stateId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(incoming.get(new IncomingKey(transitionId, stateId)));
    }

    /**
     * Returns the total number of registered callbacks.
     *
     * @return outgoing + incoming registrations
     */
    public int size() {
        return outgoing.size() + incoming.size();
    }

    /**
     * Removes every registration.
     */
    public void clear() {
        outgoing.clear();
        incoming.clear();
    }

    private record IncomingKey(String transitionId, String stateId) {

        IncomingKey {
            if (transitionId == null) {
                throw new IllegalArgumentException("transitionId cannot be null");
            }
            if (stateId == null) {
                throw new IllegalArgumentException("stateId cannot be null");
            }
        }
    }
}
