package com.stator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Declarative state machine for one entity type.
 * <p>
 * Built once at startup through {@link #builder(String)} and validated eagerly.
 * Instances are immutable and safe to share between threads.
 *
 * <pre>
 * StateGraph.builder("fan_out")
 *         .initialState("new")
 *         .state("new", s -&gt; s.tryInterval(Duration.ofMinutes(2))
 *                 .handler(fanOutHandler)
 *                 .transitionsTo("sent", "failed"))
 *         .state("sent")
 *         .state("failed")
 *         .build();
 * </pre>
 */
public final class StateGraph {

    private final String entityType;
    private final String initialState;
    private final Map<String, State> states;
    private final List<String> dispatchableStates;

    private StateGraph(String entityType, String initialState, Map<String, State> states) {
        this.entityType = entityType;
        this.initialState = initialState;
        this.states = Collections.unmodifiableMap(states);
        List<String> dispatchable = new ArrayList<>();
        for (State state : states.values()) {
            if (!state.isTerminal() && !state.externallyProgressed()) {
                dispatchable.add(state.name());
            }
        }
        this.dispatchableStates = List.copyOf(dispatchable);
    }

    public static Builder builder(String entityType) {
        return new Builder(entityType);
    }

    public String entityType() {
        return entityType;
    }

    public String initialState() {
        return initialState;
    }

    public Set<String> stateNames() {
        return states.keySet();
    }

    public boolean hasState(String name) {
        return states.containsKey(name);
    }

    public Optional<StateHandler> handlerFor(String state) {
        return Optional.ofNullable(require(state).handler());
    }

    public Optional<Duration> tryInterval(String state) {
        return Optional.ofNullable(require(state).tryInterval());
    }

    public Optional<StateTimeout> timeoutFor(String state) {
        return Optional.ofNullable(require(state).timeout());
    }

    public boolean isTerminal(String state) {
        return require(state).isTerminal();
    }

    public boolean isExternallyProgressed(String state) {
        return require(state).externallyProgressed();
    }

    /**
     * True for states no worker ever runs a handler for.
     */
    public boolean isTerminalOrExternal(String state) {
        State definition = require(state);
        return definition.isTerminal() || definition.externallyProgressed();
    }

    /**
     * A state with a handler but no try interval. It is only retried after an
     * explicit trigger, never by the readiness pass.
     */
    public boolean isManualOnly(String state) {
        State definition = require(state);
        return definition.handler() != null && definition.tryInterval() == null;
    }

    public boolean isDispatchable(String state) {
        State definition = states.get(state);
        return definition != null && !definition.isTerminal() && !definition.externallyProgressed();
    }

    public boolean isValidTransition(String from, String to) {
        State definition = states.get(from);
        return definition != null && definition.transitions().contains(to);
    }

    public Set<String> transitionsFrom(String state) {
        return require(state).transitions();
    }

    /**
     * States a worker may select for dispatch, in declaration order.
     */
    public List<String> dispatchableStates() {
        return dispatchableStates;
    }

    private State require(String state) {
        State definition = states.get(state);
        if (definition == null) {
            throw new IllegalArgumentException(
                    "State '" + state + "' is not declared in the graph for '" + entityType + "'");
        }
        return definition;
    }

    @Override
    public String toString() {
        return "StateGraph[" + entityType + ", states=" + states.keySet() + "]";
    }

    /**
     * Move to {@code targetState} once a record has spent {@code after} in a state.
     */
    public record StateTimeout(Duration after, String targetState) {
    }

    private record State(
            String name,
            Duration tryInterval,
            boolean externallyProgressed,
            StateHandler handler,
            Set<String> transitions,
            StateTimeout timeout) {

        boolean isTerminal() {
            return transitions.isEmpty();
        }
    }

    public static final class Builder {

        private final String entityType;
        private final Map<String, StateSpec> specs = new LinkedHashMap<>();
        private String initialState;

        private Builder(String entityType) {
            this.entityType = entityType;
        }

        public Builder initialState(String name) {
            this.initialState = name == null ? null : name.trim();
            return this;
        }

        /**
         * Declares a state with no handler and no transitions.
         */
        public Builder state(String name) {
            return state(name, spec -> {
            });
        }

        public Builder state(String name, Consumer<StateSpec> customizer) {
            if (name == null || name.isBlank()) {
                throw new GraphDefinitionException("State names must not be blank in graph '" + entityType + "'");
            }
            StateSpec spec = new StateSpec(name.trim());
            if (specs.putIfAbsent(spec.name, spec) != null) {
                throw new GraphDefinitionException(
                        "State '" + spec.name + "' is declared twice in graph '" + entityType + "'");
            }
            customizer.accept(spec);
            return this;
        }

        public StateGraph build() {
            if (entityType == null || entityType.isBlank()) {
                throw new GraphDefinitionException("Graph entity type must not be blank");
            }
            if (specs.isEmpty()) {
                throw new GraphDefinitionException("Graph '" + entityType + "' declares no states");
            }
            if (initialState == null) {
                throw new GraphDefinitionException("Graph '" + entityType + "' has no initial state");
            }
            if (!specs.containsKey(initialState)) {
                throw new GraphDefinitionException(
                        "Initial state '" + initialState + "' is not declared in graph '" + entityType + "'");
            }

            Map<String, State> states = new LinkedHashMap<>();
            for (StateSpec spec : specs.values()) {
                states.put(spec.name, validate(spec));
            }
            return new StateGraph(entityType.trim(), initialState, states);
        }

        private State validate(StateSpec spec) {
            for (String target : spec.transitions) {
                if (!specs.containsKey(target)) {
                    throw new GraphDefinitionException(
                            "State '" + spec.name + "' transitions to undeclared state '" + target
                                    + "' in graph '" + entityType + "'");
                }
            }
            if (spec.timeout != null && !specs.containsKey(spec.timeout.targetState())) {
                throw new GraphDefinitionException(
                        "State '" + spec.name + "' times out to undeclared state '"
                                + spec.timeout.targetState() + "' in graph '" + entityType + "'");
            }

            boolean terminal = spec.transitions.isEmpty();
            if (terminal || spec.externallyProgressed) {
                String kind = terminal ? "Terminal" : "Externally progressed";
                if (spec.handler != null) {
                    throw new GraphDefinitionException(
                            kind + " state '" + spec.name + "' must not have a handler in graph '" + entityType + "'");
                }
                if (spec.tryInterval != null) {
                    throw new GraphDefinitionException(
                            kind + " state '" + spec.name + "' must not have a try interval in graph '"
                                    + entityType + "'");
                }
                if (spec.timeout != null) {
                    throw new GraphDefinitionException(
                            kind + " state '" + spec.name + "' must not have a timeout in graph '" + entityType + "'");
                }
            } else if (spec.handler == null) {
                throw new GraphDefinitionException(
                        "State '" + spec.name + "' has no handler and is not terminal or externally progressed"
                                + " in graph '" + entityType + "'");
            }

            return new State(spec.name, spec.tryInterval, spec.externallyProgressed, spec.handler,
                    Collections.unmodifiableSet(new LinkedHashSet<>(spec.transitions)), spec.timeout);
        }
    }

    public static final class StateSpec {

        private final String name;
        private final Set<String> transitions = new LinkedHashSet<>();
        private Duration tryInterval;
        private boolean externallyProgressed;
        private StateHandler handler;
        private StateTimeout timeout;

        private StateSpec(String name) {
            this.name = name;
        }

        public StateSpec tryInterval(Duration interval) {
            if (interval == null || interval.isZero() || interval.isNegative()) {
                throw new GraphDefinitionException("Try interval of state '" + name + "' must be positive");
            }
            this.tryInterval = interval;
            return this;
        }

        public StateSpec handler(StateHandler handler) {
            this.handler = handler;
            return this;
        }

        public StateSpec externallyProgressed() {
            this.externallyProgressed = true;
            return this;
        }

        public StateSpec transitionsTo(String... targets) {
            for (String target : targets) {
                transitions.add(stateName(target));
            }
            return this;
        }

        /**
         * Once a record has been in this state for {@code after}, the worker
         * moves it to {@code targetState} instead of running the handler.
         * The target becomes a declared transition of this state.
         */
        public StateSpec timesOutTo(String targetState, Duration after) {
            if (timeout != null) {
                throw new GraphDefinitionException("State '" + name + "' already has a timeout");
            }
            if (after == null || after.isZero() || after.isNegative()) {
                throw new GraphDefinitionException("Timeout of state '" + name + "' must be positive");
            }
            String target = stateName(targetState);
            this.timeout = new StateTimeout(after, target);
            transitions.add(target);
            return this;
        }

        private String stateName(String target) {
            if (target == null || target.isBlank()) {
                throw new GraphDefinitionException("State '" + name + "' names a blank target state");
            }
            return target.trim();
        }
    }
}
