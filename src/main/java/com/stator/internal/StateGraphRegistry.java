package com.stator.internal;

import com.stator.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * All state graphs known to this process, keyed by entity type.
 */
@Component
public class StateGraphRegistry {

    private static final Logger log = LoggerFactory.getLogger(StateGraphRegistry.class);

    private final Map<String, StateGraph> graphs;

    @Autowired
    public StateGraphRegistry(ObjectProvider<StateGraph> graphs) {
        this(graphs.orderedStream().collect(Collectors.toList()));
    }

    public StateGraphRegistry(List<StateGraph> graphs) {
        Map<String, StateGraph> byType = new LinkedHashMap<>();
        for (StateGraph graph : graphs) {
            StateGraph existing = byType.putIfAbsent(graph.entityType(), graph);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate state graph for entity type '" + graph.entityType()
                                + "'. Each entity type must have exactly one graph.");
            }
        }
        this.graphs = Map.copyOf(byType);
        log.info("Registered {} state graph(s): {}", byType.size(), byType.keySet());
    }

    public Collection<StateGraph> graphs() {
        return graphs.values();
    }

    public Optional<StateGraph> find(String entityType) {
        return Optional.ofNullable(graphs.get(entityType));
    }

    public StateGraph require(String entityType) {
        StateGraph graph = graphs.get(entityType);
        if (graph == null) {
            throw new IllegalArgumentException("No state graph registered for entity type '" + entityType + "'");
        }
        return graph;
    }
}
