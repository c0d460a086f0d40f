package io.clusterengine.actions;

import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.models.Action;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency graph over a set of actions.
 *
 * Only the {@code depends_on} edges are stored on actions; the reverse adjacency
 * ({@code depended_by}) is derived here and never persisted.
 */
public final class ActionGraph {

    private final Map<String, List<String>> dependencies = new LinkedHashMap<>();
    private final Map<String, List<String>> dependents = new HashMap<>();

    private ActionGraph() {
    }

    public static ActionGraph of(Collection<Action> actions) {
        ActionGraph graph = new ActionGraph();
        for (Action action : actions) {
            List<String> deps = action.getDependsOn() != null ? action.getDependsOn() : List.of();
            graph.dependencies.put(action.getId(), new ArrayList<>(deps));
            for (String dep : deps) {
                graph.dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(action.getId());
            }
        }
        return graph;
    }

    public List<String> dependenciesOf(String actionId) {
        return Collections.unmodifiableList(dependencies.getOrDefault(actionId, List.of()));
    }

    public List<String> dependentsOf(String actionId) {
        return Collections.unmodifiableList(dependents.getOrDefault(actionId, List.of()));
    }

    /**
     * Checks that every edge points at a known action and that the graph has no cycle.
     *
     * @param knownIds ids of actions outside this graph that edges may point at
     */
    public void validate(Collection<String> knownIds) {
        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            for (String dep : entry.getValue()) {
                if (!dependencies.containsKey(dep) && !knownIds.contains(dep)) {
                    throw new BadRequestException(String.format(
                            "Action %s depends on unknown action %s.", entry.getKey(), dep));
                }
            }
        }
        topologicalOrder();
    }

    /**
     * Actions of this graph ordered so that every action comes after its dependencies.
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> pending = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            int inGraph = (int) entry.getValue().stream().filter(dependencies::containsKey).count();
            pending.put(entry.getKey(), inGraph);
            if (inGraph == 0) {
                ready.add(entry.getKey());
            }
        }

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String dependent : dependentsOf(id)) {
                if (pending.containsKey(dependent) && pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != dependencies.size()) {
            throw new BadRequestException("Action dependencies contain a cycle.");
        }
        return order;
    }
}
