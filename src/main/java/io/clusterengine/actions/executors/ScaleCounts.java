package io.clusterengine.actions.executors;

import io.clusterengine.models.Action;

/**
 * Node count of a scale action: a policy decision wins over the requested count,
 * which wins over the default of one.
 */
final class ScaleCounts {

    static final String INPUT_COUNT = "count";

    private ScaleCounts() {
        // Utility class
    }

    static int resolve(Action action, String decisionKey) {
        Object decided = action.getData().get(decisionKey);
        if (decided instanceof Number) {
            return ((Number) decided).intValue();
        }
        Object requested = action.getInputs().get(INPUT_COUNT);
        if (requested instanceof Number) {
            return ((Number) requested).intValue();
        }
        return 1;
    }
}
