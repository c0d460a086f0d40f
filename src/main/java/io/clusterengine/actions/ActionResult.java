package io.clusterengine.actions;

import io.clusterengine.enums.ActionStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * Outcome of an action executor: SUCCEEDED or FAILED, with a reason and outputs.
 */
@Getter
@AllArgsConstructor
public class ActionResult {

    private final ActionStatus status;
    private final String reason;
    private final Map<String, Object> outputs;

    public static ActionResult ok(String reason) {
        return new ActionResult(ActionStatus.SUCCEEDED, reason, new HashMap<>());
    }

    public static ActionResult ok(String reason, Map<String, Object> outputs) {
        return new ActionResult(ActionStatus.SUCCEEDED, reason, outputs);
    }

    public static ActionResult failed(String reason) {
        return new ActionResult(ActionStatus.FAILED, reason, new HashMap<>());
    }

    public boolean isSucceeded() {
        return status == ActionStatus.SUCCEEDED;
    }
}
