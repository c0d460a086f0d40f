package io.clusterengine.policies.enforcement;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of checking one policy before an action runs.
 */
@Getter
@AllArgsConstructor
public class PolicyCheckResult {

    private static final PolicyCheckResult OK = new PolicyCheckResult(true, null);

    private final boolean passed;
    private final String reason;

    public static PolicyCheckResult ok() {
        return OK;
    }

    public static PolicyCheckResult failed(String reason) {
        return new PolicyCheckResult(false, reason);
    }
}
