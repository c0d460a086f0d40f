package io.clusterengine.policies.enforcement;

import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.PolicyType;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Policy;

import java.util.Map;

/**
 * Rule set of one policy type.
 *
 * Each PolicyEnforcer decides which cluster actions its policies take part in and,
 * before such an action runs, records its decisions in the action's data map or
 * rejects the action.
 */
public interface PolicyEnforcer {

    /**
     * Get the policy type handled by this enforcer.
     */
    PolicyType getType();

    /**
     * Check whether the given policy takes part in actions of the given name.
     */
    boolean appliesTo(Policy policy, ActionName actionName);

    /**
     * Validate a policy spec before the policy is stored.
     *
     * @throws io.clusterengine.exceptions.BadRequestException when the spec is malformed
     */
    void validateSpec(Map<String, Object> spec);

    /**
     * Check the action against the policy and record decisions in {@code action.getData()}.
     *
     * @param cluster the target cluster as read when the action started
     * @param memberCount current number of member nodes
     * @param policy the bound policy
     * @param action the action about to run
     * @return check result
     */
    PolicyCheckResult preOp(Cluster cluster, int memberCount, Policy policy, Action action);
}
