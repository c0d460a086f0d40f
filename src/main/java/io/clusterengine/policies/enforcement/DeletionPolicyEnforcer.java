package io.clusterengine.policies.enforcement;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.DeletionCriteria;
import io.clusterengine.enums.PolicyType;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Policy;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static io.clusterengine.config.Constants.DATA_DELETION_CRITERIA;
import static io.clusterengine.config.Constants.DATA_DESTROY_AFTER_DELETION;
import static io.clusterengine.config.Constants.DATA_GRACE_PERIOD;

/**
 * Decides how victims are picked when a cluster shrinks and whether released nodes
 * are destroyed.
 */
public class DeletionPolicyEnforcer implements PolicyEnforcer {

    private static final Set<ActionName> TARGETS = EnumSet.of(
            ActionName.CLUSTER_SCALE_IN, ActionName.CLUSTER_DEL_NODES, ActionName.CLUSTER_RESIZE);

    @Override
    public PolicyType getType() {
        return PolicyType.DELETION;
    }

    @Override
    public boolean appliesTo(Policy policy, ActionName actionName) {
        return TARGETS.contains(actionName);
    }

    @Override
    public void validateSpec(Map<String, Object> spec) {
        DeletionSpec deletion = PolicySpecs.read(spec, DeletionSpec.class, PolicyType.DELETION.getValue());
        if (DeletionCriteria.fromString(deletion.getCriteria()) == null) {
            throw new BadRequestException(String.format(
                    "Invalid value '%s' specified for 'criteria'", deletion.getCriteria()));
        }
        if (deletion.getGracePeriod() < 0) {
            throw new BadRequestException(String.format(
                    "Invalid value '%d' specified for 'grace_period'", deletion.getGracePeriod()));
        }
    }

    @Override
    public PolicyCheckResult preOp(Cluster cluster, int memberCount, Policy policy, Action action) {
        DeletionSpec spec = PolicySpecs.read(policy.getSpec(), DeletionSpec.class, PolicyType.DELETION.getValue());
        DeletionCriteria criteria = DeletionCriteria.fromString(spec.getCriteria());
        action.getData().put(DATA_DELETION_CRITERIA, (criteria != null ? criteria : DeletionCriteria.RANDOM).name());
        action.getData().put(DATA_DESTROY_AFTER_DELETION, spec.isDestroyAfterDeletion());
        action.getData().put(DATA_GRACE_PERIOD, spec.getGracePeriod());
        return PolicyCheckResult.ok();
    }

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class DeletionSpec {
        private String criteria = DeletionCriteria.RANDOM.name();
        private boolean destroyAfterDeletion = true;
        private int gracePeriod = 0;
    }
}
