package io.clusterengine.policies.enforcement;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.AdjustmentType;
import io.clusterengine.enums.PolicyType;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Policy;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static io.clusterengine.config.Constants.DATA_CREATION_COUNT;
import static io.clusterengine.config.Constants.DATA_DELETION_COUNT;
import static io.clusterengine.models.Cluster.UNBOUNDED;

/**
 * Computes how many nodes a scale-out or scale-in adds or removes when the request
 * gave no count, and keeps the result inside the cluster's size bounds.
 */
@Slf4j
public class ScalingPolicyEnforcer implements PolicyEnforcer {

    public static final String INPUT_COUNT = "count";

    @Override
    public PolicyType getType() {
        return PolicyType.SCALING;
    }

    @Override
    public boolean appliesTo(Policy policy, ActionName actionName) {
        ScalingSpec spec = readSpec(policy.getSpec());
        return spec.getEvent() == actionName;
    }

    @Override
    public void validateSpec(Map<String, Object> spec) {
        ScalingSpec scaling = readSpec(spec);
        if (scaling.getEvent() != ActionName.CLUSTER_SCALE_OUT && scaling.getEvent() != ActionName.CLUSTER_SCALE_IN) {
            throw new BadRequestException(String.format(
                    "Invalid value '%s' specified for 'event'", scaling.getEvent()));
        }
        Adjustment adjustment = scaling.getAdjustment();
        if (AdjustmentType.fromString(adjustment.getType()) == null) {
            throw new BadRequestException(String.format(
                    "Invalid value '%s' specified for 'adjustment.type'", adjustment.getType()));
        }
        if (adjustment.getMinStep() < 0) {
            throw new BadRequestException(String.format(
                    "Invalid value '%d' specified for 'adjustment.min_step'", adjustment.getMinStep()));
        }
    }

    @Override
    public PolicyCheckResult preOp(Cluster cluster, int memberCount, Policy policy, Action action) {
        ScalingSpec spec = readSpec(policy.getSpec());
        Adjustment adjustment = spec.getAdjustment();
        boolean scaleOut = action.getName() == ActionName.CLUSTER_SCALE_OUT;

        int count;
        Object requested = action.getInputs() != null ? action.getInputs().get(INPUT_COUNT) : null;
        if (requested instanceof Number) {
            count = ((Number) requested).intValue();
        } else {
            count = calculateCount(memberCount, adjustment, scaleOut);
        }

        if (count <= 0) {
            return PolicyCheckResult.failed(String.format(
                    "Invalid count (%d) for action '%s'.", count, action.getName()));
        }

        if (scaleOut) {
            int target = memberCount + count;
            if (cluster.getMaxSize() != UNBOUNDED && target > cluster.getMaxSize()) {
                if (!adjustment.isBestEffort()) {
                    return PolicyCheckResult.failed(String.format(
                            "The target capacity (%d) is greater than the cluster's max_size (%d).",
                            target, cluster.getMaxSize()));
                }
                count = cluster.getMaxSize() - memberCount;
            }
        } else {
            int target = memberCount - count;
            if (target < cluster.getMinSize()) {
                if (!adjustment.isBestEffort()) {
                    return PolicyCheckResult.failed(String.format(
                            "The target capacity (%d) is less than the cluster's min_size (%d).",
                            target, cluster.getMinSize()));
                }
                count = memberCount - cluster.getMinSize();
            }
        }

        if (count <= 0) {
            return PolicyCheckResult.failed(String.format(
                    "Cluster is already at its size limit, no node can be %s.", scaleOut ? "added" : "removed"));
        }

        action.getData().put(scaleOut ? DATA_CREATION_COUNT : DATA_DELETION_COUNT, count);
        log.debug("[Cluster: {}] Scaling policy {} decided count {}", cluster.getId(), policy.getId(), count);
        return PolicyCheckResult.ok();
    }

    static int calculateCount(int current, Adjustment adjustment, boolean scaleOut) {
        AdjustmentType type = AdjustmentType.fromString(adjustment.getType());
        double number = adjustment.getNumber();
        if (type == null) {
            type = AdjustmentType.CHANGE_IN_CAPACITY;
        }
        switch (type) {
            case EXACT_CAPACITY:
                return scaleOut ? (int) number - current : current - (int) number;
            case CHANGE_IN_PERCENTAGE:
                int count = (int) (number * current / 100.0);
                return Math.max(count, adjustment.getMinStep());
            case CHANGE_IN_CAPACITY:
            default:
                return (int) number;
        }
    }

    private static ScalingSpec readSpec(Map<String, Object> spec) {
        ScalingSpec scaling = PolicySpecs.read(spec, ScalingSpec.class, PolicyType.SCALING.getValue());
        if (scaling.getAdjustment() == null) {
            scaling.setAdjustment(new Adjustment());
        }
        return scaling;
    }

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class ScalingSpec {
        private ActionName event;
        private Adjustment adjustment;
    }

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class Adjustment {
        private String type = AdjustmentType.CHANGE_IN_CAPACITY.name();
        private double number = 1;
        private int minStep = 1;
        private boolean bestEffort = false;
    }
}
