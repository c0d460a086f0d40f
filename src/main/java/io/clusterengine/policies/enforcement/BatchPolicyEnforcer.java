package io.clusterengine.policies.enforcement;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.PolicyType;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Policy;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

import static io.clusterengine.config.Constants.DATA_BATCH_SIZE;

/**
 * Limits how many nodes a rolling cluster update touches at once.
 */
public class BatchPolicyEnforcer implements PolicyEnforcer {

    @Override
    public PolicyType getType() {
        return PolicyType.BATCH;
    }

    @Override
    public boolean appliesTo(Policy policy, ActionName actionName) {
        return actionName == ActionName.CLUSTER_UPDATE;
    }

    @Override
    public void validateSpec(Map<String, Object> spec) {
        BatchSpec batch = PolicySpecs.read(spec, BatchSpec.class, PolicyType.BATCH.getValue());
        if (batch.getMinInService() < 0) {
            throw new BadRequestException(String.format(
                    "Invalid value '%d' specified for 'min_in_service'", batch.getMinInService()));
        }
        if (batch.getMaxBatchSize() < -1 || batch.getMaxBatchSize() == 0) {
            throw new BadRequestException(String.format(
                    "Invalid value '%d' specified for 'max_batch_size'", batch.getMaxBatchSize()));
        }
    }

    @Override
    public PolicyCheckResult preOp(Cluster cluster, int memberCount, Policy policy, Action action) {
        BatchSpec spec = PolicySpecs.read(policy.getSpec(), BatchSpec.class, PolicyType.BATCH.getValue());
        action.getData().put(DATA_BATCH_SIZE, batchSize(memberCount, spec.getMinInService(), spec.getMaxBatchSize()));
        return PolicyCheckResult.ok();
    }

    /**
     * Half the nodes (rounded up) per batch by default; keeps {@code minInService} nodes
     * untouched when the cluster is larger than that, capped by {@code maxBatchSize}.
     */
    static int batchSize(int total, int minInService, int maxBatchSize) {
        int size = (total + 1) / 2;
        if (total > minInService) {
            size = total - minInService;
        }
        if (maxBatchSize != -1 && size > maxBatchSize) {
            size = maxBatchSize;
        }
        return Math.max(size, 1);
    }

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class BatchSpec {
        private int minInService = 1;
        private int maxBatchSize = -1;
    }
}
