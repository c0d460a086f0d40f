package io.clusterengine.policies.enforcement;

import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.PolicyType;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Policy;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.clusterengine.config.Constants.DATA_BATCH_SIZE;
import static org.assertj.core.api.Assertions.*;

class BatchPolicyEnforcerTest {

    private final BatchPolicyEnforcer enforcer = new BatchPolicyEnforcer();

    @Test
    void testBatchSize() {
        assertThat(BatchPolicyEnforcer.batchSize(5, 1, -1)).isEqualTo(4);
        assertThat(BatchPolicyEnforcer.batchSize(5, 1, 2)).isEqualTo(2);
        assertThat(BatchPolicyEnforcer.batchSize(3, 5, -1)).isEqualTo(2);
        assertThat(BatchPolicyEnforcer.batchSize(1, 1, -1)).isEqualTo(1);
        assertThat(BatchPolicyEnforcer.batchSize(0, 0, -1)).isEqualTo(1);
    }

    @Test
    void testPreOp_RecordsBatchSize() {
        // Given
        Policy policy = Policy.builder().id("p1").type(PolicyType.BATCH)
            .spec(Map.of("min_in_service", 2, "max_batch_size", 3)).build();
        Action action = Action.builder().id("a1").name(ActionName.CLUSTER_UPDATE).build();

        // When
        PolicyCheckResult result = enforcer.preOp(Cluster.builder().id("c1").build(), 10, policy, action);

        // Then
        assertThat(result.isPassed()).isTrue();
        assertThat(action.getData()).containsEntry(DATA_BATCH_SIZE, 3);
    }

    @Test
    void testAppliesOnlyToClusterUpdate() {
        Policy policy = Policy.builder().type(PolicyType.BATCH).build();

        assertThat(enforcer.appliesTo(policy, ActionName.CLUSTER_UPDATE)).isTrue();
        assertThat(enforcer.appliesTo(policy, ActionName.CLUSTER_SCALE_OUT)).isFalse();
    }

    @Test
    void testValidateSpec_ZeroBatchSize() {
        assertThatThrownBy(() -> enforcer.validateSpec(Map.of("max_batch_size", 0)))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Invalid value '0' specified for 'max_batch_size'");
    }
}
