package io.clusterengine.policies.enforcement;

import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.PolicyType;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Policy;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static io.clusterengine.config.Constants.DATA_CREATION_COUNT;
import static io.clusterengine.config.Constants.DATA_DELETION_COUNT;
import static org.assertj.core.api.Assertions.*;

class ScalingPolicyEnforcerTest {

    private final ScalingPolicyEnforcer enforcer = new ScalingPolicyEnforcer();

    private static Policy policy(ActionName event, Map<String, Object> adjustment) {
        return Policy.builder()
            .id("p1")
            .name("scaling")
            .type(PolicyType.SCALING)
            .spec(new HashMap<>(Map.of("event", event.name(), "adjustment", adjustment)))
            .build();
    }

    private static Cluster cluster(int min, int max) {
        return Cluster.builder().id("c1").minSize(min).maxSize(max).build();
    }

    private static Action action(ActionName name) {
        return Action.builder().id("a1").name(name).build();
    }

    private static ScalingPolicyEnforcer.Adjustment adjustment(String type, double number, int minStep) {
        ScalingPolicyEnforcer.Adjustment adjustment = new ScalingPolicyEnforcer.Adjustment();
        adjustment.setType(type);
        adjustment.setNumber(number);
        adjustment.setMinStep(minStep);
        return adjustment;
    }

    @Test
    void testAppliesTo_OnlyMatchingEvent() {
        Policy policy = policy(ActionName.CLUSTER_SCALE_IN, Map.of());

        assertThat(enforcer.appliesTo(policy, ActionName.CLUSTER_SCALE_IN)).isTrue();
        assertThat(enforcer.appliesTo(policy, ActionName.CLUSTER_SCALE_OUT)).isFalse();
    }

    @Test
    void testCalculateCount() {
        assertThat(ScalingPolicyEnforcer.calculateCount(4, adjustment("CHANGE_IN_CAPACITY", 3, 1), true)).isEqualTo(3);
        assertThat(ScalingPolicyEnforcer.calculateCount(4, adjustment("EXACT_CAPACITY", 6, 1), true)).isEqualTo(2);
        assertThat(ScalingPolicyEnforcer.calculateCount(4, adjustment("EXACT_CAPACITY", 1, 1), false)).isEqualTo(3);
        assertThat(ScalingPolicyEnforcer.calculateCount(10, adjustment("CHANGE_IN_PERCENTAGE", 25, 1), true)).isEqualTo(2);
        assertThat(ScalingPolicyEnforcer.calculateCount(2, adjustment("CHANGE_IN_PERCENTAGE", 10, 1), true)).isEqualTo(1);
    }

    @Test
    void testPreOp_RequestedCountWins() {
        // Given
        Action action = action(ActionName.CLUSTER_SCALE_OUT);
        action.getInputs().put(ScalingPolicyEnforcer.INPUT_COUNT, 2);

        // When
        PolicyCheckResult result = enforcer.preOp(cluster(0, -1), 3,
            policy(ActionName.CLUSTER_SCALE_OUT, Map.of("number", 5)), action);

        // Then
        assertThat(result.isPassed()).isTrue();
        assertThat(action.getData()).containsEntry(DATA_CREATION_COUNT, 2);
    }

    @Test
    void testPreOp_BestEffortClampsToMinSize() {
        // Given
        Action action = action(ActionName.CLUSTER_SCALE_IN);

        // When
        PolicyCheckResult result = enforcer.preOp(cluster(2, -1), 3,
            policy(ActionName.CLUSTER_SCALE_IN, Map.of("number", 5, "best_effort", true)), action);

        // Then
        assertThat(result.isPassed()).isTrue();
        assertThat(action.getData()).containsEntry(DATA_DELETION_COUNT, 1);
    }

    @Test
    void testPreOp_StrictBelowMinSizeFails() {
        PolicyCheckResult result = enforcer.preOp(cluster(2, -1), 3,
            policy(ActionName.CLUSTER_SCALE_IN, Map.of("number", 5)), action(ActionName.CLUSTER_SCALE_IN));

        assertThat(result.isPassed()).isFalse();
        assertThat(result.getReason()).isEqualTo("The target capacity (-2) is less than the cluster's min_size (2).");
    }

    @Test
    void testPreOp_AtLimitWithBestEffortFails() {
        PolicyCheckResult result = enforcer.preOp(cluster(0, 3), 3,
            policy(ActionName.CLUSTER_SCALE_OUT, Map.of("number", 1, "best_effort", true)),
            action(ActionName.CLUSTER_SCALE_OUT));

        assertThat(result.isPassed()).isFalse();
        assertThat(result.getReason()).contains("no node can be added");
    }
}
