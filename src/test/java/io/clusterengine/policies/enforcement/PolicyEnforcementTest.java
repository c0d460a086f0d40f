package io.clusterengine.policies.enforcement;

import io.clusterengine.EngineFixtures;
import io.clusterengine.MutableClock;
import io.clusterengine.actions.inputs.PolicyBindingInput;
import io.clusterengine.config.EngineConfig;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.PolicyType;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.identity.Reference;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Policy;
import io.clusterengine.models.Profile;
import io.clusterengine.policies.PolicyBindingManager;
import io.clusterengine.store.InMemoryMetadataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.clusterengine.config.Constants.DATA_CHECKED_POLICIES;
import static io.clusterengine.config.Constants.DATA_CREATION_COUNT;
import static io.clusterengine.config.Constants.DATA_DELETION_CRITERIA;
import static org.assertj.core.api.Assertions.*;

class PolicyEnforcementTest {

    private InMemoryMetadataStore store;
    private MutableClock clock;
    private PolicyBindingManager bindingManager;
    private PolicyEnforcement enforcement;
    private Cluster cluster;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryMetadataStore();
        clock = MutableClock.atT0();
        bindingManager = new PolicyBindingManager(store, new IdentityResolver(store), EngineConfig.defaults(), clock);
        enforcement = new PolicyEnforcement(store, bindingManager, clock);

        Profile profile = EngineFixtures.profile(store, "server", "os.nova.server");
        cluster = EngineFixtures.cluster(store, "web", profile, 4, 1, 10);
    }

    private Policy bind(String name, PolicyType type, Map<String, Object> spec, int priority, int cooldown) throws Exception {
        Policy policy = EngineFixtures.policy(store, name, type, spec);
        PolicyBindingInput input = bindingManager.validateAttach(cluster, Reference.byId(policy.getId()),
            PolicyBindingInput.builder().priority(priority).cooldown(cooldown).build());
        bindingManager.attach(cluster.getId(), input);
        return policy;
    }

    private static Action action(ActionName name) {
        return Action.builder().id("a-" + name).name(name).inputs(new HashMap<>()).build();
    }

    @Test
    void testCheckBefore_RecordsDecisionsOfApplicablePolicies() throws Exception {
        // Given
        Policy scaling = bind("scale-out", PolicyType.SCALING,
            Map.of("event", "CLUSTER_SCALE_OUT", "adjustment", Map.of("type", "CHANGE_IN_CAPACITY", "number", 2)),
            20, 0);
        bind("oldest", PolicyType.DELETION, Map.of("criteria", "OLDEST_FIRST"), 10, 0);
        Action action = action(ActionName.CLUSTER_SCALE_OUT);

        // When
        PolicyCheckResult result = enforcement.checkBefore(cluster, 4, action);

        // Then
        assertThat(result.isPassed()).isTrue();
        assertThat(action.getData()).containsEntry(DATA_CREATION_COUNT, 2);
        assertThat(action.getData()).doesNotContainKey(DATA_DELETION_CRITERIA);
        assertThat(action.getData().get(DATA_CHECKED_POLICIES)).isEqualTo(List.of(scaling.getId()));
    }

    @Test
    void testCheckBefore_FirstFailureRejects() throws Exception {
        // Given
        bind("scale-out", PolicyType.SCALING,
            Map.of("event", "CLUSTER_SCALE_OUT", "adjustment", Map.of("number", 20)), 10, 0);
        Action action = action(ActionName.CLUSTER_SCALE_OUT);

        // When
        PolicyCheckResult result = enforcement.checkBefore(cluster, 4, action);

        // Then
        assertThat(result.isPassed()).isFalse();
        assertThat(result.getReason())
            .isEqualTo("Policy check failure: The target capacity (24) is greater than the cluster's max_size (10).");
    }

    @Test
    void testRecordAfter_CooldownBlocksNextAction() throws Exception {
        // Given
        bind("scale-out", PolicyType.SCALING, Map.of("event", "CLUSTER_SCALE_OUT"), 10, 300);
        Action first = action(ActionName.CLUSTER_SCALE_OUT);
        assertThat(enforcement.checkBefore(cluster, 4, first).isPassed()).isTrue();

        // When
        enforcement.recordAfter(cluster.getId(), first);
        PolicyCheckResult second = enforcement.checkBefore(cluster, 5, action(ActionName.CLUSTER_SCALE_OUT));

        // Then
        assertThat(second.isPassed()).isFalse();
        assertThat(second.getReason()).contains("cooldown is still in progress");

        // When
        clock.advance(Duration.ofSeconds(301));

        // Then
        assertThat(enforcement.checkBefore(cluster, 5, action(ActionName.CLUSTER_SCALE_OUT)).isPassed()).isTrue();
    }

    @Test
    void testCheckBefore_DisabledBindingIsSkipped() throws Exception {
        // Given
        Policy scaling = bind("scale-out", PolicyType.SCALING,
            Map.of("event", "CLUSTER_SCALE_OUT", "adjustment", Map.of("number", 20)), 10, 0);
        bindingManager.update(cluster.getId(),
            PolicyBindingInput.builder().policyId(scaling.getId()).enabled(false).build());

        // Then
        assertThat(enforcement.checkBefore(cluster, 4, action(ActionName.CLUSTER_SCALE_OUT)).isPassed()).isTrue();
    }

    @Test
    void testValidateSpec_RejectsBadCriteria() {
        assertThatThrownBy(() -> enforcement.validateSpec(PolicyType.DELETION, Map.of("criteria", "NEWEST")))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Invalid value 'NEWEST' specified for 'criteria'");
    }

    @Test
    void testValidateSpec_RejectsBadScalingEvent() {
        assertThatThrownBy(() -> enforcement.validateSpec(PolicyType.SCALING, Map.of("event", "CLUSTER_DELETE")))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Invalid value 'CLUSTER_DELETE' specified for 'event'");
    }
}
