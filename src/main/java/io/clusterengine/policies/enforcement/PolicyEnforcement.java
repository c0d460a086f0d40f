package io.clusterengine.policies.enforcement;

import io.clusterengine.enums.PolicyType;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Policy;
import io.clusterengine.models.PolicyBinding;
import io.clusterengine.policies.PolicyBindingManager;
import io.clusterengine.store.MetadataStore;
import io.clusterengine.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.clusterengine.config.Constants.DATA_CHECKED_POLICIES;

/**
 * Runs the policies bound to a cluster around its actions.
 *
 * Enabled bindings are checked in ascending priority; the first failing check rejects
 * the action. Bindings that took part in a successful action start their cooldown.
 */
@Slf4j
public class PolicyEnforcement {

    private final MetadataStore metadataStore;
    private final PolicyBindingManager bindingManager;
    private final Clock clock;
    private final Map<PolicyType, PolicyEnforcer> enforcers = new EnumMap<>(PolicyType.class);

    public PolicyEnforcement(MetadataStore metadataStore, PolicyBindingManager bindingManager, Clock clock) {
        this(metadataStore, bindingManager, clock,
                List.of(new ScalingPolicyEnforcer(), new DeletionPolicyEnforcer(), new BatchPolicyEnforcer()));
    }

    public PolicyEnforcement(MetadataStore metadataStore, PolicyBindingManager bindingManager, Clock clock,
                             List<PolicyEnforcer> enforcers) {
        this.metadataStore = metadataStore;
        this.bindingManager = bindingManager;
        this.clock = clock;
        for (PolicyEnforcer enforcer : enforcers) {
            this.enforcers.put(enforcer.getType(), enforcer);
        }
    }

    /**
     * Validate the spec of a policy about to be created.
     */
    public void validateSpec(PolicyType type, Map<String, Object> spec) {
        PolicyEnforcer enforcer = enforcers.get(type);
        if (enforcer == null) {
            throw new BadRequestException(String.format("The specified policy type '%s' is not supported.", type));
        }
        enforcer.validateSpec(spec);
    }

    /**
     * Check every applicable binding before a cluster action runs. Decisions are written
     * to the action's data map, including the ids of the policies that were checked.
     */
    public PolicyCheckResult checkBefore(Cluster cluster, int memberCount, Action action) throws Exception {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<String> checked = new ArrayList<>();

        for (PolicyBinding binding : bindingManager.evaluationOrder(cluster.getId())) {
            Optional<Policy> policy = metadataStore.getPolicy(binding.getPolicyId());
            if (policy.isEmpty()) {
                log.warn("[Cluster: {}] Bound policy {} no longer exists, skipping", cluster.getId(), binding.getPolicyId());
                continue;
            }
            PolicyEnforcer enforcer = enforcers.get(policy.get().getType());
            if (enforcer == null || !enforcer.appliesTo(policy.get(), action.getName())) {
                continue;
            }

            if (binding.isInCooldown(now)) {
                return PolicyCheckResult.failed(String.format(
                        "Policy check failure: policy '%s' cooldown is still in progress.", policy.get().getName()));
            }

            PolicyCheckResult result = enforcer.preOp(cluster, memberCount, policy.get(), action);
            if (!result.isPassed()) {
                log.info("[Cluster: {}] Policy {} rejected action {}: {}",
                        cluster.getId(), policy.get().getId(), action.getId(), result.getReason());
                return PolicyCheckResult.failed("Policy check failure: " + result.getReason());
            }
            checked.add(binding.getPolicyId());
        }

        action.getData().put(DATA_CHECKED_POLICIES, checked);
        return PolicyCheckResult.ok();
    }

    /**
     * Start the cooldown of the bindings that were checked for a successful action.
     */
    public void recordAfter(String clusterId, Action action) throws Exception {
        List<String> checked = JsonUtils.toStringList(action.getData().get(DATA_CHECKED_POLICIES));
        if (!checked.isEmpty()) {
            bindingManager.recordLastOp(clusterId, checked);
        }
    }
}
