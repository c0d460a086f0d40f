package io.clusterengine.policies;

import io.clusterengine.actions.inputs.PolicyBindingInput;
import io.clusterengine.config.EngineConfig;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.exceptions.ConflictException;
import io.clusterengine.exceptions.ResourceNotFoundException;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.identity.Reference;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Policy;
import io.clusterengine.models.PolicyBinding;
import io.clusterengine.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Manages which policies are attached to which clusters, with what priority,
 * cooldown, level and enabled flag.
 *
 * The validate methods run on the request path and never write; attach, detach and
 * update run inside their actions and re-check against the current bindings.
 */
@Slf4j
public class PolicyBindingManager {

    private static final int MAX_LEVEL = 100;

    private final MetadataStore metadataStore;
    private final IdentityResolver identityResolver;
    private final EngineConfig config;
    private final Clock clock;

    public PolicyBindingManager(MetadataStore metadataStore, IdentityResolver identityResolver,
                                EngineConfig config, Clock clock) {
        this.metadataStore = metadataStore;
        this.identityResolver = identityResolver;
        this.config = config;
        this.clock = clock;
    }

    // =================================================================
    // VALIDATION
    // =================================================================

    /**
     * @return the binding inputs with the policy resolved to its id
     */
    public PolicyBindingInput validateAttach(Cluster cluster, Reference policyRef, PolicyBindingInput request) throws Exception {
        Policy policy = identityResolver.resolvePolicy(policyRef);
        validateValues(request);
        checkAttachable(cluster.getId(), policy, policyRef.getValue());
        return PolicyBindingInput.builder()
                .policyId(policy.getId())
                .priority(request.getPriority())
                .cooldown(request.getCooldown())
                .level(request.getLevel())
                .enabled(request.getEnabled())
                .build();
    }

    public String validateDetach(Cluster cluster, Reference policyRef) throws Exception {
        Policy policy = resolveBoundPolicy(cluster, policyRef);
        return policy.getId();
    }

    public PolicyBindingInput validateUpdate(Cluster cluster, Reference policyRef, PolicyBindingInput request) throws Exception {
        Policy policy = resolveBoundPolicy(cluster, policyRef);
        if (!request.hasChanges()) {
            throw new BadRequestException("No property needs an update.");
        }
        validateValues(request);
        return request.toBuilder().policyId(policy.getId()).build();
    }

    // =================================================================
    // EXECUTION
    // =================================================================

    public PolicyBinding attach(String clusterId, PolicyBindingInput input) throws Exception {
        Policy policy = metadataStore.getPolicy(input.getPolicyId())
                .orElseThrow(() -> new ResourceNotFoundException(
                        String.format("The policy '%s' could not be found.", input.getPolicyId())));
        checkAttachable(clusterId, policy, policy.getId());

        PolicyBinding binding = PolicyBinding.builder()
                .clusterId(clusterId)
                .policyId(policy.getId())
                .policyName(policy.getName())
                .policyType(policy.getType())
                .priority(input.getPriority() != null ? input.getPriority() : config.getDefaultPolicyPriority())
                .cooldown(input.getCooldown() != null ? input.getCooldown() : defaultCooldown(policy))
                .level(input.getLevel() != null ? input.getLevel() : policy.getLevel())
                .enabled(input.getEnabled() == null || input.getEnabled())
                .build();
        metadataStore.putBinding(binding);

        log.info("[Cluster: {}] Attached policy {} with priority {}", clusterId, policy.getId(), binding.getPriority());
        return binding;
    }

    public void detach(String clusterId, String policyId) throws Exception {
        requireBinding(clusterId, policyId, policyId);
        metadataStore.deleteBinding(clusterId, policyId);
        log.info("[Cluster: {}] Detached policy {}", clusterId, policyId);
    }

    public PolicyBinding update(String clusterId, PolicyBindingInput input) throws Exception {
        PolicyBinding binding = requireBinding(clusterId, input.getPolicyId(), input.getPolicyId());
        if (input.getPriority() != null) {
            binding.setPriority(input.getPriority());
        }
        if (input.getCooldown() != null) {
            binding.setCooldown(input.getCooldown());
        }
        if (input.getLevel() != null) {
            binding.setLevel(input.getLevel());
        }
        if (input.getEnabled() != null) {
            binding.setEnabled(input.getEnabled());
        }
        metadataStore.putBinding(binding);

        log.info("[Cluster: {}] Updated binding of policy {}", clusterId, input.getPolicyId());
        return binding;
    }

    // =================================================================
    // QUERIES
    // =================================================================

    /**
     * All bindings of a cluster ordered by priority.
     */
    public List<PolicyBinding> getBindings(String clusterId) throws Exception {
        return metadataStore.getBindingsByCluster(clusterId).stream()
                .sorted(Comparator.comparingInt(PolicyBinding::getPriority))
                .collect(Collectors.toList());
    }

    public PolicyBinding getBinding(Cluster cluster, Reference policyRef) throws Exception {
        Policy policy = identityResolver.resolvePolicy(policyRef);
        return requireBinding(cluster.getId(), policy.getId(), policyRef.getValue());
    }

    /**
     * Enabled bindings in the order they are evaluated: ascending priority.
     */
    public List<PolicyBinding> evaluationOrder(String clusterId) throws Exception {
        return getBindings(clusterId).stream()
                .filter(PolicyBinding::isEnabled)
                .collect(Collectors.toList());
    }

    /**
     * Records that the given bindings took part in an action, starting their cooldown.
     */
    public void recordLastOp(String clusterId, Collection<String> policyIds) throws Exception {
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (String policyId : policyIds) {
            Optional<PolicyBinding> binding = metadataStore.getBinding(clusterId, policyId);
            if (binding.isPresent()) {
                binding.get().setLastOp(now);
                metadataStore.putBinding(binding.get());
            }
        }
    }

    // =================================================================
    // PRIVATE HELPERS
    // =================================================================

    private void checkAttachable(String clusterId, Policy policy, String token) throws Exception {
        List<PolicyBinding> existing = metadataStore.getBindingsByCluster(clusterId);
        for (PolicyBinding binding : existing) {
            if (binding.getPolicyId().equals(policy.getId())) {
                throw new ConflictException(String.format(
                        "The policy '%s' is already attached to cluster '%s'.", token, clusterId));
            }
            if (binding.getPolicyType() == policy.getType()) {
                throw new ConflictException(String.format(
                        "Only one instance of policy type (%s) can be attached to a cluster, but another "
                                + "instance (%s) is found attached to the cluster (%s) already.",
                        policy.getType().getValue(), binding.getPolicyId(), clusterId));
            }
        }
    }

    private Policy resolveBoundPolicy(Cluster cluster, Reference policyRef) throws Exception {
        Policy policy;
        try {
            policy = identityResolver.resolvePolicy(policyRef);
        } catch (ResourceNotFoundException e) {
            throw new ResourceNotFoundException(notAttachedMessage(policyRef.getValue(), cluster.getId()));
        }
        requireBinding(cluster.getId(), policy.getId(), policyRef.getValue());
        return policy;
    }

    private PolicyBinding requireBinding(String clusterId, String policyId, String token) throws Exception {
        return metadataStore.getBinding(clusterId, policyId)
                .orElseThrow(() -> new ResourceNotFoundException(notAttachedMessage(token, clusterId)));
    }

    private static String notAttachedMessage(String token, String clusterId) {
        return String.format("The policy '%s' is not attached to the specified cluster '%s'.", token, clusterId);
    }

    private int defaultCooldown(Policy policy) {
        return policy.getCooldown() != null ? policy.getCooldown() : config.getDefaultPolicyCooldownSeconds();
    }

    private static void validateValues(PolicyBindingInput request) {
        if (request.getPriority() != null && request.getPriority() < 0) {
            throw new BadRequestException(String.format("Invalid value '%d' specified for 'priority'", request.getPriority()));
        }
        if (request.getCooldown() != null && request.getCooldown() < 0) {
            throw new BadRequestException(String.format("Invalid value '%d' specified for 'cooldown'", request.getCooldown()));
        }
        if (request.getLevel() != null && (request.getLevel() < 0 || request.getLevel() > MAX_LEVEL)) {
            throw new BadRequestException(String.format("Invalid value '%d' specified for 'level'", request.getLevel()));
        }
    }
}
