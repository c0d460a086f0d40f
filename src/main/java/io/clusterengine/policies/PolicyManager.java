package io.clusterengine.policies;

import io.clusterengine.api.models.requests.PolicyCreateRequest;
import io.clusterengine.enums.PolicyType;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.exceptions.ConflictException;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.identity.Reference;
import io.clusterengine.models.Policy;
import io.clusterengine.policies.enforcement.PolicyEnforcement;
import io.clusterengine.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;

/**
 * Creates, lists and deletes policies. A policy's spec is validated by the enforcer
 * of its type before it is stored.
 */
@Slf4j
public class PolicyManager {

    private final MetadataStore metadataStore;
    private final IdentityResolver identityResolver;
    private final PolicyEnforcement policyEnforcement;
    private final Clock clock;

    public PolicyManager(MetadataStore metadataStore, IdentityResolver identityResolver,
                         PolicyEnforcement policyEnforcement, Clock clock) {
        this.metadataStore = metadataStore;
        this.identityResolver = identityResolver;
        this.policyEnforcement = policyEnforcement;
        this.clock = clock;
    }

    public Policy createPolicy(PolicyCreateRequest request) throws Exception {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new BadRequestException("The 'name' field is required.");
        }
        PolicyType type = PolicyType.fromString(request.getType());
        if (type == null) {
            throw new BadRequestException(String.format(
                    "The specified policy type '%s' is not supported.", request.getType()));
        }
        if (request.getCooldown() != null && request.getCooldown() < 0) {
            throw new BadRequestException(String.format(
                    "Invalid value '%d' specified for 'cooldown'", request.getCooldown()));
        }
        policyEnforcement.validateSpec(type, request.getSpec());

        Policy policy = Policy.builder()
                .id(UUID.randomUUID().toString())
                .name(request.getName())
                .type(type)
                .spec(request.getSpec() != null ? request.getSpec() : new HashMap<>())
                .cooldown(request.getCooldown())
                .level(request.getLevel())
                .createdAt(OffsetDateTime.now(clock))
                .build();
        metadataStore.createPolicy(policy);

        log.info("Created policy '{}' ({}) of type {}", policy.getName(), policy.getId(), type.getValue());
        return policy;
    }

    public List<Policy> listPolicies() throws Exception {
        return metadataStore.getAllPolicies();
    }

    public Policy getPolicy(Reference reference) {
        return identityResolver.resolvePolicy(reference);
    }

    public void deletePolicy(Reference reference) throws Exception {
        Policy policy = identityResolver.resolvePolicy(reference);
        if (!metadataStore.getBindingsByPolicy(policy.getId()).isEmpty()) {
            throw new ConflictException(String.format(
                    "The policy '%s' cannot be deleted: still attached to some clusters.", reference.getValue()));
        }
        metadataStore.deletePolicy(policy.getId());
        log.info("Deleted policy {}", policy.getId());
    }
}
