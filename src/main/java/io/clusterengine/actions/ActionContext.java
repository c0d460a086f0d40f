package io.clusterengine.actions;

import io.clusterengine.capacity.CapacityResolver;
import io.clusterengine.config.EngineConfig;
import io.clusterengine.driver.ResourceDriver;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.membership.MembershipCoordinator;
import io.clusterengine.membership.VictimSelector;
import io.clusterengine.policies.PolicyBindingManager;
import io.clusterengine.policies.enforcement.PolicyEnforcement;
import io.clusterengine.store.MetadataStore;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Clock;

/**
 * Context object providing access to shared components for action execution.
 *
 * Holds stateless, cluster-agnostic services only; the target of each action is
 * carried by the action itself.
 */
@Getter
@AllArgsConstructor
public class ActionContext {

    private final MetadataStore metadataStore;
    private final ActionEnvelope actionEnvelope;
    private final IdentityResolver identityResolver;
    private final CapacityResolver capacityResolver;
    private final MembershipCoordinator membershipCoordinator;
    private final PolicyBindingManager policyBindingManager;
    private final PolicyEnforcement policyEnforcement;
    private final VictimSelector victimSelector;
    private final ResourceDriver resourceDriver;
    private final EngineConfig config;
    private final Clock clock;
    private final ActionRunner actionRunner;
}
