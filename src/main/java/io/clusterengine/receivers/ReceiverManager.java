package io.clusterengine.receivers;

import io.clusterengine.actions.ActionEnvelope;
import io.clusterengine.actions.ActionRef;
import io.clusterengine.api.models.requests.ReceiverCreateRequest;
import io.clusterengine.enums.ActionName;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.identity.Reference;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Receiver;
import io.clusterengine.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Manages webhook receivers. Triggering a receiver queues its cluster action with the
 * stored params, overridden by any params given at trigger time.
 */
@Slf4j
public class ReceiverManager {

    private final MetadataStore metadataStore;
    private final IdentityResolver identityResolver;
    private final ActionEnvelope actionEnvelope;
    private final Clock clock;

    public ReceiverManager(MetadataStore metadataStore, IdentityResolver identityResolver,
                           ActionEnvelope actionEnvelope, Clock clock) {
        this.metadataStore = metadataStore;
        this.identityResolver = identityResolver;
        this.actionEnvelope = actionEnvelope;
        this.clock = clock;
    }

    public Receiver createReceiver(ReceiverCreateRequest request) throws Exception {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new BadRequestException("The 'name' field is required.");
        }
        String type = request.getType() != null ? request.getType() : Receiver.TYPE_WEBHOOK;
        if (!Receiver.TYPE_WEBHOOK.equals(type)) {
            throw new BadRequestException(String.format("Receiver type '%s' is not supported.", type));
        }
        if (request.getClusterId() == null || request.getClusterId().isBlank()) {
            throw new BadRequestException("Cluster identity is required for creating webhook receiver.");
        }
        ActionName action = ActionName.fromString(request.getAction());
        if (action == null || !action.isClusterAction() || action == ActionName.CLUSTER_CREATE) {
            throw new BadRequestException(String.format("Illegal action '%s' specified.", request.getAction()));
        }
        Cluster cluster = identityResolver.resolveCluster(Reference.parse(request.getClusterId()));

        Receiver receiver = Receiver.builder()
                .id(UUID.randomUUID().toString())
                .name(request.getName())
                .type(type)
                .clusterId(cluster.getId())
                .action(action)
                .params(request.getParams() != null ? request.getParams() : new HashMap<>())
                .createdAt(OffsetDateTime.now(clock))
                .build();
        metadataStore.createReceiver(receiver);

        log.info("[Cluster: {}] Created receiver '{}' ({}) for {}", cluster.getId(), receiver.getName(),
                receiver.getId(), action);
        return receiver;
    }

    public List<Receiver> listReceivers() throws Exception {
        return metadataStore.getAllReceivers();
    }

    public Receiver getReceiver(Reference reference) {
        return identityResolver.resolveReceiver(reference);
    }

    public void deleteReceiver(Reference reference) throws Exception {
        Receiver receiver = identityResolver.resolveReceiver(reference);
        metadataStore.deleteReceiver(receiver.getId());
        log.info("Deleted receiver {}", receiver.getId());
    }

    public ActionRef trigger(Reference reference, Map<String, Object> params) throws Exception {
        Receiver receiver = identityResolver.resolveReceiver(reference);
        Cluster cluster = identityResolver.resolveCluster(Reference.byId(receiver.getClusterId()));

        Map<String, Object> inputs = new HashMap<>(receiver.getParams());
        if (params != null) {
            inputs.putAll(params);
        }
        Action action = actionEnvelope.submit(receiver.getAction(), cluster.getId(), inputs, cluster.getTimeout());

        log.info("[Cluster: {}] Receiver {} triggered {} as action {}", cluster.getId(), receiver.getId(),
                receiver.getAction(), action.getId());
        return ActionRef.of(action.getId());
    }
}
