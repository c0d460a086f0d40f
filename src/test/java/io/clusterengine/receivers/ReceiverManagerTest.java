package io.clusterengine.receivers;

import io.clusterengine.EngineFixtures;
import io.clusterengine.MutableClock;
import io.clusterengine.actions.ActionEnvelope;
import io.clusterengine.actions.ActionRef;
import io.clusterengine.api.models.requests.ReceiverCreateRequest;
import io.clusterengine.config.EngineConfig;
import io.clusterengine.enums.ActionName;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.exceptions.ResourceNotFoundException;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.identity.Reference;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Profile;
import io.clusterengine.models.Receiver;
import io.clusterengine.store.InMemoryMetadataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ReceiverManagerTest {

    private InMemoryMetadataStore store;
    private ActionEnvelope actionEnvelope;
    private ReceiverManager receiverManager;
    private Cluster cluster;

    @BeforeEach
    void setUp() throws Exception {
        MutableClock clock = MutableClock.atT0();
        store = new InMemoryMetadataStore();
        actionEnvelope = new ActionEnvelope(store, EngineConfig.defaults(), clock);
        receiverManager = new ReceiverManager(store, new IdentityResolver(store), actionEnvelope, clock);

        Profile profile = EngineFixtures.profile(store, "web-server", "os.nova.server-1.0");
        cluster = EngineFixtures.cluster(store, "web", profile, 1, 0, 5);
    }

    @Test
    void testCreateReceiver_ResolvesClusterByName() throws Exception {
        // When
        Receiver receiver = receiverManager.createReceiver(ReceiverCreateRequest.builder()
            .name("grow")
            .clusterId("web")
            .action("cluster_scale_out")
            .params(Map.of("count", 1))
            .build());

        // Then
        assertThat(receiver.getClusterId()).isEqualTo(cluster.getId());
        assertThat(receiver.getAction()).isEqualTo(ActionName.CLUSTER_SCALE_OUT);
        assertThat(receiver.getType()).isEqualTo(Receiver.TYPE_WEBHOOK);
        assertThat(receiverManager.getReceiver(Reference.parse("grow")).getId()).isEqualTo(receiver.getId());
    }

    @Test
    void testCreateReceiver_NodeActionIsIllegal() {
        assertThatThrownBy(() -> receiverManager.createReceiver(ReceiverCreateRequest.builder()
                .name("bad").clusterId("web").action("NODE_DELETE").build()))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Illegal action 'NODE_DELETE' specified.");
    }

    @Test
    void testCreateReceiver_ClusterRequired() {
        assertThatThrownBy(() -> receiverManager.createReceiver(ReceiverCreateRequest.builder()
                .name("bad").action("CLUSTER_SCALE_IN").build()))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Cluster identity is required for creating webhook receiver.");
    }

    @Test
    void testTrigger_TriggerParamsOverrideStoredParams() throws Exception {
        // Given
        Receiver receiver = receiverManager.createReceiver(ReceiverCreateRequest.builder()
            .name("grow").clusterId(cluster.getId()).action("CLUSTER_SCALE_OUT").params(Map.of("count", 1)).build());

        // When
        ActionRef ref = receiverManager.trigger(Reference.byId(receiver.getId()), Map.of("count", 3));

        // Then
        Action action = actionEnvelope.get(ref.getActionId());
        assertThat(action.getName()).isEqualTo(ActionName.CLUSTER_SCALE_OUT);
        assertThat(action.getTarget()).isEqualTo(cluster.getId());
        assertThat(action.getInputs()).containsEntry("count", 3);
    }

    @Test
    void testDeleteReceiver() throws Exception {
        // Given
        Receiver receiver = receiverManager.createReceiver(ReceiverCreateRequest.builder()
            .name("grow").clusterId("web").action("CLUSTER_SCALE_OUT").build());

        // When
        receiverManager.deleteReceiver(Reference.byId(receiver.getId()));

        // Then
        assertThat(receiverManager.listReceivers()).isEmpty();
        assertThatThrownBy(() -> receiverManager.getReceiver(Reference.byId(receiver.getId())))
            .isInstanceOf(ResourceNotFoundException.class);
    }
}
