package io.clusterengine.actions;

import io.clusterengine.MutableClock;
import io.clusterengine.config.EngineConfig;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ActionStatus;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.exceptions.ConflictException;
import io.clusterengine.exceptions.ResourceNotFoundException;
import io.clusterengine.models.Action;
import io.clusterengine.store.InMemoryMetadataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.clusterengine.config.Constants.REASON_CANCELLED;
import static org.assertj.core.api.Assertions.*;

class ActionEnvelopeTest {

    private InMemoryMetadataStore store;
    private ActionEnvelope envelope;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetadataStore();
        envelope = new ActionEnvelope(store, EngineConfig.defaults(), MutableClock.atT0());
    }

    private void moveTo(Action action, ActionStatus... path) throws Exception {
        ActionStatus current = action.getStatus();
        for (ActionStatus next : path) {
            assertThat(envelope.transition(action.getId(), EnumSet.of(current), next, a -> { })).isPresent();
            current = next;
        }
    }

    @Test
    void testSubmit_PersistsWaitingUserAction() throws Exception {
        // When
        Action action = envelope.submit(ActionName.CLUSTER_RESIZE, "cluster-1", Map.of("number", 3), null);

        // Then
        Action stored = envelope.get(action.getId());
        assertThat(stored.getStatus()).isEqualTo(ActionStatus.WAITING);
        assertThat(stored.isDerived()).isFalse();
        assertThat(stored.getTimeout()).isEqualTo(EngineConfig.defaults().getDefaultActionTimeoutSeconds());
        assertThat(stored.getInputs()).containsEntry("number", 3);
    }

    @Test
    void testTransition_RejectsBackwardMove() throws Exception {
        // Given
        Action action = envelope.submit(ActionName.CLUSTER_UPDATE, "c", null, 60);
        moveTo(action, ActionStatus.READY, ActionStatus.RUNNING, ActionStatus.SUCCEEDED);

        // When
        Optional<Action> result = envelope.transition(action.getId(),
            EnumSet.of(ActionStatus.SUCCEEDED), ActionStatus.RUNNING, a -> { });

        // Then
        assertThat(result).isEmpty();
        Action stored = envelope.get(action.getId());
        assertThat(stored.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(stored.getEndTime()).isNotNull();
    }

    @Test
    void testTransition_UnexpectedStatusIsNoop() throws Exception {
        Action action = envelope.submit(ActionName.CLUSTER_UPDATE, "c", null, 60);

        assertThat(envelope.transition(action.getId(), EnumSet.of(ActionStatus.READY), ActionStatus.RUNNING, a -> { }))
            .isEmpty();
        assertThat(envelope.get(action.getId()).getStatus()).isEqualTo(ActionStatus.WAITING);
    }

    @Test
    void testCancel_PendingActionIsCancelledAtOnce() throws Exception {
        Action action = envelope.submit(ActionName.CLUSTER_SCALE_OUT, "c", null, 60);

        Action cancelled = envelope.cancel(action.getId());

        assertThat(cancelled.getStatus()).isEqualTo(ActionStatus.CANCELLED);
        assertThat(cancelled.getStatusReason()).isEqualTo(REASON_CANCELLED);
    }

    @Test
    void testCancel_RunningActionMovesToCancelling() throws Exception {
        // Given
        Action action = envelope.submit(ActionName.CLUSTER_SCALE_OUT, "c", null, 60);
        moveTo(action, ActionStatus.READY, ActionStatus.RUNNING);

        // When
        Action cancelling = envelope.cancel(action.getId());

        // Then
        assertThat(cancelling.getStatus()).isEqualTo(ActionStatus.CANCELLING);
        assertThat(envelope.cancel(action.getId()).getStatus()).isEqualTo(ActionStatus.CANCELLING);
    }

    @Test
    void testCancel_TerminalActionConflicts() throws Exception {
        Action action = envelope.submit(ActionName.CLUSTER_SCALE_OUT, "c", null, 60);
        moveTo(action, ActionStatus.FAILED);

        assertThatThrownBy(() -> envelope.cancel(action.getId()))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("cannot be cancelled");
    }

    @Test
    void testGet_Missing() {
        assertThatThrownBy(() -> envelope.get("nope"))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessage("The action 'nope' could not be found.");
    }

    @Test
    void testSpawnDerived_ReleasesChildrenAndDescribesDependents() throws Exception {
        // Given
        Action parent = envelope.submit(ActionName.CLUSTER_SCALE_OUT, "c", null, 60);
        Action first = envelope.derive(parent, ActionName.NODE_CREATE, "n1", null);
        Action second = envelope.derive(parent, ActionName.NODE_CREATE, "n2", null);
        second.getDependsOn().add(first.getId());

        // When
        envelope.spawnDerived(parent, List.of(first, second));

        // Then
        List<Action> children = envelope.getChildren(parent.getId());
        assertThat(children).hasSize(2).allMatch(child -> child.getStatus() == ActionStatus.WAITING);
        assertThat(children).allMatch(Action::isDerived);
        assertThat(children).allMatch(child -> child.getTimeout() == 60);
        assertThat(envelope.describe(first.getId()).getDependedBy()).containsExactly(second.getId());
        assertThat(envelope.describe(second.getId()).getDependedBy()).isEmpty();
    }

    @Test
    void testSpawnDerived_CycleIsRejectedBeforeAnyWrite() throws Exception {
        // Given
        Action parent = envelope.submit(ActionName.CLUSTER_SCALE_OUT, "c", null, 60);
        Action first = envelope.derive(parent, ActionName.NODE_CREATE, "n1", null);
        Action second = envelope.derive(parent, ActionName.NODE_CREATE, "n2", null);
        first.getDependsOn().add(second.getId());
        second.getDependsOn().add(first.getId());

        // Then
        assertThatThrownBy(() -> envelope.spawnDerived(parent, List.of(first, second)))
            .isInstanceOf(BadRequestException.class);
        assertThat(envelope.getChildren(parent.getId())).isEmpty();
    }

    @Test
    void testCancelChildren_SkipsFinishedChildren() throws Exception {
        // Given
        Action parent = envelope.submit(ActionName.CLUSTER_SCALE_OUT, "c", null, 60);
        Action done = envelope.derive(parent, ActionName.NODE_CREATE, "n1", null);
        Action pending = envelope.derive(parent, ActionName.NODE_CREATE, "n2", null);
        envelope.spawnDerived(parent, List.of(done, pending));
        moveTo(envelope.get(done.getId()), ActionStatus.READY, ActionStatus.RUNNING, ActionStatus.SUCCEEDED);

        // When
        List<String> cancelled = envelope.cancelChildren(parent.getId());

        // Then
        assertThat(cancelled).containsExactly(pending.getId());
        assertThat(envelope.get(pending.getId()).getStatus()).isEqualTo(ActionStatus.CANCELLED);
        assertThat(envelope.get(done.getId()).getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
    }

    @Test
    void testList_FiltersByTargetAndStatus() throws Exception {
        // Given
        Action a = envelope.submit(ActionName.CLUSTER_UPDATE, "c1", null, 60);
        envelope.submit(ActionName.CLUSTER_UPDATE, "c2", null, 60);
        envelope.cancel(a.getId());

        // Then
        assertThat(envelope.list("c1", null)).extracting(Action::getId).containsExactly(a.getId());
        assertThat(envelope.list(null, ActionStatus.CANCELLED)).extracting(Action::getId).containsExactly(a.getId());
        assertThat(envelope.list(null, null)).hasSize(2);
    }
}
