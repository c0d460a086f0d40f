package io.clusterengine;

import io.clusterengine.actions.ActionEnvelope;
import io.clusterengine.actions.ActionRef;
import io.clusterengine.actions.inputs.PolicyBindingInput;
import io.clusterengine.api.models.requests.ClusterCreateRequest;
import io.clusterengine.api.models.requests.ClusterUpdateRequest;
import io.clusterengine.api.models.requests.ScaleRequest;
import io.clusterengine.capacity.CapacityResolver;
import io.clusterengine.clusters.ClusterManager;
import io.clusterengine.config.EngineConfig;
import io.clusterengine.driver.ResourceDriver;
import io.clusterengine.driver.SimulatedResourceDriver;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ActionStatus;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.enums.PolicyType;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.identity.Reference;
import io.clusterengine.lock.ClusterLock;
import io.clusterengine.lock.LocalClusterLockManager;
import io.clusterengine.membership.MembershipCoordinator;
import io.clusterengine.metrics.MetricsProvider;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.Policy;
import io.clusterengine.models.Profile;
import io.clusterengine.policies.PolicyBindingManager;
import io.clusterengine.policies.enforcement.PolicyEnforcement;
import io.clusterengine.store.InMemoryMetadataStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static io.clusterengine.config.Constants.REASON_CANCELLED;
import static io.clusterengine.config.Constants.REASON_ENGINE_DIED;
import static io.clusterengine.config.Constants.REASON_TIMEOUT;
import static io.clusterengine.metrics.MetricsConstants.ACTIONS_FINISHED_METRIC_NAME;
import static org.assertj.core.api.Assertions.*;

/**
 * Runs actions end to end through the dispatcher loop, driving the loop by hand.
 */
class ActionDispatcherTest {

    private static final long WAIT_TIMEOUT_MILLIS = 10_000;

    private MutableClock clock;
    private OrderCheckingStore store;
    private LocalClusterLockManager lockManager;
    private SimpleMeterRegistry registry;
    private EngineConfig config;
    private ActionEnvelope actionEnvelope;
    private IdentityResolver identityResolver;
    private CapacityResolver capacityResolver;
    private MembershipCoordinator membershipCoordinator;
    private PolicyBindingManager bindingManager;
    private PolicyEnforcement policyEnforcement;
    private ClusterManager clusterManager;
    private ActionDispatcher dispatcher;
    private Profile profile;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.atT0();
        store = new OrderCheckingStore();
        store.initialize();
        lockManager = new LocalClusterLockManager(clock);
        registry = new SimpleMeterRegistry();
        config = EngineConfig.defaults().toBuilder()
            .engineId("engine-test")
            .pollIntervalMillis(10L)
            .build();

        identityResolver = new IdentityResolver(store);
        capacityResolver = new CapacityResolver(config);
        membershipCoordinator = new MembershipCoordinator(store, identityResolver, clock);
        bindingManager = new PolicyBindingManager(store, identityResolver, config, clock);
        policyEnforcement = new PolicyEnforcement(store, bindingManager, clock);
        actionEnvelope = new ActionEnvelope(store, config, clock);

        clusterManager = new ClusterManager(store, identityResolver, capacityResolver, membershipCoordinator,
            bindingManager, actionEnvelope, config);
        dispatcher = newDispatcher(new SimulatedResourceDriver());

        profile = EngineFixtures.profile(store, "web-server", "os.nova.server-1.0");
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
        assertThat(store.getOrderViolations()).isEmpty();
    }

    private ActionDispatcher newDispatcher(ResourceDriver driver) {
        return new ActionDispatcher(store, actionEnvelope, lockManager, identityResolver, capacityResolver,
            membershipCoordinator, bindingManager, policyEnforcement, driver,
            new MetricsProvider(registry, "engine-test"), config, clock);
    }

    // ===== END TO END =====

    @Test
    void testCreateCluster_ProvisionsInitialNodes() throws Exception {
        // Given
        ActionRef ref = clusterManager.createCluster(ClusterCreateRequest.builder()
            .name("web")
            .profileId("web-server")
            .desiredCapacity(2)
            .minSize(1)
            .maxSize(5)
            .build());

        // When
        Action action = runUntilTerminal(ref.getActionId());

        // Then
        assertThat(action.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        Cluster cluster = store.getCluster(ref.getId()).orElseThrow();
        assertThat(cluster.getStatus()).isEqualTo(ClusterStatus.ACTIVE);
        assertThat(cluster.getDesiredCapacity()).isEqualTo(2);

        List<Node> nodes = store.getNodesByCluster(cluster.getId());
        assertThat(nodes).hasSize(2);
        assertThat(nodes).allSatisfy(node -> {
            assertThat(node.getStatus()).isEqualTo(NodeStatus.ACTIVE);
            assertThat(node.getPhysicalId()).isNotNull();
        });
        assertThat(nodes).extracting(Node::getIndex).containsExactlyInAnyOrder(1, 2);
        assertThat(actionEnvelope.getChildren(action.getId()))
            .hasSize(2)
            .allSatisfy(child -> assertThat(child.getStatus()).isEqualTo(ActionStatus.SUCCEEDED));
        waitFor(() -> lockManager.getOwner(cluster.getId()).isEmpty());
    }

    @Test
    void testScaleOutThenScaleIn() throws Exception {
        // Given
        ActionRef created = clusterManager.createCluster(ClusterCreateRequest.builder()
            .name("web").profileId(profile.getId()).desiredCapacity(1).build());
        runUntilTerminal(created.getActionId());
        Reference cluster = Reference.byId(created.getId());

        // When
        ActionRef out = clusterManager.scaleOut(cluster, ScaleRequest.builder().count(2).build());
        Action scaledOut = runUntilTerminal(out.getActionId());

        // Then
        assertThat(scaledOut.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(store.getNodesByCluster(created.getId())).hasSize(3);

        // When
        ActionRef in = clusterManager.scaleIn(cluster, ScaleRequest.builder().count(2).build());
        Action scaledIn = runUntilTerminal(in.getActionId());

        // Then
        assertThat(scaledIn.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        Cluster result = store.getCluster(created.getId()).orElseThrow();
        assertThat(result.getNodes()).hasSize(1);
        assertThat(result.getDesiredCapacity()).isEqualTo(1);
        assertThat(result.getStatus()).isEqualTo(ClusterStatus.ACTIVE);
        assertThat(store.getAllNodes()).hasSize(1);
    }

    @Test
    void testCreateCluster_NodeFailureLeavesClusterInError() throws Exception {
        // Given
        Map<String, Object> spec = new HashMap<>();
        spec.put(SimulatedResourceDriver.SPEC_FAIL, true);
        Profile broken = EngineFixtures.profile(store, "broken", "os.nova.server-1.0", spec);
        ActionRef ref = clusterManager.createCluster(ClusterCreateRequest.builder()
            .name("web").profileId(broken.getId()).desiredCapacity(1).build());

        // When
        Action action = runUntilTerminal(ref.getActionId());

        // Then
        assertThat(action.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(action.getStatusReason()).contains("NODE_CREATE");
        assertThat(store.getCluster(ref.getId()).orElseThrow().getStatus()).isEqualTo(ClusterStatus.ERROR);
        assertThat(store.getNodesByCluster(ref.getId()))
            .singleElement()
            .satisfies(node -> assertThat(node.getStatus()).isEqualTo(NodeStatus.ERROR));
    }

    @Test
    void testFinishedActionsAreCounted() throws Exception {
        // Given
        ActionRef ref = clusterManager.createCluster(ClusterCreateRequest.builder()
            .name("web").profileId(profile.getId()).build());

        // When
        runUntilTerminal(ref.getActionId());

        // Then
        Counter counter = registry.find(ACTIONS_FINISHED_METRIC_NAME)
            .tag("action", "CLUSTER_CREATE")
            .tag("status", "SUCCEEDED")
            .counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void testProfileUpdateRollsOverNodesInBatches() throws Exception {
        // Given
        Cluster cluster = EngineFixtures.cluster(store, "web", profile, 3, 0, 5);
        Profile upgraded = EngineFixtures.profile(store, "web-server-v2", "os.nova.server-1.0");
        Policy batch = EngineFixtures.policy(store, "one-at-a-time", PolicyType.BATCH, Map.of("max_batch_size", 1));
        bindingManager.attach(cluster.getId(), PolicyBindingInput.builder().policyId(batch.getId()).build());
        ClusterUpdateRequest request = new ClusterUpdateRequest();
        request.setProfileId("web-server-v2");

        // When
        ActionRef ref = clusterManager.updateCluster(Reference.byId(cluster.getId()), request);
        Action action = runUntilTerminal(ref.getActionId());

        // Then
        assertThat(action.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(store.getCluster(cluster.getId()).orElseThrow().getProfileId()).isEqualTo(upgraded.getId());
        assertThat(store.getNodesByCluster(cluster.getId()))
            .allSatisfy(node -> assertThat(node.getProfileId()).isEqualTo(upgraded.getId()));

        List<Action> children = actionEnvelope.getChildren(action.getId());
        assertThat(children).hasSize(3)
            .allSatisfy(child -> assertThat(child.getName()).isEqualTo(ActionName.NODE_UPDATE));
        long roots = children.stream().filter(child -> child.getDependsOn().isEmpty()).count();
        assertThat(roots).isEqualTo(1);
        assertThat(children).filteredOn(child -> !child.getDependsOn().isEmpty())
            .allSatisfy(child -> assertThat(child.getDependsOn()).hasSize(1));
    }

    // ===== CLUSTER LOCK =====

    @Test
    void testClusterActionWaitsWhileLockIsHeld() throws Exception {
        // Given
        Cluster cluster = EngineFixtures.cluster(store, "web", profile, 1, 0, 5);
        ClusterLock foreign = lockManager.tryAcquire(cluster.getId(), "someone-else", 60).orElseThrow();
        ActionRef ref = clusterManager.scaleOut(Reference.byId(cluster.getId()), ScaleRequest.builder().count(1).build());

        // When
        dispatcher.tick();
        dispatcher.tick();

        // Then
        assertThat(actionEnvelope.get(ref.getActionId()).getStatus()).isEqualTo(ActionStatus.WAITING);

        // When
        lockManager.release(foreign);
        Action action = runUntilTerminal(ref.getActionId());

        // Then
        assertThat(action.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(store.getNodesByCluster(cluster.getId())).hasSize(2);
    }

    @Test
    void testLockScope() throws Exception {
        // Given
        Cluster cluster = EngineFixtures.cluster(store, "web", profile, 1, 0, 5);
        String memberId = cluster.getNodes().get(0);
        Node orphan = EngineFixtures.orphan(store, "spare", profile);

        Action clusterAction = actionEnvelope.submit(ActionName.CLUSTER_SCALE_OUT, cluster.getId(), null, null);
        Action memberAction = actionEnvelope.submit(ActionName.NODE_UPDATE, memberId, null, null);
        Action orphanAction = actionEnvelope.submit(ActionName.NODE_DELETE, orphan.getId(), null, null);
        Action joiningCreate = actionEnvelope.submit(ActionName.NODE_CREATE, "new-node",
            Map.of("cluster_id", cluster.getId()), null);
        Action derived = actionEnvelope.derive(clusterAction, ActionName.NODE_CREATE, memberId, null);

        // Then
        assertThat(dispatcher.lockScope(clusterAction)).contains(cluster.getId());
        assertThat(dispatcher.lockScope(memberAction)).contains(cluster.getId());
        assertThat(dispatcher.lockScope(orphanAction)).isEmpty();
        assertThat(dispatcher.lockScope(joiningCreate)).contains(cluster.getId());
        assertThat(dispatcher.lockScope(derived)).isEmpty();
    }

    // ===== TIMEOUT AND RECOVERY =====

    @Test
    void testOverdueActionIsFailedWithTimeout() throws Exception {
        // Given
        Cluster cluster = EngineFixtures.cluster(store, "web", profile, 1, 0, 5);
        Action action = actionEnvelope.submit(ActionName.CLUSTER_SCALE_OUT, cluster.getId(), null, 30);
        markRunning(action.getId(), "another-engine");

        // When
        clock.advance(Duration.ofSeconds(20));
        dispatcher.tick();

        // Then
        assertThat(actionEnvelope.get(action.getId()).getStatus()).isEqualTo(ActionStatus.RUNNING);

        // When
        clock.advance(Duration.ofSeconds(11));
        dispatcher.tick();

        // Then
        Action reaped = actionEnvelope.get(action.getId());
        assertThat(reaped.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(reaped.getStatusReason()).isEqualTo(REASON_TIMEOUT);
    }

    @Test
    void testRecoverAbandonedActions() throws Exception {
        // Given
        Cluster cluster = EngineFixtures.cluster(store, "web", profile, 1, 0, 5);
        Cluster other = EngineFixtures.cluster(store, "db", profile, 1, 0, 5);
        Action owned = actionEnvelope.submit(ActionName.CLUSTER_SCALE_OUT, cluster.getId(), null, null);
        markRunning(owned.getId(), "engine-test");
        Action unlocked = actionEnvelope.submit(ActionName.CLUSTER_SCALE_IN, other.getId(), null, null);
        actionEnvelope.transition(unlocked.getId(), EnumSet.of(ActionStatus.WAITING), ActionStatus.READY, a -> { });
        Action waiting = actionEnvelope.submit(ActionName.CLUSTER_SCALE_OUT, cluster.getId(), null, null);

        // When
        dispatcher.recoverAbandonedActions();

        // Then
        Action recovered = actionEnvelope.get(owned.getId());
        assertThat(recovered.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(recovered.getStatusReason()).isEqualTo(REASON_ENGINE_DIED);
        assertThat(actionEnvelope.get(unlocked.getId()).getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(actionEnvelope.get(waiting.getId()).getStatus()).isEqualTo(ActionStatus.WAITING);

        Cluster compensated = store.getCluster(cluster.getId()).orElseThrow();
        assertThat(compensated.getStatus()).isEqualTo(ClusterStatus.WARNING);
        assertThat(compensated.getStatusReason()).isEqualTo(REASON_CANCELLED);
    }

    @Test
    void testRunIfReady_IgnoresActionsNotReady() throws Exception {
        // Given
        Cluster cluster = EngineFixtures.cluster(store, "web", profile, 1, 0, 5);
        Action action = actionEnvelope.submit(ActionName.CLUSTER_SCALE_OUT, cluster.getId(), null, null);

        // When
        boolean ran = dispatcher.runIfReady(action.getId());

        // Then
        assertThat(ran).isFalse();
        assertThat(actionEnvelope.get(action.getId()).getStatus()).isEqualTo(ActionStatus.WAITING);
    }

    // ===== DEPENDENCY ORDERING =====

    @Test
    void testDerivedActions_RunOnlyAfterEveryDependencySucceeded() throws Exception {
        // Given
        Random random = new Random(7L);
        Action parent = runningParent();
        List<Action> children = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            Node node = EngineFixtures.orphan(store, "n" + i, profile);
            Action child = renameNode(parent, node, "renamed-" + i);
            if (i > 0) {
                child.getDependsOn().add(children.get(i - 1).getId());
            }
            for (int j = 0; j < i - 1; j++) {
                if (random.nextInt(4) == 0) {
                    child.getDependsOn().add(children.get(j).getId());
                }
            }
            children.add(child);
        }
        actionEnvelope.spawnDerived(parent, children);

        // When
        for (Action child : children) {
            runUntilTerminal(child.getId());
        }

        // Then
        for (int i = 0; i < children.size(); i++) {
            Action finished = actionEnvelope.get(children.get(i).getId());
            assertThat(finished.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
            assertThat(store.getNode(finished.getTarget()).orElseThrow().getName()).isEqualTo("renamed-" + i);
        }
        assertThat(store.getRunningOrder()).containsExactlyElementsOf(
            children.stream().map(Action::getId).collect(Collectors.toList()));
        assertThat(store.getOrderViolations()).isEmpty();
    }

    @Test
    void testFailedDependency_FailsItsDependentsOnly() throws Exception {
        // Given
        Profile broken = EngineFixtures.profile(store, "broken", "os.nova.server-1.0",
            new HashMap<>(Map.of(SimulatedResourceDriver.SPEC_FAIL, true)));
        Action parent = runningParent();
        Node first = EngineFixtures.orphan(store, "first", profile);
        Node second = EngineFixtures.orphan(store, "second", profile);
        Node joined = EngineFixtures.orphan(store, "joined", profile);
        Node sibling = EngineFixtures.orphan(store, "sibling", profile);

        Map<String, Object> toBroken = new HashMap<>();
        toBroken.put("profile_id", broken.getId());
        Action failing = actionEnvelope.derive(parent, ActionName.NODE_UPDATE, first.getId(), toBroken);
        Action healthy = renameNode(parent, second, "second-renamed");
        Action dependent = renameNode(parent, joined, "joined-renamed");
        dependent.getDependsOn().add(failing.getId());
        dependent.getDependsOn().add(healthy.getId());
        Action transitive = renameNode(parent, sibling, "never");
        transitive.getDependsOn().add(dependent.getId());
        actionEnvelope.spawnDerived(parent, List.of(failing, healthy, dependent, transitive));

        // When
        Action dependentResult = runUntilTerminal(dependent.getId());
        Action transitiveResult = runUntilTerminal(transitive.getId());

        // Then
        assertThat(actionEnvelope.get(failing.getId()).getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(runUntilTerminal(healthy.getId()).getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(dependentResult.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(dependentResult.getStatusReason())
            .isEqualTo("Dependency " + failing.getId() + " ended in status FAILED");
        assertThat(dependentResult.getStartTime()).isNull();
        assertThat(transitiveResult.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(store.getNode(joined.getId()).orElseThrow().getName()).isEqualTo("joined");
        assertThat(store.getNode(sibling.getId()).orElseThrow().getName()).isEqualTo("sibling");
        assertThat(store.getRunningOrder()).doesNotContain(dependent.getId(), transitive.getId());
    }

    // ===== CANCELLATION =====

    @Test
    void testCancelRunningAction_StopsAtNextCheckpoint() throws Exception {
        // Given
        BlockingDriver driver = new BlockingDriver();
        dispatcher.stop();
        dispatcher = newDispatcher(driver);
        ActionRef ref = clusterManager.createCluster(ClusterCreateRequest.builder()
            .name("web")
            .profileId("web-server")
            .desiredCapacity(1)
            .build());
        waitFor(() -> driver.started.getCount() == 0);

        // When
        Action cancelling = actionEnvelope.cancel(ref.getActionId());
        driver.proceed.countDown();
        Action action = runUntilTerminal(ref.getActionId());

        // Then
        assertThat(cancelling.getStatus()).isEqualTo(ActionStatus.CANCELLING);
        assertThat(action.getStatus()).isEqualTo(ActionStatus.CANCELLED);
        assertThat(action.getStatusReason()).isEqualTo(REASON_CANCELLED);
        assertThat(store.getCluster(ref.getId()).orElseThrow().getStatus()).isEqualTo(ClusterStatus.ERROR);
        waitFor(() -> lockManager.getOwner(ref.getId()).isEmpty());
    }

    @Test
    void testCancelWaitingAction_IsImmediate() throws Exception {
        // Given
        ActionRef ref = clusterManager.createCluster(ClusterCreateRequest.builder()
            .name("web")
            .profileId("web-server")
            .build());

        // When
        Action cancelled = actionEnvelope.cancel(ref.getActionId());
        dispatcher.tick();

        // Then
        assertThat(cancelled.getStatus()).isEqualTo(ActionStatus.CANCELLED);
        assertThat(actionEnvelope.get(ref.getActionId()).getStatus()).isEqualTo(ActionStatus.CANCELLED);
        assertThat(store.getCluster(ref.getId())).isEmpty();
        assertThat(store.getRunningOrder()).isEmpty();
    }

    // ===== HELPERS =====

    private Action runningParent() throws Exception {
        Action parent = actionEnvelope.submit(ActionName.CLUSTER_UPDATE, "cluster-elsewhere", new HashMap<>(), null);
        markRunning(parent.getId(), "another-engine");
        return actionEnvelope.get(parent.getId());
    }

    private Action renameNode(Action parent, Node node, String name) {
        Map<String, Object> inputs = new HashMap<>();
        inputs.put("name", name);
        return actionEnvelope.derive(parent, ActionName.NODE_UPDATE, node.getId(), inputs);
    }

    private void markRunning(String actionId, String owner) throws Exception {
        actionEnvelope.transition(actionId, EnumSet.of(ActionStatus.WAITING), ActionStatus.READY, a -> { });
        actionEnvelope.transition(actionId, EnumSet.of(ActionStatus.READY), ActionStatus.RUNNING, a -> {
            a.setOwner(owner);
            a.setStartTime(EngineFixtures.T0);
        });
    }

    private Action runUntilTerminal(String actionId) throws Exception {
        waitFor(() -> actionEnvelope.get(actionId).getStatus().isTerminal());
        return actionEnvelope.get(actionId);
    }

    private void waitFor(Callable<Boolean> condition) throws Exception {
        long deadline = System.currentTimeMillis() + WAIT_TIMEOUT_MILLIS;
        while (!condition.call()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within " + WAIT_TIMEOUT_MILLIS + "ms");
            }
            dispatcher.tick();
            Thread.sleep(10);
        }
    }

    /**
     * Records the order in which derived actions start running and flags any action
     * that starts before all of its dependencies succeeded.
     */
    private static class OrderCheckingStore extends InMemoryMetadataStore {

        private final List<String> runningOrder = new CopyOnWriteArrayList<>();
        private final List<String> orderViolations = new CopyOnWriteArrayList<>();

        @Override
        public synchronized boolean updateAction(Action action) throws Exception {
            boolean starting = action.getStatus() == ActionStatus.RUNNING
                && getAction(action.getId()).map(a -> a.getStatus() == ActionStatus.READY).orElse(false);
            if (starting) {
                for (String dependency : action.getDependsOn()) {
                    ActionStatus status = getAction(dependency).map(Action::getStatus).orElse(null);
                    if (status != ActionStatus.SUCCEEDED) {
                        orderViolations.add(action.getId() + " started while " + dependency + " was " + status);
                    }
                }
            }
            boolean updated = super.updateAction(action);
            if (updated && starting && action.isDerived()) {
                runningOrder.add(action.getId());
            }
            return updated;
        }

        List<String> getRunningOrder() {
            return runningOrder;
        }

        List<String> getOrderViolations() {
            return orderViolations;
        }
    }

    /**
     * Holds node creation until the test lets it proceed.
     */
    private static class BlockingDriver extends SimulatedResourceDriver {

        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch proceed = new CountDownLatch(1);

        @Override
        public String createNode(Node node, Profile profile) throws Exception {
            started.countDown();
            if (!proceed.await(WAIT_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                throw new IllegalStateException("Node creation was never released");
            }
            return super.createNode(node, profile);
        }
    }
}
