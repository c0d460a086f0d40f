package io.clusterengine;

import com.google.common.util.concurrent.AtomicDouble;
import io.clusterengine.actions.ActionAbortedException;
import io.clusterengine.actions.ActionCancelledException;
import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionEnvelope;
import io.clusterengine.actions.ActionExecutor;
import io.clusterengine.actions.ActionExecutorFactory;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.actions.ActionRunner;
import io.clusterengine.capacity.CapacityResolver;
import io.clusterengine.config.EngineConfig;
import io.clusterengine.driver.ResourceDriver;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ActionStatus;
import io.clusterengine.exceptions.EngineException;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.lock.ClusterLock;
import io.clusterengine.lock.ClusterLockManager;
import io.clusterengine.membership.MembershipCoordinator;
import io.clusterengine.membership.VictimSelector;
import io.clusterengine.metrics.MetricsProvider;
import io.clusterengine.models.Action;
import io.clusterengine.models.Node;
import io.clusterengine.policies.PolicyBindingManager;
import io.clusterengine.policies.enforcement.PolicyEnforcement;
import io.clusterengine.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.clusterengine.config.Constants.REASON_CANCELLED;
import static io.clusterengine.config.Constants.REASON_ENGINE_DIED;
import static io.clusterengine.config.Constants.REASON_TIMEOUT;
import static io.clusterengine.metrics.MetricsConstants.ACTIONS_FINISHED_METRIC_NAME;
import static io.clusterengine.metrics.MetricsConstants.ACTION_EXECUTION_TIME_METRIC_NAME;
import static io.clusterengine.metrics.MetricsConstants.ACTION_NAME_TAG;
import static io.clusterengine.metrics.MetricsConstants.ACTION_STATUS_TAG;
import static io.clusterengine.metrics.MetricsConstants.CLUSTER_LOCKS_HELD_METRIC_NAME;

/**
 * Moves actions through their lifecycle.
 *
 * A single loop thread reaps timed-out actions, releases and renews cluster locks and
 * promotes WAITING actions to READY once their dependencies succeeded and, for
 * cluster-scoped actions, their cluster lock was acquired without blocking. READY
 * actions run on a fixed worker pool. Within one lock scope, WAITING actions are
 * promoted in creation order.
 *
 * Lock scope: a cluster action locks its target cluster, a user-requested node action
 * locks the node's cluster, and derived actions run under their parent's lock.
 */
@Slf4j
public class ActionDispatcher implements ActionRunner {

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final MetadataStore metadataStore;
    private final ActionEnvelope actionEnvelope;
    private final ClusterLockManager lockManager;
    private final MetricsProvider metricsProvider;
    private final EngineConfig config;
    private final Clock clock;
    private final ActionContext actionContext;

    // lock held on behalf of each promoted action, keyed by action id
    private final Map<String, ClusterLock> heldLocks = new ConcurrentHashMap<>();
    // actions handed to the worker pool and not yet returned
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean wakeUpPending = new AtomicBoolean(false);
    private final AtomicDouble locksHeld;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private volatile boolean isRunning = false;

    public ActionDispatcher(MetadataStore metadataStore,
                            ActionEnvelope actionEnvelope,
                            ClusterLockManager lockManager,
                            IdentityResolver identityResolver,
                            CapacityResolver capacityResolver,
                            MembershipCoordinator membershipCoordinator,
                            PolicyBindingManager policyBindingManager,
                            PolicyEnforcement policyEnforcement,
                            ResourceDriver resourceDriver,
                            MetricsProvider metricsProvider,
                            EngineConfig config,
                            Clock clock) {
        this.metadataStore = metadataStore;
        this.actionEnvelope = actionEnvelope;
        this.lockManager = lockManager;
        this.metricsProvider = metricsProvider;
        this.config = config;
        this.clock = clock;
        this.actionContext = new ActionContext(metadataStore, actionEnvelope, identityResolver, capacityResolver,
                membershipCoordinator, policyBindingManager, policyEnforcement, new VictimSelector(),
                resourceDriver, config, clock, this);
        this.locksHeld = metricsProvider.gauge(CLUSTER_LOCKS_HELD_METRIC_NAME, Map.of());

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("action-dispatcher");
            t.setDaemon(true);
            return t;
        });
        this.workers = Executors.newFixedThreadPool(config.getDispatcherWorkers(), r -> {
            Thread t = new Thread(r);
            t.setName("action-worker-" + t.getId());
            t.setDaemon(true);
            return t;
        });

        log.info("ActionDispatcher initialized: engineId={}, workers={}", config.getEngineId(), config.getDispatcherWorkers());
    }

    // =================================================================
    // LIFECYCLE
    // =================================================================

    public void start() {
        log.info("Starting action dispatcher for engine {}", config.getEngineId());
        recoverAbandonedActions();

        isRunning = true;
        scheduler.scheduleWithFixedDelay(this::tick, 0, config.getPollIntervalMillis(), TimeUnit.MILLISECONDS);
    }

    public void stop() {
        log.info("Stopping action dispatcher for engine {}", config.getEngineId());
        isRunning = false;
        scheduler.shutdownNow();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Action workers did not terminate within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (String actionId : new ArrayList<>(heldLocks.keySet())) {
            releaseLock(actionId);
        }
        // NOTE: the metadata store is shared and closed by the application
    }

    public boolean isRunning() {
        return isRunning;
    }

    /**
     * Run the dispatcher loop as soon as possible instead of waiting for the next poll.
     */
    public void wakeUp() {
        if (!isRunning || !wakeUpPending.compareAndSet(false, true)) {
            return;
        }
        try {
            scheduler.execute(() -> {
                wakeUpPending.set(false);
                tick();
            });
        } catch (RejectedExecutionException e) {
            wakeUpPending.set(false);
            log.debug("Dispatcher is shutting down, wake-up ignored");
        }
    }

    // =================================================================
    // DISPATCHER LOOP
    // =================================================================

    /**
     * One pass of the dispatcher loop. Runs only on the dispatcher thread, or directly
     * from tests.
     */
    synchronized void tick() {
        try {
            reapOverdueActions();
            releaseFinishedLocks();
            renewLocks();
            promoteWaitingActions();
            dispatchReadyActions();
        } catch (Exception e) {
            log.error("Error in action dispatcher loop: {}", e.getMessage(), e);
        }
    }

    private void reapOverdueActions() throws Exception {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Action> active = new ArrayList<>(metadataStore.getActionsByStatus(ActionStatus.RUNNING));
        active.addAll(metadataStore.getActionsByStatus(ActionStatus.CANCELLING));

        for (Action action : active) {
            if (!action.isOverdue(now)) {
                continue;
            }
            try {
                Optional<Action> failed = actionEnvelope.transition(action.getId(),
                        EnumSet.of(ActionStatus.RUNNING, ActionStatus.CANCELLING), ActionStatus.FAILED,
                        a -> a.setStatusReason(REASON_TIMEOUT));
                if (failed.isPresent()) {
                    log.warn("Action {} {} timed out after {}s", action.getId(), action.getName(), action.getTimeout());
                    actionEnvelope.cancelChildren(action.getId());
                    releaseLock(action.getId());
                    recordFinished(failed.get());
                }
            } catch (Exception e) {
                log.error("Failed to time out action {}: {}", action.getId(), e.getMessage(), e);
            }
        }
    }

    private void releaseFinishedLocks() throws Exception {
        for (String actionId : new ArrayList<>(heldLocks.keySet())) {
            Optional<Action> action = actionEnvelope.find(actionId);
            if (action.isEmpty() || action.get().getStatus().isTerminal()) {
                releaseLock(actionId);
            }
        }
    }

    private void renewLocks() {
        for (Map.Entry<String, ClusterLock> entry : new ArrayList<>(heldLocks.entrySet())) {
            if (!lockManager.renew(entry.getValue())) {
                log.warn("[Cluster: {}] Lost cluster lock held for action {}",
                        entry.getValue().getClusterId(), entry.getKey());
                heldLocks.remove(entry.getKey());
                locksHeld.set(heldLocks.size());
            }
        }
    }

    private void promoteWaitingActions() throws Exception {
        List<Action> waiting = new ArrayList<>(metadataStore.getActionsByStatus(ActionStatus.WAITING));
        waiting.sort(Comparator.comparing(Action::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));

        Set<String> blockedScopes = new HashSet<>();
        for (Action action : waiting) {
            try {
                promote(action, blockedScopes);
            } catch (Exception e) {
                log.error("Failed to promote action {}: {}", action.getId(), e.getMessage(), e);
            }
        }
    }

    private void promote(Action action, Set<String> blockedScopes) throws Exception {
        for (String dependency : action.getDependsOn()) {
            Optional<Action> dep = actionEnvelope.find(dependency);
            if (dep.isEmpty() || dep.get().getStatus() == ActionStatus.FAILED
                    || dep.get().getStatus() == ActionStatus.CANCELLED) {
                String reason = dep.isEmpty()
                        ? String.format("Dependency %s not found", dependency)
                        : String.format("Dependency %s ended in status %s", dependency, dep.get().getStatus());
                actionEnvelope.transition(action.getId(), EnumSet.of(ActionStatus.WAITING), ActionStatus.FAILED,
                        a -> a.setStatusReason(reason)).ifPresent(this::recordFinished);
                log.info("Action {} failed: {}", action.getId(), reason);
                return;
            }
            if (dep.get().getStatus() != ActionStatus.SUCCEEDED) {
                return;
            }
        }

        Optional<String> scope = lockScope(action);
        ClusterLock lock = null;
        if (scope.isPresent()) {
            if (blockedScopes.contains(scope.get())) {
                return;
            }
            Optional<ClusterLock> acquired = lockManager.tryAcquire(scope.get(), action.getId(), config.getLockLeaseSeconds());
            if (acquired.isEmpty()) {
                log.debug("[Cluster: {}] Lock busy, action {} keeps waiting", scope.get(), action.getId());
                blockedScopes.add(scope.get());
                return;
            }
            lock = acquired.get();
        }

        Optional<Action> ready = actionEnvelope.transition(action.getId(), EnumSet.of(ActionStatus.WAITING),
                ActionStatus.READY, a -> { });
        if (ready.isEmpty()) {
            if (lock != null) {
                lockManager.release(lock);
            }
            return;
        }
        if (lock != null) {
            heldLocks.put(action.getId(), lock);
            locksHeld.set(heldLocks.size());
            log.info("[Cluster: {}] Action {} {} is ready", lock.getClusterId(), action.getId(), action.getName());
        }
        submit(action.getId());
    }

    /**
     * Hand READY actions that nobody is running to the worker pool: derived actions, and
     * cluster-scoped actions whose lock this engine holds.
     */
    private void dispatchReadyActions() throws Exception {
        for (Action action : metadataStore.getActionsByStatus(ActionStatus.READY)) {
            if (inFlight.contains(action.getId())) {
                continue;
            }
            if (heldLocks.containsKey(action.getId()) || lockScope(action).isEmpty()) {
                submit(action.getId());
            }
        }
    }

    private void submit(String actionId) {
        if (!inFlight.add(actionId)) {
            return;
        }
        try {
            workers.submit(() -> {
                try {
                    runIfReady(actionId);
                } finally {
                    inFlight.remove(actionId);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(actionId);
            log.warn("Worker pool rejected action {}", actionId);
        }
    }

    // =================================================================
    // EXECUTION
    // =================================================================

    @Override
    public boolean runIfReady(String actionId) {
        Optional<Action> claimed;
        try {
            claimed = actionEnvelope.transition(actionId, EnumSet.of(ActionStatus.READY), ActionStatus.RUNNING, a -> {
                a.setOwner(config.getEngineId());
                a.setStartTime(OffsetDateTime.now(clock));
            });
        } catch (Exception e) {
            log.error("Failed to claim action {}: {}", actionId, e.getMessage(), e);
            return false;
        }
        if (claimed.isEmpty()) {
            return false;
        }

        Action action = claimed.get();
        log.info("Executing action {} {} on {}", action.getId(), action.getName(), action.getTarget());
        long startNanos = System.nanoTime();
        ActionExecutor executor = ActionExecutorFactory.createExecutor(action.getName());

        ActionResult result;
        try {
            result = executor.execute(actionContext, action);
        } catch (ActionCancelledException e) {
            compensate(executor, action);
            result = null;
            actionEnvelopeCancel(action);
        } catch (ActionAbortedException e) {
            log.info("Action {} was terminated while running: {}", action.getId(), e.getMessage());
            compensate(executor, action);
            result = null;
        } catch (EngineException e) {
            result = ActionResult.failed(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = ActionResult.failed("Action execution was interrupted.");
        } catch (Exception e) {
            log.error("Action {} {} failed with an unexpected error: {}", action.getId(), action.getName(), e.getMessage(), e);
            result = ActionResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        if (result != null) {
            complete(action, result);
        }
        metricsProvider.timer(ACTION_EXECUTION_TIME_METRIC_NAME, Map.of(ACTION_NAME_TAG, action.getName().name()))
                .record(Duration.ofNanos(System.nanoTime() - startNanos));
        releaseLock(action.getId());
        wakeUp();
        return true;
    }

    private void complete(Action action, ActionResult result) {
        try {
            Optional<Action> finished = actionEnvelope.transition(action.getId(), EnumSet.of(ActionStatus.RUNNING),
                    result.getStatus(), a -> {
                        a.setStatusReason(result.getReason());
                        a.getOutputs().putAll(action.getOutputs());
                        a.getOutputs().putAll(result.getOutputs());
                        a.setData(action.getData());
                    });
            if (finished.isEmpty()) {
                // cancel requested after the last checkpoint
                finished = actionEnvelope.transition(action.getId(), EnumSet.of(ActionStatus.CANCELLING),
                        ActionStatus.CANCELLED, a -> a.setStatusReason(REASON_CANCELLED));
            }
            finished.ifPresent(a -> {
                log.info("Action {} {} finished: {} ({})", a.getId(), a.getName(), a.getStatus(), a.getStatusReason());
                recordFinished(a);
            });
        } catch (Exception e) {
            log.error("Failed to record result of action {}: {}", action.getId(), e.getMessage(), e);
        }
    }

    private void actionEnvelopeCancel(Action action) {
        try {
            actionEnvelope.transition(action.getId(), EnumSet.of(ActionStatus.CANCELLING), ActionStatus.CANCELLED,
                    a -> a.setStatusReason(REASON_CANCELLED)).ifPresent(a -> {
                        log.info("Action {} {} cancelled", a.getId(), a.getName());
                        recordFinished(a);
                    });
        } catch (Exception e) {
            log.error("Failed to mark action {} cancelled: {}", action.getId(), e.getMessage(), e);
        }
    }

    private void compensate(ActionExecutor executor, Action action) {
        try {
            executor.compensate(actionContext, action);
        } catch (Exception e) {
            log.warn("Compensation of action {} failed: {}", action.getId(), e.getMessage(), e);
        }
    }

    // =================================================================
    // RECOVERY
    // =================================================================

    /**
     * Fail READY, RUNNING and CANCELLING actions that no live engine is executing:
     * actions this engine claimed before it restarted, derived actions whose parent is
     * gone, and cluster actions that no longer hold their cluster lock.
     */
    void recoverAbandonedActions() {
        try {
            List<Action> candidates = new ArrayList<>();
            for (ActionStatus status : List.of(ActionStatus.READY, ActionStatus.RUNNING, ActionStatus.CANCELLING)) {
                candidates.addAll(metadataStore.getActionsByStatus(status));
            }
            for (Action action : candidates) {
                if (!isAbandoned(action)) {
                    continue;
                }
                Optional<Action> failed = actionEnvelope.transition(action.getId(),
                        EnumSet.of(ActionStatus.READY, ActionStatus.RUNNING, ActionStatus.CANCELLING),
                        ActionStatus.FAILED, a -> a.setStatusReason(REASON_ENGINE_DIED));
                if (failed.isPresent()) {
                    log.warn("Recovered abandoned action {} {} on {}", action.getId(), action.getName(), action.getTarget());
                    compensate(ActionExecutorFactory.createExecutor(action.getName()), failed.get());
                    recordFinished(failed.get());
                }
            }
        } catch (Exception e) {
            log.error("Failed to recover abandoned actions: {}", e.getMessage(), e);
        }
    }

    private boolean isAbandoned(Action action) throws Exception {
        if (config.getEngineId().equals(action.getOwner())) {
            return true;
        }
        if (action.isDerived()) {
            Optional<Action> parent = action.getParent() != null ? actionEnvelope.find(action.getParent()) : Optional.empty();
            return parent.isEmpty() || parent.get().getStatus().isTerminal()
                    || config.getEngineId().equals(parent.get().getOwner());
        }
        Optional<String> scope = lockScope(action);
        if (scope.isPresent()) {
            return !action.getId().equals(lockManager.getOwner(scope.get()).orElse(null));
        }
        return action.getStatus() != ActionStatus.READY;
    }

    // =================================================================
    // PRIVATE HELPERS
    // =================================================================

    Optional<String> lockScope(Action action) throws Exception {
        if (action.isDerived()) {
            return Optional.empty();
        }
        if (action.getName().isClusterAction()) {
            return Optional.of(action.getTarget());
        }
        if (action.getName() == ActionName.NODE_CREATE) {
            Object clusterId = action.getInputs().get("cluster_id");
            return clusterId instanceof String ? Optional.of((String) clusterId) : Optional.empty();
        }
        return metadataStore.getNode(action.getTarget()).map(Node::getClusterId);
    }

    private void releaseLock(String actionId) {
        ClusterLock lock = heldLocks.remove(actionId);
        if (lock != null) {
            lockManager.release(lock);
            locksHeld.set(heldLocks.size());
            log.debug("[Cluster: {}] Released lock held for action {}", lock.getClusterId(), actionId);
        }
    }

    private void recordFinished(Action action) {
        metricsProvider.counter(ACTIONS_FINISHED_METRIC_NAME, Map.of(
                ACTION_NAME_TAG, action.getName().name(),
                ACTION_STATUS_TAG, action.getStatus().name())).increment();
    }
}
