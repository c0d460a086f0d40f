package io.clusterengine.actions;

import io.clusterengine.config.EngineConfig;
import io.clusterengine.enums.ActionCause;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ActionStatus;
import io.clusterengine.exceptions.ConflictException;
import io.clusterengine.exceptions.InternalErrorException;
import io.clusterengine.exceptions.ResourceNotFoundException;
import io.clusterengine.models.Action;
import io.clusterengine.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static io.clusterengine.config.Constants.REASON_CANCELLED;

/**
 * Creates, tracks and cancels actions.
 *
 * Every status change is a compare-and-swap against the revision the action was read
 * at, guarded by {@link ActionStatus#canTransitionTo(ActionStatus)}, so concurrent
 * writers (workers, the dispatcher loop, cancel requests) can never move an action
 * backwards or out of a terminal status.
 */
@Slf4j
public class ActionEnvelope {

    private static final int MAX_UPDATE_ATTEMPTS = 10;

    private final MetadataStore metadataStore;
    private final EngineConfig config;
    private final Clock clock;

    public ActionEnvelope(MetadataStore metadataStore, EngineConfig config, Clock clock) {
        this.metadataStore = metadataStore;
        this.config = config;
        this.clock = clock;
    }

    // =================================================================
    // CREATION
    // =================================================================

    /**
     * Persist a user-requested action in WAITING.
     */
    public Action submit(ActionName name, String target, Map<String, Object> inputs, Integer timeout) throws Exception {
        Action action = Action.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .target(target)
                .status(ActionStatus.WAITING)
                .cause(ActionCause.USER)
                .inputs(inputs != null ? inputs : new HashMap<>())
                .createdAt(now())
                .timeout(timeout != null && timeout > 0 ? timeout : config.getDefaultActionTimeoutSeconds())
                .build();
        metadataStore.createAction(action);

        log.info("Action {} {} submitted for target {}", action.getId(), name, target);
        return action;
    }

    /**
     * Build a derived action of {@code parent} in INIT. It is not persisted until
     * passed to {@link #spawnDerived(Action, List)}.
     */
    public Action derive(Action parent, ActionName name, String target, Map<String, Object> inputs) {
        return Action.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .target(target)
                .status(ActionStatus.INIT)
                .cause(ActionCause.DERIVED)
                .parent(parent.getId())
                .inputs(inputs != null ? inputs : new HashMap<>())
                .createdAt(now())
                .timeout(parent.getTimeout())
                .build();
    }

    /**
     * Persist derived actions in INIT, check their dependency edges, then release them
     * to WAITING together so none can start before its siblings exist.
     */
    public void spawnDerived(Action parent, List<Action> children) throws Exception {
        ActionGraph.of(children).validate(List.of());

        for (Action child : children) {
            metadataStore.createAction(child);
        }
        for (Action child : children) {
            transition(child.getId(), EnumSet.of(ActionStatus.INIT), ActionStatus.WAITING, a -> { });
        }

        log.info("Action {} spawned {} derived actions", parent.getId(), children.size());
    }

    // =================================================================
    // QUERIES
    // =================================================================

    public Action get(String actionId) throws Exception {
        return find(actionId).orElseThrow(() -> new ResourceNotFoundException(
                String.format("The action '%s' could not be found.", actionId)));
    }

    public Optional<Action> find(String actionId) throws Exception {
        return metadataStore.getAction(actionId);
    }

    public List<Action> list(String target, ActionStatus status) throws Exception {
        List<Action> actions = target != null ? metadataStore.getActionsByTarget(target)
                : status != null ? metadataStore.getActionsByStatus(status)
                : metadataStore.getAllActions();
        return actions.stream()
                .filter(action -> status == null || action.getStatus() == status)
                .sorted(Comparator.comparing(Action::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    public List<Action> getChildren(String parentId) throws Exception {
        return metadataStore.getAllActions().stream()
                .filter(action -> parentId.equals(action.getParent()))
                .collect(Collectors.toList());
    }

    /**
     * The action with its dependents, derived from its siblings' dependency edges.
     */
    public ActionDetail describe(String actionId) throws Exception {
        Action action = get(actionId);
        List<Action> siblings = action.getParent() != null ? getChildren(action.getParent()) : List.of(action);
        return new ActionDetail(action, ActionGraph.of(siblings).dependentsOf(actionId));
    }

    // =================================================================
    // STATUS CHANGES
    // =================================================================

    /**
     * Move an action from one of {@code expected} to {@code next}, applying
     * {@code changes} in the same write. Sets end_time on terminal statuses.
     *
     * @return the updated action, or empty when it was not in an expected status
     */
    public Optional<Action> transition(String actionId, Set<ActionStatus> expected, ActionStatus next,
                                       Consumer<Action> changes) throws Exception {
        for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
            Optional<Action> current = find(actionId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            Action action = current.get();
            if (!expected.contains(action.getStatus()) || !action.getStatus().canTransitionTo(next)) {
                return Optional.empty();
            }

            changes.accept(action);
            action.setStatus(next);
            if (next.isTerminal()) {
                action.setEndTime(now());
            }
            if (metadataStore.updateAction(action)) {
                log.debug("Action {} moved to {}", actionId, next);
                return Optional.of(action);
            }
        }
        throw new InternalErrorException(String.format(
                "Failed to update action %s after %d attempts", actionId, MAX_UPDATE_ATTEMPTS), null);
    }

    /**
     * Persist data and outputs collected by a running action without changing its status.
     */
    public void saveProgress(Action action) throws Exception {
        for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
            Action current = get(action.getId());
            if (current.getStatus().isTerminal()) {
                return;
            }
            current.setData(action.getData());
            current.setOutputs(action.getOutputs());
            if (metadataStore.updateAction(current)) {
                return;
            }
        }
        throw new InternalErrorException(String.format(
                "Failed to update action %s after %d attempts", action.getId(), MAX_UPDATE_ATTEMPTS), null);
    }

    /**
     * Cancel an action. Pending actions are cancelled at once; a running action moves to
     * CANCELLING and stops at its next checkpoint.
     */
    public Action cancel(String actionId) throws Exception {
        for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
            Action action = get(actionId);
            ActionStatus status = action.getStatus();

            if (status.isTerminal()) {
                throw new ConflictException(String.format(
                        "Action (%s) is in status (%s) and cannot be cancelled.", actionId, status));
            }
            if (status == ActionStatus.CANCELLING) {
                return action;
            }

            Optional<Action> updated;
            if (status.isPending()) {
                updated = transition(actionId, EnumSet.of(status), ActionStatus.CANCELLED,
                        a -> a.setStatusReason(REASON_CANCELLED));
            } else {
                updated = transition(actionId, EnumSet.of(ActionStatus.RUNNING), ActionStatus.CANCELLING,
                        a -> a.setStatusReason("Cancel requested."));
            }
            if (updated.isPresent()) {
                log.info("Action {} cancel requested, now {}", actionId, updated.get().getStatus());
                return updated.get();
            }
        }
        throw new InternalErrorException(String.format("Failed to cancel action %s", actionId), null);
    }

    /**
     * Cancel every non-terminal derived action of {@code parentId}.
     */
    public List<String> cancelChildren(String parentId) throws Exception {
        List<String> cancelled = new ArrayList<>();
        for (Action child : getChildren(parentId)) {
            if (child.getStatus().isTerminal()) {
                continue;
            }
            try {
                cancel(child.getId());
                cancelled.add(child.getId());
            } catch (ConflictException e) {
                log.debug("Child {} of {} finished before it could be cancelled", child.getId(), parentId);
            }
        }
        return cancelled;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
