package io.clusterengine.api.handlers;

import io.clusterengine.actions.ActionEnvelope;
import io.clusterengine.actions.ActionRef;
import io.clusterengine.api.models.responses.ItemsResponse;
import io.clusterengine.enums.ActionStatus;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.models.Action;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API handler for actions.
 * - GET  /v1/actions?target=...&status=...   - List actions, oldest first
 * - GET  /v1/actions/{action}                - Show an action with its dependents
 * - POST /v1/actions/{action}/cancel         - Cancel a pending or running action (202)
 */
@Slf4j
@RestController
@RequestMapping("/v1/actions")
public class ActionHandler {

    private final ActionEnvelope actionEnvelope;
    private final HandlerSupport support;

    public ActionHandler(ActionEnvelope actionEnvelope, HandlerSupport support) {
        this.actionEnvelope = actionEnvelope;
        this.support = support;
    }

    @GetMapping
    public ResponseEntity<Object> listActions(@RequestParam(required = false) String target,
                                              @RequestParam(required = false) String status) {
        try {
            ActionStatus filter = null;
            if (status != null) {
                filter = ActionStatus.fromString(status);
                if (filter == null) {
                    throw new BadRequestException(String.format("Invalid value '%s' specified for 'status'", status));
                }
            }
            return ResponseEntity.ok(ItemsResponse.of(actionEnvelope.list(target, filter)));
        } catch (Exception e) {
            return support.error(e, "listing actions");
        }
    }

    @GetMapping("/{action}")
    public ResponseEntity<Object> getAction(@PathVariable String action) {
        try {
            return ResponseEntity.ok(actionEnvelope.describe(action));
        } catch (Exception e) {
            return support.error(e, "getting action " + action);
        }
    }

    @PostMapping("/{action}/cancel")
    public ResponseEntity<Object> cancelAction(@PathVariable String action) {
        try {
            log.info("Cancelling action '{}'", action);
            Action cancelled = actionEnvelope.cancel(action);
            return support.accepted(ActionRef.of(cancelled.getId()));
        } catch (Exception e) {
            return support.error(e, "cancelling action " + action);
        }
    }
}
