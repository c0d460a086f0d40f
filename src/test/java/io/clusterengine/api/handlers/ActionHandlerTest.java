package io.clusterengine.api.handlers;

import io.clusterengine.actions.ActionEnvelope;
import io.clusterengine.actions.ActionRef;
import io.clusterengine.api.models.responses.ErrorResponse;
import io.clusterengine.api.models.responses.ItemsResponse;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ActionStatus;
import io.clusterengine.exceptions.ConflictException;
import io.clusterengine.exceptions.ResourceNotFoundException;
import io.clusterengine.models.Action;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ActionHandlerTest {

    @Mock
    private ActionEnvelope actionEnvelope;

    private ActionHandler actionHandler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        actionHandler = new ActionHandler(actionEnvelope, new HandlerSupport(false));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testListActions_FiltersByStatus() throws Exception {
        // Given
        Action action = Action.builder().id("action-1").name(ActionName.CLUSTER_RESIZE).status(ActionStatus.RUNNING).build();
        when(actionEnvelope.list("cluster-1", ActionStatus.RUNNING)).thenReturn(List.of(action));

        // When
        ResponseEntity<Object> response = actionHandler.listActions("cluster-1", "running");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        ItemsResponse<Action> body = (ItemsResponse<Action>) response.getBody();
        assertThat(body.getItems()).containsExactly(action);
    }

    @Test
    void testListActions_InvalidStatus() throws Exception {
        // When
        ResponseEntity<Object> response = actionHandler.listActions(null, "sleeping");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(((ErrorResponse) response.getBody()).getError().getMessage())
            .isEqualTo("Invalid value 'sleeping' specified for 'status'");
        verify(actionEnvelope, never()).list(any(), any());
    }

    @Test
    void testGetAction_NotFound() throws Exception {
        // Given
        when(actionEnvelope.describe("missing"))
            .thenThrow(new ResourceNotFoundException("The action 'missing' could not be found."));

        // When
        ResponseEntity<Object> response = actionHandler.getAction("missing");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(((ErrorResponse) response.getBody()).getError().getMessage())
            .isEqualTo("The action 'missing' could not be found.");
    }

    @Test
    void testCancelAction_Accepted() throws Exception {
        // Given
        when(actionEnvelope.cancel("action-1"))
            .thenReturn(Action.builder().id("action-1").status(ActionStatus.CANCELLING).build());

        // When
        ResponseEntity<Object> response = actionHandler.cancelAction("action-1");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(response.getHeaders().getLocation()).isEqualTo(URI.create("/actions/action-1"));
        assertThat(((ActionRef) response.getBody()).getActionId()).isEqualTo("action-1");
    }

    @Test
    void testCancelAction_AlreadyFinished() throws Exception {
        // Given
        when(actionEnvelope.cancel("action-1"))
            .thenThrow(new ConflictException("The action 'action-1' is SUCCEEDED and cannot be cancelled."));

        // When
        ResponseEntity<Object> response = actionHandler.cancelAction("action-1");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }
}
