package io.clusterengine.api.handlers;

import io.clusterengine.actions.ActionRef;
import io.clusterengine.api.models.responses.ErrorResponse;
import io.clusterengine.api.models.responses.ResourceResponse;
import io.clusterengine.exceptions.EngineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URI;

/**
 * Response building shared by the API handlers.
 */
@Slf4j
public class HandlerSupport {

    private final boolean debug;

    public HandlerSupport(boolean debug) {
        this.debug = debug;
    }

    /**
     * 202 for a queued action, with the action to poll in the Location header.
     */
    public ResponseEntity<Object> accepted(ActionRef ref) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .location(URI.create(ref.getLocation()))
            .body(ref);
    }

    /**
     * 201 for an entity created synchronously under {@code collection}.
     */
    public ResponseEntity<Object> created(String collection, String id) {
        String location = collection + "/" + id;
        return ResponseEntity.created(URI.create(location)).body(new ResourceResponse(id, location));
    }

    public ResponseEntity<Object> error(Exception e, String operation) {
        if (e instanceof EngineException) {
            EngineException engineException = (EngineException) e;
            int status = engineException.getErrorType().getStatus();
            if (status >= 500) {
                log.error("Error {}: {}", operation, e.getMessage(), e);
            } else {
                log.info("Rejected {}: {}", operation, e.getMessage());
            }
            ErrorResponse body = ErrorResponse.from(engineException);
            attachTraceback(body, e, status);
            return ResponseEntity.status(status).body(body);
        }
        log.error("Error {}: {}", operation, e.getMessage(), e);
        ErrorResponse body = ErrorResponse.internalError(e.getMessage());
        attachTraceback(body, e, 500);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private void attachTraceback(ErrorResponse body, Exception e, int status) {
        if (!debug || status < 500) {
            return;
        }
        StringWriter trace = new StringWriter();
        e.printStackTrace(new PrintWriter(trace));
        body.getError().setTraceback(trace.toString());
    }
}
