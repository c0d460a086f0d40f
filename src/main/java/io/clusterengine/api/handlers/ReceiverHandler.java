package io.clusterengine.api.handlers;

import io.clusterengine.api.models.requests.ReceiverCreateRequest;
import io.clusterengine.api.models.responses.ItemsResponse;
import io.clusterengine.identity.Reference;
import io.clusterengine.models.Receiver;
import io.clusterengine.receivers.ReceiverManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API handler for receivers.
 * - POST   /v1/receivers                      - Create a webhook receiver (201)
 * - GET    /v1/receivers                      - List receivers
 * - GET    /v1/receivers/{receiver}           - Show a receiver
 * - DELETE /v1/receivers/{receiver}           - Delete a receiver (204)
 * - POST   /v1/receivers/{receiver}/trigger   - Queue the receiver's cluster action (202)
 */
@Slf4j
@RestController
@RequestMapping(ReceiverHandler.BASE_PATH)
public class ReceiverHandler {

    static final String BASE_PATH = "/v1/receivers";

    private final ReceiverManager receiverManager;
    private final HandlerSupport support;

    public ReceiverHandler(ReceiverManager receiverManager, HandlerSupport support) {
        this.receiverManager = receiverManager;
        this.support = support;
    }

    @PostMapping
    public ResponseEntity<Object> createReceiver(@RequestBody ReceiverCreateRequest request) {
        try {
            log.info("Creating receiver '{}'", request.getName());
            Receiver receiver = receiverManager.createReceiver(request);
            return support.created(BASE_PATH, receiver.getId());
        } catch (Exception e) {
            return support.error(e, "creating receiver");
        }
    }

    @GetMapping
    public ResponseEntity<Object> listReceivers() {
        try {
            return ResponseEntity.ok(ItemsResponse.of(receiverManager.listReceivers()));
        } catch (Exception e) {
            return support.error(e, "listing receivers");
        }
    }

    @GetMapping("/{receiver}")
    public ResponseEntity<Object> getReceiver(@PathVariable String receiver) {
        try {
            return ResponseEntity.ok(receiverManager.getReceiver(Reference.parse(receiver)));
        } catch (Exception e) {
            return support.error(e, "getting receiver " + receiver);
        }
    }

    @DeleteMapping("/{receiver}")
    public ResponseEntity<Object> deleteReceiver(@PathVariable String receiver) {
        try {
            log.info("Deleting receiver '{}'", receiver);
            receiverManager.deleteReceiver(Reference.parse(receiver));
            return ResponseEntity.noContent().build();
        } catch (Exception e) {
            return support.error(e, "deleting receiver " + receiver);
        }
    }

    @PostMapping("/{receiver}/trigger")
    public ResponseEntity<Object> trigger(@PathVariable String receiver,
                                          @RequestBody(required = false) Map<String, Object> params) {
        try {
            log.info("Triggering receiver '{}'", receiver);
            return support.accepted(receiverManager.trigger(Reference.parse(receiver), params));
        } catch (Exception e) {
            return support.error(e, "triggering receiver " + receiver);
        }
    }
}
