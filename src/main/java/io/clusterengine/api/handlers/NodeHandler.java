package io.clusterengine.api.handlers;

import io.clusterengine.api.models.requests.NodeCreateRequest;
import io.clusterengine.api.models.requests.NodeUpdateRequest;
import io.clusterengine.api.models.responses.ItemsResponse;
import io.clusterengine.identity.Reference;
import io.clusterengine.nodes.NodeManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API handler for nodes.
 * - POST   /v1/nodes                  - Create a node, optionally in a cluster (202)
 * - GET    /v1/nodes?cluster_id=...   - List nodes
 * - GET    /v1/nodes/{node}           - Show a node
 * - PATCH  /v1/nodes/{node}           - Update a node (202)
 * - DELETE /v1/nodes/{node}           - Delete a node (202)
 */
@Slf4j
@RestController
@RequestMapping("/v1/nodes")
public class NodeHandler {

    private final NodeManager nodeManager;
    private final HandlerSupport support;

    public NodeHandler(NodeManager nodeManager, HandlerSupport support) {
        this.nodeManager = nodeManager;
        this.support = support;
    }

    @PostMapping
    public ResponseEntity<Object> createNode(@RequestBody NodeCreateRequest request) {
        try {
            log.info("Creating node '{}'", request.getName());
            return support.accepted(nodeManager.createNode(request));
        } catch (Exception e) {
            return support.error(e, "creating node");
        }
    }

    @GetMapping
    public ResponseEntity<Object> listNodes(@RequestParam(name = "cluster_id", required = false) String clusterId) {
        try {
            Reference cluster = clusterId != null ? Reference.parse(clusterId) : null;
            return ResponseEntity.ok(ItemsResponse.of(nodeManager.listNodes(cluster)));
        } catch (Exception e) {
            return support.error(e, "listing nodes");
        }
    }

    @GetMapping("/{node}")
    public ResponseEntity<Object> getNode(@PathVariable String node) {
        try {
            return ResponseEntity.ok(nodeManager.getNode(Reference.parse(node)));
        } catch (Exception e) {
            return support.error(e, "getting node " + node);
        }
    }

    @PatchMapping("/{node}")
    public ResponseEntity<Object> updateNode(@PathVariable String node,
                                             @RequestBody(required = false) NodeUpdateRequest request) {
        try {
            log.info("Updating node '{}'", node);
            return support.accepted(nodeManager.updateNode(Reference.parse(node), request));
        } catch (Exception e) {
            return support.error(e, "updating node " + node);
        }
    }

    @DeleteMapping("/{node}")
    public ResponseEntity<Object> deleteNode(@PathVariable String node) {
        try {
            log.info("Deleting node '{}'", node);
            return support.accepted(nodeManager.deleteNode(Reference.parse(node)));
        } catch (Exception e) {
            return support.error(e, "deleting node " + node);
        }
    }
}
