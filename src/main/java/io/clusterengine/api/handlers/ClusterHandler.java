package io.clusterengine.api.handlers;

import io.clusterengine.api.models.requests.ClusterCreateRequest;
import io.clusterengine.api.models.requests.ClusterUpdateRequest;
import io.clusterengine.api.models.requests.NodeListRequest;
import io.clusterengine.api.models.requests.PolicyBindingRequest;
import io.clusterengine.api.models.requests.ReplaceNodesRequest;
import io.clusterengine.api.models.requests.ScaleRequest;
import io.clusterengine.api.models.responses.ItemsResponse;
import io.clusterengine.capacity.CapacityRequest;
import io.clusterengine.clusters.ClusterManager;
import io.clusterengine.identity.Reference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API handler for clusters, their membership, capacity and policy bindings.
 *
 * Every mutating endpoint answers 202 with the queued action:
 * - POST   /v1/clusters                                  - Create a cluster
 * - PATCH  /v1/clusters/{cluster}                        - Update name, metadata, timeout or profile
 * - DELETE /v1/clusters/{cluster}                        - Delete a cluster and its nodes
 * - POST   /v1/clusters/{cluster}/actions/resize         - Resize
 * - POST   /v1/clusters/{cluster}/actions/scale_out      - Scale out
 * - POST   /v1/clusters/{cluster}/actions/scale_in       - Scale in
 * - POST   /v1/clusters/{cluster}/actions/add_nodes      - Add orphan nodes
 * - POST   /v1/clusters/{cluster}/actions/del_nodes      - Remove member nodes
 * - POST   /v1/clusters/{cluster}/actions/replace_nodes  - Swap members for orphans
 * - POST   /v1/clusters/{cluster}/actions/attach_policy  - Bind a policy
 * - POST   /v1/clusters/{cluster}/actions/detach_policy  - Unbind a policy
 * - POST   /v1/clusters/{cluster}/actions/update_policy  - Change a binding
 */
@Slf4j
@RestController
@RequestMapping("/v1/clusters")
public class ClusterHandler {

    private final ClusterManager clusterManager;
    private final HandlerSupport support;

    public ClusterHandler(ClusterManager clusterManager, HandlerSupport support) {
        this.clusterManager = clusterManager;
        this.support = support;
    }

    @PostMapping
    public ResponseEntity<Object> createCluster(@RequestBody ClusterCreateRequest request) {
        try {
            log.info("Creating cluster '{}'", request.getName());
            return support.accepted(clusterManager.createCluster(request));
        } catch (Exception e) {
            return support.error(e, "creating cluster");
        }
    }

    @GetMapping
    public ResponseEntity<Object> listClusters() {
        try {
            return ResponseEntity.ok(ItemsResponse.of(clusterManager.listClusters()));
        } catch (Exception e) {
            return support.error(e, "listing clusters");
        }
    }

    @GetMapping("/{cluster}")
    public ResponseEntity<Object> getCluster(@PathVariable String cluster) {
        try {
            return ResponseEntity.ok(clusterManager.getCluster(Reference.parse(cluster)));
        } catch (Exception e) {
            return support.error(e, "getting cluster " + cluster);
        }
    }

    @PatchMapping("/{cluster}")
    public ResponseEntity<Object> updateCluster(@PathVariable String cluster,
                                                @RequestBody(required = false) ClusterUpdateRequest request) {
        try {
            log.info("Updating cluster '{}'", cluster);
            return support.accepted(clusterManager.updateCluster(Reference.parse(cluster), request));
        } catch (Exception e) {
            return support.error(e, "updating cluster " + cluster);
        }
    }

    @DeleteMapping("/{cluster}")
    public ResponseEntity<Object> deleteCluster(@PathVariable String cluster) {
        try {
            log.info("Deleting cluster '{}'", cluster);
            return support.accepted(clusterManager.deleteCluster(Reference.parse(cluster)));
        } catch (Exception e) {
            return support.error(e, "deleting cluster " + cluster);
        }
    }

    // =================================================================
    // CLUSTER ACTIONS
    // =================================================================

    @PostMapping("/{cluster}/actions/resize")
    public ResponseEntity<Object> resize(@PathVariable String cluster,
                                         @RequestBody(required = false) CapacityRequest request) {
        try {
            log.info("Resizing cluster '{}'", cluster);
            return support.accepted(clusterManager.resize(Reference.parse(cluster), request));
        } catch (Exception e) {
            return support.error(e, "resizing cluster " + cluster);
        }
    }

    @PostMapping("/{cluster}/actions/scale_out")
    public ResponseEntity<Object> scaleOut(@PathVariable String cluster,
                                           @RequestBody(required = false) ScaleRequest request) {
        try {
            log.info("Scaling out cluster '{}'", cluster);
            return support.accepted(clusterManager.scaleOut(Reference.parse(cluster), request));
        } catch (Exception e) {
            return support.error(e, "scaling out cluster " + cluster);
        }
    }

    @PostMapping("/{cluster}/actions/scale_in")
    public ResponseEntity<Object> scaleIn(@PathVariable String cluster,
                                          @RequestBody(required = false) ScaleRequest request) {
        try {
            log.info("Scaling in cluster '{}'", cluster);
            return support.accepted(clusterManager.scaleIn(Reference.parse(cluster), request));
        } catch (Exception e) {
            return support.error(e, "scaling in cluster " + cluster);
        }
    }

    @PostMapping("/{cluster}/actions/add_nodes")
    public ResponseEntity<Object> addNodes(@PathVariable String cluster,
                                           @RequestBody(required = false) NodeListRequest request) {
        try {
            log.info("Adding nodes to cluster '{}'", cluster);
            return support.accepted(clusterManager.addNodes(Reference.parse(cluster), request));
        } catch (Exception e) {
            return support.error(e, "adding nodes to cluster " + cluster);
        }
    }

    @PostMapping("/{cluster}/actions/del_nodes")
    public ResponseEntity<Object> delNodes(@PathVariable String cluster,
                                           @RequestBody(required = false) NodeListRequest request) {
        try {
            log.info("Removing nodes from cluster '{}'", cluster);
            return support.accepted(clusterManager.delNodes(Reference.parse(cluster), request));
        } catch (Exception e) {
            return support.error(e, "removing nodes from cluster " + cluster);
        }
    }

    @PostMapping("/{cluster}/actions/replace_nodes")
    public ResponseEntity<Object> replaceNodes(@PathVariable String cluster,
                                               @RequestBody(required = false) ReplaceNodesRequest request) {
        try {
            log.info("Replacing nodes of cluster '{}'", cluster);
            return support.accepted(clusterManager.replaceNodes(Reference.parse(cluster), request));
        } catch (Exception e) {
            return support.error(e, "replacing nodes of cluster " + cluster);
        }
    }

    @PostMapping("/{cluster}/actions/attach_policy")
    public ResponseEntity<Object> attachPolicy(@PathVariable String cluster,
                                               @RequestBody(required = false) PolicyBindingRequest request) {
        try {
            log.info("Attaching policy to cluster '{}'", cluster);
            return support.accepted(clusterManager.attachPolicy(Reference.parse(cluster), request));
        } catch (Exception e) {
            return support.error(e, "attaching policy to cluster " + cluster);
        }
    }

    @PostMapping("/{cluster}/actions/detach_policy")
    public ResponseEntity<Object> detachPolicy(@PathVariable String cluster,
                                               @RequestBody PolicyBindingRequest request) {
        try {
            log.info("Detaching policy '{}' from cluster '{}'", request.getPolicyId(), cluster);
            return support.accepted(clusterManager.detachPolicy(Reference.parse(cluster),
                    Reference.parse(request.getPolicyId())));
        } catch (Exception e) {
            return support.error(e, "detaching policy from cluster " + cluster);
        }
    }

    @PostMapping("/{cluster}/actions/update_policy")
    public ResponseEntity<Object> updatePolicy(@PathVariable String cluster,
                                               @RequestBody PolicyBindingRequest request) {
        try {
            log.info("Updating policy '{}' on cluster '{}'", request.getPolicyId(), cluster);
            return support.accepted(clusterManager.updatePolicy(Reference.parse(cluster),
                    Reference.parse(request.getPolicyId()), request));
        } catch (Exception e) {
            return support.error(e, "updating policy on cluster " + cluster);
        }
    }

    // =================================================================
    // POLICY BINDINGS
    // =================================================================

    @GetMapping("/{cluster}/policies")
    public ResponseEntity<Object> listClusterPolicies(@PathVariable String cluster) {
        try {
            return ResponseEntity.ok(ItemsResponse.of(clusterManager.listPolicies(Reference.parse(cluster))));
        } catch (Exception e) {
            return support.error(e, "listing policies of cluster " + cluster);
        }
    }

    @GetMapping("/{cluster}/policies/{policy}")
    public ResponseEntity<Object> getClusterPolicy(@PathVariable String cluster, @PathVariable String policy) {
        try {
            return ResponseEntity.ok(clusterManager.getPolicy(Reference.parse(cluster), Reference.parse(policy)));
        } catch (Exception e) {
            return support.error(e, "getting policy " + policy + " of cluster " + cluster);
        }
    }
}
