package io.clusterengine.api.handlers;

import io.clusterengine.api.models.requests.PolicyCreateRequest;
import io.clusterengine.api.models.responses.ItemsResponse;
import io.clusterengine.identity.Reference;
import io.clusterengine.models.Policy;
import io.clusterengine.policies.PolicyManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API handler for policies. All operations are synchronous.
 */
@Slf4j
@RestController
@RequestMapping(PolicyHandler.BASE_PATH)
public class PolicyHandler {

    static final String BASE_PATH = "/v1/policies";

    private final PolicyManager policyManager;
    private final HandlerSupport support;

    public PolicyHandler(PolicyManager policyManager, HandlerSupport support) {
        this.policyManager = policyManager;
        this.support = support;
    }

    @PostMapping
    public ResponseEntity<Object> createPolicy(@RequestBody PolicyCreateRequest request) {
        try {
            log.info("Creating policy '{}'", request.getName());
            Policy policy = policyManager.createPolicy(request);
            return support.created(BASE_PATH, policy.getId());
        } catch (Exception e) {
            return support.error(e, "creating policy");
        }
    }

    @GetMapping
    public ResponseEntity<Object> listPolicies() {
        try {
            return ResponseEntity.ok(ItemsResponse.of(policyManager.listPolicies()));
        } catch (Exception e) {
            return support.error(e, "listing policies");
        }
    }

    @GetMapping("/{policy}")
    public ResponseEntity<Object> getPolicy(@PathVariable String policy) {
        try {
            return ResponseEntity.ok(policyManager.getPolicy(Reference.parse(policy)));
        } catch (Exception e) {
            return support.error(e, "getting policy " + policy);
        }
    }

    @DeleteMapping("/{policy}")
    public ResponseEntity<Object> deletePolicy(@PathVariable String policy) {
        try {
            log.info("Deleting policy '{}'", policy);
            policyManager.deletePolicy(Reference.parse(policy));
            return ResponseEntity.noContent().build();
        } catch (Exception e) {
            return support.error(e, "deleting policy " + policy);
        }
    }
}
