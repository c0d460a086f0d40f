package io.clusterengine.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.PolicyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Attachment of a policy to a cluster. At most one binding exists per (cluster, policy) pair.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PolicyBinding {

    @JsonProperty("cluster_id")
    private String clusterId;

    @JsonProperty("policy_id")
    private String policyId;

    @JsonProperty("policy_name")
    private String policyName;

    @JsonProperty("policy_type")
    private PolicyType policyType;

    // lower value is evaluated first
    @JsonProperty("priority")
    private int priority;

    @JsonProperty("cooldown")
    private Integer cooldown;

    @JsonProperty("level")
    private Integer level;

    @JsonProperty("enabled")
    @Builder.Default
    private boolean enabled = true;

    @JsonProperty("last_op")
    private OffsetDateTime lastOp;

    /**
     * Whether the binding took part in an action less than its cooldown ago.
     */
    @JsonIgnore
    public boolean isInCooldown(OffsetDateTime now) {
        if (cooldown == null || cooldown <= 0 || lastOp == null) {
            return false;
        }
        return lastOp.plusSeconds(cooldown).isAfter(now);
    }
}
