package io.clusterengine.actions.inputs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inputs of the policy binding actions. Absent fields keep their current or default values.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PolicyBindingInput {
    private String policyId;
    private Integer priority;
    private Integer cooldown;
    private Integer level;
    private Boolean enabled;

    public boolean hasChanges() {
        return priority != null || cooldown != null || level != null || enabled != null;
    }
}
