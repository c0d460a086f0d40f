package io.clusterengine.api.models.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request model for policy creation.
 *
 * Example usage:
 * <pre>
 * {
 *   "name": "scale-out-by-two",
 *   "type": "cluster.policy.scaling",
 *   "spec": {
 *     "event": "CLUSTER_SCALE_OUT",
 *     "adjustment": {"type": "CHANGE_IN_CAPACITY", "number": 2}
 *   },
 *   "cooldown": 60
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PolicyCreateRequest {
    private String name;
    private String type;
    private Map<String, Object> spec;
    private Integer cooldown;
    private Integer level;
}
