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
 * Request model for cluster creation.
 *
 * Example usage:
 * <pre>
 * {
 *   "name": "web",
 *   "profile_id": "web-server",
 *   "desired_capacity": 3,
 *   "min_size": 1,
 *   "max_size": 10
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClusterCreateRequest {
    private String name;
    // profile id or name
    private String profileId;
    private Integer desiredCapacity;
    private Integer minSize;
    private Integer maxSize;
    private Integer timeout;
    private Map<String, String> metadata;
}
