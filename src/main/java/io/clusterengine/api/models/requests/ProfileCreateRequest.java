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
 * Request model for profile creation.
 *
 * Example usage:
 * <pre>
 * {
 *   "name": "web-server",
 *   "type": "os.nova.server-1.0",
 *   "spec": {"flavor": "m1.small", "image": "ubuntu-22.04"}
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProfileCreateRequest {
    private String name;
    private String type;
    private Map<String, Object> spec;
    private Map<String, String> metadata;
}
