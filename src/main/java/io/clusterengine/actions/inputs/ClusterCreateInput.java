package io.clusterengine.actions.inputs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Inputs of CLUSTER_CREATE. The cluster id is allocated during validation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClusterCreateInput {
    private String name;
    private String profileId;
    private int desiredCapacity;
    private int minSize;
    private int maxSize;
    private int timeout;
    private Map<String, String> metadata;
}
