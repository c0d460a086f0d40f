package io.clusterengine.api.models.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request model for adding nodes to or removing nodes from a cluster.
 *
 * Example usage:
 * <pre>
 * {
 *   "nodes": ["node-1", "0f6c1f0e-8a46-4f0f-a3d5-4cf0b5b0bb5e"]
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NodeListRequest {
    // node ids or names
    private List<String> nodes;
    // only honoured by del-nodes
    private Boolean destroyAfterDeletion;
}
