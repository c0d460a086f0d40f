package io.clusterengine.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.NodeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * A single managed resource. A node with no cluster is an orphan and has index -1.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Node implements Versioned {

    public static final int ORPHAN_INDEX = -1;

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("cluster_id")
    private String clusterId;

    @JsonProperty("profile_id")
    private String profileId;

    @JsonProperty("role")
    private String role;

    @JsonProperty("index")
    @Builder.Default
    private int index = ORPHAN_INDEX;

    @JsonProperty("status")
    private NodeStatus status;

    @JsonProperty("status_reason")
    private String statusReason;

    @JsonProperty("physical_id")
    private String physicalId;

    @JsonProperty("metadata")
    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    @JsonProperty("updated_at")
    private OffsetDateTime updatedAt;

    @JsonIgnore
    private long revision;

    @JsonIgnore
    public boolean isOrphan() {
        return clusterId == null;
    }

    public void joinCluster(String clusterId, int index) {
        this.clusterId = clusterId;
        this.index = index;
    }

    public void leaveCluster() {
        this.clusterId = null;
        this.index = ORPHAN_INDEX;
    }
}
