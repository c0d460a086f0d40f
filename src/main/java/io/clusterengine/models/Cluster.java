package io.clusterengine.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.ClusterStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A named group of homogeneous nodes built from one profile.
 *
 * When ACTIVE: min_size &lt;= desired_capacity, and desired_capacity &lt;= max_size unless max_size is -1.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Cluster implements Versioned {

    public static final int UNBOUNDED = -1;

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("profile_id")
    private String profileId;

    @JsonProperty("desired_capacity")
    private int desiredCapacity;

    @JsonProperty("min_size")
    private int minSize;

    @JsonProperty("max_size")
    @Builder.Default
    private int maxSize = UNBOUNDED;

    @JsonProperty("timeout")
    private int timeout;

    @JsonProperty("status")
    private ClusterStatus status;

    @JsonProperty("status_reason")
    private String statusReason;

    @JsonProperty("metadata")
    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    // ordered node ids
    @JsonProperty("nodes")
    @Builder.Default
    private List<String> nodes = new ArrayList<>();

    @JsonProperty("next_index")
    @Builder.Default
    private int nextIndex = 1;

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    @JsonProperty("updated_at")
    private OffsetDateTime updatedAt;

    @JsonProperty("deleted_at")
    private OffsetDateTime deletedAt;

    // store revision the record was read at, used for compare-and-swap
    @JsonIgnore
    private long revision;

    @JsonIgnore
    public boolean isDeleted() {
        return status == ClusterStatus.DELETED;
    }

    @JsonIgnore
    public boolean isUnbounded() {
        return maxSize == UNBOUNDED;
    }

    /**
     * Allocates the next fresh node index. Indexes are never reused within a cluster.
     */
    public int allocateIndex() {
        return nextIndex++;
    }
}
