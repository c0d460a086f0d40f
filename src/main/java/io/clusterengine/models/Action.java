package io.clusterengine.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.ActionCause;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ActionStatus;
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
 * Persistent record of one asynchronous unit of work. Only dependencies are stored;
 * dependents are derived from the dependency graph.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Action implements Versioned {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private ActionName name;

    @JsonProperty("target")
    private String target;

    @JsonProperty("status")
    private ActionStatus status;

    @JsonProperty("status_reason")
    private String statusReason;

    @JsonProperty("cause")
    private ActionCause cause;

    @JsonProperty("owner")
    private String owner;

    @JsonProperty("parent")
    private String parent;

    @JsonProperty("inputs")
    @Builder.Default
    private Map<String, Object> inputs = new HashMap<>();

    @JsonProperty("outputs")
    @Builder.Default
    private Map<String, Object> outputs = new HashMap<>();

    // decisions recorded by policy checks
    @JsonProperty("data")
    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    @JsonProperty("depends_on")
    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    @JsonProperty("start_time")
    private OffsetDateTime startTime;

    @JsonProperty("end_time")
    private OffsetDateTime endTime;

    // seconds
    @JsonProperty("timeout")
    private int timeout;

    @JsonIgnore
    private long revision;

    @JsonIgnore
    public boolean isDerived() {
        return cause == ActionCause.DERIVED;
    }

    @JsonIgnore
    public boolean isOverdue(OffsetDateTime now) {
        return startTime != null && timeout > 0 && startTime.plusSeconds(timeout).isBefore(now);
    }
}
