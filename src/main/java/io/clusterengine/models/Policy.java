package io.clusterengine.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.PolicyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * An automation rule that can be attached to clusters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Policy {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private PolicyType type;

    @JsonProperty("spec")
    @Builder.Default
    private Map<String, Object> spec = new HashMap<>();

    // default cooldown for new bindings, seconds
    @JsonProperty("cooldown")
    private Integer cooldown;

    @JsonProperty("level")
    private Integer level;

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;
}
