package io.clusterengine.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Template nodes are built from. Nodes may only join a cluster whose profile has the same type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Profile {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private String type;

    @JsonProperty("spec")
    @Builder.Default
    private Map<String, Object> spec = new HashMap<>();

    @JsonProperty("metadata")
    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;
}
