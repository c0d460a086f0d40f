package io.clusterengine.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.ActionName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Triggers a fixed cluster action on behalf of an external caller, e.g. a monitoring webhook.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Receiver {

    public static final String TYPE_WEBHOOK = "webhook";

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    @Builder.Default
    private String type = TYPE_WEBHOOK;

    @JsonProperty("cluster_id")
    private String clusterId;

    @JsonProperty("action")
    private ActionName action;

    @JsonProperty("params")
    @Builder.Default
    private Map<String, Object> params = new HashMap<>();

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;
}
