package io.clusterengine.actions;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import io.clusterengine.models.Action;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * An action as shown to callers, with its dependents derived from the dependency graph.
 */
@Getter
@AllArgsConstructor
public class ActionDetail {

    @JsonUnwrapped
    private final Action action;

    @JsonProperty("depended_by")
    private final List<String> dependedBy;
}
