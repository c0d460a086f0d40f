package io.clusterengine.actions;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import static io.clusterengine.config.Constants.ACTION_LOCATION_PREFIX;

/**
 * Handle returned for an accepted asynchronous request: the id of the created entity
 * (or of the action itself) and where to poll the action.
 */
@Getter
@AllArgsConstructor
public class ActionRef {

    @JsonProperty("id")
    private final String id;

    @JsonIgnore
    private final String actionId;

    public static ActionRef of(String actionId) {
        return new ActionRef(actionId, actionId);
    }

    @JsonProperty("location")
    public String getLocation() {
        return ACTION_LOCATION_PREFIX + actionId;
    }
}
