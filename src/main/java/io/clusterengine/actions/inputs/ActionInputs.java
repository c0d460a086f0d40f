package io.clusterengine.actions.inputs;

import com.fasterxml.jackson.core.type.TypeReference;
import io.clusterengine.models.Action;
import io.clusterengine.util.JsonUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Converts typed payloads to and from the generic input map persisted with an action.
 */
public final class ActionInputs {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private ActionInputs() {
        // Utility class
    }

    public static Map<String, Object> toMap(Object payload) {
        if (payload == null) {
            return new HashMap<>();
        }
        return JsonUtils.mapper().convertValue(payload, MAP_TYPE);
    }

    public static <T> T read(Action action, Class<T> payloadType) {
        Map<String, Object> inputs = action.getInputs() != null ? action.getInputs() : new HashMap<>();
        return JsonUtils.mapper().convertValue(inputs, payloadType);
    }
}
