package io.clusterengine.policies.enforcement;

import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.util.JsonUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Reads typed policy specs out of the free-form spec map stored with a policy.
 */
final class PolicySpecs {

    private PolicySpecs() {
        // Utility class
    }

    static <T> T read(Map<String, Object> spec, Class<T> specType, String policyType) {
        try {
            return JsonUtils.mapper().convertValue(spec != null ? spec : new HashMap<>(), specType);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(String.format("Invalid spec for policy type '%s': %s",
                    policyType, e.getMessage()));
        }
    }
}
