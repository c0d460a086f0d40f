package io.clusterengine.capacity;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of a size change: the capacity to reach and the bounds to persist with it.
 */
@Data
@AllArgsConstructor
public class CapacityDecision {
    private final int targetCapacity;
    private final int minSize;
    private final int maxSize;
}
