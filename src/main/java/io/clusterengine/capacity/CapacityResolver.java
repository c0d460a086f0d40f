package io.clusterengine.capacity;

import io.clusterengine.config.EngineConfig;
import io.clusterengine.enums.AdjustmentType;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.models.Cluster;
import lombok.extern.slf4j.Slf4j;

import static io.clusterengine.models.Cluster.UNBOUNDED;

/**
 * Reconciles a requested size change against the size constraints of a cluster.
 *
 * Pure: reads nothing and writes nothing. Checks run in a fixed order and the first
 * violation wins. Bound violations against the current desired capacity only fail
 * in strict mode; in non-strict mode the target is clamped into the effective bounds.
 */
@Slf4j
public class CapacityResolver {

    private final int maxNodesPerCluster;

    public CapacityResolver(EngineConfig config) {
        this.maxNodesPerCluster = config.getMaxNodesPerCluster();
    }

    public CapacityDecision resolve(Cluster cluster, CapacityRequest request) {
        return resolve(cluster.getDesiredCapacity(), cluster.getMinSize(), cluster.getMaxSize(), request);
    }

    public CapacityDecision resolve(int desired, int min, int max, CapacityRequest request) {
        Integer newMin = request.getMinSize();
        Integer newMax = request.getMaxSize();
        boolean strict = request.isStrict();

        validateBoundValues(newMin, newMax, request.getMinStep());
        checkMaxSizeQuota(newMax);

        // 1. new bounds must be consistent with each other
        if (newMin != null && newMax != null && newMax != UNBOUNDED && newMin > newMax) {
            throw new BadRequestException(String.format(
                    "The specified min_size (%d) is greater than the specified max_size (%d).", newMin, newMax));
        }

        // 2. effective bounds
        int effMin = newMin != null ? newMin : min;
        int effMax = newMax != null ? newMax : max;

        // 3-4. target from the adjustment, if any
        long target = desired;
        if (request.hasAdjustment()) {
            AdjustmentType type = parseAdjustment(request);
            target = calculateTarget(desired, type, request.getNumber(), request.getMinStep());
        }

        // 5. new bound against the opposite current bound
        if (newMin == null && newMax != null && newMax != UNBOUNDED && newMax < min) {
            throw new BadRequestException(String.format(
                    "The specified max_size (%d) is less than the current min_size (%d) of the cluster.", newMax, min));
        }
        if (newMax == null && newMin != null && max != UNBOUNDED && newMin > max) {
            throw new BadRequestException(String.format(
                    "The specified min_size (%d) is greater than the current max_size (%d) of the cluster.", newMin, max));
        }

        // 6. new bounds against the current desired capacity when it is not being changed
        if (!request.hasAdjustment() && strict) {
            if (newMax != null && newMax != UNBOUNDED && newMax < desired) {
                throw new BadRequestException(String.format(
                        "The specified max_size (%d) is less than the current desired_capacity (%d) of the cluster.",
                        newMax, desired));
            }
            if (newMin != null && newMin > desired) {
                throw new BadRequestException(String.format(
                        "The specified min_size (%d) is greater than the current desired_capacity (%d) of the cluster.",
                        newMin, desired));
            }
        }

        // 7. target against the node quota and the effective bounds
        int resolved = clamp(target, effMin, effMax, strict);

        log.debug("Resolved capacity: desired {} -> {}, bounds [{}, {}]", desired, resolved, effMin, effMax);
        return new CapacityDecision(resolved, effMin, effMax);
    }

    /**
     * Validates the size parameters of a cluster about to be created.
     */
    public void checkInitialSize(int desired, int min, int max) {
        if (desired < 0) {
            throw new BadRequestException(String.format("Invalid value '%d' specified for 'desired_capacity'", desired));
        }
        validateBoundValues(min, max, null);
        checkMaxSizeQuota(max);
        if (max != UNBOUNDED && min > max) {
            throw new BadRequestException(String.format(
                    "The specified min_size (%d) is greater than the specified max_size (%d).", min, max));
        }
        clamp(desired, min, max, true);
    }

    private void checkMaxSizeQuota(Integer newMax) {
        if (newMax != null && newMax != UNBOUNDED && newMax > maxNodesPerCluster) {
            throw new BadRequestException(String.format(
                    "The specified max_size (%d) is greater than the maximum number of nodes allowed per cluster (%d).",
                    newMax, maxNodesPerCluster));
        }
    }

    private int clamp(long target, int effMin, int effMax, boolean strict) {
        if (target > maxNodesPerCluster) {
            if (strict) {
                throw new BadRequestException(String.format(
                        "The target capacity (%d) is greater than the maximum number of nodes allowed per cluster (%d).",
                        target, maxNodesPerCluster));
            }
            target = maxNodesPerCluster;
        }
        if (target < effMin) {
            if (strict) {
                throw new BadRequestException(String.format(
                        "The target capacity (%d) is less than the cluster's min_size (%d).", target, effMin));
            }
            target = effMin;
        }
        if (effMax != UNBOUNDED && target > effMax) {
            if (strict) {
                throw new BadRequestException(String.format(
                        "The target capacity (%d) is greater than the cluster's max_size (%d).", target, effMax));
            }
            target = effMax;
        }
        return (int) target;
    }

    private AdjustmentType parseAdjustment(CapacityRequest request) {
        if (request.getAdjustmentType() != null && request.getNumber() == null) {
            throw new BadRequestException("Missing number value for size adjustment.");
        }
        if (request.getAdjustmentType() == null) {
            throw new BadRequestException("Missing adjustment_type value for size adjustment.");
        }
        AdjustmentType type = AdjustmentType.fromString(request.getAdjustmentType());
        if (type == null) {
            throw new BadRequestException(String.format(
                    "Invalid value '%s' specified for 'adjustment_type'", request.getAdjustmentType()));
        }
        return type;
    }

    private long calculateTarget(int desired, AdjustmentType type, double number, Integer minStep) {
        switch (type) {
            case EXACT_CAPACITY:
                if (number < 0 || number != Math.floor(number)) {
                    throw new BadRequestException(
                            "The 'number' must be positive integer for adjustment type 'EXACT_CAPACITY'.");
                }
                return toLong(number);
            case CHANGE_IN_CAPACITY:
                if (number != Math.floor(number)) {
                    throw new BadRequestException(
                            "The 'number' must be an integer for adjustment type 'CHANGE_IN_CAPACITY'.");
                }
                return desired + toLong(number);
            case CHANGE_IN_PERCENTAGE:
                return desired + percentageDelta(desired, number, minStep);
            default:
                throw new IllegalStateException("Unhandled adjustment type " + type);
        }
    }

    /**
     * Fractions of less than one node round away from zero; larger deltas truncate
     * toward zero. A configured min_step lifts the magnitude of the delta.
     */
    static long percentageDelta(int desired, double number, Integer minStep) {
        double delta = desired * number / 100.0;
        long rounded;
        if (Math.abs(delta) < 1.0) {
            rounded = delta > 0 ? 1 : (delta < 0 ? -1 : 0);
        } else {
            rounded = toLong(delta);
        }
        if (minStep != null && minStep > Math.abs(rounded)) {
            rounded = (long) Math.signum(number) * minStep;
        }
        return rounded;
    }

    // Saturates beyond the int range; any such target is outside every bound.
    private static long toLong(double value) {
        double limited = Math.max(Integer.MIN_VALUE * 2.0, Math.min(Integer.MAX_VALUE * 2.0, value));
        return (long) limited;
    }

    private static void validateBoundValues(Integer newMin, Integer newMax, Integer minStep) {
        if (newMin != null && newMin < 0) {
            throw new BadRequestException(String.format("Invalid value '%d' specified for 'min_size'", newMin));
        }
        if (newMax != null && newMax < UNBOUNDED) {
            throw new BadRequestException(String.format("Invalid value '%d' specified for 'max_size'", newMax));
        }
        if (minStep != null && minStep < 0) {
            throw new BadRequestException(String.format("Invalid value '%d' specified for 'min_step'", minStep));
        }
    }
}
