package io.clusterengine.capacity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A requested size change, also persisted as the inputs of CLUSTER_RESIZE.
 * Every field is optional; strict defaults to true.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CapacityRequest {
    // raw so that unknown values can be reported back verbatim
    private String adjustmentType;
    private Double number;
    private Integer minSize;
    private Integer maxSize;
    private Integer minStep;
    @Builder.Default
    private boolean strict = true;

    public boolean hasAdjustment() {
        return adjustmentType != null || number != null;
    }
}
