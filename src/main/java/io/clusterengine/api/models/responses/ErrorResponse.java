package io.clusterengine.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.clusterengine.enums.ErrorType;
import io.clusterengine.exceptions.EngineException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body returned by every API operation: {@code {"error": {type, message, code}}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private ErrorDetail error;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ErrorDetail {
        private String type;
        private String message;
        private Integer code;
        // only filled in debug mode
        private String traceback;
    }

    public static ErrorResponse of(ErrorType type, String message) {
        return ErrorResponse.builder()
            .error(ErrorDetail.builder()
                .type(type.getValue())
                .message(message)
                .code(type.getStatus())
                .build())
            .build();
    }

    public static ErrorResponse from(EngineException e) {
        return of(e.getErrorType(), e.getMessage());
    }

    public static ErrorResponse internalError(String message) {
        return of(ErrorType.INTERNAL_ERROR, message);
    }
}
