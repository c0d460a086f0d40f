package io.clusterengine.exceptions;

import io.clusterengine.enums.ErrorType;
import lombok.Getter;

/**
 * Base class of every error the engine reports to callers. Carries the error category
 * that the API layer maps to an HTTP status.
 */
@Getter
public class EngineException extends RuntimeException {

    private final ErrorType errorType;

    public EngineException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public EngineException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }
}
