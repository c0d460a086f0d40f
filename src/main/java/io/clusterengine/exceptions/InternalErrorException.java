package io.clusterengine.exceptions;

import io.clusterengine.enums.ErrorType;

public class InternalErrorException extends EngineException {

    public InternalErrorException(String message, Throwable cause) {
        super(ErrorType.INTERNAL_ERROR, message, cause);
    }
}
