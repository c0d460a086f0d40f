package io.clusterengine.exceptions;

import io.clusterengine.enums.ErrorType;

/**
 * Request failed validation.
 */
public class BadRequestException extends EngineException {

    public BadRequestException(String message) {
        super(ErrorType.BAD_REQUEST, message);
    }
}
