package io.clusterengine.exceptions;

import io.clusterengine.enums.ErrorType;

/**
 * Request conflicts with the current state of an entity.
 */
public class ConflictException extends EngineException {

    public ConflictException(String message) {
        super(ErrorType.CONFLICT, message);
    }
}
