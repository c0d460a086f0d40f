package io.clusterengine.exceptions;

import io.clusterengine.enums.ErrorType;

/**
 * Referenced entity does not exist.
 */
public class ResourceNotFoundException extends EngineException {

    public ResourceNotFoundException(String message) {
        super(ErrorType.NOT_FOUND, message);
    }
}
