package io.clusterengine.exceptions;

import io.clusterengine.enums.ErrorType;

/**
 * A name matched more than one entity.
 */
public class AmbiguousReferenceException extends EngineException {

    public AmbiguousReferenceException(String message) {
        super(ErrorType.AMBIGUOUS, message);
    }
}
