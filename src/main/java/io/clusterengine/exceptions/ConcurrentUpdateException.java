package io.clusterengine.exceptions;

/**
 * Raised by the store when a compare-and-swap update loses against a concurrent writer.
 */
public class ConcurrentUpdateException extends ConflictException {

    public ConcurrentUpdateException(String message) {
        super(message);
    }
}
