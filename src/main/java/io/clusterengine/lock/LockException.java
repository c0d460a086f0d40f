package io.clusterengine.lock;

/**
 * Raised when the lock backend cannot be reached or answers unexpectedly. Losing a
 * contention race is not an error and is reported as an empty result instead.
 */
public class LockException extends Exception {

    public LockException(String message) {
        super(message);
    }

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
