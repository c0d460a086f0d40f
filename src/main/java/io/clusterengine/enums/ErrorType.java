package io.clusterengine.enums;

/**
 * Error categories surfaced to callers, with the HTTP status each one maps to.
 */
public enum ErrorType {
    NOT_FOUND("ResourceNotFound", 404),
    AMBIGUOUS("MultipleChoices", 400),
    BAD_REQUEST("BadRequest", 400),
    CONFLICT("Conflict", 409),
    INTERNAL_ERROR("InternalError", 500);

    private final String value;
    private final int status;

    ErrorType(String value, int status) {
        this.value = value;
        this.status = status;
    }

    public String getValue() {
        return value;
    }

    public int getStatus() {
        return status;
    }
}
