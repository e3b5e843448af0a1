package com.hoa.retention.store;

/**
 * Thrown when a statement is rejected because its filter, identifiers or
 * assignments are malformed. Valid policies never produce this.
 */
public class ConstraintViolationException extends RecordStoreException {

    public ConstraintViolationException(String message) {
        super(message);
    }

    public ConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
