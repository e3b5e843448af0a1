package com.hoa.retention.store;

/**
 * Thrown when the store fails while executing a batch statement.
 * The statement is treated as having had no effect for the caller's accounting.
 */
public class PartialBatchFailureException extends RecordStoreException {

    public PartialBatchFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
