package com.hoa.retention.store;

/**
 * Thrown when the backing store cannot be reached (connection or transport failure).
 */
public class StoreUnavailableException extends RecordStoreException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
