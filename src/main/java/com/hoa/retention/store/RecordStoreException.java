package com.hoa.retention.store;

/**
 * Base runtime exception for failures reported by a {@link RecordStore}.
 * Retention components catch this type at policy and store granularity.
 */
public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
