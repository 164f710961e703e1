package com.wavegate.core.persistence;

/**
 * Unrecoverable failure of the underlying storage (I/O or SQL).
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
