package com.wakecycle.tools.backend.store;

/**
 * Raised when a document cannot be written. The previous version of the document stays in place.
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
