package com.signal.corroboration.source;

/**
 * Thrown when a source catalog or seed list cannot be read or is malformed.
 */
public class CatalogLoadException extends RuntimeException {

    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
