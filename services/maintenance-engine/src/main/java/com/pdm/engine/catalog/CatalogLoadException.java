package com.pdm.engine.catalog;

/**
 * A reference catalog resource could not be read or is inconsistent.
 */
public class CatalogLoadException extends RuntimeException {

    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
