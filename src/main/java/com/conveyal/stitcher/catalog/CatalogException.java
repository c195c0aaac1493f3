package com.conveyal.stitcher.catalog;

/**
 * Thrown when the work catalog cannot be created, read or updated.
 * During startup this is fatal: the coordinator has nothing to dispatch without its catalog.
 */
public class CatalogException extends RuntimeException {

    public CatalogException (String message) {
        super(message);
    }

    public CatalogException (String message, Exception ex) {
        super(message, ex);
    }

}
