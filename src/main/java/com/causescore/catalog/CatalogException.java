package com.causescore.catalog;

/**
 * Catalog GraphQL call failed: transport error, timeout, or a GraphQL {@code errors} payload.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
