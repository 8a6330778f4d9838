package com.holdco.tycoon.config;

/**
 * Exception thrown when static game data (sectors, events) cannot be loaded.
 */
public class CatalogException extends Exception {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
