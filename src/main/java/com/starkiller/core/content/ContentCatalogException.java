package com.starkiller.core.content;

/**
 * Thrown when the content catalog cannot be read or refers to content it does not define.
 */
public class ContentCatalogException extends RuntimeException {
    public ContentCatalogException(String message) {
        super(message);
    }

    public ContentCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
