package com.arqsz.skillsense.scanner;

/**
 * Thrown when a built-in rule definition is invalid. Raised while the catalog
 * initializes, so a broken catalog fails the process at startup instead of at scan time.
 */
public class RuleCatalogException extends RuntimeException {

    public RuleCatalogException(String message) {
        super(message);
    }

    public RuleCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
