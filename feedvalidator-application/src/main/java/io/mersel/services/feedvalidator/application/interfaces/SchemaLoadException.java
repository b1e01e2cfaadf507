package io.mersel.services.feedvalidator.application.interfaces;

/**
 * Thrown when the XSD cannot be read, parsed or compiled.
 * <p>
 * Fatal for the whole validation run.
 */
public class SchemaLoadException extends Exception {

    public SchemaLoadException(String message) {
        super(message);
    }

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
