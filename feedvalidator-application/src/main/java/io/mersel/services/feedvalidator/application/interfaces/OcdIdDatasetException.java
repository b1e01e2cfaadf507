package io.mersel.services.feedvalidator.application.interfaces;

/**
 * Thrown when an OCD-ID catalogue cannot be fetched, verified or read.
 * <p>
 * Only the rules depending on the catalogue fail; the rest of the run continues.
 */
public class OcdIdDatasetException extends Exception {

    public OcdIdDatasetException(String message) {
        super(message);
    }

    public OcdIdDatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
