package io.mersel.services.feedvalidator.application.interfaces;

/**
 * Thrown when the election feed cannot be read or is not well formed XML.
 * <p>
 * Fatal for the whole validation run.
 */
public class FeedLoadException extends Exception {

    public FeedLoadException(String message) {
        super(message);
    }

    public FeedLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
