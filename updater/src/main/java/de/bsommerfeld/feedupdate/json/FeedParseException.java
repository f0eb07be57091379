package de.bsommerfeld.feedupdate.json;

/**
 * Thrown when a feed payload cannot be parsed into a {@code Feed}.
 */
public class FeedParseException extends RuntimeException {

    public FeedParseException(String message) {
        super(message);
    }

    public FeedParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
