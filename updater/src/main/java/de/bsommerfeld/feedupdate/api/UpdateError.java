package de.bsommerfeld.feedupdate.api;

import de.bsommerfeld.feedupdate.download.FetchException;
import de.bsommerfeld.feedupdate.json.FeedParseException;

import java.util.concurrent.CompletionException;

/**
 * A failure inside the fetch-parse-decide span of a check. Such failures
 * are logged and absorbed; they never reach the caller of a check.
 *
 * @param kind    what went wrong
 * @param message short description for the log
 * @param cause   underlying exception
 */
public record UpdateError(Kind kind, String message, Throwable cause) {

    public enum Kind {
        /** Network, timeout or HTTP status failure. */
        FETCH,
        /** The feed payload was malformed. */
        PARSE,
        /** A bug or an unexpected runtime failure. */
        UNEXPECTED
    }

    /** Classifies {@code error}, looking through future wrappers. */
    public static UpdateError of(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        Kind kind;
        if (cause instanceof FetchException) {
            kind = Kind.FETCH;
        } else if (cause instanceof FeedParseException) {
            kind = Kind.PARSE;
        } else {
            kind = Kind.UNEXPECTED;
        }
        return new UpdateError(kind, String.valueOf(cause.getMessage()), cause);
    }
}
