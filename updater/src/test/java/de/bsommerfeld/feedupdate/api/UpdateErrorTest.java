package de.bsommerfeld.feedupdate.api;

import de.bsommerfeld.feedupdate.download.FetchException;
import de.bsommerfeld.feedupdate.json.FeedParseException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class UpdateErrorTest {

    @Test
    void of_shouldClassifyFetchFailures() {
        var error = UpdateError.of(FetchException.httpStatus("https://x/feed.json", 503));
        assertEquals(UpdateError.Kind.FETCH, error.kind());
        assertTrue(error.message().contains("503"));
    }

    @Test
    void of_shouldLookThroughCompletionWrappers() {
        var cause = new FeedParseException("Malformed feed");
        var error = UpdateError.of(new CompletionException(new CompletionException(cause)));
        assertEquals(UpdateError.Kind.PARSE, error.kind());
        assertSame(cause, error.cause());
    }

    @Test
    void of_shouldTreatAnythingElseAsUnexpected() {
        assertEquals(UpdateError.Kind.UNEXPECTED, UpdateError.of(new NullPointerException()).kind());
        assertEquals("null", UpdateError.of(new NullPointerException()).message());
    }
}
