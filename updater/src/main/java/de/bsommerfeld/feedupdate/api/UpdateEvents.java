package de.bsommerfeld.feedupdate.api;

import de.bsommerfeld.feedupdate.model.Feed;

import java.nio.file.Path;

/**
 * Notifications posted on the {@code UpdateEventBus}. Subscribe with Guava's
 * {@code @Subscribe}.
 */
public final class UpdateEvents {

    private UpdateEvents() {
    }

    /**
     * A feed was fetched and parsed. Posted for every successfully parsed
     * feed, before deciding whether to offer it.
     */
    public record FeedAvailableEvent(Feed feed) {
    }

    /**
     * An artifact finished downloading. Posted before the artifact is
     * verified, so the file is not yet trusted.
     */
    public record ArtifactDownloadedEvent(Path artifact) {
    }
}
