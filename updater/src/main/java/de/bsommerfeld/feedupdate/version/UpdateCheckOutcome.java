package de.bsommerfeld.feedupdate.version;

import de.bsommerfeld.feedupdate.model.Feed;

import java.util.Objects;

/**
 * Result of one update decision.
 *
 * <ul>
 * <li>{@link NoUpdate}: nothing to offer</li>
 * <li>{@link UpdateAvailable}: the feed offers a strictly newer release</li>
 * <li>{@link Forced}: a forced check re-offers the release the application
 * already runs</li>
 * </ul>
 */
public sealed interface UpdateCheckOutcome
        permits UpdateCheckOutcome.NoUpdate, UpdateCheckOutcome.UpdateAvailable, UpdateCheckOutcome.Forced {

    /** Whether the host should be offered the feed's release. */
    default boolean offersUpdate() {
        return !(this instanceof NoUpdate);
    }

    record NoUpdate() implements UpdateCheckOutcome {
    }

    record UpdateAvailable(Feed feed) implements UpdateCheckOutcome {
        public UpdateAvailable {
            Objects.requireNonNull(feed, "feed");
        }
    }

    record Forced(Feed feed) implements UpdateCheckOutcome {
        public Forced {
            Objects.requireNonNull(feed, "feed");
        }
    }
}
