package de.bsommerfeld.feedupdate.api;

import de.bsommerfeld.feedupdate.model.Feed;
import de.bsommerfeld.feedupdate.version.UpdateCheckOutcome;

/**
 * What the fetch-parse-decide span of a check produced.
 */
sealed interface CheckResult permits CheckResult.Decided, CheckResult.Failed, CheckResult.Cancelled {

    record Decided(Feed feed, UpdateCheckOutcome outcome) implements CheckResult {
    }

    record Failed(UpdateError error) implements CheckResult {
    }

    record Cancelled() implements CheckResult {
    }
}
