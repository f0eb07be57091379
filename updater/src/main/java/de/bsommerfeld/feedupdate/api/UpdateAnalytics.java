package de.bsommerfeld.feedupdate.api;

import de.bsommerfeld.feedupdate.model.Feed;

/**
 * Records the user's choices during an update cycle, for hosts that track
 * how updates are adopted.
 */
public interface UpdateAnalytics {

    void downloadNowChosen(Feed feed);

    void continueWithInstallationChosen(Feed feed);

    void verificationFailed(Feed feed);
}
