package de.bsommerfeld.feedupdate.api;

import de.bsommerfeld.feedupdate.model.Feed;

/** Default analytics sink that records nothing. */
public class NoOpUpdateAnalytics implements UpdateAnalytics {

    @Override
    public void downloadNowChosen(Feed feed) {
    }

    @Override
    public void continueWithInstallationChosen(Feed feed) {
    }

    @Override
    public void verificationFailed(Feed feed) {
    }
}
