package de.bsommerfeld.feedupdate.version;

import java.util.Optional;

/**
 * Process-local skip store. The choice is forgotten on restart.
 */
public class InMemorySkippedVersionStore implements SkippedVersionStore {

    private volatile String skipped;

    @Override
    public Optional<String> skippedVersion() {
        return Optional.ofNullable(skipped);
    }

    @Override
    public void skip(String version) {
        this.skipped = version;
    }

    @Override
    public void clear() {
        this.skipped = null;
    }
}
