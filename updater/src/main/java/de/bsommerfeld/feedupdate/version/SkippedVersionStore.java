package de.bsommerfeld.feedupdate.version;

import java.util.Optional;

/**
 * Remembers the release the user chose not to be reminded about. Only
 * background checks honor the skip; forced checks always offer.
 */
public interface SkippedVersionStore {

    Optional<String> skippedVersion();

    void skip(String version);

    void clear();
}
