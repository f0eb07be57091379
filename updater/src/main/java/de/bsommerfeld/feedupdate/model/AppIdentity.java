package de.bsommerfeld.feedupdate.model;

import de.bsommerfeld.feedupdate.core.config.UpdaterConfig;
import de.bsommerfeld.feedupdate.version.SemanticVersion;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * What the updater knows about the running application. Supplied once by the
 * host and immutable for the lifetime of the process.
 *
 * @param currentVersion version of the running application
 * @param feedUrl        default feed location polled by background checks
 * @param publicKeyPath  locally bundled key used to verify artifact signatures
 */
public record AppIdentity(SemanticVersion currentVersion, String feedUrl, Path publicKeyPath) {

    public AppIdentity {
        Objects.requireNonNull(currentVersion, "currentVersion");
        Objects.requireNonNull(feedUrl, "feedUrl");
        Objects.requireNonNull(publicKeyPath, "publicKeyPath");
    }

    /**
     * @throws IllegalArgumentException if {@code currentVersion} is not a
     *                                  valid semantic version
     */
    public static AppIdentity of(String currentVersion, String feedUrl, Path publicKeyPath) {
        return new AppIdentity(SemanticVersion.parse(currentVersion), feedUrl, publicKeyPath);
    }

    /**
     * Builds the identity from the loaded configuration and the version the
     * host application was built with.
     *
     * @throws IllegalArgumentException if {@code currentVersion} is invalid or
     *                                  the configuration lacks a feed URL
     */
    public static AppIdentity of(UpdaterConfig config, String currentVersion) {
        if (config.getFeedUrl() == null || config.getFeedUrl().isBlank()) {
            throw new IllegalArgumentException("Updater configuration has no feed-url");
        }
        return of(currentVersion, config.getFeedUrl(), Paths.get(config.getPublicKeyPath()));
    }
}
