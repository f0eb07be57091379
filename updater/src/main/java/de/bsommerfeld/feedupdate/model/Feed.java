package de.bsommerfeld.feedupdate.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A release descriptor fetched from the remote feed.
 *
 * <p>
 * The typed fields cover what the updater understands today. Every top-level
 * key of the raw document, typed or not, is also kept in
 * {@link #extensionFields()} so fields introduced by newer feed producers
 * survive a round trip through older clients.
 *
 * @param version         semantic version string of the offered release
 * @param artifactUrl     where the release artifact can be downloaded
 * @param signature       Base64 signature over the artifact, or {@code null}
 *                        when the feed ships unsigned releases
 * @param title           optional human readable release title
 * @param releaseNotesUrl optional link to release notes
 * @param publishedDate   optional publication date, passed through verbatim
 * @param extensionFields raw key/value view of the whole document, in
 *                        document order
 */
public record Feed(String version, String artifactUrl, String signature, String title,
        String releaseNotesUrl, String publishedDate, Map<String, Object> extensionFields) {

    public Feed {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(artifactUrl, "artifactUrl");
        if (signature != null && signature.isBlank()) {
            signature = null;
        }
        extensionFields = extensionFields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extensionFields));
    }

    /** Creates a feed with only the fields the update pipeline needs. */
    public static Feed of(String version, String artifactUrl, String signature) {
        return new Feed(version, artifactUrl, signature, null, null, null, null);
    }

    public Optional<String> signatureIfPresent() {
        return Optional.ofNullable(signature);
    }

    public Optional<String> titleIfPresent() {
        return Optional.ofNullable(title);
    }

    public Optional<String> releaseNotesUrlIfPresent() {
        return Optional.ofNullable(releaseNotesUrl);
    }

    /** Returns the raw value of any top-level feed field, known to the model or not. */
    public Optional<Object> extensionField(String key) {
        return Optional.ofNullable(extensionFields.get(key));
    }

    @Override
    public String toString() {
        return "Feed[version=" + version + ", artifactUrl=" + artifactUrl
                + ", signed=" + (signature != null) + ", fields=" + extensionFields.keySet() + "]";
    }
}
