package de.bsommerfeld.feedupdate.version;

import com.google.inject.Singleton;
import de.bsommerfeld.feedupdate.model.Feed;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a fetched feed should be offered to the user.
 *
 * <h3>Rules</h3>
 * <pre>
 * feed &gt; current                      -> UpdateAvailable (unless skipped on a normal check)
 * feed == current and forced           -> Forced
 * feed &lt; current, or unparsable feed   -> NoUpdate, forced or not
 * </pre>
 *
 * <p>
 * An unparsable feed version is never treated as newer: the updater cannot
 * prove it is not a downgrade, so it offers nothing and logs the rejected
 * value.
 *
 * <p>
 * The decision is a pure function of the feed, the current version, the
 * force flag and the skip store's current answer.
 */
@Singleton
public class UpdateDecider {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateDecider.class);

    private final SkippedVersionStore skippedVersions;

    /** Creates a decider that never skips a release. */
    public UpdateDecider() {
        this(new InMemorySkippedVersionStore());
    }

    @Inject
    public UpdateDecider(SkippedVersionStore skippedVersions) {
        this.skippedVersions = Objects.requireNonNull(skippedVersions, "skippedVersions");
    }

    public UpdateCheckOutcome decide(Feed feed, SemanticVersion currentVersion, boolean forceCheck) {
        Optional<SemanticVersion> offered = SemanticVersion.tryParse(feed.version());
        if (offered.isEmpty()) {
            LOG.warn("Feed version '{}' is not a semantic version, not offering it", feed.version());
            return new UpdateCheckOutcome.NoUpdate();
        }

        int comparison = offered.get().compareTo(currentVersion);
        if (comparison > 0) {
            if (!forceCheck && isSkipped(offered.get())) {
                LOG.info("Version {} was skipped by the user", offered.get());
                return new UpdateCheckOutcome.NoUpdate();
            }
            return new UpdateCheckOutcome.UpdateAvailable(feed);
        }
        if (comparison == 0 && forceCheck) {
            return new UpdateCheckOutcome.Forced(feed);
        }
        return new UpdateCheckOutcome.NoUpdate();
    }

    public boolean shouldUpdate(Feed feed, SemanticVersion currentVersion, boolean forceCheck) {
        return decide(feed, currentVersion, forceCheck).offersUpdate();
    }

    private boolean isSkipped(SemanticVersion offered) {
        return skippedVersions.skippedVersion()
                .flatMap(SemanticVersion::tryParse)
                .map(offered::equals)
                .orElse(false);
    }
}
