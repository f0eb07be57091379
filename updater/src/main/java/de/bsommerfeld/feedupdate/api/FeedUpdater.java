package de.bsommerfeld.feedupdate.api;

import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.feedupdate.core.event.UpdateEventBus;
import de.bsommerfeld.feedupdate.download.ArtifactPaths;
import de.bsommerfeld.feedupdate.download.ContentFetcher;
import de.bsommerfeld.feedupdate.download.DownloadSession;
import de.bsommerfeld.feedupdate.json.FeedParser;
import de.bsommerfeld.feedupdate.model.AppIdentity;
import de.bsommerfeld.feedupdate.model.Feed;
import de.bsommerfeld.feedupdate.trust.TrustGate;
import de.bsommerfeld.feedupdate.trust.TrustVerdict;
import de.bsommerfeld.feedupdate.version.SkippedVersionStore;
import de.bsommerfeld.feedupdate.version.UpdateCheckOutcome;
import de.bsommerfeld.feedupdate.version.UpdateDecider;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Drives one update cycle from feed fetch to artifact hand-off.
 *
 * <h3>Pipeline</h3>
 * <pre>
 * 1. Fetch the feed                       (FETCHING)
 * 2. Parse it, post FeedAvailableEvent    (PARSED)
 * 3. Decide whether to offer it           (DECIDING)
 *      nothing to offer -> quiet, or "no updates" notice for forced checks
 * 4. Ask the host to confirm the offer    (UPDATE_OFFERED)
 * 5. Download to a fresh temp path,
 *    post ArtifactDownloadedEvent         (DOWNLOADING)
 * 6. Ask the host to continue, then
 *    check the signature                  (TRUST_GATING)
 * 7. Launch (READY) or delete (REJECTED)
 * </pre>
 *
 * <h3>Failure boundary</h3>
 * Steps 1 to 3 produce a {@link CheckResult}; fetch and parse failures
 * become {@link CheckResult.Failed}, are logged, and end the cycle silently.
 * Nothing from that span reaches the caller. Failures after the user
 * engaged (download failure, rejected signature) are reported to the
 * {@link UpdateHost} instead, because someone is waiting for an answer.
 *
 * <h3>Concurrency</h3>
 * At most one cycle runs per updater. A check requested while another is in
 * flight is logged and ignored. Each cycle is sequential: every stage starts
 * after the previous one completed, so no locking is needed inside it.
 * {@link #cancel()} aborts a feed fetch or artifact download in progress and
 * is honored at every other suspension point; a cancelled cycle deletes
 * whatever it downloaded and ends without notifying the host.
 *
 * <h3>Ownership</h3>
 * The downloaded artifact belongs to the cycle. It leaves the cycle only
 * through {@link UpdateHost#launchArtifact}; every other ending deletes it.
 */
@Singleton
public class FeedUpdater {

    /** Binding name of the executor that runs check cycles and signature checks. */
    public static final String WORKER_EXECUTOR = "feedupdate.worker";

    private static final Logger LOG = LoggerFactory.getLogger(FeedUpdater.class);

    private final AppIdentity identity;
    private final ContentFetcher fetcher;
    private final FeedParser parser;
    private final UpdateDecider decider;
    private final TrustGate trustGate;
    private final SkippedVersionStore skippedVersions;
    private final UpdateHost host;
    private final UpdateAnalytics analytics;
    private final UpdateDiagnostics diagnostics;
    private final UpdateEventBus eventBus;
    private final ArtifactPaths artifactPaths;
    private final Executor executor;

    private final AtomicBoolean inFlight = new AtomicBoolean();
    private volatile CheckState state = CheckState.IDLE;
    private volatile boolean cancelRequested;
    private volatile DownloadSession activeSession;
    private volatile CompletableFuture<?> activeTransfer;

    @Inject
    public FeedUpdater(AppIdentity identity, ContentFetcher fetcher, FeedParser parser, UpdateDecider decider,
            TrustGate trustGate, SkippedVersionStore skippedVersions, UpdateHost host, UpdateAnalytics analytics,
            UpdateDiagnostics diagnostics, UpdateEventBus eventBus, ArtifactPaths artifactPaths,
            @Named(WORKER_EXECUTOR) Executor executor) {
        this.identity = identity;
        this.fetcher = fetcher;
        this.parser = parser;
        this.decider = decider;
        this.trustGate = trustGate;
        this.skippedVersions = skippedVersions;
        this.host = host;
        this.analytics = analytics;
        this.diagnostics = diagnostics;
        this.eventBus = eventBus;
        this.artifactPaths = artifactPaths;
        this.executor = executor;
    }

    // =====================================================================
    // Entry points
    // =====================================================================

    /** Checks the configured feed without user-visible feedback when up to date. */
    public CompletableFuture<CheckState> checkInBackground() {
        return checkInBackground(null, false);
    }

    /**
     * Starts a background check and returns immediately.
     *
     * @param feedUrlOverride feed to poll instead of the configured one, or
     *                        {@code null}
     * @param showDiagnostics ask the host to show its diagnostics view
     * @return the state the cycle ended in; never completes exceptionally
     */
    public CompletableFuture<CheckState> checkInBackground(String feedUrlOverride, boolean showDiagnostics) {
        return start(feedUrlOverride, showDiagnostics, false);
    }

    /** User-initiated check; always ends with an offer or a "no updates" notice. */
    public CompletableFuture<CheckState> forceCheckInBackground() {
        return forceCheckInBackground(null, false);
    }

    /**
     * Like {@link #checkInBackground(String, boolean)}, but re-offers the
     * running version and ignores a skipped version.
     */
    public CompletableFuture<CheckState> forceCheckInBackground(String feedUrlOverride, boolean showDiagnostics) {
        return start(feedUrlOverride, showDiagnostics, true);
    }

    /**
     * Requests cancellation of the running cycle.
     *
     * @return {@code true} if a cycle was running
     */
    public boolean cancel() {
        if (!inFlight.get())
            return false;
        LOG.info("Cancellation of the running update check requested");
        cancelRequested = true;
        CompletableFuture<?> transfer = activeTransfer;
        if (transfer != null) {
            transfer.cancel(true);
        }
        return true;
    }

    /** Remembers the user's wish not to be offered this release again by background checks. */
    public void skipVersion(Feed feed) {
        skippedVersions.skip(feed.version());
    }

    public CheckState state() {
        return state;
    }

    public boolean isChecking() {
        return inFlight.get();
    }

    // =====================================================================
    // Cycle
    // =====================================================================

    private CompletableFuture<CheckState> start(String feedUrlOverride, boolean showDiagnostics, boolean force) {
        if (!inFlight.compareAndSet(false, true)) {
            LOG.warn("Update check already in progress, ignoring {} check request", force ? "forced" : "background");
            return CompletableFuture.completedFuture(CheckState.IDLE);
        }
        cancelRequested = false;
        activeSession = null;
        activeTransfer = null;
        String feedUrl = feedUrlOverride != null ? feedUrlOverride : identity.feedUrl();

        if (showDiagnostics) {
            notifyHost("show diagnostics", host::showDiagnostics);
        }

        CompletableFuture<CheckState> cycle;
        try {
            cycle = CompletableFuture.supplyAsync(() -> feedUrl, executor)
                    .thenCompose(url -> fetchAndDecide(url, force))
                    .thenCompose(result -> act(result, force));
        } catch (RuntimeException e) {
            // executor rejected the task
            cycle = CompletableFuture.failedFuture(e);
        }

        return cycle.handle((terminal, error) -> {
            if (error != null) {
                LOG.error("Update check ended with an unexpected failure", error);
            }
            return finish(error == null ? terminal : CheckState.IDLE);
        });
    }

    private CheckState finish(CheckState terminal) {
        DownloadSession session = activeSession;
        if (session != null && terminal != CheckState.READY) {
            session.deleteArtifact();
        }
        activeSession = null;
        activeTransfer = null;
        transition(CheckState.IDLE);
        inFlight.set(false);
        LOG.debug("Update check finished in state {}", terminal);
        return terminal;
    }

    /**
     * Fetch, parse and decide. Every failure in this span is turned into a
     * {@link CheckResult.Failed} value here; nothing is thrown past it.
     */
    private CompletableFuture<CheckResult> fetchAndDecide(String feedUrl, boolean force) {
        transition(CheckState.FETCHING);
        diagnostics.log("Starting fetching remote feed content from address: " + feedUrl);

        return track(callSafely(() -> fetcher.fetchText(feedUrl)))
                .handle((content, error) -> {
                    if (cancelRequested) {
                        return (CheckResult) new CheckResult.Cancelled();
                    }
                    if (error != null) {
                        return new CheckResult.Failed(UpdateError.of(error));
                    }
                    try {
                        return parseAndDecide(content, force);
                    } catch (RuntimeException e) {
                        // FeedParseException classifies as PARSE, anything else as UNEXPECTED
                        return new CheckResult.Failed(UpdateError.of(e));
                    }
                })
                .whenComplete((result, error) -> diagnostics.log("Finished fetching remote feed content"));
    }

    private CheckResult parseAndDecide(String content, boolean force) {
        diagnostics.log("Started deserializing remote feed content");
        Feed feed = parser.parse(content);
        transition(CheckState.PARSED);
        diagnostics.log("Finished deserializing remote feed content");

        eventBus.post(new UpdateEvents.FeedAvailableEvent(feed));

        transition(CheckState.DECIDING);
        UpdateCheckOutcome outcome = decider.decide(feed, identity.currentVersion(), force);
        LOG.info("Feed offers {}, running {}: {}", feed.version(), identity.currentVersion(),
                outcome.getClass().getSimpleName());
        return new CheckResult.Decided(feed, outcome);
    }

    private CompletableFuture<CheckState> act(CheckResult result, boolean force) {
        if (result instanceof CheckResult.Failed) {
            UpdateError error = ((CheckResult.Failed) result).error();
            if (error.kind() == UpdateError.Kind.UNEXPECTED) {
                LOG.error("Update check failed unexpectedly: {}", error.message(), error.cause());
            } else {
                LOG.warn("Update check aborted ({}): {}", error.kind(), error.message());
            }
            diagnostics.log("Error checking remote feed: " + error.message());
            return done(CheckState.IDLE);
        }
        if (result instanceof CheckResult.Cancelled) {
            return done(CheckState.IDLE);
        }

        CheckResult.Decided decided = (CheckResult.Decided) result;
        Feed feed = decided.feed();
        if (!decided.outcome().offersUpdate()) {
            if (force) {
                transition(CheckState.NO_UPDATE_REPORTED);
                notifyHost("show no updates", host::showNoUpdates);
                return done(CheckState.NO_UPDATE_REPORTED);
            }
            return done(CheckState.IDLE);
        }

        transition(CheckState.UPDATE_OFFERED);
        return askHost(() -> host.confirmUpdate(feed)).thenCompose(confirmed -> {
            if (!confirmed) {
                diagnostics.log("Update to " + feed.version() + " declined");
                return done(CheckState.IDLE);
            }
            analytics.downloadNowChosen(feed);
            diagnostics.log("Continuing with downloading the artifact");
            return download(feed);
        });
    }

    private CompletableFuture<CheckState> download(Feed feed) {
        if (cancelRequested) {
            return done(CheckState.IDLE);
        }
        DownloadSession session;
        try {
            session = DownloadSession.start(feed.artifactUrl(), artifactPaths);
        } catch (IllegalArgumentException e) {
            LOG.error("Feed artifact URL is invalid: {}", feed.artifactUrl());
            notifyHost("show download failure", () -> host.showDownloadFailure(feed, e));
            return done(CheckState.IDLE);
        }
        activeSession = session;
        Path artifact = session.localPath();

        transition(CheckState.DOWNLOADING);
        diagnostics.log("Downloading artifact from " + feed.artifactUrl() + " to " + artifact);

        return track(callSafely(() -> fetcher.fetchBinary(feed.artifactUrl(), artifact,
                (read, total) -> notifyHost("report download progress",
                        () -> host.onDownloadProgress(feed, read, total)))))
                .handle((ignored, error) -> error)
                .thenCompose(error -> {
                    if (error != null && cancelRequested) {
                        session.markFailed();
                        session.deleteArtifact();
                        diagnostics.log("Download cancelled");
                        return done(CheckState.IDLE);
                    }
                    if (error != null) {
                        session.markFailed();
                        session.deleteArtifact();
                        Throwable cause = unwrap(error);
                        LOG.error("Download of {} failed: {}", feed.artifactUrl(), cause.getMessage());
                        notifyHost("show download failure", () -> host.showDownloadFailure(feed, cause));
                        return done(CheckState.IDLE);
                    }
                    session.markCompleted();
                    diagnostics.log("Finished downloading artifact");
                    if (cancelRequested) {
                        return done(CheckState.IDLE);
                    }
                    eventBus.post(new UpdateEvents.ArtifactDownloadedEvent(artifact));
                    return confirmInstallation(feed, session);
                });
    }

    private CompletableFuture<CheckState> confirmInstallation(Feed feed, DownloadSession session) {
        return askHost(() -> host.confirmInstallation(feed, session.localPath())).thenCompose(confirmed -> {
            if (!confirmed) {
                diagnostics.log("Installation declined, removing downloaded artifact");
                return done(CheckState.IDLE);
            }
            diagnostics.log("Continue after downloading artifact");
            analytics.continueWithInstallationChosen(feed);
            if (cancelRequested) {
                return done(CheckState.IDLE);
            }
            return verifyAndHandOff(feed, session);
        });
    }

    private CompletableFuture<CheckState> verifyAndHandOff(Feed feed, DownloadSession session) {
        transition(CheckState.TRUST_GATING);
        Path artifact = session.localPath();
        if (feed.signatureIfPresent().isPresent()) {
            diagnostics.log("Signature provided. Verifying artifact's signature");
        }

        return CompletableFuture.supplyAsync(
                () -> trustGate.verify(feed.signatureIfPresent(), artifact, identity.publicKeyPath()), executor)
                .thenApply(verdict -> {
                    if (!verdict.allowsExecution()) {
                        return reject(feed, session);
                    }
                    if (verdict == TrustVerdict.NO_SIGNATURE_PRESENT) {
                        LOG.warn("Feed for {} carries no signature, launching {} unverified",
                                feed.version(), artifact.getFileName());
                        diagnostics.log("No signature provided. Skipping signature verification");
                    } else {
                        diagnostics.log("Successfully verified artifact's signature");
                    }
                    if (cancelRequested) {
                        return CheckState.IDLE;
                    }
                    transition(CheckState.READY);
                    notifyHost("launch artifact", () -> host.launchArtifact(feed, artifact));
                    diagnostics.log("Opened artifact");
                    return CheckState.READY;
                });
    }

    private CheckState reject(Feed feed, DownloadSession session) {
        transition(CheckState.REJECTED);
        LOG.error("Signature verification failed for {}, deleting {}", feed.version(), session.localPath());
        diagnostics.log("Couldn't verify artifact's signature. The artifact will now be deleted.");
        session.deleteArtifact();
        analytics.verificationFailed(feed);
        notifyHost("show verification failure", () -> host.showVerificationFailure(feed));
        return CheckState.REJECTED;
    }

    // =====================================================================
    // Utilities
    // =====================================================================

    private void transition(CheckState next) {
        CheckState previous = state;
        state = next;
        LOG.debug("Update check state: {} -> {}", previous, next);
    }

    /** Makes {@code transfer} the one {@link #cancel()} aborts. */
    private <T> CompletableFuture<T> track(CompletableFuture<T> transfer) {
        activeTransfer = transfer;
        if (cancelRequested) {
            transfer.cancel(true);
        }
        return transfer;
    }

    private static CompletableFuture<CheckState> done(CheckState terminal) {
        return CompletableFuture.completedFuture(terminal);
    }

    /**
     * Invokes a future-returning collaborator, turning a synchronous throw or
     * a {@code null} future into a failed future.
     */
    private static <T> CompletableFuture<T> callSafely(Supplier<CompletableFuture<T>> call) {
        try {
            CompletableFuture<T> future = call.get();
            return future != null
                    ? future
                    : CompletableFuture.failedFuture(new IllegalStateException("Collaborator returned no future"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /** Asks the host a yes/no question; anything but an explicit yes is a no. */
    private static CompletableFuture<Boolean> askHost(Supplier<CompletableFuture<Boolean>> question) {
        return callSafely(question).handle((answer, error) -> {
            if (error != null) {
                LOG.warn("Host confirmation failed, treating as declined", unwrap(error));
                return false;
            }
            return Boolean.TRUE.equals(answer);
        });
    }

    private static void notifyHost(String action, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.error("Host failed to {}", action, e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
