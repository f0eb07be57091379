package de.bsommerfeld.feedupdate.api;

import de.bsommerfeld.feedupdate.model.Feed;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * The embedding application's side of an update cycle: dialogs, progress
 * display and launching the verified artifact.
 *
 * <p>
 * Confirmation methods are asynchronous so the host can answer from its UI
 * thread whenever the user decides. A {@code false} answer, an exceptional
 * completion or a {@code null} future all count as "declined".
 *
 * <p>
 * Callbacks may arrive on any thread; hosts with a single UI thread must
 * marshal them themselves.
 */
public interface UpdateHost {

    /** Offers the feed's release to the user. Completes with {@code true} to download it. */
    CompletableFuture<Boolean> confirmUpdate(Feed feed);

    /**
     * Called once the artifact is fully downloaded. Completes with
     * {@code true} to verify and launch it.
     */
    CompletableFuture<Boolean> confirmInstallation(Feed feed, Path artifact);

    /** A forced check found nothing newer. */
    void showNoUpdates();

    /** The artifact's signature did not verify; it has already been deleted. */
    void showVerificationFailure(Feed feed);

    /** The user-confirmed download failed; no artifact remains on disk. */
    void showDownloadFailure(Feed feed, Throwable cause);

    /** Hands the verified artifact over for execution. */
    void launchArtifact(Feed feed, Path artifact);

    /** Requested by checks started with {@code showDiagnostics = true}. */
    default void showDiagnostics() {
    }

    default void onDownloadProgress(Feed feed, long bytesRead, long totalBytes) {
    }
}
