package de.bsommerfeld.feedupdate.download;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Retrieves feed documents and release artifacts.
 *
 * <p>
 * Both operations are asynchronous: they return immediately and complete
 * the future once the transfer finished. Transport problems complete the
 * future exceptionally with a {@link FetchException}, never with a raw
 * transport exception.
 *
 * <p>
 * {@link #fetchBinary} must never leave a partial file at
 * {@code destination}: the file either holds the complete body or does not
 * exist.
 */
public interface ContentFetcher {

    CompletableFuture<String> fetchText(String url);

    CompletableFuture<Void> fetchBinary(String url, Path destination, DownloadProgressListener listener);

    default CompletableFuture<Void> fetchBinary(String url, Path destination) {
        return fetchBinary(url, destination, DownloadProgressListener.NONE);
    }
}
