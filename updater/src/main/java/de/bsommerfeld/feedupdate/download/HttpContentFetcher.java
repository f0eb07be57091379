package de.bsommerfeld.feedupdate.download;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Singleton;
import de.bsommerfeld.feedupdate.core.config.UpdaterConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ContentFetcher} built on the JDK {@link HttpClient}.
 *
 * <p>
 * All requests go through {@link HttpClient#sendAsync}, so no caller thread
 * blocks while bytes are in flight. The shared client follows redirects,
 * which release hosts commonly use to hand off to a CDN.
 *
 * <h3>Binary downloads</h3>
 * The body streams into a {@code .part} sibling of the destination and is
 * atomically renamed once complete. When the server announced a
 * Content-Length, a shorter body is rejected as incomplete. A body that
 * delivers no bytes for longer than the request timeout is abandoned as
 * stalled. Any failure deletes the {@code .part} file, so callers never
 * observe half-written artifacts.
 *
 * <p>
 * Cancelling a returned future aborts the underlying exchange.
 */
@Singleton
public class HttpContentFetcher implements ContentFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpContentFetcher.class);

    private static final ScheduledExecutorService WATCHDOG = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("feedupdate-download-watchdog-%d").setDaemon(true).build());
    private static final long MIN_IDLE_CHECK_MILLIS = 10;

    private final HttpClient http;
    private final Duration requestTimeout;
    private final String userAgent;

    @Inject
    public HttpContentFetcher(UpdaterConfig config) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.connectTimeout())
                .build(),
                config.requestTimeout(),
                config.getUserAgent());
    }

    public HttpContentFetcher(HttpClient http, Duration requestTimeout, String userAgent) {
        this.http = http;
        this.requestTimeout = requestTimeout;
        this.userAgent = userAgent;
    }

    /**
     * Downloads a URL as a UTF-8 string. The whole exchange, body included,
     * must finish within the request timeout since feeds are small.
     */
    @Override
    public CompletableFuture<String> fetchText(String url) {
        CompletableFuture<HttpResponse<byte[]>> exchange;
        try {
            exchange = http.sendAsync(request(url), HttpResponse.BodyHandlers.ofByteArray());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new FetchException(url, "Invalid URL: " + url, e));
        }
        CompletableFuture<String> body = exchange.orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(response -> {
                    validateStatus(response.statusCode(), url);
                    return new String(response.body(), StandardCharsets.UTF_8);
                });
        CompletableFuture<String> result = translate(body, url);
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    @Override
    public CompletableFuture<Void> fetchBinary(String url, Path destination, DownloadProgressListener listener) {
        Path part = destination.resolveSibling(destination.getFileName() + ".part");
        CompletableFuture<HttpResponse<Path>> exchange;
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            exchange = http.sendAsync(request(url),
                    responseInfo -> bodyHandler(responseInfo, part, listener, requestTimeout));
        } catch (IOException | RuntimeException e) {
            return CompletableFuture.failedFuture(new FetchException(url, "Cannot start download of " + url, e));
        }

        CompletableFuture<Void> completed = exchange.thenApply(response -> {
            validateStatus(response.statusCode(), url);
            moveIntoPlace(part, destination, url);
            LOG.debug("Downloaded {} to {}", url, destination);
            return (Void) null;
        });

        // the part file is gone before callers observe a failure
        CompletableFuture<Void> result = translate(completed, url, () -> deleteQuietly(part));
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
                deleteQuietly(part);
            }
        });
        return result;
    }

    // =====================================================================
    // Internals
    // =====================================================================

    private HttpRequest request(String url) {
        return HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("User-Agent", userAgent)
                .GET()
                .build();
    }

    /**
     * Streams 2xx bodies into the part file while counting bytes. Error
     * responses are discarded so nothing is written for them.
     */
    private static HttpResponse.BodySubscriber<Path> bodyHandler(HttpResponse.ResponseInfo info, Path part,
            DownloadProgressListener listener, Duration idleTimeout) {
        if (info.statusCode() < 200 || info.statusCode() >= 300) {
            return HttpResponse.BodySubscribers.replacing(part);
        }
        long totalBytes = info.headers().firstValueAsLong("Content-Length").orElse(-1);
        return new CountingBodySubscriber(HttpResponse.BodySubscribers.ofFile(part), totalBytes, listener,
                idleTimeout);
    }

    private static void moveIntoPlace(Path part, Path destination, String url) {
        try {
            Files.move(part, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new CompletionException(new FetchException(url, "Cannot store download of " + url, e));
        }
    }

    /** Validates that the HTTP status code is in the 2xx success range. */
    private static void validateStatus(int status, String url) {
        if (status < 200 || status >= 300) {
            throw new CompletionException(FetchException.httpStatus(url, status));
        }
    }

    /**
     * Re-raises every failure of {@code future} as a {@link FetchException}
     * so callers see one error type regardless of the transport problem.
     */
    private static <T> CompletableFuture<T> translate(CompletionStage<T> future, String url) {
        return translate(future, url, () -> { });
    }

    private static <T> CompletableFuture<T> translate(CompletionStage<T> future, String url, Runnable onFailure) {
        CompletableFuture<T> result = new CompletableFuture<>();
        future.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
            } else {
                onFailure.run();
                result.completeExceptionally(asFetchException(unwrap(error), url));
            }
        });
        return result;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static FetchException asFetchException(Throwable cause, String url) {
        if (cause instanceof FetchException) {
            return (FetchException) cause;
        }
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof IncompleteBodyException) {
                IncompleteBodyException incomplete = (IncompleteBodyException) t;
                return FetchException.incomplete(url, incomplete.received, incomplete.expected);
            }
            if (t instanceof StalledBodyException) {
                return new FetchException(url, "Download of " + url + " stalled: " + t.getMessage(), t);
            }
        }
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            return new FetchException(url, "Timed out fetching " + url, cause);
        }
        return new FetchException(url, "Failed to fetch " + url + ": " + cause.getMessage(), cause);
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete partial download {}", file, e);
        }
    }

    /**
     * Forwards body chunks to the file subscriber, reporting progress and
     * failing the download when fewer bytes arrive than announced or when
     * the body goes quiet for longer than the idle timeout.
     */
    private static final class CountingBodySubscriber implements HttpResponse.BodySubscriber<Path> {

        private final HttpResponse.BodySubscriber<Path> delegate;
        private final long totalBytes;
        private final DownloadProgressListener listener;
        private final long idleTimeoutNanos;
        private final AtomicBoolean finished = new AtomicBoolean();
        private volatile long transferred;
        private volatile long lastActivity;
        private volatile Flow.Subscription subscription;
        private volatile ScheduledFuture<?> watchdog;

        CountingBodySubscriber(HttpResponse.BodySubscriber<Path> delegate, long totalBytes,
                DownloadProgressListener listener, Duration idleTimeout) {
            this.delegate = delegate;
            this.totalBytes = totalBytes;
            this.listener = listener;
            this.idleTimeoutNanos = idleTimeout.toNanos();
        }

        @Override
        public CompletionStage<Path> getBody() {
            return delegate.getBody();
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            this.lastActivity = System.nanoTime();
            delegate.onSubscribe(subscription);
            long period = Math.max(MIN_IDLE_CHECK_MILLIS, TimeUnit.NANOSECONDS.toMillis(idleTimeoutNanos) / 4);
            watchdog = WATCHDOG.scheduleAtFixedRate(this::checkIdle, period, period, TimeUnit.MILLISECONDS);
            if (finished.get()) {
                watchdog.cancel(false);
            }
        }

        @Override
        public void onNext(List<ByteBuffer> item) {
            if (finished.get()) {
                return;
            }
            lastActivity = System.nanoTime();
            long received = transferred;
            for (ByteBuffer buffer : item) {
                received += buffer.remaining();
            }
            transferred = received;
            delegate.onNext(item);
            listener.onProgress(received, totalBytes);
        }

        @Override
        public void onError(Throwable throwable) {
            if (finish()) {
                delegate.onError(throwable);
            }
        }

        @Override
        public void onComplete() {
            if (!finish()) {
                return;
            }
            if (totalBytes >= 0 && transferred < totalBytes) {
                delegate.onError(new IncompleteBodyException(transferred, totalBytes));
                return;
            }
            delegate.onComplete();
        }

        private void checkIdle() {
            if (System.nanoTime() - lastActivity < idleTimeoutNanos || !finish()) {
                return;
            }
            LOG.warn("Download idle for {} ms after {} bytes, aborting",
                    TimeUnit.NANOSECONDS.toMillis(idleTimeoutNanos), transferred);
            subscription.cancel();
            delegate.onError(new StalledBodyException(transferred, Duration.ofNanos(idleTimeoutNanos)));
        }

        private boolean finish() {
            if (!finished.compareAndSet(false, true)) {
                return false;
            }
            ScheduledFuture<?> scheduled = watchdog;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
            return true;
        }
    }

    private static final class IncompleteBodyException extends IOException {

        private final long received;
        private final long expected;

        IncompleteBodyException(long received, long expected) {
            super("Body ended after " + received + " of " + expected + " bytes");
            this.received = received;
            this.expected = expected;
        }
    }

    private static final class StalledBodyException extends IOException {

        StalledBodyException(long received, Duration idleTimeout) {
            super("no data for " + idleTimeout.toMillis() + " ms after " + received + " bytes");
        }
    }
}
