package de.bsommerfeld.feedupdate.download;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the fetcher against a local {@link HttpServer}.
 */
class HttpContentFetcherTest {

    private static final byte[] ARTIFACT = new byte[64 * 1024];

    static {
        new Random(3).nextBytes(ARTIFACT);
    }

    @TempDir
    Path dir;

    private HttpServer server;
    private ExecutorService serverThreads;
    private String baseUrl;
    private final AtomicReference<String> lastUserAgent = new AtomicReference<>();

    private HttpContentFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverThreads = Executors.newCachedThreadPool();
        server.setExecutor(serverThreads);

        server.createContext("/feed.json", exchange -> {
            lastUserAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            respond(exchange, 200, "{\"version\":\"1.0.0\",\"title\":\"Grüße\"}".getBytes(StandardCharsets.UTF_8));
        });
        server.createContext("/missing", exchange -> respond(exchange, 404, "not here".getBytes()));
        server.createContext("/artifact.bin", exchange -> respond(exchange, 200, ARTIFACT));
        server.createContext("/truncated.bin", exchange -> {
            exchange.sendResponseHeaders(200, 1000);
            OutputStream body = exchange.getResponseBody();
            body.write(new byte[10]);
            body.flush();
            // closing short of Content-Length makes the server drop the connection
            exchange.close();
        });
        server.createContext("/stalled.bin", exchange -> {
            exchange.sendResponseHeaders(200, 1000);
            OutputStream body = exchange.getResponseBody();
            body.write(new byte[10]);
            body.flush();
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.close();
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "late".getBytes());
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        fetcher = new HttpContentFetcher(HttpClient.newHttpClient(), Duration.ofSeconds(5), "feedupdate-test");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        serverThreads.shutdownNow();
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private static FetchException failureOf(CompletableFuture<?> future) {
        var ex = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
        return assertInstanceOf(FetchException.class, ex.getCause());
    }

    // -- fetchText --

    @Test
    void fetchText_shouldDecodeBodyAsUtf8() throws Exception {
        String body = fetcher.fetchText(baseUrl + "/feed.json").get(10, TimeUnit.SECONDS);
        assertEquals("{\"version\":\"1.0.0\",\"title\":\"Grüße\"}", body);
        assertEquals("feedupdate-test", lastUserAgent.get());
    }

    @Test
    void fetchText_shouldFailWithStatusCodeOnNon2xx() {
        FetchException ex = failureOf(fetcher.fetchText(baseUrl + "/missing"));
        assertEquals(404, ex.statusCode());
        assertEquals(baseUrl + "/missing", ex.url());
    }

    @Test
    void fetchText_shouldFailOnUnreachableHost() {
        FetchException ex = failureOf(fetcher.fetchText("http://127.0.0.1:1/feed.json"));
        assertEquals(-1, ex.statusCode());
    }

    @Test
    void fetchText_shouldFailOnInvalidUrl() {
        failureOf(fetcher.fetchText("not a url"));
    }

    @Test
    void fetchText_shouldTimeOut() {
        var impatient = new HttpContentFetcher(HttpClient.newHttpClient(), Duration.ofMillis(200), "test");
        FetchException ex = failureOf(impatient.fetchText(baseUrl + "/slow"));
        assertTrue(ex.getMessage().contains("Timed out"), ex.getMessage());
    }

    // -- fetchBinary --

    @Test
    void fetchBinary_shouldWriteCompleteFileAndReportProgress() throws Exception {
        Path destination = dir.resolve("nested/artifact.bin");
        AtomicLong lastRead = new AtomicLong();
        AtomicLong lastTotal = new AtomicLong();

        fetcher.fetchBinary(baseUrl + "/artifact.bin", destination, (read, total) -> {
            lastRead.set(read);
            lastTotal.set(total);
        }).get(10, TimeUnit.SECONDS);

        assertArrayEquals(ARTIFACT, Files.readAllBytes(destination));
        assertEquals(ARTIFACT.length, lastRead.get());
        assertEquals(ARTIFACT.length, lastTotal.get());
        assertFalse(Files.exists(dir.resolve("nested/artifact.bin.part")));
    }

    @Test
    void fetchBinary_shouldLeaveNothingOnHttpError() throws IOException {
        Path destination = dir.resolve("artifact.bin");

        FetchException ex = failureOf(fetcher.fetchBinary(baseUrl + "/missing", destination));

        assertEquals(404, ex.statusCode());
        assertFalse(Files.exists(destination));
        try (var files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void fetchBinary_shouldLeaveNothingOnTruncatedBody() throws IOException {
        Path destination = dir.resolve("artifact.bin");

        failureOf(fetcher.fetchBinary(baseUrl + "/truncated.bin", destination));

        assertFalse(Files.exists(destination));
        try (var files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void fetchBinary_shouldFailOnUnreachableHost() {
        Path destination = dir.resolve("artifact.bin");
        failureOf(fetcher.fetchBinary("http://127.0.0.1:1/artifact.bin", destination));
        assertFalse(Files.exists(destination));
    }

    @Test
    void fetchBinary_shouldAbortBodyThatStopsSendingData() throws IOException {
        var impatient = new HttpContentFetcher(HttpClient.newHttpClient(), Duration.ofMillis(500), "test");
        Path destination = dir.resolve("artifact.bin");
        long started = System.nanoTime();

        FetchException ex = failureOf(impatient.fetchBinary(baseUrl + "/stalled.bin", destination));

        assertTrue(ex.getMessage().contains("stalled"), ex.getMessage());
        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(4)) < 0,
                "stall should be detected well before the server resumes");
        assertFalse(Files.exists(destination));
        try (var files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void fetchBinary_shouldAbortTransferAndLeaveNothingWhenCancelled() throws Exception {
        Path destination = dir.resolve("artifact.bin");
        AtomicLong lastRead = new AtomicLong();
        CompletableFuture<Void> download = fetcher.fetchBinary(baseUrl + "/stalled.bin", destination,
                (read, total) -> lastRead.set(read));

        // wait until the first bytes arrived so the cancel hits an open body
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (lastRead.get() == 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(10, lastRead.get());

        assertTrue(download.cancel(true));

        assertTrue(download.isCancelled());
        assertFalse(Files.exists(destination));
        assertFalse(Files.exists(dir.resolve("artifact.bin.part")));
    }
}
