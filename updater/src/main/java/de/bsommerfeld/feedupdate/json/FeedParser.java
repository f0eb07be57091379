package de.bsommerfeld.feedupdate.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.feedupdate.model.Feed;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;

/**
 * Turns raw feed bytes into a {@link Feed}.
 *
 * <h3>Expected document</h3>
 * <pre>{@code
 * {
 *   "version": "2.0.0",
 *   "artifactUrl": "https://downloads.example.com/app-2.0.0.msi",
 *   "signature": "MC0CFQ...",
 *   "title": "Version 2.0",
 *   "releaseNotesUrl": "https://example.com/notes/2.0.0",
 *   "publishedDate": "2024-05-01",
 *   "channel": "stable"
 * }
 * }</pre>
 *
 * <h3>Two passes</h3>
 * The payload is deserialized twice, independently: once onto the typed
 * document, which drops keys it does not know, and once into an ordered
 * map that keeps every top-level key. The map is therefore complete even
 * for fields the typed model has never heard of ({@code channel} above).
 *
 * <p>
 * The parser is stateless and thread-safe.
 */
@Singleton
public class FeedParser {

    private static final TypeReference<LinkedHashMap<String, Object>> RAW_DOCUMENT = new TypeReference<>() {
    };

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    /**
     * Parses a UTF-8 encoded feed document.
     *
     * @throws FeedParseException if the payload is not a JSON object or lacks
     *                            {@code version} or {@code artifactUrl}
     */
    public Feed parse(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new FeedParseException("Feed payload is empty");
        }

        FeedDocument typed = readTyped(payload);
        LinkedHashMap<String, Object> raw = readRaw(payload);

        requireText(typed.version, "version");
        requireText(typed.artifactUrl, "artifactUrl");

        return new Feed(typed.version.strip(), typed.artifactUrl.strip(), typed.signature,
                typed.title, typed.releaseNotesUrl, typed.publishedDate, raw);
    }

    /** Parses a feed document that was already decoded to text. */
    public Feed parse(String payload) {
        if (payload == null) {
            throw new FeedParseException("Feed payload is empty");
        }
        return parse(payload.getBytes(StandardCharsets.UTF_8));
    }

    private FeedDocument readTyped(byte[] payload) {
        try {
            FeedDocument document = mapper.readValue(payload, FeedDocument.class);
            if (document == null) {
                throw new FeedParseException("Feed payload is not a JSON object");
            }
            return document;
        } catch (IOException e) {
            throw new FeedParseException("Malformed feed: " + e.getMessage(), e);
        }
    }

    private LinkedHashMap<String, Object> readRaw(byte[] payload) {
        try {
            LinkedHashMap<String, Object> raw = mapper.readValue(payload, RAW_DOCUMENT);
            if (raw == null) {
                throw new FeedParseException("Feed payload is not a JSON object");
            }
            return raw;
        } catch (IOException e) {
            throw new FeedParseException("Malformed feed: " + e.getMessage(), e);
        }
    }

    private static void requireText(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new FeedParseException("Feed is missing required field: " + key);
        }
    }

    /** Typed view of the document; unknown keys are left to the raw pass. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class FeedDocument {

        @JsonProperty("version")
        String version;

        @JsonProperty("artifactUrl")
        String artifactUrl;

        @JsonProperty("signature")
        String signature;

        @JsonProperty("title")
        String title;

        @JsonProperty("releaseNotesUrl")
        String releaseNotesUrl;

        @JsonProperty("publishedDate")
        String publishedDate;
    }
}
