package de.bsommerfeld.feedupdate.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Updater settings, persisted as TOML next to the application's other data.
 *
 * <pre>{@code
 * feed-url = "https://example.com/releases/latest.json"
 * public-key-path = "/opt/app/update-key.pem"
 * download-directory = ""
 * signature-algorithm = ""
 * connect-timeout-seconds = 10
 * request-timeout-seconds = 30
 * check-interval-minutes = 360
 * initial-delay-seconds = 30
 * user-agent = "feedupdate"
 * }</pre>
 *
 * <p>
 * Blank strings mean "use the default": the system temp directory for
 * downloads, and the key's natural algorithm for signatures.
 */
@JsonPropertyOrder({ "feed-url", "public-key-path", "download-directory", "signature-algorithm",
        "connect-timeout-seconds", "request-timeout-seconds", "check-interval-minutes",
        "initial-delay-seconds", "user-agent" })
public class UpdaterConfig {

    private static final Logger LOG = LoggerFactory.getLogger(UpdaterConfig.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    @JsonProperty("feed-url")
    private String feedUrl = "";

    @JsonProperty("public-key-path")
    private String publicKeyPath = "";

    @JsonProperty("download-directory")
    private String downloadDirectory = "";

    @JsonProperty("signature-algorithm")
    private String signatureAlgorithm = "";

    @JsonProperty("connect-timeout-seconds")
    private int connectTimeoutSeconds = 10;

    @JsonProperty("request-timeout-seconds")
    private int requestTimeoutSeconds = 30;

    @JsonProperty("check-interval-minutes")
    private int checkIntervalMinutes = 360;

    @JsonProperty("initial-delay-seconds")
    private int initialDelaySeconds = 30;

    @JsonProperty("user-agent")
    private String userAgent = "feedupdate";

    /**
     * Reads the configuration at {@code file}. A missing file is created with
     * the default values so users have something to edit.
     *
     * @throws ConfigException if the file exists but cannot be read or bound,
     *                         or the defaults cannot be written
     */
    public static UpdaterConfig load(Path file) {
        if (!Files.exists(file)) {
            UpdaterConfig defaults = new UpdaterConfig();
            defaults.save(file);
            LOG.info("Wrote default updater configuration to {}", file.toAbsolutePath());
            return defaults;
        }
        try {
            UpdaterConfig config = MAPPER.readValue(file.toFile(), UpdaterConfig.class);
            config.validate();
            LOG.info("Loaded updater configuration from {}", file.toAbsolutePath());
            return config;
        } catch (IOException e) {
            throw new ConfigException("Failed to read updater configuration: " + file, e);
        }
    }

    /**
     * Writes this configuration to {@code file}, creating parent directories.
     *
     * @throws ConfigException on I/O failure
     */
    public void save(Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(file.toFile(), this);
        } catch (IOException e) {
            throw new ConfigException("Failed to write updater configuration: " + file, e);
        }
    }

    private void validate() {
        if (connectTimeoutSeconds <= 0)
            throw new ConfigException("connect-timeout-seconds must be positive");
        if (requestTimeoutSeconds <= 0)
            throw new ConfigException("request-timeout-seconds must be positive");
        if (checkIntervalMinutes < 0)
            throw new ConfigException("check-interval-minutes must not be negative");
        if (initialDelaySeconds < 0)
            throw new ConfigException("initial-delay-seconds must not be negative");
    }

    /** Directory downloads are written to; the system temp directory when unset. */
    public Path resolveDownloadDirectory() {
        if (downloadDirectory == null || downloadDirectory.isBlank()) {
            return Paths.get(System.getProperty("java.io.tmpdir"));
        }
        return Paths.get(downloadDirectory);
    }

    public Duration connectTimeout() {
        return Duration.ofSeconds(connectTimeoutSeconds);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public String getFeedUrl() {
        return feedUrl;
    }

    public void setFeedUrl(String feedUrl) {
        this.feedUrl = feedUrl;
    }

    public String getPublicKeyPath() {
        return publicKeyPath;
    }

    public void setPublicKeyPath(String publicKeyPath) {
        this.publicKeyPath = publicKeyPath;
    }

    public String getDownloadDirectory() {
        return downloadDirectory;
    }

    public void setDownloadDirectory(String downloadDirectory) {
        this.downloadDirectory = downloadDirectory;
    }

    public String getSignatureAlgorithm() {
        return signatureAlgorithm;
    }

    public void setSignatureAlgorithm(String signatureAlgorithm) {
        this.signatureAlgorithm = signatureAlgorithm;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getCheckIntervalMinutes() {
        return checkIntervalMinutes;
    }

    public void setCheckIntervalMinutes(int checkIntervalMinutes) {
        this.checkIntervalMinutes = checkIntervalMinutes;
    }

    public int getInitialDelaySeconds() {
        return initialDelaySeconds;
    }

    public void setInitialDelaySeconds(int initialDelaySeconds) {
        this.initialDelaySeconds = initialDelaySeconds;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }
}
