package de.bsommerfeld.feedupdate.version;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists the skipped version as a single line of text so the choice
 * survives restarts.
 *
 * <p>
 * A missing or unreadable file reads as "nothing skipped": losing the
 * preference only means the user is asked again.
 */
public class FileSkippedVersionStore implements SkippedVersionStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileSkippedVersionStore.class);

    private final Path file;

    public FileSkippedVersionStore(Path file) {
        this.file = file;
    }

    @Override
    public Optional<String> skippedVersion() {
        if (!Files.exists(file))
            return Optional.empty();
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8).strip();
            return content.isEmpty() ? Optional.empty() : Optional.of(content);
        } catch (IOException e) {
            LOG.warn("Could not read skipped version from {}", file, e);
            return Optional.empty();
        }
    }

    /**
     * @throws UncheckedIOException if the choice cannot be written
     */
    @Override
    public void skip(String version) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, version, StandardCharsets.UTF_8);
            LOG.info("Skipping version {} on future checks", version);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to record skipped version in " + file, e);
        }
    }

    @Override
    public void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear skipped version in " + file, e);
        }
    }
}
