package de.bsommerfeld.feedupdate.download;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One artifact download, owned by a single update cycle.
 *
 * <p>
 * The session is the only owner of {@link #localPath()}: nobody else reads
 * or deletes the file while the cycle runs. The file is handed to the host
 * only after the session reached {@link State#COMPLETED}.
 */
public final class DownloadSession {

    private static final Logger LOG = LoggerFactory.getLogger(DownloadSession.class);

    public enum State {
        PENDING,
        COMPLETED,
        FAILED
    }

    private final String artifactUrl;
    private final Path localPath;
    private volatile State state = State.PENDING;

    public DownloadSession(String artifactUrl, Path localPath) {
        this.artifactUrl = Objects.requireNonNull(artifactUrl, "artifactUrl");
        this.localPath = Objects.requireNonNull(localPath, "localPath");
    }

    /** Starts a session targeting a fresh, collision-free path from {@code paths}. */
    public static DownloadSession start(String artifactUrl, ArtifactPaths paths) {
        return new DownloadSession(artifactUrl, paths.newArtifactPath(artifactUrl));
    }

    public String artifactUrl() {
        return artifactUrl;
    }

    public Path localPath() {
        return localPath;
    }

    public State state() {
        return state;
    }

    public void markCompleted() {
        state = State.COMPLETED;
    }

    public void markFailed() {
        state = State.FAILED;
    }

    /**
     * Removes the local artifact if present.
     *
     * @return {@code true} if no file remains at {@link #localPath()}
     */
    public boolean deleteArtifact() {
        try {
            Files.deleteIfExists(localPath);
            return true;
        } catch (IOException e) {
            LOG.error("Could not delete artifact {}", localPath, e);
            return false;
        }
    }

    @Override
    public String toString() {
        return "DownloadSession[" + artifactUrl + " -> " + localPath + ", " + state + "]";
    }
}
