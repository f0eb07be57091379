package de.bsommerfeld.feedupdate.download;

import java.net.URI;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Builds local paths for downloaded artifacts.
 *
 * <p>
 * The name is a fresh random UUID followed by the remote file name, e.g.
 * {@code 3f2b...e9app-2.0.0.msi}. Concurrent or repeated downloads of the
 * same artifact never share a path, and the original extension is kept so
 * the operating system still knows how to open the file.
 */
public class ArtifactPaths {

    private static final String FALLBACK_NAME = "artifact";

    private final Path directory;

    public ArtifactPaths(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    /**
     * @throws IllegalArgumentException if {@code artifactUrl} is not a valid URI
     */
    public Path newArtifactPath(String artifactUrl) {
        return directory.resolve(UUID.randomUUID() + remoteFileName(artifactUrl));
    }

    /**
     * Last path segment of the URL, without query or fragment. Falls back to
     * {@value #FALLBACK_NAME} for URLs that end in a slash or have no path.
     */
    static String remoteFileName(String artifactUrl) {
        String path = URI.create(artifactUrl).getPath();
        if (path == null)
            return FALLBACK_NAME;
        String name = path.substring(path.lastIndexOf('/') + 1);
        // Windows separators would escape the download directory
        name = name.substring(name.lastIndexOf('\\') + 1);
        if (name.isEmpty() || name.equals(".") || name.equals(".."))
            return FALLBACK_NAME;
        return name;
    }
}
