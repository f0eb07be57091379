package de.bsommerfeld.feedupdate.download;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactPathsTest {

    private final ArtifactPaths paths = new ArtifactPaths(Path.of("downloads"));

    @ParameterizedTest
    @CsvSource({
            "https://example.com/releases/app-2.0.0.msi, app-2.0.0.msi",
            "https://example.com/app.zip?token=abc#frag, app.zip",
            "https://example.com/releases/, artifact",
            "https://example.com, artifact",
            "https://example.com/a/.., artifact",
    })
    void remoteFileName_shouldUseLastPathSegment(String url, String expected) {
        assertEquals(expected, ArtifactPaths.remoteFileName(url));
    }

    @Test
    void newArtifactPath_shouldStayInsideDirectoryAndKeepExtension() {
        Path path = paths.newArtifactPath("https://example.com/app-2.0.0.msi");
        assertEquals(Path.of("downloads"), path.getParent());
        assertTrue(path.getFileName().toString().endsWith("app-2.0.0.msi"));
    }

    @Test
    void newArtifactPath_shouldNeverRepeat() {
        Path first = paths.newArtifactPath("https://example.com/app.msi");
        Path second = paths.newArtifactPath("https://example.com/app.msi");
        assertNotEquals(first, second);
    }

    @Test
    void newArtifactPath_shouldRejectInvalidUrl() {
        assertThrows(IllegalArgumentException.class, () -> paths.newArtifactPath("https://exa mple.com/a"));
    }
}
