package de.bsommerfeld.feedupdate.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.toString().contains("test-app"));
    }

    @Test
    void getAppDataDir_shouldBeAbsolute() {
        assertTrue(StorageUtils.getAppDataDir("test-app").isAbsolute());
    }

    @Test
    void getConfigFile_shouldLiveInAppDataDir() {
        Path appDir = StorageUtils.getAppDataDir("test-app");
        assertEquals(appDir.resolve("updater.toml"), StorageUtils.getConfigFile("test-app"));
    }

    @Test
    void getSkippedVersionFile_shouldLiveInAppDataDir() {
        Path appDir = StorageUtils.getAppDataDir("test-app");
        assertEquals(appDir.resolve("skipped-version.txt"), StorageUtils.getSkippedVersionFile("test-app"));
    }

    @Test
    void getAppDataDir_differentNames_shouldProduceDifferentPaths() {
        assertNotEquals(StorageUtils.getAppDataDir("app-one"), StorageUtils.getAppDataDir("app-two"));
    }
}
