package com.cstfs.app.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("cstfs.mediaExtensions");
        System.setProperty("cstfs.dbName", Config.DEFAULT_DB_NAME);
    }

    @Test
    void dbFileNameComesFromSystemProperty() {
        // Set by Surefire system properties in pom.xml.
        assertEquals("cstfs.db", Config.getDbFileName());

        System.setProperty("cstfs.dbName", "other.sqlite");
        assertEquals("other.sqlite", Config.getDbFileName());
    }

    @Test
    void dbFileNameMustNotContainSeparators() {
        System.setProperty("cstfs.dbName", "nested/cstfs.db");
        assertThrows(IllegalStateException.class, Config::getDbFileName);
    }

    @Test
    void defaultMediaExtensionsCoverImagesAudioAndVideo() {
        Set<String> ext = Config.getMediaExtensions();
        assertTrue(ext.contains("jpg"));
        assertTrue(ext.contains("flac"));
        assertTrue(ext.contains("mkv"));
        assertFalse(ext.contains("txt"));
        assertFalse(ext.contains("db"));
    }

    @Test
    void mediaExtensionsOverrideIsNormalized() {
        System.setProperty("cstfs.mediaExtensions", ".JPG, png,, .Raw ");
        assertEquals(Set.of("jpg", "png", "raw"), Config.getMediaExtensions());
    }

    @Test
    void emptyMediaExtensionsOverrideFallsBackToDefaults() {
        System.setProperty("cstfs.mediaExtensions", " , ,");
        assertEquals(Set.copyOf(Config.DEFAULT_MEDIA_EXTENSIONS), Config.getMediaExtensions());
    }
}
