package com.cstfs.app.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Central configuration for cstfs.
 * Resolves the index file name, the default data directory and the
 * media extension allow-list. Values are only defaults: callers thread
 * them explicitly into {@code IndexStore.open} and the scanner.
 */
public final class Config {

    public static final String DEFAULT_DB_NAME = "cstfs.db";

    public static final List<String> DEFAULT_MEDIA_EXTENSIONS = List.of(
        // images
        "jpg", "jpeg", "png", "gif", "bmp", "tif", "tiff", "webp", "heic", "heif",
        "raw", "cr2", "cr3", "nef", "arw", "orf", "rw2", "dng", "svg",
        // audio
        "mp3", "wav", "flac", "aac", "ogg", "oga", "m4a", "wma", "opus", "aiff",
        // video
        "mp4", "m4v", "mkv", "avi", "mov", "wmv", "flv", "webm", "mpg", "mpeg",
        "3gp", "mts", "m2ts"
    );

    // Environment keys (priority order: system property, env, .env)
    private static final String ENV_DB_NAME = "CSTFS_DB_NAME";
    private static final String ENV_DATA_DIR = "CSTFS_DATA_DIR";
    private static final String ENV_MEDIA_EXTENSIONS = "CSTFS_MEDIA_EXTENSIONS";

    // System property overrides (useful for tests/CI)
    private static final String PROP_DB_NAME = "cstfs.dbName";
    private static final String PROP_DATA_DIR = "cstfs.dataDir";
    private static final String PROP_MEDIA_EXTENSIONS = "cstfs.mediaExtensions";

    // Logger must be initialized before any static initializer that may use it
    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Config.class);
    // A missing .env is normal outside development
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    // Utility class
    private Config() {}

    /**
     * Name of the index file, resolved inside the indexed root.
     */
    public static String getDbFileName() {
        String name = getEnvOrDotenv(ENV_DB_NAME);
        if (name == null) return DEFAULT_DB_NAME;
        // The index always lives directly under the indexed root; a path here
        // would let the scanner pick the index file up as media.
        if (name.contains("/") || name.contains("\\")) {
            throw new IllegalStateException(ENV_DB_NAME + " must be a plain file name, got: " + name);
        }
        return name;
    }

    /**
     * Data directory used when the command line does not name one.
     */
    public static Path getDefaultDataDir() {
        String dir = getEnvOrDotenv(ENV_DATA_DIR);
        return Paths.get(dir == null ? "." : dir);
    }

    /**
     * Lower-case media extensions without the leading dot.
     */
    public static Set<String> getMediaExtensions() {
        String raw = getEnvOrDotenv(ENV_MEDIA_EXTENSIONS);
        if (raw == null) return Set.copyOf(DEFAULT_MEDIA_EXTENSIONS);

        Set<String> out = new LinkedHashSet<>();
        // Accepts "JPG, .png,mp4": case and leading dots are not significant
        for (String part : raw.split(",")) {
            String ext = part.trim().toLowerCase(Locale.ROOT);
            while (ext.startsWith(".")) ext = ext.substring(1);
            if (!ext.isEmpty()) out.add(ext);
        }
        if (out.isEmpty()) {
            logger.warn("{} is set but lists no extension; falling back to the built-in list", ENV_MEDIA_EXTENSIONS);
            return Set.copyOf(DEFAULT_MEDIA_EXTENSIONS);
        }
        return Set.copyOf(out);
    }

    /**
     * Resolves a key: system property first, then the process environment,
     * then {@code .env}. Blank values count as unset at every level.
     */
    private static String getEnvOrDotenv(String key) {
        String propKey = mapToSystemPropertyKey(key);
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (propVal != null && !propVal.isBlank()) {
                return propVal.trim();
            }
        }

        String envVal = System.getenv(key);
        if (envVal != null && !envVal.isBlank()) {
            return envVal.trim();
        }

        String fileVal = dotenv.get(key);
        if (fileVal == null || fileVal.isBlank()) {
            return null;
        }
        return fileVal.trim();
    }

    private static String mapToSystemPropertyKey(String envKey) {
        if (envKey == null) return null;
        return switch (envKey) {
            case ENV_DB_NAME -> PROP_DB_NAME;
            case ENV_DATA_DIR -> PROP_DATA_DIR;
            case ENV_MEDIA_EXTENSIONS -> PROP_MEDIA_EXTENSIONS;
            default -> null;
        };
    }
}
