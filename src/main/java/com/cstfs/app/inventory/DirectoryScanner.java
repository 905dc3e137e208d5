package com.cstfs.app.inventory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive walk of a data directory returning every file eligible for the
 * index, sorted by relative path.
 * <p>
 * Skipped: directories, the index file (and its SQLite side files) at the
 * root, files without an extension and files outside the media allow-list.
 * Any unreadable directory or file attribute aborts the whole scan.
 */
public final class DirectoryScanner {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryScanner.class);

    private static final List<String> SQLITE_SIDE_SUFFIXES = List.of("-journal", "-wal", "-shm");

    private final MediaFilter filter;
    private final String dbFileName;

    public DirectoryScanner(MediaFilter filter, String dbFileName) {
        this.filter = filter;
        this.dbFileName = dbFileName;
    }

    public static DirectoryScanner forExtensions(Set<String> extensions, String dbFileName) {
        return new DirectoryScanner(new MediaFilter(extensions), dbFileName);
    }

    /**
     * @return absolute paths of the eligible files; a new list on every call
     */
    public List<Path> scan(Path root) throws IOException {
        final Path rootAbs = root.toAbsolutePath().normalize();
        final List<Path> out = new ArrayList<>();
        final long[] excluded = {0};

        Files.walkFileTree(
            rootAbs,
            EnumSet.noneOf(FileVisitOption.class),
            Integer.MAX_VALUE,
            new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile()) {
                        logger.debug("excluded: not a regular file: {}", file);
                        excluded[0]++;
                        return FileVisitResult.CONTINUE;
                    }
                    if (isIndexFile(rootAbs, file)) {
                        logger.debug("excluded: index file: {}", file);
                        return FileVisitResult.CONTINUE;
                    }

                    switch (filter.classify(file)) {
                        case ACCEPTED -> out.add(file);
                        case NO_EXTENSION -> {
                            logger.info("excluded: no file extension: {}", relativize(rootAbs, file));
                            excluded[0]++;
                        }
                        case NOT_MEDIA -> {
                            logger.info("excluded: not a media file: {}", relativize(rootAbs, file));
                            excluded[0]++;
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    throw new IOException("Failed reading " + file, exc);
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    if (exc != null) throw new IOException("Failed listing " + dir, exc);
                    return FileVisitResult.CONTINUE;
                }
            }
        );

        out.sort(Comparator.comparing(p -> relativize(rootAbs, p)));
        logger.debug("Scan of {} found {} files, excluded {}", rootAbs, out.size(), excluded[0]);
        return out;
    }

    /**
     * Root-relative path with forward slashes, the form stored in the index.
     */
    public static String relativize(Path root, Path file) {
        Path rootAbs = root.toAbsolutePath().normalize();
        Path fileAbs = file.toAbsolutePath().normalize();
        if (!fileAbs.startsWith(rootAbs)) {
            throw new IllegalArgumentException("Path \"" + file + "\" was not a base of \"" + root + "\"");
        }
        return rootAbs.relativize(fileAbs).toString().replace('\\', '/');
    }

    private boolean isIndexFile(Path rootAbs, Path file) {
        if (!rootAbs.equals(file.getParent())) return false;
        String name = file.getFileName().toString();
        if (name.equals(dbFileName)) return true;
        for (String suffix : SQLITE_SIDE_SUFFIXES) {
            if (name.equals(dbFileName + suffix)) return true;
        }
        return false;
    }
}
