package com.cstfs.app.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cstfs.app.config.Config;
import com.cstfs.app.database.IndexException;
import com.cstfs.app.database.IndexStore;
import com.cstfs.app.diff.DiffGenerator;
import com.cstfs.app.diff.DiffRecord;
import com.cstfs.app.diff.RefreshReport;
import com.cstfs.app.diff.RefreshService;
import com.cstfs.app.duplicate.DuplicatePrompt;
import com.cstfs.app.duplicate.RunAbortedException;
import com.cstfs.app.inventory.ContentHasher;
import com.cstfs.app.inventory.DirectoryScanner;
import com.cstfs.app.inventory.FileRemover;
import com.cstfs.app.inventory.IndexBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Command line entry point.
 * <pre>
 *   cstfs [-d &lt;data dir&gt;] init [--force]
 *   cstfs [-d &lt;data dir&gt;] refresh [--json]
 *   cstfs help
 * </pre>
 * Exit codes: 0 success, 1 fatal error or operator abort, 2 usage error.
 */
public final class Cli {

    private static final Logger logger = LoggerFactory.getLogger(Cli.class);

    private static final ObjectMapper JSON = new ObjectMapper();

    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public Cli(BufferedReader in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        int exitCode = new Cli(stdin, System.out, System.err).execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    public int execute(String[] args) {
        ParseResult<Invocation> parsed = Invocation.parse(args);
        if (parsed.help()) {
            printUsage();
            return 0;
        }
        if (parsed.error() != null) {
            err.println(parsed.error());
            printUsage();
            return 2;
        }

        Invocation inv = parsed.value();
        Path root = inv.dataDir().toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            err.println("Data directory does not exist: " + root);
            return 2;
        }

        try {
            return switch (inv.command()) {
                case "init" -> runInit(root, inv.flag());
                case "refresh" -> runRefresh(root, inv.flag());
                default -> throw new IllegalStateException("Unhandled command " + inv.command());
            };
        } catch (RunAbortedException e) {
            logger.info(e.getMessage());
            return 1;
        } catch (IndexException e) {
            logger.error("Index failure ({})", e.reason(), e);
            err.println("Index error (" + e.reason() + "): " + safeMsg(e));
            return 1;
        } catch (IOException | RuntimeException e) {
            logger.error("Run failed", e);
            err.println("Fatal error: " + safeMsg(e));
            return 1;
        }
    }

    // ----------------- init -----------------

    private int runInit(Path root, boolean force) throws IOException {
        String dbFileName = Config.getDbFileName();
        Path dbPath = IndexStore.indexPath(root, dbFileName);

        boolean exists = Files.exists(dbPath);
        if (exists) {
            if (!force) {
                err.println("Cannot initialize a database that already exists: " + dbPath);
                return 1;
            }
            out.println("Regenerating database");
        }

        DirectoryScanner scanner = DirectoryScanner.forExtensions(Config.getMediaExtensions(), dbFileName);
        DuplicatePrompt prompt = new DuplicatePrompt(in, out, new FileRemover());
        IndexBuilder builder = new IndexBuilder(scanner, new ContentHasher(), prompt);

        try (IndexStore store = IndexStore.open(root, dbFileName)) {
            IndexBuilder.BuildMetrics metrics = builder.build(root, store, out::println, exists);
            out.println("Indexed " + metrics.filesInserted.sum() + " of " + metrics.filesSeen.sum()
                + " files (" + metrics.duplicatesFound.sum() + " duplicates)");
        }
        return 0;
    }

    // ----------------- refresh -----------------

    private int runRefresh(Path root, boolean json) throws IOException {
        String dbFileName = Config.getDbFileName();
        Path dbPath = IndexStore.indexPath(root, dbFileName);
        if (!Files.exists(dbPath)) {
            err.println("No index found at " + dbPath + "; run init first");
            return 1;
        }

        DirectoryScanner scanner = DirectoryScanner.forExtensions(Config.getMediaExtensions(), dbFileName);
        RefreshService service = new RefreshService(new DiffGenerator(scanner, new ContentHasher()));

        RefreshReport report;
        try (IndexStore store = IndexStore.open(root, dbFileName)) {
            report = service.refresh(root, store, json ? logger::info : out::println);
        }

        if (json) {
            out.println(toJson(report));
            return 0;
        }
        for (DiffRecord record : report.records()) {
            out.println(record.describe());
        }
        out.println(report.isClean() ? "Index is up to date" : "Summary: " + report.summary());
        return 0;
    }

    private static String toJson(RefreshReport report) throws IOException {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(report.records());
        } catch (JsonProcessingException e) {
            throw new IOException("Failed rendering diff report as JSON", e);
        }
    }

    // ----------------- usage -----------------

    private void printUsage() {
        out.println("""
                cstfs - content-addressed index of a media directory
                Commands:
                  [-d <data dir>] init [--force]     build the index from scratch
                  [-d <data dir>] refresh [--json]   report changes since the last init
                  help
                """);
    }

    // ----------------- parsing -----------------

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new IllegalArgumentException("Missing value for " + opt);
            return next();
        }
    }

    private record ParseResult<T>(T value, boolean help, String error) {
        static <T> ParseResult<T> okResult(T v) { return new ParseResult<>(v, false, null); }
        static <T> ParseResult<T> helpResult() { return new ParseResult<>(null, true, null); }
        static <T> ParseResult<T> errorResult(String e) { return new ParseResult<>(null, false, e); }
    }

    /**
     * @param flag {@code --force} for init, {@code --json} for refresh
     */
    record Invocation(Path dataDir, String command, boolean flag) {
        static ParseResult<Invocation> parse(String[] args) {
            Path dataDir = null;
            String command = null;
            boolean flag = false;

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help", "help" -> { return ParseResult.helpResult(); }
                        case "-d", "--data-dir" -> dataDir = Path.of(c.requireNext(t));
                        case "init", "refresh" -> {
                            if (command != null) return ParseResult.errorResult("Only one command allowed, got " + command + " and " + t);
                            command = t;
                        }
                        case "-f", "--force" -> {
                            if (!"init".equals(command)) return ParseResult.errorResult(t + " only applies to init");
                            flag = true;
                        }
                        case "--json" -> {
                            if (!"refresh".equals(command)) return ParseResult.errorResult(t + " only applies to refresh");
                            flag = true;
                        }
                        default -> { return ParseResult.errorResult("Invalid option: " + t); }
                    }
                }
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }

            if (command == null) {
                return args == null || args.length == 0
                    ? ParseResult.helpResult()
                    : ParseResult.errorResult("Missing command, expected init or refresh");
            }
            return ParseResult.okResult(new Invocation(dataDir == null ? Config.getDefaultDataDir() : dataDir, command, flag));
        }
    }

    // ----------------- misc -----------------

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return (m == null || m.isBlank())
                ? (t == null ? "Error" : t.getClass().getSimpleName())
                : m;
    }
}
