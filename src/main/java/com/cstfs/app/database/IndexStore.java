package com.cstfs.app.database;

import java.nio.file.Path;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cstfs.app.database.IndexException.Reason;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Owns the SQLite file backing the content index: connection pool, Jdbi
 * instance and schema. Transaction boundaries are chosen by the caller.
 */
public final class IndexStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(IndexStore.class);

    private final Path dbPath;
    private final HikariDataSource dataSource;
    private final Jdbi jdbi;

    private IndexStore(Path dbPath, HikariDataSource dataSource, Jdbi jdbi) {
        this.dbPath = dbPath;
        this.dataSource = dataSource;
        this.jdbi = jdbi;
    }

    @FunctionalInterface
    public interface IndexCallback<R, X extends Exception> {
        R withIndex(ContentIndex index) throws X;
    }

    public static Path indexPath(Path root, String dbFileName) {
        return root.toAbsolutePath().normalize().resolve(dbFileName);
    }

    /**
     * Opens (creating if needed) {@code root/dbFileName} and makes sure the
     * {@code files} table exists.
     *
     * @throws IndexException with {@link Reason#OPEN} when the file cannot be
     *         opened, {@link Reason#MIGRATION} when the schema cannot be created
     */
    public static IndexStore open(Path root, String dbFileName) {
        Path dbPath = indexPath(root, dbFileName);

        // --- CONNECTION POOL (HikariCP) ---
        // At most one writing transaction plus one reader
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + dbPath);
        config.setPoolName("cstfs-index");
        config.setConnectionTestQuery("SELECT 1");
        config.setMaximumPoolSize(2);
        // Wait for a lock held by another process instead of failing at once
        config.setConnectionInitSql("PRAGMA busy_timeout=10000");

        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new IndexException(Reason.OPEN, "Failed to open db at " + dbPath, e);
        }

        // --- JDBI + SCHEMA ---
        Jdbi jdbi = Jdbi.create(dataSource);
        jdbi.installPlugin(new SqlObjectPlugin());

        try {
            jdbi.useExtension(IndexDao.class, IndexDao::createSchema);
        } catch (JdbiException e) {
            dataSource.close();
            throw new IndexException(Reason.MIGRATION, "Failed creating table in " + dbPath, e);
        }

        logger.debug("Index opened at {}", dbPath);
        return new IndexStore(dbPath, dataSource, jdbi);
    }

    /**
     * Runs {@code callback} in one transaction: committed when it returns,
     * rolled back when it throws.
     */
    public <R, X extends Exception> R inTransaction(IndexCallback<R, X> callback) throws X {
        return jdbi.inTransaction(handle -> callback.withIndex(new ContentIndex(handle)));
    }

    /**
     * Runs {@code callback} without a transaction. Mutations are rejected.
     */
    public <R, X extends Exception> R read(IndexCallback<R, X> callback) throws X {
        return jdbi.withHandle(handle -> callback.withIndex(new ContentIndex(handle)));
    }

    public Path dbPath() {
        return dbPath;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
