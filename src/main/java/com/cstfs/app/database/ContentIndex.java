package com.cstfs.app.database;

import java.util.List;
import java.util.Optional;

import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.JdbiException;

import com.cstfs.app.database.IndexException.Reason;

/**
 * Hash to path table bound to one Jdbi handle.
 * <p>
 * Mutations require the handle to be inside a transaction opened by the
 * caller ({@link IndexStore#inTransaction}); this class never commits.
 * Every insert, update and delete asserts that exactly one row changed.
 */
public final class ContentIndex {

    private final Handle handle;
    private final IndexDao dao;

    ContentIndex(Handle handle) {
        this.handle = handle;
        this.dao = handle.attach(IndexDao.class);
    }

    /**
     * Adds {@code path} under {@code hash}.
     *
     * @throws DuplicateInsertionException if the hash is already indexed
     */
    public void insert(String path, String hash) throws DuplicateInsertionException {
        requireTransaction("insert");
        List<IndexEntry> existing = query("lookup of hash " + hash, () -> dao.findAllByHash(hash));
        if (existing.size() > 1) {
            throw corrupt(hash, existing);
        }
        if (!existing.isEmpty()) {
            throw new DuplicateInsertionException(existing.get(0).path(), path, hash);
        }
        int rows = query("insert of " + path, () -> dao.insert(path, hash));
        expectOneRow(rows, "insert of " + path + " at " + hash);
    }

    /**
     * Points the entry of {@code hash} at {@code newPath}.
     */
    public void rebindPath(String newPath, String hash) {
        requireTransaction("rebindPath");
        List<IndexEntry> entries = query("lookup of hash " + hash, () -> dao.findAllByHash(hash));
        if (entries.isEmpty()) {
            throw new IndexException(Reason.HASH_DOES_NOT_EXIST,
                "Cannot rebind " + newPath + ": hash " + hash + " is not indexed");
        }
        if (entries.size() > 1) {
            throw corrupt(hash, entries);
        }
        int rows = query("update of " + newPath, () -> dao.updatePath(newPath, hash));
        expectOneRow(rows, "update of " + newPath + " at " + hash);
    }

    public void remove(String hash) {
        requireTransaction("remove");
        int rows = query("delete of hash " + hash, () -> dao.delete(hash));
        expectOneRow(rows, "delete of hash " + hash);
    }

    /**
     * Empty when no row holds the hash; a failing query is an {@link IndexException}.
     */
    public Optional<IndexEntry> findByHash(String hash) {
        List<IndexEntry> entries = query("lookup of hash " + hash, () -> dao.findAllByHash(hash));
        if (entries.size() > 1) {
            throw corrupt(hash, entries);
        }
        return entries.stream().findFirst();
    }

    /**
     * Deletes every entry. Used by a forced rebuild so the old rows only
     * disappear when the new ones commit.
     *
     * @return number of rows removed
     */
    public int clear() {
        requireTransaction("clear");
        return query("clear of all files", dao::clear);
    }

    public List<IndexEntry> scanAll() {
        return query("scan of all files", dao::scanAll);
    }

    public long count() {
        return query("count of files", dao::count);
    }

    private void requireTransaction(String operation) {
        if (!handle.isInTransaction()) {
            throw new IllegalStateException(operation + " must run inside a caller-supplied transaction");
        }
    }

    private static IndexException corrupt(String hash, List<IndexEntry> entries) {
        List<String> paths = entries.stream().map(IndexEntry::path).toList();
        return new IndexException(Reason.DUPLICATE_PATHS,
            "Index is corrupt: hash " + hash + " is bound to " + paths);
    }

    private static void expectOneRow(int rows, String operation) {
        if (rows < 1) {
            throw new IndexException(Reason.TOO_FEW_ROWS_AFFECTED,
                "Expected 1 row affected by " + operation + ", got " + rows);
        }
        if (rows > 1) {
            throw new IndexException(Reason.TOO_MANY_ROWS_AFFECTED,
                "Expected 1 row affected by " + operation + ", got " + rows);
        }
    }

    private static <T> T query(String operation, DaoCall<T> call) {
        try {
            return call.run();
        } catch (JdbiException e) {
            throw new IndexException(Reason.QUERY, "Failed " + operation, e);
        }
    }

    @FunctionalInterface
    private interface DaoCall<T> {
        T run();
    }
}
