package com.cstfs.app.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

public interface IndexDao {

    // --- Schema --------------------------------------------------------------

    @SqlUpdate("""
        CREATE TABLE IF NOT EXISTS files (
            path TEXT NOT NULL,
            hash TEXT NOT NULL PRIMARY KEY
        )
        """)
    void createSchema();

    // --- Files ---------------------------------------------------------------

    @SqlUpdate("INSERT INTO files(path, hash) VALUES(:path, :hash)")
    int insert(@Bind("path") String path, @Bind("hash") String hash);

    @SqlUpdate("UPDATE files SET path = :path WHERE hash = :hash")
    int updatePath(@Bind("path") String path, @Bind("hash") String hash);

    @SqlUpdate("DELETE FROM files WHERE hash = :hash")
    int delete(@Bind("hash") String hash);

    @SqlUpdate("DELETE FROM files")
    int clear();

    @SqlQuery("""
        SELECT path, hash
          FROM files
         WHERE hash = :hash
        """)
    @RegisterRowMapper(IndexEntryMapper.class)
    List<IndexEntry> findAllByHash(@Bind("hash") String hash);

    @SqlQuery("""
        SELECT path, hash
          FROM files
         ORDER BY rowid
        """)
    @RegisterRowMapper(IndexEntryMapper.class)
    List<IndexEntry> scanAll();

    @SqlQuery("SELECT COUNT(*) FROM files")
    long count();

    final class IndexEntryMapper implements RowMapper<IndexEntry> {
        @Override
        public IndexEntry map(ResultSet rs, StatementContext ctx) throws SQLException {
            return new IndexEntry(rs.getString("path"), rs.getString("hash"));
        }
    }
}
