package io.issuebridge.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class CacheDatabase {
    private final Path file;
    private final String jdbcUrl;

    public CacheDatabase(Path file) {
        this.file = file;
        this.jdbcUrl = "jdbc:sqlite:" + file.toString();
    }

    public Path file() {
        return file;
    }

    public Connection open() {
        initDirectories();
        Connection conn;
        try {
            conn = DriverManager.getConnection(jdbcUrl);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to open cache database " + file, e);
        }
        try {
            applyAndValidatePragmas(conn);
            initSchema(conn);
            return conn;
        } catch (RuntimeException e) {
            closeQuietly(conn, e);
            throw e;
        }
    }

    private void initDirectories() {
        Path parent = file.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private static void initSchema(Connection conn) {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS issues (
                        key TEXT PRIMARY KEY,
                        data TEXT NOT NULL,
                        cached_at INTEGER NOT NULL,
                        expires_at INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS search_cache (
                        jql_hash TEXT PRIMARY KEY,
                        jql TEXT NOT NULL,
                        result TEXT NOT NULL,
                        cached_at INTEGER NOT NULL,
                        expires_at INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS sync_state (
                        id INTEGER PRIMARY KEY CHECK (id = 1),
                        last_sync_at INTEGER,
                        last_sync_status TEXT,
                        pending_changes TEXT NOT NULL DEFAULT '[]'
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_issues_expires_at ON issues(expires_at)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_search_cache_expires_at ON search_cache(expires_at)");
            st.execute("INSERT OR IGNORE INTO sync_state(id, pending_changes) VALUES (1, '[]')");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize cache schema", e);
        }
    }

    private static void applyAndValidatePragmas(Connection conn) {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("PRAGMA busy_timeout=5000");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private static void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    private static void closeQuietly(Connection conn, RuntimeException primary) {
        try {
            conn.close();
        } catch (SQLException e) {
            primary.addSuppressed(e);
        }
    }
}
