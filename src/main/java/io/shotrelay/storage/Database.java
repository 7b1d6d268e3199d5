package io.shotrelay.storage;

import io.shotrelay.config.ShotRelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;
import java.util.concurrent.ThreadLocalRandom;

public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final int BUSY_TIMEOUT_MS = 5_000;
    private static final int MAX_TRANSACTION_ATTEMPTS = 5;

    private final ShotRelayConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(ShotRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MS);
        sqlite.enforceForeignKeys(true);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = sqlite.toProperties();
    }

    public ShotRelayConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    /**
     * Runs {@code work} in one write transaction. A busy or locked database restarts the whole
     * unit from a fresh read; any other failure rolls back and propagates. Exceptions thrown by
     * {@code work} that are already runtime exceptions are rethrown as-is.
     */
    public <T> T inTransaction(String operation, TransactionWork<T> work) {
        int attempt = 0;
        while (true) {
            attempt++;
            try (Connection c = openConnection()) {
                c.setAutoCommit(false);
                try {
                    T out = work.run(c);
                    c.commit();
                    return out;
                } catch (Exception e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (SQLException e) {
                if (isBusy(e) && attempt < MAX_TRANSACTION_ATTEMPTS) {
                    log.debug("Retrying {} after busy database, attempt={}", operation, attempt);
                    pause(attempt);
                    continue;
                }
                throw new RuntimeException("Failed " + operation, e);
            }
        }
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.artifactsDir());
            Files.createDirectories(config.scratchDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS builds (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        name TEXT NOT NULL UNIQUE,
                        is_public INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS releases (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        build_id INTEGER NOT NULL,
                        name TEXT NOT NULL,
                        number INTEGER NOT NULL,
                        url TEXT,
                        status TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        completed_at_ms INTEGER,
                        UNIQUE(build_id, name, number),
                        FOREIGN KEY(build_id) REFERENCES builds(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS artifacts (
                        sha256 TEXT PRIMARY KEY,
                        content_type TEXT NOT NULL,
                        size_bytes INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS runs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        release_id INTEGER NOT NULL,
                        name TEXT NOT NULL,
                        url TEXT,
                        status TEXT NOT NULL,
                        image TEXT,
                        log TEXT,
                        config TEXT,
                        diff_image TEXT,
                        diff_log TEXT,
                        ref_url TEXT,
                        ref_image TEXT,
                        ref_log TEXT,
                        ref_config TEXT,
                        baseline_pending INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        UNIQUE(release_id, name),
                        FOREIGN KEY(release_id) REFERENCES releases(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        task_id TEXT PRIMARY KEY,
                        type TEXT NOT NULL,
                        payload TEXT NOT NULL,
                        owner_release_id INTEGER NOT NULL,
                        run_id INTEGER,
                        status TEXT NOT NULL,
                        attempt_count INTEGER NOT NULL DEFAULT 0,
                        available_at_ms INTEGER NOT NULL,
                        lease_owner TEXT,
                        lease_deadline_ms INTEGER,
                        lease_epoch INTEGER NOT NULL DEFAULT 0,
                        result TEXT,
                        last_error TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(owner_release_id) REFERENCES releases(id)
                    )
                    """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_releases_build_name ON releases(build_id, name, number)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_releases_build_status_created ON releases(build_id, status, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_runs_release_status ON runs(release_id, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_status_available ON tasks(status, available_at_ms, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_owner_status ON tasks(owner_release_id, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_status_deadline ON tasks(status, lease_deadline_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_run_status ON tasks(run_id, status)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
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

    private static boolean isBusy(SQLException e) {
        Throwable cur = e;
        while (cur != null) {
            if (cur instanceof SQLException) {
                int primary = ((SQLException) cur).getErrorCode() & 0xff;
                if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
                    return true;
                }
            }
            cur = cur.getCause();
        }
        return false;
    }

    private static void pause(int attempt) {
        long sleepMs = 20L * attempt + ThreadLocalRandom.current().nextLong(0L, 20L);
        try {
            Thread.sleep(sleepMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry transaction", e);
        }
    }

    @FunctionalInterface
    public interface TransactionWork<T> {
        T run(Connection c) throws SQLException;
    }
}
