package io.bundlemesh.storage;

import io.bundlemesh.config.BundleMeshConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "bundlemesh.schema.migration.v1";
    private final BundleMeshConfig config;
    private final String jdbcUrl;

    public Database(BundleMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", "5000");
        props.setProperty("foreign_keys", "true");
        props.setProperty("transaction_mode", "IMMEDIATE");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    public Path file() {
        return config.dbFile();
    }

    /**
     * Removes the database and its WAL side files. Callers must have closed every
     * component that holds connections.
     */
    public void deleteFiles() {
        Path db = config.dbFile();
        try {
            Files.deleteIfExists(db);
            Files.deleteIfExists(db.resolveSibling(db.getFileName() + "-wal"));
            Files.deleteIfExists(db.resolveSibling(db.getFileName() + "-shm"));
        } catch (IOException e) {
            throw new StorageException("Failed to delete database files: " + db, e);
        }
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
        } catch (IOException e) {
            throw new StorageException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS bundles (
                        bundle_id TEXT PRIMARY KEY,
                        topic TEXT NOT NULL,
                        destination TEXT NOT NULL,
                        priority_rank INTEGER NOT NULL,
                        audience TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL,
                        hop_limit INTEGER NOT NULL,
                        hop_count INTEGER NOT NULL,
                        custody_requested INTEGER NOT NULL,
                        custody_state TEXT NOT NULL,
                        custody_holder TEXT,
                        received_from TEXT,
                        ack_for TEXT,
                        size_bytes INTEGER NOT NULL,
                        stored_at_ms INTEGER NOT NULL,
                        encoded BLOB NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS queue_state (
                        bundle_id TEXT NOT NULL,
                        neighbor_id TEXT NOT NULL,
                        attempts INTEGER NOT NULL DEFAULT 0,
                        last_attempt_ms INTEGER NOT NULL DEFAULT 0,
                        next_attempt_ms INTEGER NOT NULL DEFAULT 0,
                        delivered INTEGER NOT NULL DEFAULT 0,
                        PRIMARY KEY(bundle_id, neighbor_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS ephemeral_records (
                        record_id TEXT PRIMARY KEY,
                        parent_id TEXT NOT NULL,
                        kind TEXT NOT NULL,
                        body TEXT NOT NULL,
                        purge_at_ms INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS deliveries (
                        sequence INTEGER PRIMARY KEY AUTOINCREMENT,
                        bundle_id TEXT NOT NULL UNIQUE,
                        topic TEXT NOT NULL,
                        delivered_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS subscriptions (
                        topic TEXT PRIMARY KEY,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS neighbors (
                        neighbor_id TEXT PRIMARY KEY,
                        last_contact_ms INTEGER NOT NULL DEFAULT 0,
                        last_outcome TEXT NOT NULL DEFAULT '',
                        consecutive_failures INTEGER NOT NULL DEFAULT 0,
                        next_contact_ms INTEGER NOT NULL DEFAULT 0,
                        suspect_count INTEGER NOT NULL DEFAULT 0,
                        bundles_sent INTEGER NOT NULL DEFAULT 0,
                        bundles_received INTEGER NOT NULL DEFAULT 0
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS metric_counters (
                        metric TEXT NOT NULL,
                        priority TEXT NOT NULL,
                        topic TEXT NOT NULL,
                        value INTEGER NOT NULL,
                        PRIMARY KEY(metric, priority, topic)
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260301_001_bundle_indexes",
                "Index bundles by expiry, topic and scheduling order",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_bundles_expires ON bundles(expires_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_bundles_topic ON bundles(topic)",
                        "CREATE INDEX IF NOT EXISTS idx_bundles_order ON bundles(priority_rank, expires_at_ms, bundle_id)",
                        "CREATE INDEX IF NOT EXISTS idx_bundles_ack_for ON bundles(ack_for)",
                        "CREATE INDEX IF NOT EXISTS idx_queue_neighbor ON queue_state(neighbor_id, delivered, next_attempt_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_deliveries_topic ON deliveries(topic, sequence)"
                )
        ));
        steps.add(new MigrationStep(
                "20260301_002_ephemeral_purge_guard",
                "Index ephemeral records and make purge_at_ms write-once",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_ephemeral_parent ON ephemeral_records(parent_id)",
                        "CREATE INDEX IF NOT EXISTS idx_ephemeral_purge ON ephemeral_records(purge_at_ms)",
                        """
                        CREATE TRIGGER IF NOT EXISTS trg_ephemeral_purge_at_write_once
                        BEFORE UPDATE OF purge_at_ms ON ephemeral_records
                        WHEN NEW.purge_at_ms IS NOT OLD.purge_at_ms
                        BEGIN
                            SELECT RAISE(ABORT, 'purge_at_ms is write-once');
                        END
                        """
                )
        ));
        steps.add(new MigrationStep(
                "20260415_003_custody_ack_source",
                "Record the signer address of custody acks",
                List.of("ALTER TABLE bundles ADD COLUMN ack_source TEXT")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        String checksum = checksum(step);
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new StorageException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new StorageException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new StorageException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
