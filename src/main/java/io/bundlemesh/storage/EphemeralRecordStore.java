package io.bundlemesh.storage;

import io.bundlemesh.model.EphemeralRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Short-lived records tied to a parent's closure time. The purge time is fixed
 * at creation: this class offers no update, and the schema rejects one.
 */
public final class EphemeralRecordStore {
    private final Database database;

    public EphemeralRecordStore(Database database) {
        this.database = database;
    }

    public EphemeralRecord attach(String parentId, String kind, String body, long purgeAtMs, long nowMs) {
        if (parentId == null || parentId.isBlank()) {
            throw new IllegalArgumentException("parentId must not be blank");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind must not be blank");
        }
        if (purgeAtMs <= nowMs) {
            throw new IllegalArgumentException("purgeAtMs must be in the future");
        }
        EphemeralRecord record = new EphemeralRecord(
                UUID.randomUUID().toString(),
                parentId.trim(),
                kind.trim(),
                body == null ? "" : body,
                purgeAtMs,
                nowMs
        );
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "INSERT INTO ephemeral_records(record_id, parent_id, kind, body, purge_at_ms, created_at_ms) VALUES(?,?,?,?,?,?)")) {
            ps.setString(1, record.recordId());
            ps.setString(2, record.parentId());
            ps.setString(3, record.kind());
            ps.setString(4, record.body());
            ps.setLong(5, record.purgeAtMs());
            ps.setLong(6, record.createdAtMs());
            ps.executeUpdate();
            return record;
        } catch (SQLException e) {
            throw new StorageException("Failed to attach ephemeral record to " + parentId, e);
        }
    }

    public Optional<EphemeralRecord> get(String recordId) {
        List<EphemeralRecord> rows = query("SELECT * FROM ephemeral_records WHERE record_id=?", recordId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<EphemeralRecord> listByParent(String parentId) {
        return query("SELECT * FROM ephemeral_records WHERE parent_id=? ORDER BY created_at_ms, record_id", parentId);
    }

    /**
     * Deletes records whose purge time has passed. Only {@link ExpiryReaper} calls this.
     */
    int purgeDue(long nowMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM ephemeral_records WHERE purge_at_ms < ?")) {
            ps.setLong(1, nowMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to purge ephemeral records", e);
        }
    }

    private List<EphemeralRecord> query(String sql, String arg) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, arg);
            List<EphemeralRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new EphemeralRecord(
                            rs.getString("record_id"),
                            rs.getString("parent_id"),
                            rs.getString("kind"),
                            rs.getString("body"),
                            rs.getLong("purge_at_ms"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to read ephemeral records", e);
        }
    }
}
