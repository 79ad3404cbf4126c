package io.bundlemesh.observability;

import io.bundlemesh.model.Priority;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Aggregate bundle counters kept in the node database, so every process that
 * opens the same root sees the same totals. Counters are keyed by metric,
 * priority and topic only.
 */
public final class BundleMetrics {
    public static final String CREATED = "created";
    public static final String RECEIVED = "received";
    public static final String FORWARDED = "forwarded";
    public static final String DELIVERED = "delivered";
    public static final String EXPIRED = "expired";
    public static final String EVICTED = "evicted";
    public static final String QUARANTINED = "quarantined";
    public static final String CUSTODY_LOST = "custody_lost";
    public static final String DUPLICATE = "duplicate";

    private BundleMetrics() {
    }

    public static void increment(Connection conn, String metric, Priority priority, String topic, long delta)
            throws SQLException {
        if (delta == 0L) {
            return;
        }
        try (PreparedStatement ps = conn.prepareStatement("""
                INSERT INTO metric_counters(metric, priority, topic, value) VALUES(?,?,?,?)
                ON CONFLICT(metric, priority, topic) DO UPDATE SET value = value + excluded.value
                """)) {
            ps.setString(1, metric);
            ps.setString(2, priority == null ? "unknown" : priority.label());
            ps.setString(3, topic == null ? "" : topic);
            ps.setLong(4, delta);
            ps.executeUpdate();
        }
    }

    public static List<Counter> read(Connection conn) throws SQLException {
        List<Counter> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT metric, priority, topic, value FROM metric_counters ORDER BY metric, priority, topic");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new Counter(
                        rs.getString("metric"),
                        rs.getString("priority").toLowerCase(Locale.ROOT),
                        rs.getString("topic"),
                        rs.getLong("value")
                ));
            }
        }
        return out;
    }

    public record Counter(String metric, String priority, String topic, long value) {
    }
}
