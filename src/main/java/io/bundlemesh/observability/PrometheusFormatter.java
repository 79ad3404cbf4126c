package io.bundlemesh.observability;

import io.bundlemesh.runtime.BundleNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prometheus text exposition of node stats. Only aggregate counts appear;
 * bundle ids, node addresses and payloads never do.
 */
public final class PrometheusFormatter {
    private static final Map<String, String> COUNTER_HELP = new LinkedHashMap<>();

    static {
        COUNTER_HELP.put(BundleMetrics.CREATED, "Bundles created on this node");
        COUNTER_HELP.put(BundleMetrics.RECEIVED, "Bundles received from neighbors and stored");
        COUNTER_HELP.put(BundleMetrics.FORWARDED, "Bundles acknowledged by a neighbor");
        COUNTER_HELP.put(BundleMetrics.DELIVERED, "Bundles delivered to local consumers");
        COUNTER_HELP.put(BundleMetrics.EXPIRED, "Bundles removed after expiry");
        COUNTER_HELP.put(BundleMetrics.EVICTED, "Bundles evicted to make room");
        COUNTER_HELP.put(BundleMetrics.QUARANTINED, "Bundles rejected on validation");
        COUNTER_HELP.put(BundleMetrics.CUSTODY_LOST, "Custody bundles evicted before acknowledgement");
        COUNTER_HELP.put(BundleMetrics.DUPLICATE, "Duplicate bundles ignored");
    }

    private PrometheusFormatter() {
    }

    public static String format(BundleNode.StatsOutcome stats) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : COUNTER_HELP.entrySet()) {
            appendCounter(sb, e.getKey(), e.getValue(), stats.counters());
        }
        appendGauge(sb, "bundlemesh_store_bundles", "Bundles currently stored", null, null, stats.bundleCount());
        appendGauge(sb, "bundlemesh_store_used_bytes", "Encoded bytes currently stored", null, null, stats.usedBytes());
        appendGauge(sb, "bundlemesh_store_capacity_bytes", "Configured store capacity", null, null, stats.capacityBytes());
        appendMapGauge(sb, "bundlemesh_pending_bundles", "Unexpired, unacknowledged bundles by priority", "priority", stats.pendingByPriority());
        appendGauge(sb, "bundlemesh_custody_pending", "Custody bundles awaiting acknowledgement", null, null, stats.custodyPending());
        appendGauge(sb, "bundlemesh_queue_undelivered", "Per-neighbor queue entries not yet delivered", null, null, stats.queuedUndelivered());
        appendGauge(sb, "bundlemesh_deliveries", "Local deliveries recorded", null, null, stats.deliveries());
        appendGauge(sb, "bundlemesh_neighbors", "Known neighbors", "state", "all", stats.neighbors());
        appendGauge(sb, "bundlemesh_neighbors", "Known neighbors", "state", "suspect", stats.suspectNeighbors());
        appendGauge(sb, "bundlemesh_neighbors", "Known neighbors", "state", "backoff", stats.neighborsInBackoff());
        appendGauge(sb, "bundlemesh_active_sessions", "Exchange sessions currently running", null, null, stats.activeSessions());
        return sb.toString();
    }

    private static void appendCounter(StringBuilder sb, String name, String help, List<BundleMetrics.Counter> counters) {
        String metric = "bundlemesh_bundles_" + name + "_total";
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" counter").append('\n');
        for (BundleMetrics.Counter c : counters) {
            if (!name.equals(c.metric())) {
                continue;
            }
            sb.append(metric).append('{')
                    .append("priority=\"").append(escapeLabel(c.priority())).append("\",")
                    .append("topic=\"").append(escapeLabel(c.topic())).append("\"}")
                    .append(' ').append(c.value()).append('\n');
        }
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
