package io.bundlemesh.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.bundlemesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Tunables of one node, read from {@code bundlemesh-settings.json} in the data
 * root. Missing or out-of-range fields fall back to defaults.
 */
public record NodeSettings(
        long capacityBytes,
        int defaultHopLimit,
        long defaultTtlMs,
        long baseBackoffMs,
        long maxBackoffMs,
        long reaperIntervalMs,
        long receiveTimeoutMs,
        long shutdownGraceMs,
        int maxWorkers,
        int pageSize,
        List<String> subscriptions,
        List<String> trustedNeighbors,
        boolean trustedMember
) {
    public NodeSettings {
        subscriptions = List.copyOf(subscriptions == null ? List.of() : subscriptions);
        trustedNeighbors = List.copyOf(trustedNeighbors == null ? List.of() : trustedNeighbors);
    }

    public static NodeSettings defaults() {
        return new NodeSettings(
                BundleMeshConfig.DEFAULT_CAPACITY_BYTES,
                BundleMeshConfig.DEFAULT_HOP_LIMIT,
                BundleMeshConfig.DEFAULT_TTL_MS,
                BundleMeshConfig.DEFAULT_BASE_BACKOFF_MS,
                BundleMeshConfig.DEFAULT_MAX_BACKOFF_MS,
                BundleMeshConfig.DEFAULT_REAPER_INTERVAL_MS,
                BundleMeshConfig.DEFAULT_RECEIVE_TIMEOUT_MS,
                BundleMeshConfig.DEFAULT_SHUTDOWN_GRACE_MS,
                BundleMeshConfig.DEFAULT_MAX_WORKERS,
                BundleMeshConfig.DEFAULT_PAGE_SIZE,
                List.of(),
                List.of(),
                false
        );
    }

    /**
     * Loads the settings file if it exists, defaults otherwise.
     */
    public static NodeSettings load(Path file) {
        NodeSettings defaults = defaults();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load node settings: " + file, e);
        }
    }

    public void save(Path file) {
        SettingsFile raw = new SettingsFile(
                capacityBytes,
                defaultHopLimit,
                defaultTtlMs,
                baseBackoffMs,
                maxBackoffMs,
                reaperIntervalMs,
                receiveTimeoutMs,
                shutdownGraceMs,
                maxWorkers,
                pageSize,
                subscriptions,
                trustedNeighbors,
                trustedMember
        );
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, Jsons.toJson(raw));
        } catch (IOException e) {
            throw new RuntimeException("Failed to write node settings: " + file, e);
        }
    }

    public NodeSettings withCapacityBytes(long value) {
        return new NodeSettings(value, defaultHopLimit, defaultTtlMs, baseBackoffMs, maxBackoffMs,
                reaperIntervalMs, receiveTimeoutMs, shutdownGraceMs, maxWorkers, pageSize,
                subscriptions, trustedNeighbors, trustedMember);
    }

    public NodeSettings withBackoff(long baseMs, long maxMs) {
        return new NodeSettings(capacityBytes, defaultHopLimit, defaultTtlMs, baseMs, Math.max(baseMs, maxMs),
                reaperIntervalMs, receiveTimeoutMs, shutdownGraceMs, maxWorkers, pageSize,
                subscriptions, trustedNeighbors, trustedMember);
    }

    public NodeSettings withReceiveTimeoutMs(long value) {
        return new NodeSettings(capacityBytes, defaultHopLimit, defaultTtlMs, baseBackoffMs, maxBackoffMs,
                reaperIntervalMs, value, shutdownGraceMs, maxWorkers, pageSize,
                subscriptions, trustedNeighbors, trustedMember);
    }

    public NodeSettings withTrust(List<String> neighbors, boolean member) {
        return new NodeSettings(capacityBytes, defaultHopLimit, defaultTtlMs, baseBackoffMs, maxBackoffMs,
                reaperIntervalMs, receiveTimeoutMs, shutdownGraceMs, maxWorkers, pageSize,
                subscriptions, normalizeAddresses(neighbors), member);
    }

    public boolean isTrustedNeighbor(String nodeAddress) {
        return nodeAddress != null && trustedNeighbors.contains(nodeAddress.toLowerCase(Locale.ROOT));
    }

    static NodeSettings fromFile(SettingsFile file, NodeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long capacity = sanitizeLong(file.capacityBytes(), defaults.capacityBytes(), 1_024L);
        int hopLimit = Math.min(255, sanitizeInt(file.defaultHopLimit(), defaults.defaultHopLimit(), 1));
        long ttl = sanitizeLong(file.defaultTtlMs(), defaults.defaultTtlMs(), 1_000L);
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        long reaperInterval = sanitizeLong(file.reaperIntervalMs(), defaults.reaperIntervalMs(), 100L);
        long receiveTimeout = sanitizeLong(file.receiveTimeoutMs(), defaults.receiveTimeoutMs(), 10L);
        long grace = sanitizeLong(file.shutdownGraceMs(), defaults.shutdownGraceMs(), 0L);
        int workers = sanitizeInt(file.maxWorkers(), defaults.maxWorkers(), 1);
        int pageSize = sanitizeInt(file.pageSize(), defaults.pageSize(), 1);
        List<String> subscriptions = sanitizeTopics(file.subscriptions());
        List<String> trusted = normalizeAddresses(file.trustedNeighbors());
        boolean member = file.trustedMember() == null ? defaults.trustedMember() : file.trustedMember();
        return new NodeSettings(capacity, hopLimit, ttl, baseBackoff, maxBackoff, reaperInterval,
                receiveTimeout, grace, workers, pageSize, subscriptions, trusted, member);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static List<String> sanitizeTopics(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String topic : raw) {
            if (topic != null && !topic.isBlank()) {
                out.add(topic.trim());
            }
        }
        return new ArrayList<>(out);
    }

    private static List<String> normalizeAddresses(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        raw.stream()
                .filter(Objects::nonNull)
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .filter(value -> !value.isEmpty())
                .forEach(out::add);
        return new ArrayList<>(out);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SettingsFile(
            Long capacityBytes,
            Integer defaultHopLimit,
            Long defaultTtlMs,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long reaperIntervalMs,
            Long receiveTimeoutMs,
            Long shutdownGraceMs,
            Integer maxWorkers,
            Integer pageSize,
            List<String> subscriptions,
            List<String> trustedNeighbors,
            Boolean trustedMember
    ) {
    }
}
