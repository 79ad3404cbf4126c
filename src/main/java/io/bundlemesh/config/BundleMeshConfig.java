package io.bundlemesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class BundleMeshConfig {
    public static final String SETTINGS_FILE = "bundlemesh-settings.json";
    public static final long DEFAULT_CAPACITY_BYTES = 64L * 1024L * 1024L;
    public static final int DEFAULT_HOP_LIMIT = 30;
    public static final long DEFAULT_TTL_MS = 24L * 60L * 60L * 1000L;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 10L * 60L * 1000L;
    public static final long DEFAULT_REAPER_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_RECEIVE_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 5_000L;
    public static final int DEFAULT_MAX_WORKERS = 8;
    public static final int DEFAULT_PAGE_SIZE = 64;
    public static final int DEFAULT_LISTEN_PORT = 4556;
    public static final int DEFAULT_HTTP_PORT = 9464;

    private final Path rootDir;

    public BundleMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static BundleMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new BundleMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("bundlemesh.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path secretsRoot() {
        return securityRoot().resolve("secrets");
    }
}
