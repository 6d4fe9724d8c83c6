package io.poolscope.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Filesystem layout of a poolscope data root.
 */
public final class PoolScopeConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String COLLECTION_PREFIX = "scoped_";
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;

    private final Path rootDir;
    private final int busyTimeoutMs;

    public PoolScopeConfig(Path rootDir, int busyTimeoutMs) {
        this.rootDir = rootDir;
        this.busyTimeoutMs = busyTimeoutMs;
    }

    public static PoolScopeConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new PoolScopeConfig(resolved.toAbsolutePath().normalize(), DEFAULT_BUSY_TIMEOUT_MS);
    }

    /**
     * Store collection holding the scope entries of a consumer namespace.
     */
    public static String collectionName(String namespace) {
        return COLLECTION_PREFIX + sanitizeNamespace(namespace);
    }

    public static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public int busyTimeoutMs() {
        return busyTimeoutMs;
    }

    public Path dbFile() {
        return rootDir.resolve("poolscope.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("scope-audit.jsonl");
    }
}
