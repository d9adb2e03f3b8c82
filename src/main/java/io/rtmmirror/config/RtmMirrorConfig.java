package io.rtmmirror.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class RtmMirrorConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DB_FILE_NAME = "rtm-mirror.db";
    public static final String SETTINGS_FILE_NAME = "rtm-mirror-settings.json";

    private final Path rootDir;

    public RtmMirrorConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static RtmMirrorConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new RtmMirrorConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILE_NAME);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("sync-audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
