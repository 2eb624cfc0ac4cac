package com.assistants.common.config;

import java.nio.file.Path;

/**
 * Project-relative configuration paths.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static final String PROJECT_DIRNAME = ".assistants";
    public static final String CONFIG_FILENAME = "config.json";

    /**
     * Per-project state directory: {@code <cwd>/.assistants}. Schedules and
     * their locks live underneath it.
     */
    public static Path resolveProjectDir(Path cwd) {
        return cwd.resolve(PROJECT_DIRNAME);
    }

    /**
     * Project config file: {@code <cwd>/.assistants/config.json}.
     */
    public static Path resolveConfigPath(Path cwd) {
        return resolveProjectDir(cwd).resolve(CONFIG_FILENAME);
    }

    /**
     * Current working directory of the JVM.
     */
    public static Path currentDir() {
        return Path.of(System.getProperty("user.dir"));
    }
}
