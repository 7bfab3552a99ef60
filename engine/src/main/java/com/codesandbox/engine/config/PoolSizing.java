package com.codesandbox.engine.config;

/** Worker pool size: the configured value, or clamp(cpus * 4, 4, 32) when unset. */
public final class PoolSizing {

    static final int MIN_AUTO = 4;
    static final int MAX_AUTO = 32;

    private PoolSizing() {}

    public static int resolve(int configured) {
        return resolve(configured, Runtime.getRuntime().availableProcessors());
    }

    static int resolve(int configured, int cpus) {
        if (configured > 0) {
            return configured;
        }
        return Math.max(MIN_AUTO, Math.min(MAX_AUTO, cpus * 4));
    }
}
