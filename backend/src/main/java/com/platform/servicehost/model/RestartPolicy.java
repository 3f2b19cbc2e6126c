package com.platform.servicehost.model;

/**
 * Restart-on-exit policy: when enabled, the hosted process is relaunched
 * whenever it exits with {@code triggerExitCode}.
 */
public record RestartPolicy(boolean enabled, int triggerExitCode) {

    public static final int DEFAULT_TRIGGER_EXIT_CODE = 99;

    public static RestartPolicy disabled() {
        return new RestartPolicy(false, DEFAULT_TRIGGER_EXIT_CODE);
    }

    public static RestartPolicy onExitCode(int exitCode) {
        return new RestartPolicy(true, exitCode);
    }
}
