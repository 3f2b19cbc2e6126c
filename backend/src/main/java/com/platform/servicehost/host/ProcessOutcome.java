package com.platform.servicehost.host;

/**
 * Result of one external command invocation.
 *
 * @param exitCode  process exit code, or -1 when the process never ran to completion
 * @param stdout    captured standard output, truncated to a bounded size
 * @param stderr    captured standard error, or the launch failure message
 * @param timedOut  the process exceeded its timeout and was killed
 * @param elapsedMs wall-clock duration of the invocation
 */
public record ProcessOutcome(int exitCode, String stdout, String stderr, boolean timedOut, long elapsedMs) {

    public static ProcessOutcome launchFailed(String message, long elapsedMs) {
        return new ProcessOutcome(-1, "", message, false, elapsedMs);
    }

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }

    /**
     * Captured output for error details: stderr first, then stdout.
     */
    public String diagnostic() {
        StringBuilder sb = new StringBuilder();
        if (stderr != null && !stderr.isBlank()) {
            sb.append(stderr.trim());
        }
        if (stdout != null && !stdout.isBlank()) {
            if (sb.length() > 0) {
                sb.append(System.lineSeparator());
            }
            sb.append(stdout.trim());
        }
        return sb.toString();
    }
}
