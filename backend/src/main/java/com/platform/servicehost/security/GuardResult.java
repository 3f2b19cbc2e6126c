package com.platform.servicehost.security;

/**
 * Verdict of a guard check. A rejection always carries a human-readable reason.
 */
public record GuardResult(boolean accepted, String reason) {

    private static final GuardResult ACCEPTED = new GuardResult(true, null);

    public static GuardResult accept() {
        return ACCEPTED;
    }

    public static GuardResult reject(String reason) {
        return new GuardResult(false, reason);
    }

    public boolean isRejected() {
        return !accepted;
    }
}
