package com.platform.servicehost.state;

/**
 * Raw state reported by the OS service-control interface.
 * NOT_FOUND means the OS has no service registered under the queried name.
 */
public enum OsServiceState {
    STOPPED,
    START_PENDING,
    STOP_PENDING,
    RUNNING,
    CONTINUE_PENDING,
    PAUSE_PENDING,
    PAUSED,
    NOT_FOUND,
    UNKNOWN;

    /**
     * Parses the numeric state code used by the Windows service control manager.
     */
    public static OsServiceState fromScmCode(int code) {
        return switch (code) {
            case 1 -> STOPPED;
            case 2 -> START_PENDING;
            case 3 -> STOP_PENDING;
            case 4 -> RUNNING;
            case 5 -> CONTINUE_PENDING;
            case 6 -> PAUSE_PENDING;
            case 7 -> PAUSED;
            default -> UNKNOWN;
        };
    }
}
