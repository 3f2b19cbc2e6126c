package com.platform.servicehost.state;

import com.platform.servicehost.model.OperationType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Canonical status of a managed service.
 * Every service record is always in exactly one of these states.
 *
 * The predicates below are the transition table: the orchestrator consults them
 * before making any external call, and nothing else decides which operation is legal.
 */
public enum ServiceStatus {

    /**
     * Record exists but no OS service entry backs it.
     */
    NOT_INSTALLED,

    STOPPED,

    RUNNING,

    /**
     * Start requested, waiting for the OS to report RUNNING.
     */
    STARTING,

    /**
     * Stop requested, waiting for the OS to report STOPPED.
     */
    STOPPING,

    PAUSED,

    /**
     * Last operation failed or the OS status could not be read.
     */
    ERROR,

    INSTALLING,

    UNINSTALLING;

    private static final Set<ServiceStatus> TRANSITIONING =
        EnumSet.of(STARTING, STOPPING, INSTALLING, UNINSTALLING);

    private static final Set<ServiceStatus> STARTABLE = EnumSet.of(STOPPED, NOT_INSTALLED);

    private static final Set<ServiceStatus> STOPPABLE = EnumSet.of(RUNNING, STARTING);

    private static final Set<ServiceStatus> UNINSTALLABLE = EnumSet.of(STOPPED, NOT_INSTALLED, ERROR);

    /**
     * Checks if this state is a transitional state in which no new mutating operation may begin.
     */
    public boolean isTransitioning() {
        return TRANSITIONING.contains(this);
    }

    public boolean canStart() {
        return STARTABLE.contains(this);
    }

    public boolean canStop() {
        return STOPPABLE.contains(this);
    }

    /**
     * Restart is Stop followed by Start, so it needs a stoppable service.
     */
    public boolean canRestart() {
        return this == RUNNING;
    }

    /**
     * Uninstall is also accepted from RUNNING by the orchestrator, which drives
     * a Stop first; this predicate describes the status the uninstall proper needs.
     */
    public boolean canUninstall() {
        return UNINSTALLABLE.contains(this);
    }

    /**
     * Configuration edits are allowed in any stable state.
     */
    public boolean canUpdate() {
        return !isTransitioning();
    }

    /**
     * Stable states are the ones an operation can settle in or revert to.
     */
    public boolean isStable() {
        return !isTransitioning();
    }

    /**
     * The transitional status the orchestrator publishes while an operation runs.
     */
    public static ServiceStatus transitionalFor(OperationType operation) {
        return switch (operation) {
            case INSTALL -> INSTALLING;
            case START -> STARTING;
            case STOP, RESTART -> STOPPING;
            case UNINSTALL -> UNINSTALLING;
            default -> throw new IllegalArgumentException("Operation has no transitional status: " + operation);
        };
    }

    /**
     * Maps the OS-level service state to the managed status.
     */
    public static ServiceStatus fromOsState(OsServiceState osState) {
        if (osState == null) {
            return NOT_INSTALLED;
        }
        return switch (osState) {
            case RUNNING -> RUNNING;
            case STOPPED -> STOPPED;
            case START_PENDING, CONTINUE_PENDING -> STARTING;
            case STOP_PENDING, PAUSE_PENDING -> STOPPING;
            case PAUSED -> PAUSED;
            case NOT_FOUND -> NOT_INSTALLED;
            case UNKNOWN -> STOPPED;
        };
    }
}
