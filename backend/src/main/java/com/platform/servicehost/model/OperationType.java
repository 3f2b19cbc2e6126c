package com.platform.servicehost.model;

/**
 * Lifecycle operations the orchestrator and the host adapter perform.
 */
public enum OperationType {
    INSTALL,
    UNINSTALL,
    START,
    STOP,
    RESTART,
    UPDATE,
    QUERY_STATUS
}
