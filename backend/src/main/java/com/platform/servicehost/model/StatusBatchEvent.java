package com.platform.servicehost.model;

import com.platform.servicehost.state.ServiceStatus;

import java.time.Instant;
import java.util.Map;

/**
 * One coordinator tick: the status of every id queried in that tick, changed or not.
 */
public record StatusBatchEvent(Map<String, ServiceStatus> statusUpdates, Instant timestamp) {

    public StatusBatchEvent {
        statusUpdates = Map.copyOf(statusUpdates);
    }
}
