package com.platform.servicehost.model;

import java.time.Instant;
import java.util.List;

/**
 * Baseline sweep result: every record whose status changed since the previous sweep.
 */
public record ServicesUpdatedEvent(List<ServiceRecord> changed, Instant timestamp) {

    public ServicesUpdatedEvent {
        changed = List.copyOf(changed);
    }
}
