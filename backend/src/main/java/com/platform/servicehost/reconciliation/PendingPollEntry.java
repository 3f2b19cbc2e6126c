package com.platform.servicehost.reconciliation;

import java.time.Duration;
import java.time.Instant;

/**
 * A service id the coordinator is following, with the time it started following it.
 */
public record PendingPollEntry(String serviceId, Instant addedAt) {

    public boolean isExpired(Instant now, Duration maxTrackedDuration) {
        return Duration.between(addedAt, now).compareTo(maxTrackedDuration) >= 0;
    }
}
