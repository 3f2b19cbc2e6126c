package com.platform.servicehost.state;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Enforces at most one in-flight lifecycle operation per service id.
 * Operations on different ids never contend with each other.
 */
@Slf4j
@Component
public class OperationGuard {

    private final Map<String, String> inFlight = new ConcurrentHashMap<>();

    /**
     * Claims the service for an operation.
     *
     * @return true if the caller now owns the service, false if another operation holds it
     */
    public boolean tryAcquire(String serviceId, String operation) {
        String holder = inFlight.putIfAbsent(serviceId, operation);
        if (holder != null) {
            log.debug("Operation {} on {} rejected, {} in flight", operation, serviceId, holder);
            return false;
        }
        return true;
    }

    public void release(String serviceId) {
        inFlight.remove(serviceId);
    }

    public boolean isBusy(String serviceId) {
        return inFlight.containsKey(serviceId);
    }

    /**
     * Name of the operation currently holding the service, if any.
     */
    public Optional<String> currentOperation(String serviceId) {
        return Optional.ofNullable(inFlight.get(serviceId));
    }
}
