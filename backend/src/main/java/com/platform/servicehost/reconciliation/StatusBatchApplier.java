package com.platform.servicehost.reconciliation;

import com.platform.servicehost.error.PersistenceException;
import com.platform.servicehost.model.ServiceRecord;
import com.platform.servicehost.model.StatusBatchEvent;
import com.platform.servicehost.observability.MetricsRegistry;
import com.platform.servicehost.persistence.ServiceRecordStore;
import com.platform.servicehost.state.OperationGuard;
import com.platform.servicehost.state.ServiceStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Writes coordinator observations back into the store. Ids with an operation
 * in flight are left alone; the operation settles their status itself.
 */
@Slf4j
@Component
public class StatusBatchApplier {

    private final ServiceRecordStore store;
    private final OperationGuard operationGuard;
    private final MetricsRegistry metricsRegistry;

    public StatusBatchApplier(ServiceRecordStore store, OperationGuard operationGuard, MetricsRegistry metricsRegistry) {
        this.store = store;
        this.operationGuard = operationGuard;
        this.metricsRegistry = metricsRegistry;
    }

    @EventListener
    public void onStatusBatch(StatusBatchEvent event) {
        int changed = 0;
        for (Map.Entry<String, ServiceStatus> update : event.statusUpdates().entrySet()) {
            String id = update.getKey();
            ServiceStatus before = store.get(id).map(ServiceRecord::getStatus).orElse(null);
            Optional<ServiceRecord> applied = store.applyObservedStatus(id, update.getValue(), operationGuard::isBusy);
            if (applied.isPresent()) {
                changed++;
                metricsRegistry.recordStatusTransition("polling", before, update.getValue());
                log.info("Service {} observed {} -> {}", id, before, update.getValue());
            }
        }
        if (changed > 0) {
            try {
                store.persist();
            } catch (PersistenceException e) {
                log.error("Failed to save {} polled status changes", changed, e);
                metricsRegistry.incrementCounter("servicehost.persistence.failures");
            }
        }
    }
}
