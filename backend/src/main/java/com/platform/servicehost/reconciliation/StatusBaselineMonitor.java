package com.platform.servicehost.reconciliation;

import com.platform.servicehost.config.SchedulingConfig;
import com.platform.servicehost.config.ServiceHostProperties;
import com.platform.servicehost.error.PersistenceException;
import com.platform.servicehost.host.ServiceHostAdapter;
import com.platform.servicehost.model.ServiceRecord;
import com.platform.servicehost.model.ServicesUpdatedEvent;
import com.platform.servicehost.observability.MetricsRegistry;
import com.platform.servicehost.persistence.ServiceRecordStore;
import com.platform.servicehost.state.OperationGuard;
import com.platform.servicehost.state.ServiceStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Low-frequency sweep over every known service. Corrects any status the
 * coordinator missed and picks up changes made outside this application.
 */
@Slf4j
@Component
public class StatusBaselineMonitor {

    private final ServiceRecordStore store;
    private final ServiceHostAdapter hostAdapter;
    private final OperationGuard operationGuard;
    private final PollingCoordinator pollingCoordinator;
    private final ApplicationEventPublisher eventPublisher;
    private final MetricsRegistry metricsRegistry;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final ServiceHostProperties.Baseline settings;

    private ScheduledFuture<?> schedule;

    public StatusBaselineMonitor(
            ServiceRecordStore store,
            ServiceHostAdapter hostAdapter,
            OperationGuard operationGuard,
            PollingCoordinator pollingCoordinator,
            ApplicationEventPublisher eventPublisher,
            MetricsRegistry metricsRegistry,
            @Qualifier(SchedulingConfig.TASK_SCHEDULER) TaskScheduler taskScheduler,
            ServiceHostProperties properties,
            Clock clock) {
        this.store = store;
        this.hostAdapter = hostAdapter;
        this.operationGuard = operationGuard;
        this.pollingCoordinator = pollingCoordinator;
        this.eventPublisher = eventPublisher;
        this.metricsRegistry = metricsRegistry;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.settings = properties.getBaseline();
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!settings.isEnabled()) {
            log.info("Baseline status monitor disabled");
            return;
        }
        if (schedule != null) {
            return;
        }
        Duration interval = settings.getInterval();
        schedule = taskScheduler.scheduleWithFixedDelay(this::sweep,
            clock.instant().plus(settings.getInitialDelay()), interval);
        log.info("Baseline status monitor started (interval={} ms)", interval.toMillis());
    }

    public synchronized void stop() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
            log.info("Baseline status monitor stopped");
        }
    }

    public synchronized boolean isRunning() {
        return schedule != null;
    }

    /**
     * Queries every record once and publishes a single event with the records that changed.
     *
     * @return the records whose status changed
     */
    public List<ServiceRecord> sweep() {
        long started = System.nanoTime();
        List<ServiceRecord> changed = new ArrayList<>();

        for (String id : store.getIds()) {
            if (operationGuard.isBusy(id)) {
                continue;
            }
            try {
                ServiceStatus observed = hostAdapter.queryStatus(id);
                ServiceStatus before = store.get(id).map(ServiceRecord::getStatus).orElse(null);
                Optional<ServiceRecord> applied = store.applyObservedStatus(id, observed, operationGuard::isBusy);
                if (applied.isPresent()) {
                    changed.add(applied.get());
                    metricsRegistry.recordStatusTransition("baseline", before, observed);
                    log.info("Service {} drifted {} -> {}", id, before, observed);
                    if (observed.isTransitioning()) {
                        pollingCoordinator.trackService(id);
                    }
                }
            } catch (RuntimeException e) {
                log.error("Baseline check of {} failed", id, e);
            }
        }

        if (!changed.isEmpty()) {
            try {
                store.persist();
            } catch (PersistenceException e) {
                log.error("Failed to save {} baseline status changes", changed.size(), e);
                metricsRegistry.incrementCounter("servicehost.persistence.failures");
            }
            eventPublisher.publishEvent(new ServicesUpdatedEvent(changed, clock.instant()));
        }

        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        metricsRegistry.recordBaselineSweep(elapsedMs, changed.size());
        log.debug("Baseline sweep finished in {} ms, {} changed", elapsedMs, changed.size());
        return changed;
    }
}
