package com.platform.servicehost.reconciliation;

import com.platform.servicehost.config.SchedulingConfig;
import com.platform.servicehost.config.ServiceHostProperties;
import com.platform.servicehost.host.ServiceHostAdapter;
import com.platform.servicehost.model.StatusBatchEvent;
import com.platform.servicehost.observability.MetricsRegistry;
import com.platform.servicehost.state.ServiceStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Follows services right after a mutating operation until their status settles.
 *
 * The pending set and the timer are owned together: every add, remove and interval
 * change happens under {@code lock}, so "set became non-empty" and "timer started"
 * can never be observed apart. The tick interval grows with the pending set to keep
 * the load on the OS service-control interface bounded.
 */
@Slf4j
@Component
public class PollingCoordinator {

    private final TaskScheduler taskScheduler;
    private final Executor queryExecutor;
    private final ServiceHostAdapter hostAdapter;
    private final ApplicationEventPublisher eventPublisher;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;

    private final Duration maxTrackedDuration;
    private final Duration queryTimeout;
    private final Semaphore querySlots;

    private final Map<String, PendingPollEntry> pending = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean ticking = new AtomicBoolean(false);

    private ScheduledFuture<?> timer;
    private Duration currentInterval = Duration.ZERO;
    private boolean stopped;

    public PollingCoordinator(
            @Qualifier(SchedulingConfig.TASK_SCHEDULER) TaskScheduler taskScheduler,
            @Qualifier(SchedulingConfig.STATUS_QUERY_EXECUTOR) Executor queryExecutor,
            ServiceHostAdapter hostAdapter,
            ApplicationEventPublisher eventPublisher,
            MetricsRegistry metricsRegistry,
            ServiceHostProperties properties,
            Clock clock) {
        this.taskScheduler = taskScheduler;
        this.queryExecutor = queryExecutor;
        this.hostAdapter = hostAdapter;
        this.eventPublisher = eventPublisher;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        this.maxTrackedDuration = properties.getPolling().getMaxTrackedDuration();
        this.queryTimeout = properties.getPolling().getQueryTimeout();
        this.querySlots = new Semaphore(Math.max(1, properties.getPolling().getMaxConcurrentQueries()));
    }

    /**
     * Tick interval for a pending set of the given size; {@link Duration#ZERO} means no timer.
     */
    public static Duration intervalFor(int pendingCount) {
        if (pendingCount <= 0) {
            return Duration.ZERO;
        }
        if (pendingCount == 1) {
            return Duration.ofMillis(500);
        }
        if (pendingCount <= 3) {
            return Duration.ofMillis(1000);
        }
        if (pendingCount <= 5) {
            return Duration.ofMillis(1500);
        }
        return Duration.ofMillis(2000);
    }

    /**
     * Starts following a service. Tracking an id again restarts its maximum tracked duration.
     */
    public void trackService(String serviceId) {
        lock.lock();
        try {
            if (stopped) {
                log.debug("Ignoring track request for {} after shutdown", serviceId);
                return;
            }
            pending.put(serviceId, new PendingPollEntry(serviceId, clock.instant()));
            reconfigureTimer();
            log.debug("Tracking {} ({} pending)", serviceId, pending.size());
        } finally {
            lock.unlock();
        }
    }

    public void untrackService(String serviceId) {
        lock.lock();
        try {
            if (pending.remove(serviceId) != null) {
                reconfigureTimer();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * One polling pass: query every pending id with bounded concurrency, drop the ones that
     * settled or ran out of time, and publish the statuses of all ids queried.
     */
    public void tick() {
        if (!ticking.compareAndSet(false, true)) {
            log.debug("Previous polling tick still running, skipping");
            return;
        }
        try {
            List<PendingPollEntry> snapshot = snapshot();
            if (snapshot.isEmpty()) {
                return;
            }

            Map<String, ServiceStatus> statuses = queryAll(snapshot);
            Instant now = clock.instant();
            int settled = 0;

            lock.lock();
            try {
                for (PendingPollEntry entry : snapshot) {
                    ServiceStatus status = statuses.get(entry.serviceId());
                    boolean done = status != null && !status.isTransitioning();
                    boolean expired = entry.isExpired(now, maxTrackedDuration);
                    if ((done || expired) && pending.remove(entry.serviceId(), entry)) {
                        settled++;
                        if (expired && !done) {
                            log.warn("Stopped tracking {} after {} without a settled status",
                                entry.serviceId(), maxTrackedDuration);
                        }
                    }
                }
                reconfigureTimer();
            } finally {
                lock.unlock();
            }

            metricsRegistry.recordPollingTick(statuses.size(), settled);
            if (!statuses.isEmpty()) {
                eventPublisher.publishEvent(new StatusBatchEvent(statuses, now));
            }
        } catch (RuntimeException e) {
            log.error("Polling tick failed", e);
        } finally {
            ticking.set(false);
        }
    }

    /**
     * Cancels the timer and forgets all pending ids. Later track requests are ignored.
     */
    public void stop() {
        lock.lock();
        try {
            stopped = true;
            pending.clear();
            reconfigureTimer();
        } finally {
            lock.unlock();
        }
        log.info("Polling coordinator stopped");
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return timer != null;
        } finally {
            lock.unlock();
        }
    }

    public Duration currentInterval() {
        lock.lock();
        try {
            return currentInterval;
        } finally {
            lock.unlock();
        }
    }

    public Set<String> pendingIds() {
        lock.lock();
        try {
            return Set.copyOf(pending.keySet());
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private void reconfigureTimer() {
        Duration wanted = intervalFor(pending.size());
        metricsRegistry.setPendingPolls(pending.size());
        if (timer != null && wanted.equals(currentInterval)) {
            return;
        }
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
        currentInterval = wanted;
        if (wanted.isZero()) {
            log.debug("Pending set empty, polling timer stopped");
            return;
        }
        timer = taskScheduler.scheduleWithFixedDelay(this::tick, clock.instant().plus(wanted), wanted);
        log.debug("Polling every {} ms for {} pending services", wanted.toMillis(), pending.size());
    }

    private List<PendingPollEntry> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(pending.values());
        } finally {
            lock.unlock();
        }
    }

    private Map<String, ServiceStatus> queryAll(List<PendingPollEntry> entries) {
        Map<String, CompletableFuture<ServiceStatus>> inFlight = new LinkedHashMap<>();
        for (PendingPollEntry entry : entries) {
            String id = entry.serviceId();
            try {
                if (!querySlots.tryAcquire(queryTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("No status query slot free after {} ms, deferring remaining ids", queryTimeout.toMillis());
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while scheduling status queries");
                break;
            }
            try {
                inFlight.put(id, CompletableFuture.supplyAsync(() -> {
                    try {
                        return hostAdapter.queryStatus(id);
                    } finally {
                        querySlots.release();
                    }
                }, queryExecutor));
            } catch (RuntimeException e) {
                querySlots.release();
                log.warn("Could not submit status query for {}: {}", id, e.getMessage());
            }
        }

        Map<String, ServiceStatus> statuses = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<ServiceStatus>> query : inFlight.entrySet()) {
            try {
                statuses.put(query.getKey(), query.getValue().get(queryTimeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                log.warn("Status query for {} timed out after {} ms", query.getKey(), queryTimeout.toMillis());
            } catch (ExecutionException e) {
                log.warn("Status query for {} failed", query.getKey(), e.getCause());
                statuses.put(query.getKey(), ServiceStatus.ERROR);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for status queries");
                break;
            }
        }
        return statuses;
    }
}
