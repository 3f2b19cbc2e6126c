package com.platform.servicehost.reconciliation;

import com.platform.servicehost.config.ServiceHostProperties;
import com.platform.servicehost.host.ServiceHostAdapter;
import com.platform.servicehost.model.StatusBatchEvent;
import com.platform.servicehost.observability.MetricsRegistry;
import com.platform.servicehost.state.ServiceStatus;
import com.platform.servicehost.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PollingCoordinatorTest {

    @Mock
    private TaskScheduler taskScheduler;
    @Mock
    private ServiceHostAdapter hostAdapter;

    private final List<ScheduledFuture<?>> futures = new ArrayList<>();
    private final List<Object> events = new ArrayList<>();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

    private PollingCoordinator coordinator;

    @BeforeEach
    void setUp() {
        lenient().doAnswer(invocation -> {
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            futures.add(future);
            return future;
        }).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));

        ServiceHostProperties properties = new ServiceHostProperties();
        coordinator = new PollingCoordinator(taskScheduler, Runnable::run, hostAdapter, events::add,
            new MetricsRegistry(new SimpleMeterRegistry()), properties, clock);
    }

    @Test
    void intervalFor_shouldFollowPendingSetSize() {
        assertEquals(Duration.ZERO, PollingCoordinator.intervalFor(0));
        assertEquals(Duration.ofMillis(500), PollingCoordinator.intervalFor(1));
        assertEquals(Duration.ofMillis(1000), PollingCoordinator.intervalFor(2));
        assertEquals(Duration.ofMillis(1000), PollingCoordinator.intervalFor(3));
        assertEquals(Duration.ofMillis(1500), PollingCoordinator.intervalFor(4));
        assertEquals(Duration.ofMillis(1500), PollingCoordinator.intervalFor(5));
        assertEquals(Duration.ofMillis(2000), PollingCoordinator.intervalFor(6));
        assertEquals(Duration.ofMillis(2000), PollingCoordinator.intervalFor(7));
    }

    @Test
    void trackService_firstId_shouldStartTimerAt500ms() {
        assertFalse(coordinator.isRunning());

        coordinator.trackService("a");

        assertTrue(coordinator.isRunning());
        assertEquals(Duration.ofMillis(500), coordinator.currentInterval());
        verify(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(Duration.ofMillis(500)));
    }

    @Test
    void trackService_growingSet_shouldRescheduleOnlyWhenIntervalChanges() {
        for (int i = 1; i <= 7; i++) {
            coordinator.trackService("svc-" + i);
        }

        assertEquals(Duration.ofMillis(2000), coordinator.currentInterval());
        verify(taskScheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(Duration.ofMillis(1000)));
        verify(taskScheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(Duration.ofMillis(1500)));
        verify(taskScheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(Duration.ofMillis(2000)));
        assertEquals(4, futures.size());
        // every superseded timer was cancelled, the current one was not
        for (int i = 0; i < futures.size() - 1; i++) {
            verify(futures.get(i)).cancel(false);
        }
        verify(futures.get(futures.size() - 1), never()).cancel(false);
    }

    @Test
    void trackService_sameIdTwice_shouldKeepOneEntry() {
        coordinator.trackService("a");
        coordinator.trackService("a");

        assertEquals(Set.of("a"), coordinator.pendingIds());
        assertEquals(1, futures.size());
    }

    @Test
    void tick_shouldDropSettledIdsAndPublishEveryQueriedStatus() {
        coordinator.trackService("a");
        coordinator.trackService("b");
        when(hostAdapter.queryStatus("a")).thenReturn(ServiceStatus.RUNNING);
        when(hostAdapter.queryStatus("b")).thenReturn(ServiceStatus.STARTING);

        coordinator.tick();

        assertEquals(Set.of("b"), coordinator.pendingIds());
        assertEquals(Duration.ofMillis(500), coordinator.currentInterval());
        assertEquals(1, events.size());
        StatusBatchEvent event = assertInstanceOf(StatusBatchEvent.class, events.get(0));
        assertEquals(Map.of("a", ServiceStatus.RUNNING, "b", ServiceStatus.STARTING), event.statusUpdates());
    }

    @Test
    void tick_unchangedTransitioningStatus_shouldStillBeReported() {
        coordinator.trackService("a");
        when(hostAdapter.queryStatus("a")).thenReturn(ServiceStatus.STOPPING);

        coordinator.tick();
        coordinator.tick();

        assertEquals(2, events.size());
        assertEquals(Set.of("a"), coordinator.pendingIds());
    }

    @Test
    void tick_allSettled_shouldStopTimer() {
        coordinator.trackService("a");
        when(hostAdapter.queryStatus("a")).thenReturn(ServiceStatus.STOPPED);

        coordinator.tick();

        assertFalse(coordinator.isRunning());
        assertEquals(Duration.ZERO, coordinator.currentInterval());
        verify(futures.get(0)).cancel(false);
    }

    @Test
    void trackService_afterAutoStop_shouldRestartTimer() {
        coordinator.trackService("a");
        when(hostAdapter.queryStatus("a")).thenReturn(ServiceStatus.RUNNING);
        coordinator.tick();
        assertFalse(coordinator.isRunning());

        coordinator.trackService("b");

        assertTrue(coordinator.isRunning());
        assertEquals(Duration.ofMillis(500), coordinator.currentInterval());
        assertEquals(2, futures.size());
    }

    @Test
    void tick_entryPastMaxTrackedDuration_shouldBeDroppedWhileTransitioning() {
        coordinator.trackService("stuck");
        when(hostAdapter.queryStatus("stuck")).thenReturn(ServiceStatus.STARTING);

        coordinator.tick();
        assertEquals(Set.of("stuck"), coordinator.pendingIds());

        clock.advance(Duration.ofSeconds(31));
        coordinator.tick();

        assertTrue(coordinator.pendingIds().isEmpty());
        assertFalse(coordinator.isRunning());
    }

    @Test
    void tick_withEmptySet_shouldNotQueryOrPublish() {
        coordinator.tick();

        verify(hostAdapter, never()).queryStatus(any());
        assertTrue(events.isEmpty());
    }

    @Test
    void untrackService_lastId_shouldStopTimer() {
        coordinator.trackService("a");

        coordinator.untrackService("a");

        assertFalse(coordinator.isRunning());
        verify(futures.get(0)).cancel(false);
    }

    @Test
    void stop_shouldIgnoreLaterTrackRequests() {
        coordinator.trackService("a");

        coordinator.stop();
        coordinator.trackService("b");

        assertFalse(coordinator.isRunning());
        assertTrue(coordinator.pendingIds().isEmpty());
    }

    @Test
    void tick_manyPendingIds_shouldNeverRunMoreThanFiveQueriesAtOnce() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(20);
        try {
            PollingCoordinator pooled = new PollingCoordinator(taskScheduler, pool, hostAdapter, events::add,
                new MetricsRegistry(new SimpleMeterRegistry()), new ServiceHostProperties(), clock);
            AtomicInteger inFlight = new AtomicInteger();
            AtomicInteger maxInFlight = new AtomicInteger();
            when(hostAdapter.queryStatus(anyString())).thenAnswer(invocation -> {
                int now = inFlight.incrementAndGet();
                maxInFlight.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(200);
                } finally {
                    inFlight.decrementAndGet();
                }
                return ServiceStatus.RUNNING;
            });
            for (int i = 1; i <= 12; i++) {
                pooled.trackService("svc-" + i);
            }

            pooled.tick();

            assertEquals(5, maxInFlight.get());
            verify(hostAdapter, times(12)).queryStatus(anyString());
            StatusBatchEvent event = assertInstanceOf(StatusBatchEvent.class, events.get(events.size() - 1));
            assertEquals(12, event.statusUpdates().size());
            assertTrue(pooled.pendingIds().isEmpty());
        } finally {
            pool.shutdownNow();
        }
    }
}
