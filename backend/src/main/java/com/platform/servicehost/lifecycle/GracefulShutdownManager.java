package com.platform.servicehost.lifecycle;

import com.platform.servicehost.config.SchedulingConfig;
import com.platform.servicehost.observability.MetricsRegistry;
import com.platform.servicehost.reconciliation.PollingCoordinator;
import com.platform.servicehost.reconciliation.StatusBaselineMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops status monitoring before the context tears down its executors.
 *
 * Order:
 * 1. Cancel the baseline sweep
 * 2. Stop the polling coordinator and drop its pending set
 * 3. Drain in-flight status queries
 */
@Slf4j
@Component
public class GracefulShutdownManager implements ApplicationListener<ContextClosedEvent> {
    
    private final StatusBaselineMonitor baselineMonitor;
    private final PollingCoordinator pollingCoordinator;
    private final ThreadPoolTaskExecutor statusQueryExecutor;
    private final MetricsRegistry metricsRegistry;
    
    @Value("${servicehost.shutdown.timeout-seconds:10}")
    private int shutdownTimeoutSeconds;
    
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    
    public GracefulShutdownManager(
            StatusBaselineMonitor baselineMonitor,
            PollingCoordinator pollingCoordinator,
            @Qualifier(SchedulingConfig.STATUS_QUERY_EXECUTOR) ThreadPoolTaskExecutor statusQueryExecutor,
            MetricsRegistry metricsRegistry) {
        this.baselineMonitor = baselineMonitor;
        this.pollingCoordinator = pollingCoordinator;
        this.statusQueryExecutor = statusQueryExecutor;
        this.metricsRegistry = metricsRegistry;
    }
    
    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        performGracefulShutdown();
    }
    
    public void performGracefulShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return;
        }
        
        Instant started = Instant.now();
        log.info("Graceful shutdown initiated");
        
        log.info("[1/3] Stopping baseline status monitor...");
        baselineMonitor.stop();
        
        log.info("[2/3] Stopping polling coordinator...");
        pollingCoordinator.stop();
        
        log.info("[3/3] Draining status queries...");
        drainStatusQueries();
        
        metricsRegistry.incrementCounter("servicehost.lifecycle.shutdown", "status", "complete");
        log.info("Graceful shutdown complete ({} ms)", Duration.between(started, Instant.now()).toMillis());
    }
    
    /**
     * In-flight operations are not waited for; their guards die with the process.
     */
    private void drainStatusQueries() {
        ThreadPoolExecutor executor = statusQueryExecutor.getThreadPoolExecutor();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Status queries still running after {} s, interrupting", shutdownTimeoutSeconds);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining status queries");
            executor.shutdownNow();
        }
    }
}
