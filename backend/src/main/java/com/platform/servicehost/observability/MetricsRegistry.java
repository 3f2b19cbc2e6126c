package com.platform.servicehost.observability;

import com.platform.servicehost.model.OperationType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for service host metrics.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final AtomicInteger pendingPolls = new AtomicInteger(0);
    private final AtomicInteger managedServices = new AtomicInteger(0);
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        
        Gauge.builder("servicehost.polling.pending", pendingPolls, AtomicInteger::get)
            .description("Service ids tracked by the polling coordinator")
            .register(meterRegistry);
        Gauge.builder("servicehost.services.managed", managedServices, AtomicInteger::get)
            .register(meterRegistry);
        
        log.info("Metrics registry initialized");
    }
    
    /**
     * Record latency and outcome of a lifecycle operation.
     */
    public void recordOperation(OperationType operation, boolean success, long elapsedMs) {
        String key = operation.name() + "." + success;
        Timer timer = timers.computeIfAbsent(key, k ->
            Timer.builder("servicehost.operation.latency")
                .tag("operation", operation.name())
                .tag("success", String.valueOf(success))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(Duration.ofMillis(elapsedMs));
        
        incrementCounter("servicehost.operation.total",
            "operation", operation.name(), "success", String.valueOf(success));
    }
    
    public void recordStatusTransition(String source, Object fromStatus, Object toStatus) {
        String from = fromStatus != null ? fromStatus.toString() : "null";
        String to = toStatus != null ? toStatus.toString() : "unknown";
        
        incrementCounter("servicehost.status.transition",
            "source", source,
            "from", from,
            "to", to);
        
        log.debug("Recorded status transition ({}): {} -> {}", source, from, to);
    }
    
    public void recordConflict(OperationType operation) {
        incrementCounter("servicehost.operation.conflict", "operation", operation.name());
    }
    
    public void recordBaselineSweep(long elapsedMs, int changed) {
        timers.computeIfAbsent("baseline.sweep", k ->
            Timer.builder("servicehost.baseline.sweep.duration")
                .register(meterRegistry))
            .record(Duration.ofMillis(elapsedMs));
        if (changed > 0) {
            incrementCounter("servicehost.baseline.changes", "count", changed > 5 ? "many" : String.valueOf(changed));
        }
    }
    
    public void recordPollingTick(int queried, int completed) {
        incrementCounter("servicehost.polling.ticks");
        if (completed > 0) {
            counters.computeIfAbsent("servicehost.polling.completed", k ->
                Counter.builder(k).register(meterRegistry))
                .increment(completed);
        }
        log.debug("Polling tick queried {} ids, {} settled", queried, completed);
    }
    
    public void setPendingPolls(int size) {
        pendingPolls.set(size);
    }
    
    public void setManagedServices(int count) {
        managedServices.set(count);
    }
    
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, k ->
            Counter.builder(name)
                .register(meterRegistry))
            .increment();
    }
    
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
}
