package com.platform.servicehost.persistence;

import com.platform.servicehost.model.ServiceRecord;
import com.platform.servicehost.observability.MetricsRegistry;
import com.platform.servicehost.state.ServiceStatus;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-memory authoritative collection of service records.
 *
 * The map is guarded by {@code lock}; {@link #persist()} snapshots and writes under a
 * second lock so the file on disk always reflects the latest snapshot written.
 */
@Slf4j
@Component
public class ServiceRecordStore {
    
    private final ServiceRecordRepository repository;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    
    private final Map<String, ServiceRecord> records = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock persistLock = new ReentrantLock();
    
    public ServiceRecordStore(ServiceRecordRepository repository, MetricsRegistry metricsRegistry, Clock clock) {
        this.repository = repository;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }
    
    @PostConstruct
    public void load() {
        List<ServiceRecord> loaded = repository.loadAll();
        lock.lock();
        try {
            records.clear();
            for (ServiceRecord record : loaded) {
                records.put(record.getId(), record);
            }
            metricsRegistry.setManagedServices(records.size());
        } finally {
            lock.unlock();
        }
        log.info("Loaded {} service records", loaded.size());
    }
    
    public List<ServiceRecord> getAll() {
        lock.lock();
        try {
            return List.copyOf(records.values());
        } finally {
            lock.unlock();
        }
    }
    
    public List<String> getIds() {
        lock.lock();
        try {
            return new ArrayList<>(records.keySet());
        } finally {
            lock.unlock();
        }
    }
    
    public Optional<ServiceRecord> get(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(records.get(id));
        } finally {
            lock.unlock();
        }
    }
    
    public boolean contains(String id) {
        lock.lock();
        try {
            return records.containsKey(id);
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * @return false if a record with the same id already exists
     */
    public boolean add(ServiceRecord record) {
        lock.lock();
        try {
            if (records.containsKey(record.getId())) {
                return false;
            }
            records.put(record.getId(), record);
            metricsRegistry.setManagedServices(records.size());
            return true;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Atomically replaces a record with {@code change} applied to its current value.
     */
    public Optional<ServiceRecord> update(String id, UnaryOperator<ServiceRecord> change) {
        lock.lock();
        try {
            ServiceRecord current = records.get(id);
            if (current == null) {
                return Optional.empty();
            }
            ServiceRecord updated = change.apply(current);
            records.put(id, updated);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }
    
    public Optional<ServiceRecord> setStatus(String id, ServiceStatus status) {
        return update(id, r -> r.withStatus(status, clock.instant()));
    }
    
    /**
     * Applies an observed status; returns the new snapshot only when it differed.
     * {@code skip} is evaluated under the store lock, so an owner that claims the id
     * before reading its record can never have its transitional status overwritten.
     */
    public Optional<ServiceRecord> applyObservedStatus(String id, ServiceStatus observed, Predicate<String> skip) {
        lock.lock();
        try {
            ServiceRecord current = records.get(id);
            if (current == null || current.getStatus() == observed || skip.test(id)) {
                return Optional.empty();
            }
            ServiceRecord updated = current.withStatus(observed, clock.instant());
            records.put(id, updated);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }
    
    public Optional<ServiceRecord> remove(String id) {
        lock.lock();
        try {
            ServiceRecord removed = records.remove(id);
            metricsRegistry.setManagedServices(records.size());
            return Optional.ofNullable(removed);
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Writes the current collection through the repository.
     *
     * @throws com.platform.servicehost.error.PersistenceException if the write fails
     */
    public void persist() {
        persistLock.lock();
        try {
            repository.saveAll(getAll());
        } finally {
            persistLock.unlock();
        }
    }
}
