package com.platform.servicehost.persistence;

import com.platform.servicehost.model.ServiceRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for service records. {@link #saveAll(List)} rewrites the whole
 * collection, so implementations must serialize concurrent writers.
 */
public interface ServiceRecordRepository {
    
    List<ServiceRecord> loadAll();
    
    void saveAll(List<ServiceRecord> records);
    
    Optional<ServiceRecord> loadById(String id);
}
