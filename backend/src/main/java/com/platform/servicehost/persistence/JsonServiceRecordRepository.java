package com.platform.servicehost.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.servicehost.config.ServiceHostProperties;
import com.platform.servicehost.error.PersistenceException;
import com.platform.servicehost.model.ServiceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stores all records in {@code services.json}.
 *
 * Before each overwrite the current file is copied to {@code services.json.backup};
 * a failed write restores it. Reads fall back to the backup when the main file is corrupt.
 */
@Slf4j
@Repository
public class JsonServiceRecordRepository implements ServiceRecordRepository {
    
    static final String FILE_NAME = "services.json";
    static final String BACKUP_SUFFIX = ".backup";
    
    private static final TypeReference<List<ServiceRecord>> RECORD_LIST = new TypeReference<>() {};
    
    private final ObjectMapper objectMapper;
    private final Path dataFile;
    private final Path backupFile;
    private final ReentrantLock writeLock = new ReentrantLock();
    
    @Autowired
    public JsonServiceRecordRepository(ObjectMapper objectMapper, ServiceHostProperties properties) {
        this(objectMapper, properties.dataDirectoryPath());
    }
    
    public JsonServiceRecordRepository(ObjectMapper objectMapper, Path dataDirectory) {
        this.objectMapper = objectMapper;
        this.dataFile = dataDirectory.resolve(FILE_NAME);
        this.backupFile = dataDirectory.resolve(FILE_NAME + BACKUP_SUFFIX);
    }
    
    @Override
    public List<ServiceRecord> loadAll() {
        try {
            return read(dataFile);
        } catch (IOException e) {
            log.error("Failed to read {}, trying backup", dataFile, e);
            if (!Files.exists(backupFile)) {
                throw new PersistenceException("Service metadata is unreadable and no backup exists: " + dataFile, e);
            }
            try {
                List<ServiceRecord> fromBackup = read(backupFile);
                log.warn("Loaded {} records from backup {}", fromBackup.size(), backupFile);
                return fromBackup;
            } catch (IOException backupError) {
                e.addSuppressed(backupError);
                throw new PersistenceException("Service metadata is unreadable: " + dataFile, e);
            }
        }
    }
    
    @Override
    public Optional<ServiceRecord> loadById(String id) {
        return loadAll().stream()
            .filter(r -> r.getId().equals(id))
            .findFirst();
    }
    
    @Override
    public void saveAll(List<ServiceRecord> records) {
        writeLock.lock();
        try {
            Files.createDirectories(dataFile.getParent());
            boolean hadFile = Files.exists(dataFile);
            if (hadFile) {
                Files.copy(dataFile, backupFile, StandardCopyOption.REPLACE_EXISTING);
            }
            
            Path temp = dataFile.resolveSibling(FILE_NAME + ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), new ArrayList<>(records));
                Files.move(temp, dataFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                Files.deleteIfExists(temp);
                if (hadFile) {
                    Files.copy(backupFile, dataFile, StandardCopyOption.REPLACE_EXISTING);
                    log.warn("Restored {} from backup after failed write", dataFile);
                }
                throw e;
            }
            log.debug("Saved {} service records to {}", records.size(), dataFile);
        } catch (IOException e) {
            throw new PersistenceException("Failed to save service metadata to " + dataFile, e);
        } finally {
            writeLock.unlock();
        }
    }
    
    private List<ServiceRecord> read(Path file) throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) {
            return List.of();
        }
        String content = Files.readString(file);
        if (content.isBlank()) {
            return List.of();
        }
        List<ServiceRecord> records = objectMapper.readValue(content, RECORD_LIST);
        return records != null ? records : List.of();
    }
}
