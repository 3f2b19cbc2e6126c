package com.platform.servicehost.persistence;

import com.platform.servicehost.config.JacksonConfig;
import com.platform.servicehost.error.PersistenceException;
import com.platform.servicehost.model.RestartPolicy;
import com.platform.servicehost.model.ServiceRecord;
import com.platform.servicehost.model.StartMode;
import com.platform.servicehost.state.ServiceStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonServiceRecordRepositoryTest {

    @TempDir
    Path dataDirectory;

    private JsonServiceRecordRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JsonServiceRecordRepository(JacksonConfig.standardObjectMapper(), dataDirectory);
    }

    private static ServiceRecord record(String id, ServiceStatus status) {
        Instant created = Instant.parse("2024-05-01T10:15:30Z");
        return ServiceRecord.builder()
            .id(id)
            .displayName("Service " + id)
            .executablePath("C:\\apps\\" + id + "\\app.exe")
            .arguments("--port 8080")
            .dependencies(Set.of("db"))
            .environmentVariables(Map.of("JAVA_OPTS", "-Xmx256m"))
            .startMode(StartMode.MANUAL)
            .restartPolicy(RestartPolicy.onExitCode(7))
            .status(status)
            .createdAt(created)
            .updatedAt(created)
            .build();
    }

    @Test
    void loadAll_noFile_shouldReturnEmptyList() {
        assertTrue(repository.loadAll().isEmpty());
    }

    @Test
    void saveAll_thenLoad_shouldPreserveEveryField() {
        ServiceRecord original = record("api", ServiceStatus.RUNNING);

        repository.saveAll(List.of(original));

        assertEquals(original, repository.loadById("api").orElseThrow());
    }

    @Test
    void saveAll_existingFile_shouldKeepPreviousVersionAsBackup() throws Exception {
        repository.saveAll(List.of(record("first", ServiceStatus.STOPPED)));
        repository.saveAll(List.of(record("second", ServiceStatus.STOPPED)));

        Path backup = dataDirectory.resolve("services.json.backup");
        assertTrue(Files.readString(backup).contains("first"));
        assertEquals("second", repository.loadAll().get(0).getId());
    }

    @Test
    void loadAll_corruptFile_shouldFallBackToBackup() throws Exception {
        repository.saveAll(List.of(record("kept", ServiceStatus.RUNNING)));
        repository.saveAll(List.of(record("kept", ServiceStatus.STOPPED)));
        Files.writeString(dataDirectory.resolve("services.json"), "{ not json");

        List<ServiceRecord> loaded = repository.loadAll();

        assertEquals(1, loaded.size());
        assertEquals(ServiceStatus.RUNNING, loaded.get(0).getStatus());
    }

    @Test
    void loadAll_corruptFileWithoutBackup_shouldFail() throws Exception {
        Files.writeString(dataDirectory.resolve("services.json"), "[{\"id\":");

        assertThrows(PersistenceException.class, () -> repository.loadAll());
    }

    @Test
    void loadAll_unknownProperties_shouldBeIgnored() throws Exception {
        Files.writeString(dataDirectory.resolve("services.json"),
            "[{\"id\":\"legacy\",\"displayName\":\"Legacy\",\"executablePath\":\"C:\\\\a.exe\","
                + "\"status\":\"STOPPED\",\"retiredField\":true}]");

        ServiceRecord loaded = repository.loadById("legacy").orElseThrow();

        assertEquals(ServiceStatus.STOPPED, loaded.getStatus());
        assertEquals(ServiceRecord.DEFAULT_STOP_TIMEOUT_MS, loaded.getStopTimeoutMs());
    }
}
