package com.platform.servicehost.host;

import com.platform.servicehost.config.ServiceHostProperties;
import com.platform.servicehost.model.RestartPolicy;
import com.platform.servicehost.model.SandboxLayout;
import com.platform.servicehost.model.ServiceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SandboxManagerTest {

    @TempDir
    Path root;

    private Path hostTemplate;
    private Path wrapperTemplate;
    private SandboxManager sandboxManager;

    @BeforeEach
    void setUp() throws IOException {
        Path templates = Files.createDirectories(root.resolve("templates"));
        hostTemplate = Files.writeString(templates.resolve("WinSW-x64.exe"), "binary");
        wrapperTemplate = Files.writeString(templates.resolve("wrapper.bat"), "@echo off");

        ServiceHostProperties properties = new ServiceHostProperties();
        properties.setServicesRoot(root.resolve("services").toString());
        properties.getHostTool().setTemplatePath(hostTemplate.toString());
        properties.getHostTool().setWrapperTemplatePath(wrapperTemplate.toString());
        properties.getUninstall().setDeleteRetries(2);
        properties.getUninstall().setDeleteRetryDelay(Duration.ofMillis(10));
        sandboxManager = new SandboxManager(properties, new HostToolConfigWriter());
    }

    private static ServiceRecord record(RestartPolicy policy) {
        return ServiceRecord.builder()
            .id("svc01")
            .displayName("Sandboxed")
            .executablePath("C:\\apps\\app.exe")
            .restartPolicy(policy)
            .build();
    }

    @Test
    void stage_shouldCreateFixedLayout() throws IOException {
        SandboxLayout layout = sandboxManager.stage(record(RestartPolicy.disabled()));

        assertEquals(root.resolve("services").resolve("svc01"), layout.serviceDirectory());
        assertEquals("binary", Files.readString(layout.hostExecutablePath()));
        assertTrue(Files.readString(layout.configPath()).contains("<id>svc01</id>"));
        assertTrue(Files.isRegularFile(layout.outputLogPath()));
        assertTrue(Files.isRegularFile(layout.errorLogPath()));
        assertEquals("svc01.out.log", layout.outputLogPath().getFileName().toString());
        assertFalse(Files.exists(layout.wrapperPath()));
        assertTrue(sandboxManager.exists("svc01"));
    }

    @Test
    void stage_again_shouldKeepExistingLogs() throws IOException {
        SandboxLayout layout = sandboxManager.stage(record(RestartPolicy.disabled()));
        Files.writeString(layout.outputLogPath(), "earlier output");

        sandboxManager.stage(record(RestartPolicy.disabled()));

        assertEquals("earlier output", Files.readString(layout.outputLogPath()));
    }

    @Test
    void stage_restartPolicy_shouldCopyWrapper() throws IOException {
        SandboxLayout layout = sandboxManager.stage(record(RestartPolicy.onExitCode(99)));

        assertEquals("@echo off", Files.readString(layout.wrapperPath()));
    }

    @Test
    void stage_missingHostTemplate_shouldFailBeforeCreatingAnything() throws IOException {
        Files.delete(hostTemplate);

        assertThrows(NoSuchFileException.class, () -> sandboxManager.stage(record(RestartPolicy.disabled())));
        assertFalse(sandboxManager.exists("svc01"));
    }

    @Test
    void writeConfiguration_policyDisabled_shouldRemoveStaleWrapper() throws IOException {
        SandboxLayout layout = sandboxManager.stage(record(RestartPolicy.onExitCode(99)));

        sandboxManager.writeConfiguration(record(RestartPolicy.disabled()), layout);

        assertFalse(Files.exists(layout.wrapperPath()));
    }

    @Test
    void delete_shouldRemoveTree() throws IOException {
        SandboxLayout layout = sandboxManager.stage(record(RestartPolicy.disabled()));
        Files.writeString(layout.logDirectory().resolve("svc01.out.log.1"), "rolled");

        sandboxManager.delete("svc01");

        assertFalse(Files.exists(layout.serviceDirectory()));
    }

    @Test
    void delete_missingDirectory_shouldBeNoOp() {
        assertDoesNotThrow(() -> sandboxManager.delete("never-staged"));
    }
}
