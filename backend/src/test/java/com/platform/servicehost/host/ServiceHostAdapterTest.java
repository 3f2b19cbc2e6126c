package com.platform.servicehost.host;

import com.platform.servicehost.config.ServiceHostProperties;
import com.platform.servicehost.error.ErrorCode;
import com.platform.servicehost.model.OperationResult;
import com.platform.servicehost.model.ServiceRecord;
import com.platform.servicehost.state.OsServiceState;
import com.platform.servicehost.state.ServiceStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ServiceHostAdapterTest {

    @TempDir
    Path root;

    @Mock
    private ServiceControl serviceControl;

    private FakeCommandRunner commandRunner;
    private SandboxManager sandboxManager;
    private ServiceHostAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        Path template = Files.writeString(Files.createDirectories(root.resolve("templates")).resolve("WinSW-x64.exe"), "bin");
        ServiceHostProperties properties = new ServiceHostProperties();
        properties.setServicesRoot(root.resolve("services").toString());
        properties.getHostTool().setTemplatePath(template.toString());
        properties.getControl().setPollInterval(Duration.ofMillis(5));
        properties.getControl().setWaitCeiling(Duration.ofMillis(100));
        properties.getUninstall().setDeleteRetryDelay(Duration.ofMillis(10));

        commandRunner = new FakeCommandRunner(new FakeServiceControl());
        sandboxManager = new SandboxManager(properties, new HostToolConfigWriter());
        adapter = new ServiceHostAdapter(commandRunner, serviceControl, sandboxManager, properties);
    }

    private static ServiceRecord record() {
        return ServiceRecord.builder()
            .id("svc42")
            .displayName("Adapter Target")
            .executablePath("C:\\apps\\app.exe")
            .build();
    }

    @Test
    void install_shouldRunHostToolInSandbox() {
        OperationResult<Void> result = adapter.install(record());

        assertTrue(result.success());
        assertEquals(1, commandRunner.countVerb("install"));
        assertTrue(commandRunner.commands().get(0).get(0).endsWith("svc42.exe"));
    }

    @Test
    void install_toolTimedOut_shouldReportTimeoutAndKeepSandbox() {
        commandRunner.script("install", new ProcessOutcome(-1, "", "", true, 120000));

        OperationResult<Void> result = adapter.install(record());

        assertEquals(ErrorCode.OPERATION_TIMEOUT, result.errorCode());
        assertTrue(sandboxManager.exists("svc42"));
    }

    @Test
    void start_serviceNeverReachesRunning_shouldTimeOut() throws Exception {
        when(serviceControl.queryState("svc42")).thenReturn(OsServiceState.START_PENDING);

        OperationResult<Void> result = adapter.start("svc42");

        assertEquals(ErrorCode.OPERATION_TIMEOUT, result.errorCode());
        assertTrue(result.detail().contains("START_PENDING"));
    }

    @Test
    void start_serviceVanishes_shouldReportControlFailure() throws Exception {
        when(serviceControl.queryState("svc42")).thenReturn(OsServiceState.NOT_FOUND);

        OperationResult<Void> result = adapter.start("svc42");

        assertEquals(ErrorCode.SERVICE_CONTROL_FAILED, result.errorCode());
    }

    @Test
    void stop_alreadyStopped_shouldSucceedWithoutControlCall() throws Exception {
        when(serviceControl.queryState("svc42")).thenReturn(OsServiceState.STOPPED);

        OperationResult<Void> result = adapter.stop("svc42");

        assertTrue(result.success());
        verify(serviceControl, never()).stop("svc42");
    }

    @Test
    void stop_controlTimeout_shouldMapToOperationTimeout() throws Exception {
        when(serviceControl.queryState("svc42")).thenReturn(OsServiceState.RUNNING);
        doThrow(new ServiceControlException(ServiceControlException.Kind.TIMEOUT, "svc42", "sc.exe stop timed out"))
            .when(serviceControl).stop("svc42");

        OperationResult<Void> result = adapter.stop("svc42");

        assertEquals(ErrorCode.OPERATION_TIMEOUT, result.errorCode());
    }

    @Test
    void restart_stopFails_shouldNotStart() throws Exception {
        when(serviceControl.queryState("svc42")).thenReturn(OsServiceState.RUNNING);
        doThrow(new ServiceControlException(ServiceControlException.Kind.FAILED, "svc42", "denied"))
            .when(serviceControl).stop("svc42");

        OperationResult<Void> result = adapter.restart("svc42");

        assertFalse(result.success());
        verify(serviceControl, never()).start("svc42");
    }

    @Test
    void queryStatus_failure_shouldReturnErrorInsteadOfThrowing() throws Exception {
        when(serviceControl.queryState("svc42"))
            .thenThrow(new ServiceControlException(ServiceControlException.Kind.FAILED, "svc42", "rpc unavailable"));

        assertEquals(ServiceStatus.ERROR, adapter.queryStatus("svc42"));
    }

    @Test
    void queryStatus_notFound_shouldReturnNotInstalled() throws Exception {
        when(serviceControl.queryState("svc42")).thenThrow(ServiceControlException.notFound("svc42"));

        assertEquals(ServiceStatus.NOT_INSTALLED, adapter.queryStatus("svc42"));
    }

    @Test
    void uninstall_hostBinaryMissing_shouldFailAndKeepSandbox() throws Exception {
        adapter.install(record());
        Files.delete(sandboxManager.layoutFor("svc42").hostExecutablePath());
        when(serviceControl.queryState("svc42")).thenReturn(OsServiceState.STOPPED);

        OperationResult<Void> result = adapter.uninstall(record());

        assertEquals(ErrorCode.HOST_TOOL_FAILED, result.errorCode());
        assertTrue(sandboxManager.exists("svc42"));
    }

    @Test
    void updateConfiguration_noSandbox_shouldSucceedWithoutWriting() {
        OperationResult<Void> result = adapter.updateConfiguration(record());

        assertTrue(result.success());
        assertFalse(sandboxManager.exists("svc42"));
    }
}
