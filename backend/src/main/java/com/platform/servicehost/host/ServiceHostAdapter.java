package com.platform.servicehost.host;

import com.platform.servicehost.config.ServiceHostProperties;
import com.platform.servicehost.error.ErrorCode;
import com.platform.servicehost.model.OperationResult;
import com.platform.servicehost.model.OperationType;
import com.platform.servicehost.model.SandboxLayout;
import com.platform.servicehost.model.ServiceRecord;
import com.platform.servicehost.state.OsServiceState;
import com.platform.servicehost.state.ServiceStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * The only component that touches the service-host tool and the OS service manager.
 *
 * Every operation returns an {@link OperationResult}; failures and timeouts are
 * reported there and never thrown.
 */
@Slf4j
@Component
public class ServiceHostAdapter {
    
    private final CommandRunner commandRunner;
    private final ServiceControl serviceControl;
    private final SandboxManager sandboxManager;
    private final Duration commandTimeout;
    private final Duration pollInterval;
    private final Duration waitCeiling;
    
    public ServiceHostAdapter(
            CommandRunner commandRunner,
            ServiceControl serviceControl,
            SandboxManager sandboxManager,
            ServiceHostProperties properties) {
        this.commandRunner = commandRunner;
        this.serviceControl = serviceControl;
        this.sandboxManager = sandboxManager;
        this.commandTimeout = properties.getHostTool().getCommandTimeout();
        this.pollInterval = properties.getControl().getPollInterval();
        this.waitCeiling = properties.getControl().getWaitCeiling();
    }
    
    /**
     * Stages the sandbox and registers the service with the OS through the host tool.
     *
     * A staging failure removes whatever was created and reports {@code SANDBOX_IO_ERROR};
     * a tool failure or timeout keeps the sandbox so a later uninstall can clean up.
     */
    public OperationResult<Void> install(ServiceRecord record) {
        long started = System.nanoTime();
        String id = record.getId();
        
        SandboxLayout layout;
        try {
            layout = sandboxManager.stage(record);
        } catch (IOException e) {
            log.error("Failed to stage sandbox for {}: {}", id, e.getMessage());
            rollbackSandbox(id);
            return OperationResult.<Void>failure(OperationType.INSTALL, id, ErrorCode.SANDBOX_IO_ERROR,
                "Failed to prepare service directory", e.toString()).withElapsedMs(elapsed(started));
        }
        
        OperationResult<Void> result = runHostTool(OperationType.INSTALL, layout, "install");
        if (result.success()) {
            log.info("Installed service {}", id);
        }
        return result.withElapsedMs(elapsed(started));
    }
    
    /**
     * Stops the service if needed, unregisters it and removes the sandbox.
     * An OS service that is already gone skips the tool invocation.
     */
    public OperationResult<Void> uninstall(ServiceRecord record) {
        long started = System.nanoTime();
        String id = record.getId();
        SandboxLayout layout = sandboxManager.layoutFor(id);
        
        OsServiceState osState;
        try {
            osState = serviceControl.queryState(id);
        } catch (ServiceControlException e) {
            return controlFailure(OperationType.UNINSTALL, id, e).withElapsedMs(elapsed(started));
        }
        
        if (osState != OsServiceState.NOT_FOUND) {
            OperationResult<Void> stopped = stop(id);
            if (stopped.isFailure()) {
                return stopped.<Void>asFailureOf(OperationType.UNINSTALL).withElapsedMs(elapsed(started));
            }
            if (!Files.isRegularFile(layout.hostExecutablePath())) {
                return OperationResult.<Void>failure(OperationType.UNINSTALL, id, ErrorCode.HOST_TOOL_FAILED,
                    "Host tool binary is missing from the service directory",
                    layout.hostExecutablePath().toString()).withElapsedMs(elapsed(started));
            }
            OperationResult<Void> unregistered = runHostTool(OperationType.UNINSTALL, layout, "uninstall");
            if (unregistered.isFailure()) {
                return unregistered.withElapsedMs(elapsed(started));
            }
        } else {
            log.info("Service {} is not registered with the OS, removing local state only", id);
        }
        
        try {
            sandboxManager.delete(id);
        } catch (IOException e) {
            log.error("Failed to remove sandbox for {}: {}", id, e.getMessage());
            return OperationResult.<Void>failure(OperationType.UNINSTALL, id, ErrorCode.SANDBOX_IO_ERROR,
                "Service was unregistered but its directory could not be removed", e.toString())
                .withElapsedMs(elapsed(started));
        }
        
        log.info("Uninstalled service {}", id);
        return OperationResult.<Void>success(OperationType.UNINSTALL, id, "Service uninstalled", null)
            .withElapsedMs(elapsed(started));
    }
    
    public OperationResult<Void> start(String id) {
        long started = System.nanoTime();
        try {
            serviceControl.start(id);
        } catch (ServiceControlException e) {
            return controlFailure(OperationType.START, id, e).withElapsedMs(elapsed(started));
        }
        return awaitState(OperationType.START, id, OsServiceState.RUNNING).withElapsedMs(elapsed(started));
    }
    
    /**
     * Idempotent: a service that is already stopped succeeds without a control call.
     */
    public OperationResult<Void> stop(String id) {
        long started = System.nanoTime();
        try {
            OsServiceState current = serviceControl.queryState(id);
            if (current == OsServiceState.STOPPED) {
                return OperationResult.<Void>success(OperationType.STOP, id, "Service already stopped", null)
                    .withElapsedMs(elapsed(started));
            }
            if (current == OsServiceState.NOT_FOUND) {
                throw ServiceControlException.notFound(id);
            }
            serviceControl.stop(id);
        } catch (ServiceControlException e) {
            return controlFailure(OperationType.STOP, id, e).withElapsedMs(elapsed(started));
        }
        return awaitState(OperationType.STOP, id, OsServiceState.STOPPED).withElapsedMs(elapsed(started));
    }
    
    /**
     * Stop followed by Start; Start is not attempted when Stop fails.
     */
    public OperationResult<Void> restart(String id) {
        long started = System.nanoTime();
        OperationResult<Void> stopped = stop(id);
        if (stopped.isFailure()) {
            return stopped.<Void>asFailureOf(OperationType.RESTART).withElapsedMs(elapsed(started));
        }
        OperationResult<Void> startedResult = start(id);
        if (startedResult.isFailure()) {
            return startedResult.<Void>asFailureOf(OperationType.RESTART).withElapsedMs(elapsed(started));
        }
        return OperationResult.<Void>success(OperationType.RESTART, id, "Service restarted", null)
            .withElapsedMs(elapsed(started));
    }
    
    /**
     * Never throws: an unknown service maps to NOT_INSTALLED, any failure to ERROR.
     */
    public ServiceStatus queryStatus(String id) {
        try {
            return ServiceStatus.fromOsState(serviceControl.queryState(id));
        } catch (ServiceControlException e) {
            if (e.isNotFound()) {
                return ServiceStatus.NOT_INSTALLED;
            }
            log.warn("Status query for {} failed: {}", id, e.getMessage());
            return ServiceStatus.ERROR;
        } catch (RuntimeException e) {
            log.warn("Status query for {} failed unexpectedly", id, e);
            return ServiceStatus.ERROR;
        }
    }
    
    /**
     * Rewrites the configuration of an installed service. Takes effect on the next start.
     */
    public OperationResult<Void> updateConfiguration(ServiceRecord record) {
        long started = System.nanoTime();
        String id = record.getId();
        if (!sandboxManager.exists(id)) {
            return OperationResult.<Void>success(OperationType.UPDATE, id, "No service directory to update", null)
                .withElapsedMs(elapsed(started));
        }
        try {
            sandboxManager.writeConfiguration(record, sandboxManager.layoutFor(id));
        } catch (IOException e) {
            log.error("Failed to rewrite configuration for {}: {}", id, e.getMessage());
            return OperationResult.<Void>failure(OperationType.UPDATE, id, ErrorCode.SANDBOX_IO_ERROR,
                "Failed to write service configuration", e.toString()).withElapsedMs(elapsed(started));
        }
        return OperationResult.<Void>success(OperationType.UPDATE, id, "Configuration updated", null)
            .withElapsedMs(elapsed(started));
    }
    
    public SandboxLayout layoutFor(String id) {
        return sandboxManager.layoutFor(id);
    }
    
    private OperationResult<Void> runHostTool(OperationType operation, SandboxLayout layout, String verb) {
        String id = layout.serviceId();
        List<String> command = List.of(layout.hostExecutablePath().toString(), verb);
        ProcessOutcome outcome = commandRunner.run(command, layout.serviceDirectory(), commandTimeout);
        
        if (outcome.timedOut()) {
            log.error("Host tool {} for {} timed out after {} ms", verb, id, outcome.elapsedMs());
            return OperationResult.failure(operation, id, ErrorCode.OPERATION_TIMEOUT,
                String.format("Host tool '%s' timed out after %d s", verb, commandTimeout.toSeconds()),
                outcome.diagnostic());
        }
        if (!outcome.isSuccess()) {
            log.error("Host tool {} for {} failed with exit code {}", verb, id, outcome.exitCode());
            return OperationResult.failure(operation, id, ErrorCode.HOST_TOOL_FAILED,
                String.format("Host tool '%s' failed with exit code %d", verb, outcome.exitCode()),
                outcome.diagnostic());
        }
        return OperationResult.success(operation, id, "Host tool '" + verb + "' succeeded", null);
    }
    
    private OperationResult<Void> awaitState(OperationType operation, String id, OsServiceState target) {
        long deadline = System.nanoTime() + waitCeiling.toNanos();
        OsServiceState last = null;
        while (true) {
            try {
                last = serviceControl.queryState(id);
            } catch (ServiceControlException e) {
                if (e.isNotFound()) {
                    return controlFailure(operation, id, e);
                }
                log.debug("Status query for {} failed while waiting for {}: {}", id, target, e.getMessage());
            }
            if (last == target) {
                return OperationResult.success(operation, id,
                    "Service reached " + ServiceStatus.fromOsState(target), null);
            }
            if (last == OsServiceState.NOT_FOUND) {
                return controlFailure(operation, id, ServiceControlException.notFound(id));
            }
            if (System.nanoTime() >= deadline) {
                return OperationResult.failure(operation, id, ErrorCode.OPERATION_TIMEOUT,
                    String.format("Service did not reach %s within %d s", target, waitCeiling.toSeconds()),
                    "Last observed state: " + last);
            }
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(pollInterval.toNanos(), Math.max(0, deadline - System.nanoTime())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return OperationResult.failure(operation, id, ErrorCode.OPERATION_TIMEOUT,
                    "Interrupted while waiting for " + target);
            }
        }
    }
    
    private OperationResult<Void> controlFailure(OperationType operation, String id, ServiceControlException e) {
        ErrorCode code = e.getKind() == ServiceControlException.Kind.TIMEOUT
            ? ErrorCode.OPERATION_TIMEOUT
            : ErrorCode.SERVICE_CONTROL_FAILED;
        log.error("{} of {} failed: {}", operation, id, e.getMessage());
        return OperationResult.failure(operation, id, code, e.getMessage());
    }
    
    private void rollbackSandbox(String id) {
        try {
            sandboxManager.delete(id);
        } catch (IOException e) {
            log.error("Rollback could not remove sandbox for {}", id, e);
        }
    }
    
    private static long elapsed(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
