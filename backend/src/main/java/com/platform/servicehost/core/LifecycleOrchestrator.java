package com.platform.servicehost.core;

import com.platform.servicehost.error.ErrorCode;
import com.platform.servicehost.error.PersistenceException;
import com.platform.servicehost.host.ServiceHostAdapter;
import com.platform.servicehost.model.OperationResult;
import com.platform.servicehost.model.OperationType;
import com.platform.servicehost.model.RestartPolicy;
import com.platform.servicehost.model.ServiceCreateRequest;
import com.platform.servicehost.model.ServiceRecord;
import com.platform.servicehost.model.ServiceUpdateRequest;
import com.platform.servicehost.model.StartMode;
import com.platform.servicehost.observability.LoggingConfig;
import com.platform.servicehost.observability.MetricsRegistry;
import com.platform.servicehost.persistence.ServiceRecordStore;
import com.platform.servicehost.reconciliation.PollingCoordinator;
import com.platform.servicehost.security.SecurityAuditLogger;
import com.platform.servicehost.state.OperationGuard;
import com.platform.servicehost.state.ServiceStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives every lifecycle operation through the status state machine.
 *
 * Each mutating call claims the service id in {@link OperationGuard}, checks the
 * status predicate, publishes the transitional status, calls the host adapter and
 * settles the record in a terminal status. A rejected call makes no external call.
 */
@Slf4j
@Component
public class LifecycleOrchestrator {

    private final ServiceRecordStore store;
    private final ServiceHostAdapter hostAdapter;
    private final RequestValidator requestValidator;
    private final ServiceDependencyValidator dependencyValidator;
    private final OperationGuard operationGuard;
    private final PollingCoordinator pollingCoordinator;
    private final SecurityAuditLogger auditLogger;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;

    public LifecycleOrchestrator(
            ServiceRecordStore store,
            ServiceHostAdapter hostAdapter,
            RequestValidator requestValidator,
            ServiceDependencyValidator dependencyValidator,
            OperationGuard operationGuard,
            PollingCoordinator pollingCoordinator,
            SecurityAuditLogger auditLogger,
            MetricsRegistry metricsRegistry,
            Clock clock) {
        this.store = store;
        this.hostAdapter = hostAdapter;
        this.requestValidator = requestValidator;
        this.dependencyValidator = dependencyValidator;
        this.operationGuard = operationGuard;
        this.pollingCoordinator = pollingCoordinator;
        this.auditLogger = auditLogger;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }

    // ==================== Queries ====================

    public List<ServiceRecord> getAll() {
        return store.getAll();
    }

    public Optional<ServiceRecord> get(String id) {
        return store.get(id);
    }

    public Optional<ServiceStatus> getStatus(String id) {
        return store.get(id).map(ServiceRecord::getStatus);
    }

    /**
     * Ids to start before {@code id}, dependencies first, ending with {@code id} itself.
     */
    public Optional<List<String>> startOrder(String id) {
        if (!store.contains(id)) {
            return Optional.empty();
        }
        return Optional.of(dependencyValidator.startOrder(id, store.getAll()));
    }

    // ==================== Create ====================

    /**
     * Validates the request, stages and installs the service, and starts it when
     * {@code autoStart} is set.
     *
     * A staging failure leaves no record behind. A host-tool failure or timeout keeps
     * the record in ERROR so that uninstall can clean up. A failed auto-start still
     * reports success because the service is installed; the record settles in STOPPED.
     */
    public OperationResult<ServiceRecord> create(ServiceCreateRequest request) {
        String id = UUID.randomUUID().toString().replace("-", "");
        Instant now = clock.instant();
        ServiceRecord candidate = toRecord(id, request, now);

        return execute(OperationType.INSTALL, id, () -> {
            Optional<OperationResult<ServiceRecord>> rejected = rejectInvalid(OperationType.INSTALL, candidate);
            if (rejected.isPresent()) {
                auditLogger.logServiceCreate(id, candidate.getExecutablePath(), false, rejected.get().message());
                return rejected.get();
            }

            ServiceRecord installing = candidate.withStatus(ServiceStatus.transitionalFor(OperationType.INSTALL), now);
            if (!store.add(installing)) {
                return OperationResult.failure(OperationType.INSTALL, id, ErrorCode.OPERATION_CONFLICT,
                    "A service with id " + id + " already exists");
            }
            log.info("Installing service {} ({})", id, candidate.getDisplayName());

            OperationResult<Void> installed = hostAdapter.install(installing);
            if (installed.isFailure()) {
                auditLogger.logServiceCreate(id, candidate.getExecutablePath(), false, installed.message());
                if (installed.errorCode() == ErrorCode.SANDBOX_IO_ERROR) {
                    store.remove(id);
                    log.warn("Install of {} rolled back: {}", id, installed.message());
                    return installed.asFailureOf(OperationType.INSTALL);
                }
                return settleFailure(id, ServiceStatus.ERROR, installed, OperationType.INSTALL);
            }

            ServiceRecord stopped = store.update(id, r -> r.withSuccess(ServiceStatus.STOPPED, clock.instant()))
                .orElseThrow();
            auditLogger.logServiceCreate(id, candidate.getExecutablePath(), true, null);

            if (!request.isAutoStart()) {
                return persisted(OperationResult.success(OperationType.INSTALL, id, "Service installed", stopped));
            }

            transition(id, OperationType.START);
            OperationResult<Void> started = hostAdapter.start(id);
            if (started.isFailure()) {
                ServiceRecord notStarted = store.update(id,
                    r -> r.withFailure(ServiceStatus.STOPPED, started.message(), clock.instant())).orElseThrow();
                log.warn("Service {} installed but failed to start: {}", id, started.message());
                OperationResult<ServiceRecord> result = OperationResult.success(OperationType.INSTALL, id,
                    "Service installed but failed to start: " + started.message(), notStarted);
                return persisted(result.withDetail(started.detail()));
            }

            ServiceRecord running = store.update(id, r -> r.withSuccess(ServiceStatus.RUNNING, clock.instant()))
                .orElseThrow();
            return persisted(OperationResult.success(OperationType.INSTALL, id, "Service installed and started", running));
        });
    }

    // ==================== Start / Stop / Restart ====================

    /**
     * Starts a STOPPED service. A NOT_INSTALLED record whose OS entry disappeared is
     * re-registered from its record before starting.
     */
    public OperationResult<ServiceRecord> start(String id) {
        return execute(OperationType.START, id, () -> {
            Optional<ServiceRecord> found = store.get(id);
            if (found.isEmpty()) {
                return notFound(OperationType.START, id);
            }
            ServiceRecord record = found.get();
            if (!record.getStatus().canStart()) {
                return conflict(OperationType.START, record);
            }

            if (record.getStatus() == ServiceStatus.NOT_INSTALLED) {
                transition(id, OperationType.INSTALL);
                OperationResult<Void> installed = hostAdapter.install(record);
                if (installed.isFailure()) {
                    return settleFailure(id, ServiceStatus.ERROR, installed, OperationType.START);
                }
                log.info("Re-registered service {} before start", id);
            }

            transition(id, OperationType.START);
            OperationResult<Void> started = hostAdapter.start(id);
            if (started.isFailure()) {
                return settleFailure(id, ServiceStatus.STOPPED, started, OperationType.START);
            }
            return settleSuccess(id, ServiceStatus.RUNNING, OperationType.START, "Service started");
        });
    }

    public OperationResult<ServiceRecord> stop(String id) {
        return execute(OperationType.STOP, id, () -> {
            Optional<ServiceRecord> found = store.get(id);
            if (found.isEmpty()) {
                return notFound(OperationType.STOP, id);
            }
            ServiceRecord record = found.get();
            ServiceStatus prior = record.getStatus();
            if (!prior.canStop()) {
                return conflict(OperationType.STOP, record);
            }

            transition(id, OperationType.STOP);
            OperationResult<Void> stopped = hostAdapter.stop(id);
            if (stopped.isFailure()) {
                return settleFailure(id, revertTarget(prior), stopped, OperationType.STOP);
            }
            return settleSuccess(id, ServiceStatus.STOPPED, OperationType.STOP, "Service stopped");
        });
    }

    /**
     * Stop followed by Start. A failed Stop keeps the service RUNNING and Start is
     * never attempted; a failed Start leaves it STOPPED.
     */
    public OperationResult<ServiceRecord> restart(String id) {
        return execute(OperationType.RESTART, id, () -> {
            Optional<ServiceRecord> found = store.get(id);
            if (found.isEmpty()) {
                return notFound(OperationType.RESTART, id);
            }
            ServiceRecord record = found.get();
            if (!record.getStatus().canRestart()) {
                return conflict(OperationType.RESTART, record);
            }

            transition(id, OperationType.STOP);
            OperationResult<Void> stopped = hostAdapter.stop(id);
            if (stopped.isFailure()) {
                return settleFailure(id, ServiceStatus.RUNNING, stopped, OperationType.RESTART);
            }

            transition(id, OperationType.START);
            OperationResult<Void> started = hostAdapter.start(id);
            if (started.isFailure()) {
                return settleFailure(id, ServiceStatus.STOPPED, started, OperationType.RESTART);
            }
            return settleSuccess(id, ServiceStatus.RUNNING, OperationType.RESTART, "Service restarted");
        });
    }

    // ==================== Uninstall ====================

    /**
     * Removes the OS service, the sandbox and the record. A RUNNING or PAUSED service
     * is stopped first; if that Stop fails the record reverts and nothing is removed.
     * A service other records depend on is rejected.
     */
    public OperationResult<ServiceRecord> uninstall(String id) {
        return execute(OperationType.UNINSTALL, id, () -> {
            Optional<ServiceRecord> found = store.get(id);
            if (found.isEmpty()) {
                return notFound(OperationType.UNINSTALL, id);
            }
            ServiceRecord record = found.get();
            ServiceStatus prior = record.getStatus();
            if (prior.isTransitioning()) {
                return conflict(OperationType.UNINSTALL, record);
            }

            List<String> dependents = dependencyValidator.dependents(id, store.getAll());
            if (!dependents.isEmpty()) {
                return OperationResult.failure(OperationType.UNINSTALL, id, ErrorCode.INVALID_DEPENDENCY,
                    "Service is required by: " + String.join(", ", dependents));
            }

            if (!prior.canUninstall()) {
                transition(id, OperationType.STOP);
                OperationResult<Void> stopped = hostAdapter.stop(id);
                if (stopped.isFailure()) {
                    auditLogger.logServiceUninstall(id, false, stopped.message());
                    return settleFailure(id, prior, stopped, OperationType.UNINSTALL);
                }
                store.update(id, r -> r.withSuccess(ServiceStatus.STOPPED, clock.instant()));
            }

            transition(id, OperationType.UNINSTALL);
            OperationResult<Void> removed = hostAdapter.uninstall(record);
            if (removed.isFailure()) {
                auditLogger.logServiceUninstall(id, false, removed.message());
                return settleFailure(id, ServiceStatus.ERROR, removed, OperationType.UNINSTALL);
            }

            ServiceRecord last = store.remove(id).orElse(record);
            auditLogger.logServiceUninstall(id, true, null);
            log.info("Service {} uninstalled", id);
            return persisted(OperationResult.success(OperationType.UNINSTALL, id, "Service uninstalled",
                last.withStatus(ServiceStatus.NOT_INSTALLED, clock.instant())));
        });
    }

    // ==================== Update ====================

    /**
     * Applies a configuration change in any stable status. The host-tool configuration is
     * rewritten when the sandbox exists; a running service picks it up on its next start.
     */
    public OperationResult<ServiceRecord> update(String id, ServiceUpdateRequest request) {
        return execute(OperationType.UPDATE, id, () -> {
            Optional<ServiceRecord> found = store.get(id);
            if (found.isEmpty()) {
                return notFound(OperationType.UPDATE, id);
            }
            ServiceRecord current = found.get();
            if (!current.getStatus().canUpdate()) {
                return conflict(OperationType.UPDATE, current);
            }

            ServiceRecord merged = merge(current, request, clock.instant());
            Optional<OperationResult<ServiceRecord>> rejected = rejectInvalid(OperationType.UPDATE, merged);
            if (rejected.isPresent()) {
                auditLogger.logServiceUpdate(id, false, rejected.get().message());
                return rejected.get();
            }

            OperationResult<Void> rewritten = hostAdapter.updateConfiguration(merged);
            if (rewritten.isFailure()) {
                auditLogger.logServiceUpdate(id, false, rewritten.message());
                return rewritten.asFailureOf(OperationType.UPDATE);
            }

            ServiceRecord updated = store.update(id, r -> merged.toBuilder()
                .status(r.getStatus())
                .lastError(r.getLastError())
                .build()).orElseThrow();
            auditLogger.logServiceUpdate(id, true, null);
            log.info("Service {} configuration updated", id);
            return persisted(OperationResult.success(OperationType.UPDATE, id, "Service updated", updated));
        });
    }

    // ==================== Internals ====================

    private OperationResult<ServiceRecord> execute(OperationType operation, String id,
                                                   Supplier<OperationResult<ServiceRecord>> body) {
        long started = System.nanoTime();
        if (!operationGuard.tryAcquire(id, operation.name())) {
            String holder = operationGuard.currentOperation(id).orElse("another operation");
            metricsRegistry.recordConflict(operation);
            log.warn("Rejected {} on {}: {} in progress", operation, id, holder);
            return finish(OperationResult.failure(operation, id, ErrorCode.OPERATION_IN_PROGRESS,
                String.format("Service %s is busy with %s", id, holder)), started);
        }

        OperationResult<ServiceRecord> result;
        LoggingConfig.setOperationContext(id, operation.name());
        try {
            result = body.get();
        } catch (RuntimeException e) {
            log.error("Unexpected failure during {} on {}", operation, id, e);
            markErrorIfTransitioning(id, e);
            result = OperationResult.failure(operation, id, ErrorCode.UNEXPECTED_ERROR,
                "Unexpected failure: " + e.getMessage());
        } finally {
            operationGuard.release(id);
            LoggingConfig.clearOperationContext();
        }

        if (result.success() && operation == OperationType.UNINSTALL) {
            pollingCoordinator.untrackService(id);
        } else if (result.success() || result.errorCode() == ErrorCode.OPERATION_TIMEOUT) {
            // a timed-out OS call leaves the real state unknown, so reconcile it quickly as well
            if (store.contains(id)) {
                pollingCoordinator.trackService(id);
            }
        }
        return finish(result, started);
    }

    private OperationResult<ServiceRecord> finish(OperationResult<ServiceRecord> result, long started) {
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        metricsRegistry.recordOperation(result.operation(), result.success(), elapsedMs);
        if (result.isFailure()) {
            log.debug("{} on {} failed with {}: {}", result.operation(), result.serviceId(),
                result.errorCode(), result.message());
        }
        return result.withElapsedMs(elapsedMs);
    }

    private Optional<OperationResult<ServiceRecord>> rejectInvalid(OperationType operation, ServiceRecord candidate) {
        String id = candidate.getId();
        Optional<RequestValidator.Violation> violation = requestValidator.validate(candidate);
        if (violation.isPresent()) {
            RequestValidator.Violation v = violation.get();
            auditLogger.logInputRejected(id, v.field(), v.rejectedValue(), v.reason());
            return Optional.of(OperationResult.failure(operation, id, v.errorCode(),
                v.field() + ": " + v.reason()));
        }

        Optional<String> dependencyError = dependencyValidator.validate(id, candidate.getDependencies(), store.getAll());
        if (dependencyError.isPresent()) {
            log.warn("Rejected {} on {}: {}", operation, id, dependencyError.get());
            return Optional.of(OperationResult.failure(operation, id, ErrorCode.INVALID_DEPENDENCY,
                dependencyError.get()));
        }
        return Optional.empty();
    }

    /**
     * Publishes the transitional status of one host call before it is made.
     */
    private void transition(String id, OperationType step) {
        ServiceStatus status = ServiceStatus.transitionalFor(step);
        store.setStatus(id, status);
        log.info("Service {} is {}", id, status);
    }

    private OperationResult<ServiceRecord> settleSuccess(String id, ServiceStatus status,
                                                         OperationType operation, String message) {
        ServiceRecord settled = store.update(id, r -> r.withSuccess(status, clock.instant())).orElseThrow();
        log.info("Service {} is {}", id, status);
        return persisted(OperationResult.success(operation, id, message, settled));
    }

    private OperationResult<ServiceRecord> settleFailure(String id, ServiceStatus status,
                                                         OperationResult<Void> failure, OperationType operation) {
        ServiceRecord settled = store.update(id, r -> r.withFailure(status, failure.message(), clock.instant()))
            .orElse(null);
        log.warn("{} on {} failed ({}), status now {}: {}", operation, id, failure.errorCode(), status,
            failure.message());
        return persisted(failure.<ServiceRecord>asFailureOf(operation).withValue(settled));
    }

    private void markErrorIfTransitioning(String id, RuntimeException cause) {
        store.update(id, r -> r.getStatus().isTransitioning()
            ? r.withFailure(ServiceStatus.ERROR, "Unexpected failure: " + cause.getMessage(), clock.instant())
            : r);
    }

    /**
     * Saves the store. The operation already happened, so a failed save is reported in
     * the result's detail rather than changing its outcome.
     */
    private OperationResult<ServiceRecord> persisted(OperationResult<ServiceRecord> result) {
        try {
            store.persist();
            return result;
        } catch (PersistenceException e) {
            log.error("Failed to save service records after {} on {}", result.operation(), result.serviceId(), e);
            metricsRegistry.incrementCounter("servicehost.persistence.failures");
            String note = "Service records could not be saved: " + e.getMessage();
            return result.withDetail(result.detail() == null ? note : result.detail() + "; " + note);
        }
    }

    private static ServiceStatus revertTarget(ServiceStatus prior) {
        return prior.isStable() ? prior : ServiceStatus.ERROR;
    }

    private static OperationResult<ServiceRecord> notFound(OperationType operation, String id) {
        return OperationResult.failure(operation, id, ErrorCode.SERVICE_NOT_FOUND, "Service not found: " + id);
    }

    private OperationResult<ServiceRecord> conflict(OperationType operation, ServiceRecord record) {
        metricsRegistry.recordConflict(operation);
        log.warn("Rejected {} on {}: not allowed while {}", operation, record.getId(), record.getStatus());
        return OperationResult.<ServiceRecord>failure(operation, record.getId(), ErrorCode.OPERATION_CONFLICT,
            String.format("Cannot %s service while it is %s", operation.name().toLowerCase(), record.getStatus()))
            .withValue(record);
    }

    // ==================== Request mapping ====================

    private static ServiceRecord toRecord(String id, ServiceCreateRequest request, Instant now) {
        RestartPolicy restartPolicy = request.isRestartOnExit()
            ? RestartPolicy.onExitCode(request.getRestartExitCode() != null
                ? request.getRestartExitCode() : RestartPolicy.DEFAULT_TRIGGER_EXIT_CODE)
            : RestartPolicy.disabled();

        return ServiceRecord.builder()
            .id(id)
            .displayName(trimToNull(request.getDisplayName()))
            .description(isBlank(request.getDescription())
                ? ServiceRecord.DEFAULT_DESCRIPTION : request.getDescription().trim())
            .executablePath(trimToNull(request.getExecutablePath()))
            .scriptPath(trimToNull(request.getScriptPath()))
            .arguments(request.getArguments() == null ? "" : request.getArguments().trim())
            .workingDirectory(trimToNull(request.getWorkingDirectory()))
            .dependencies(copyOf(request.getDependencies()))
            .environmentVariables(copyOf(request.getEnvironmentVariables()))
            .serviceAccount(trimToNull(request.getServiceAccount()))
            .startMode(request.getStartMode() != null ? request.getStartMode() : StartMode.AUTOMATIC)
            .stopTimeoutMs(request.getStopTimeoutMs() != null
                ? request.getStopTimeoutMs() : ServiceRecord.DEFAULT_STOP_TIMEOUT_MS)
            .restartPolicy(restartPolicy)
            .status(ServiceStatus.NOT_INSTALLED)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Null fields keep the current value; an empty string clears an optional path or account.
     */
    private static ServiceRecord merge(ServiceRecord current, ServiceUpdateRequest request, Instant now) {
        ServiceRecord.ServiceRecordBuilder builder = current.toBuilder().updatedAt(now);

        if (request.getDisplayName() != null) {
            builder.displayName(request.getDisplayName().trim());
        }
        if (request.getDescription() != null) {
            builder.description(isBlank(request.getDescription())
                ? ServiceRecord.DEFAULT_DESCRIPTION : request.getDescription().trim());
        }
        if (request.getExecutablePath() != null) {
            builder.executablePath(request.getExecutablePath().trim());
        }
        if (request.getScriptPath() != null) {
            builder.scriptPath(trimToNull(request.getScriptPath()));
        }
        if (request.getArguments() != null) {
            builder.arguments(request.getArguments().trim());
        }
        if (request.getWorkingDirectory() != null) {
            builder.workingDirectory(trimToNull(request.getWorkingDirectory()));
        }
        if (request.getDependencies() != null) {
            builder.dependencies(copyOf(request.getDependencies()));
        }
        if (request.getEnvironmentVariables() != null) {
            builder.environmentVariables(copyOf(request.getEnvironmentVariables()));
        }
        if (request.getServiceAccount() != null) {
            builder.serviceAccount(trimToNull(request.getServiceAccount()));
        }
        if (request.getStartMode() != null) {
            builder.startMode(request.getStartMode());
        }
        if (request.getStopTimeoutMs() != null) {
            builder.stopTimeoutMs(request.getStopTimeoutMs());
        }
        if (request.getRestartOnExit() != null || request.getRestartExitCode() != null) {
            RestartPolicy policy = current.getRestartPolicy();
            builder.restartPolicy(new RestartPolicy(
                request.getRestartOnExit() != null ? request.getRestartOnExit() : policy.enabled(),
                request.getRestartExitCode() != null ? request.getRestartExitCode() : policy.triggerExitCode()));
        }
        return builder.build();
    }

    private static Set<String> copyOf(Set<String> values) {
        if (values == null) {
            return Set.of();
        }
        Set<String> copy = new LinkedHashSet<>();
        for (String value : values) {
            if (!isBlank(value)) {
                copy.add(value.trim());
            }
        }
        return Collections.unmodifiableSet(copy);
    }

    private static Map<String, String> copyOf(Map<String, String> values) {
        if (values == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
