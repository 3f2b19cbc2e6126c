package com.platform.servicehost.api;

import com.platform.servicehost.core.LifecycleOrchestrator;
import com.platform.servicehost.error.ResourceNotFoundException;
import com.platform.servicehost.error.ServiceOperationException;
import com.platform.servicehost.model.OperationResult;
import com.platform.servicehost.model.ServiceCreateRequest;
import com.platform.servicehost.model.ServiceRecord;
import com.platform.servicehost.model.ServiceUpdateRequest;
import com.platform.servicehost.state.ServiceStatus;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for managed services.
 *
 * Failed operation results are raised as {@link ServiceOperationException} and
 * rendered by the global exception handler.
 */
@Slf4j
@RestController
@RequestMapping("/api/services")
public class ServiceController {

    private static final String RESOURCE = "Service";

    private final LifecycleOrchestrator orchestrator;

    public ServiceController(LifecycleOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping
    public List<ServiceRecord> getAll() {
        return orchestrator.getAll();
    }

    @GetMapping("/{id}")
    public ServiceRecord get(@PathVariable String id) {
        return orchestrator.get(id)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id));
    }

    @GetMapping("/{id}/status")
    public ServiceStatusView getStatus(@PathVariable String id) {
        ServiceStatus status = orchestrator.getStatus(id)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id));
        return new ServiceStatusView(id, status);
    }

    /**
     * Ids in the order they have to be started for {@code id} to come up.
     */
    @GetMapping("/{id}/start-order")
    public List<String> getStartOrder(@PathVariable String id) {
        return orchestrator.startOrder(id)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id));
    }

    @PostMapping
    public ResponseEntity<OperationResult<ServiceRecord>> create(@Valid @RequestBody ServiceCreateRequest request) {
        log.info("Create service request: {}", request.getDisplayName());
        OperationResult<ServiceRecord> result = requireSuccess(orchestrator.create(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PutMapping("/{id}")
    public OperationResult<ServiceRecord> update(
            @PathVariable String id,
            @Valid @RequestBody ServiceUpdateRequest request) {
        return requireSuccess(orchestrator.update(id, request));
    }

    @PostMapping("/{id}/start")
    public OperationResult<ServiceRecord> start(@PathVariable String id) {
        return requireSuccess(orchestrator.start(id));
    }

    @PostMapping("/{id}/stop")
    public OperationResult<ServiceRecord> stop(@PathVariable String id) {
        return requireSuccess(orchestrator.stop(id));
    }

    @PostMapping("/{id}/restart")
    public OperationResult<ServiceRecord> restart(@PathVariable String id) {
        return requireSuccess(orchestrator.restart(id));
    }

    @DeleteMapping("/{id}")
    public OperationResult<ServiceRecord> uninstall(@PathVariable String id) {
        return requireSuccess(orchestrator.uninstall(id));
    }

    private static OperationResult<ServiceRecord> requireSuccess(OperationResult<ServiceRecord> result) {
        if (result.isFailure()) {
            throw new ServiceOperationException(result);
        }
        return result;
    }

    public record ServiceStatusView(String id, ServiceStatus status) {}
}
