package com.platform.servicehost.support;

import com.platform.servicehost.config.JacksonConfig;
import com.platform.servicehost.config.ServiceHostProperties;
import com.platform.servicehost.core.LifecycleOrchestrator;
import com.platform.servicehost.core.RequestValidator;
import com.platform.servicehost.core.ServiceDependencyValidator;
import com.platform.servicehost.host.FakeCommandRunner;
import com.platform.servicehost.host.FakeServiceControl;
import com.platform.servicehost.host.HostToolConfigWriter;
import com.platform.servicehost.host.SandboxManager;
import com.platform.servicehost.host.ServiceHostAdapter;
import com.platform.servicehost.model.ServiceCreateRequest;
import com.platform.servicehost.observability.MetricsRegistry;
import com.platform.servicehost.persistence.JsonServiceRecordRepository;
import com.platform.servicehost.persistence.ServiceRecordStore;
import com.platform.servicehost.reconciliation.PollingCoordinator;
import com.platform.servicehost.security.CommandGuard;
import com.platform.servicehost.security.PathGuard;
import com.platform.servicehost.security.SecurityAuditLogger;
import com.platform.servicehost.state.OperationGuard;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

/**
 * The real orchestrator, store, adapter and sandbox manager wired over a temp directory,
 * with the OS and the host tool replaced by fakes. The polling timer never fires on its
 * own; tests call {@link PollingCoordinator#tick()} directly.
 */
public class TestEnvironment {

    public final Path root;
    public final Path executable;
    public final ServiceHostProperties properties;
    public final FakeServiceControl serviceControl;
    public final FakeCommandRunner commandRunner;
    public final SandboxManager sandboxManager;
    public final ServiceHostAdapter hostAdapter;
    public final JsonServiceRecordRepository repository;
    public final ServiceRecordStore store;
    public final OperationGuard operationGuard;
    public final MetricsRegistry metricsRegistry;
    public final TaskScheduler taskScheduler;
    public final PollingCoordinator pollingCoordinator;
    public final LifecycleOrchestrator orchestrator;
    public final List<Object> publishedEvents = new CopyOnWriteArrayList<>();

    public TestEnvironment(Path root) throws IOException {
        this.root = root;

        Path templates = Files.createDirectories(root.resolve("templates"));
        Files.writeString(templates.resolve("WinSW-x64.exe"), "host tool binary");
        Files.writeString(templates.resolve("wrapper.bat"), "@echo off");
        Path bin = Files.createDirectories(root.resolve("bin"));
        this.executable = Files.writeString(bin.resolve("app.exe"), "app");

        this.properties = new ServiceHostProperties();
        properties.setDataDirectory(root.resolve("data").toString());
        properties.setServicesRoot(root.resolve("services").toString());
        properties.getHostTool().setTemplatePath(templates.resolve("WinSW-x64.exe").toString());
        properties.getHostTool().setWrapperTemplatePath(templates.resolve("wrapper.bat").toString());
        properties.getControl().setPollInterval(Duration.ofMillis(5));
        properties.getControl().setWaitCeiling(Duration.ofMillis(500));
        properties.getUninstall().setDeleteRetries(2);
        properties.getUninstall().setDeleteRetryDelay(Duration.ofMillis(10));

        this.serviceControl = new FakeServiceControl();
        this.commandRunner = new FakeCommandRunner(serviceControl);
        this.sandboxManager = new SandboxManager(properties, new HostToolConfigWriter());
        this.hostAdapter = new ServiceHostAdapter(commandRunner, serviceControl, sandboxManager, properties);

        this.metricsRegistry = new MetricsRegistry(new SimpleMeterRegistry());
        this.repository = new JsonServiceRecordRepository(JacksonConfig.standardObjectMapper(),
            properties.dataDirectoryPath());
        this.store = new ServiceRecordStore(repository, metricsRegistry, Clock.systemUTC());
        store.load();
        this.operationGuard = new OperationGuard();

        this.taskScheduler = mock(TaskScheduler.class);
        doAnswer(invocation -> mock(ScheduledFuture.class))
            .when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        this.pollingCoordinator = new PollingCoordinator(taskScheduler, Runnable::run, hostAdapter,
            publishedEvents::add, metricsRegistry, properties, Clock.systemUTC());

        CommandGuard commandGuard = new CommandGuard();
        this.orchestrator = new LifecycleOrchestrator(
            store,
            hostAdapter,
            new RequestValidator(PathGuard.structural(), commandGuard),
            new ServiceDependencyValidator(),
            operationGuard,
            pollingCoordinator,
            new SecurityAuditLogger(commandGuard),
            metricsRegistry,
            Clock.systemUTC());
    }

    public ServiceCreateRequest request(String displayName) {
        return ServiceCreateRequest.builder()
            .displayName(displayName)
            .executablePath(executable.toString())
            .arguments("--port 8080")
            .build();
    }

    public ServiceCreateRequest request(String displayName, boolean autoStart) {
        ServiceCreateRequest request = request(displayName);
        request.setAutoStart(autoStart);
        return request;
    }
}
