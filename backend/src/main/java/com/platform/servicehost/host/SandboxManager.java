package com.platform.servicehost.host;

import com.platform.servicehost.config.ServiceHostProperties;
import com.platform.servicehost.model.SandboxLayout;
import com.platform.servicehost.model.ServiceRecord;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Creates, refreshes and removes per-service sandbox directories.
 */
@Slf4j
@Component
public class SandboxManager {
    
    private final Path servicesRoot;
    private final Path hostToolTemplate;
    private final Path wrapperTemplate;
    private final HostToolConfigWriter configWriter;
    private final Retry deleteRetry;
    
    public SandboxManager(ServiceHostProperties properties, HostToolConfigWriter configWriter) {
        this.servicesRoot = properties.servicesRootPath();
        this.hostToolTemplate = Path.of(properties.getHostTool().getTemplatePath());
        this.wrapperTemplate = Path.of(properties.getHostTool().getWrapperTemplatePath());
        this.configWriter = configWriter;
        
        ServiceHostProperties.Uninstall uninstall = properties.getUninstall();
        // a just-stopped process may hold its log handles for a moment
        this.deleteRetry = Retry.of("sandbox-delete", RetryConfig.custom()
            .maxAttempts(Math.max(1, uninstall.getDeleteRetries()))
            .waitDuration(uninstall.getDeleteRetryDelay())
            .retryExceptions(IOException.class, UncheckedIOException.class)
            .build());
        this.deleteRetry.getEventPublisher().onRetry(event ->
            log.debug("Retrying sandbox delete (attempt {}): {}", event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "-"));
    }
    
    public SandboxLayout layoutFor(String serviceId) {
        return new SandboxLayout(servicesRoot, serviceId);
    }
    
    public boolean exists(String serviceId) {
        return Files.isDirectory(layoutFor(serviceId).serviceDirectory());
    }
    
    /**
     * Materializes the sandbox: directories, empty log files, staged binary,
     * optional wrapper script and the generated configuration.
     */
    public SandboxLayout stage(ServiceRecord record) throws IOException {
        SandboxLayout layout = layoutFor(record.getId());
        
        if (!Files.isRegularFile(hostToolTemplate)) {
            throw new NoSuchFileException(hostToolTemplate.toString(), null, "Host tool template not found");
        }
        if (record.getRestartPolicy().enabled() && !Files.isRegularFile(wrapperTemplate)) {
            throw new NoSuchFileException(wrapperTemplate.toString(), null, "Wrapper script template not found");
        }
        
        Files.createDirectories(layout.logDirectory());
        for (Path logFile : List.of(layout.outputLogPath(), layout.errorLogPath())) {
            if (!Files.exists(logFile)) {
                Files.createFile(logFile);
            }
        }
        Files.copy(hostToolTemplate, layout.hostExecutablePath(), StandardCopyOption.REPLACE_EXISTING);
        writeConfiguration(record, layout);
        
        log.info("Staged sandbox {}", layout.serviceDirectory());
        return layout;
    }
    
    /**
     * Rewrites the configuration (and the wrapper, when the policy needs one) of an existing sandbox.
     */
    public void writeConfiguration(ServiceRecord record, SandboxLayout layout) throws IOException {
        if (record.getRestartPolicy().enabled()) {
            if (!Files.isRegularFile(wrapperTemplate)) {
                throw new NoSuchFileException(wrapperTemplate.toString(), null, "Wrapper script template not found");
            }
            Files.copy(wrapperTemplate, layout.wrapperPath(), StandardCopyOption.REPLACE_EXISTING);
        } else {
            Files.deleteIfExists(layout.wrapperPath());
        }
        configWriter.write(record, layout);
    }
    
    /**
     * Removes the sandbox directory tree, retrying while files are still locked.
     */
    public void delete(String serviceId) throws IOException {
        Path directory = layoutFor(serviceId).serviceDirectory();
        if (!Files.exists(directory)) {
            return;
        }
        try {
            Retry.decorateCheckedRunnable(deleteRetry, () -> deleteTree(directory)).run();
        } catch (IOException e) {
            throw e;
        } catch (Throwable t) {
            throw new IOException("Failed to delete " + directory, t);
        }
        log.info("Removed sandbox {}", directory);
    }
    
    private static void deleteTree(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (DirectoryNotEmptyException e) {
                throw new FileSystemException(path.toString(), null, "Directory still has open entries");
            }
        }
    }
}
