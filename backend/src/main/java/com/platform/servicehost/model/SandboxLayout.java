package com.platform.servicehost.model;

import java.nio.file.Path;

/**
 * Per-service sandbox directory layout.
 * Log viewers depend on these names, so they must not change between versions.
 *
 * <pre>
 * {root}/{id}/{id}.exe          staged host-tool binary
 * {root}/{id}/{id}.xml          generated host-tool configuration
 * {root}/{id}/wrapper.bat       restart-on-exit wrapper (optional)
 * {root}/{id}/logs/{id}.out.log
 * {root}/{id}/logs/{id}.err.log
 * </pre>
 */
public record SandboxLayout(Path servicesRoot, String serviceId) {

    public static final String LOG_DIRECTORY = "logs";
    public static final String WRAPPER_SCRIPT = "wrapper.bat";

    public Path serviceDirectory() {
        return servicesRoot.resolve(serviceId);
    }

    public Path hostExecutablePath() {
        return serviceDirectory().resolve(serviceId + ".exe");
    }

    public Path configPath() {
        return serviceDirectory().resolve(serviceId + ".xml");
    }

    public Path wrapperPath() {
        return serviceDirectory().resolve(WRAPPER_SCRIPT);
    }

    public Path logDirectory() {
        return serviceDirectory().resolve(LOG_DIRECTORY);
    }

    public Path outputLogPath() {
        return logDirectory().resolve(serviceId + ".out.log");
    }

    public Path errorLogPath() {
        return logDirectory().resolve(serviceId + ".err.log");
    }
}
