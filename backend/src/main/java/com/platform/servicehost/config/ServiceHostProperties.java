package com.platform.servicehost.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for the service host manager.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "servicehost")
public class ServiceHostProperties {
    
    /**
     * Directory holding services.json and its backup.
     */
    private String dataDirectory = "data";
    
    /**
     * Sandbox root; one directory per service id.
     */
    private String servicesRoot = "services";
    
    private HostTool hostTool = new HostTool();
    
    private Control control = new Control();
    
    private Baseline baseline = new Baseline();
    
    private Polling polling = new Polling();
    
    private PathPolicy paths = new PathPolicy();
    
    private Uninstall uninstall = new Uninstall();
    
    public Path dataDirectoryPath() {
        return Path.of(dataDirectory).toAbsolutePath().normalize();
    }
    
    public Path servicesRootPath() {
        return Path.of(servicesRoot).toAbsolutePath().normalize();
    }
    
    /**
     * External service-host tool.
     */
    @Data
    public static class HostTool {
        /**
         * Binary copied into each sandbox as {id}.exe.
         */
        private String templatePath = "templates/WinSW-x64.exe";
        
        /**
         * Script staged as wrapper.bat when restart-on-exit is enabled.
         */
        private String wrapperTemplatePath = "templates/wrapper.bat";
        
        /**
         * Ceiling for one install/uninstall/start/stop invocation; the process is killed past it.
         */
        private Duration commandTimeout = Duration.ofMinutes(2);
        
        /**
         * Charset of sc.exe and host tool output. Blank means the platform's native encoding.
         */
        private String outputCharset = "";
    }
    
    /**
     * Waiting for the OS to reach a target status after start/stop.
     */
    @Data
    public static class Control {
        private Duration pollInterval = Duration.ofMillis(500);
        private Duration waitCeiling = Duration.ofSeconds(30);
        
        /**
         * Timeout for a single sc.exe invocation.
         */
        private Duration commandTimeout = Duration.ofSeconds(15);
    }
    
    @Data
    public static class Baseline {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(10);
        private Duration initialDelay = Duration.ofSeconds(5);
    }
    
    @Data
    public static class Polling {
        private int maxConcurrentQueries = 5;
        private Duration maxTrackedDuration = Duration.ofSeconds(30);
        
        /**
         * Per-query ceiling inside one coordinator tick.
         */
        private Duration queryTimeout = Duration.ofSeconds(10);
    }
    
    @Data
    public static class PathPolicy {
        /**
         * When set, every user-supplied path must resolve under this root.
         */
        private String allowedRoot;
        
        private int maxLength = 260;
    }
    
    @Data
    public static class Uninstall {
        private int deleteRetries = 5;
        private Duration deleteRetryDelay = Duration.ofMillis(500);
    }
}
