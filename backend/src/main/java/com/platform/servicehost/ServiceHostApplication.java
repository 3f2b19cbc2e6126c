package com.platform.servicehost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Service Host Manager
 *
 * Manages OS services that wrap arbitrary executables through a service-host tool:
 * - Validated creation, installation and uninstallation
 * - Start, stop and restart through a per-service state machine
 * - Status reconciliation by a baseline sweep plus targeted polling after each operation
 * - REST API and STOMP topics for front ends
 */
@SpringBootApplication
public class ServiceHostApplication {

    public static void main(String[] args) {
        SpringApplication.run(ServiceHostApplication.class, args);
    }
}
