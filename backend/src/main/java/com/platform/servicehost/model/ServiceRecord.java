package com.platform.servicehost.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.platform.servicehost.state.ServiceStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of one managed service.
 *
 * Records are replaced, never mutated: every change goes through {@link #toBuilder()}
 * and the store swaps the whole snapshot, so readers and event consumers never see a
 * half-applied update.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ServiceRecord {

    public static final String DEFAULT_DESCRIPTION = "Managed by Service Host Manager";
    public static final int DEFAULT_STOP_TIMEOUT_MS = 15000;

    /**
     * Directory name, host-tool instance name and OS service name. Never changes.
     */
    String id;

    String displayName;

    @Builder.Default
    String description = DEFAULT_DESCRIPTION;

    String executablePath;

    String scriptPath;

    @Builder.Default
    String arguments = "";

    String workingDirectory;

    @Builder.Default
    Set<String> dependencies = Set.of();

    @Builder.Default
    Map<String, String> environmentVariables = Map.of();

    String serviceAccount;

    @Builder.Default
    StartMode startMode = StartMode.AUTOMATIC;

    @Builder.Default
    int stopTimeoutMs = DEFAULT_STOP_TIMEOUT_MS;

    @Builder.Default
    RestartPolicy restartPolicy = RestartPolicy.disabled();

    @Builder.Default
    ServiceStatus status = ServiceStatus.NOT_INSTALLED;

    /**
     * Message of the last failed operation, cleared on the next success.
     */
    String lastError;

    Instant createdAt;

    Instant updatedAt;

    /**
     * Arguments handed to the executable. A script path, when set, goes first and quoted.
     */
    @JsonIgnore
    public String getFullArguments() {
        String args = arguments == null ? "" : arguments.trim();
        if (scriptPath == null || scriptPath.isBlank()) {
            return args;
        }
        String quotedScript = "\"" + scriptPath + "\"";
        return args.isEmpty() ? quotedScript : quotedScript + " " + args;
    }

    public ServiceRecord withStatus(ServiceStatus newStatus, Instant now) {
        return toBuilder().status(newStatus).updatedAt(now).build();
    }

    public ServiceRecord withFailure(ServiceStatus newStatus, String error, Instant now) {
        return toBuilder().status(newStatus).lastError(error).updatedAt(now).build();
    }

    public ServiceRecord withSuccess(ServiceStatus newStatus, Instant now) {
        return toBuilder().status(newStatus).lastError(null).updatedAt(now).build();
    }
}
