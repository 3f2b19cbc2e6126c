package com.platform.servicehost.model;

import com.platform.servicehost.security.SafeArguments;
import com.platform.servicehost.security.SafePath;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

/**
 * Partial update of a service's configuration. Null fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceUpdateRequest {

    @Size(min = 3, max = 100)
    private String displayName;

    @Size(max = 500)
    private String description;

    @SafePath
    private String executablePath;

    @SafePath
    private String scriptPath;

    @SafeArguments
    private String arguments;

    @SafePath
    private String workingDirectory;

    private Set<String> dependencies;

    private Map<String, String> environmentVariables;

    @Size(max = 256)
    private String serviceAccount;

    private StartMode startMode;

    @Min(1000)
    @Max(600000)
    private Integer stopTimeoutMs;

    private Boolean restartOnExit;

    private Integer restartExitCode;
}
