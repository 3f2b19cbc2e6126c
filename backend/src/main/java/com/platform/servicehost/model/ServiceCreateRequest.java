package com.platform.servicehost.model;

import com.platform.servicehost.security.SafeArguments;
import com.platform.servicehost.security.SafePath;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Request to create and install a new managed service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceCreateRequest {

    @NotBlank
    @Size(min = 3, max = 100)
    private String displayName;

    @Size(max = 500)
    private String description;

    @NotBlank
    @SafePath
    private String executablePath;

    @SafePath
    private String scriptPath;

    @SafeArguments
    private String arguments;

    @SafePath
    private String workingDirectory;

    @Builder.Default
    private Set<String> dependencies = new LinkedHashSet<>();

    @Builder.Default
    private Map<String, String> environmentVariables = new LinkedHashMap<>();

    @Size(max = 256)
    private String serviceAccount;

    private StartMode startMode;

    @Min(1000)
    @Max(600000)
    private Integer stopTimeoutMs;

    @Builder.Default
    private boolean autoStart = true;

    private boolean restartOnExit;

    private Integer restartExitCode;
}
