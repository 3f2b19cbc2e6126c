package com.platform.servicehost.host;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.platform.servicehost.model.SandboxLayout;
import com.platform.servicehost.model.ServiceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a record into the host tool's XML configuration.
 *
 * All user-supplied text goes through the XML serializer, so names, descriptions,
 * arguments and environment values cannot close an element or inject a new one.
 */
@Slf4j
@Component
public class HostToolConfigWriter {
    
    private final XmlMapper xmlMapper;
    
    public HostToolConfigWriter() {
        this.xmlMapper = XmlMapper.builder()
            .enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();
    }
    
    public HostToolConfig buildConfig(ServiceRecord record, SandboxLayout layout) {
        String executable = record.getExecutablePath();
        String arguments = record.getFullArguments();
        HostToolConfig.FailureAction onFailure = null;
        
        if (record.getRestartPolicy().enabled()) {
            // the wrapper relaunches the real executable when it exits with the trigger code
            executable = layout.wrapperPath().toString();
            arguments = wrapperArguments(record);
            onFailure = HostToolConfig.FailureAction.restart();
        }
        
        List<HostToolConfig.EnvironmentVariable> environment = new ArrayList<>();
        for (Map.Entry<String, String> entry : record.getEnvironmentVariables().entrySet()) {
            environment.add(new HostToolConfig.EnvironmentVariable(entry.getKey(), entry.getValue()));
        }
        
        return HostToolConfig.builder()
            .id(record.getId())
            .name(record.getDisplayName())
            .description(record.getDescription())
            .executable(executable)
            .arguments(arguments == null || arguments.isEmpty() ? null : arguments)
            .workingDirectory(resolveWorkingDirectory(record))
            .startMode(record.getStartMode().getConfigValue())
            .stopTimeout(record.getStopTimeoutMs() + " ms")
            .serviceAccount(isBlank(record.getServiceAccount())
                ? null : new HostToolConfig.ServiceAccount(record.getServiceAccount()))
            .environment(environment.isEmpty() ? null : environment)
            .dependencies(record.getDependencies().isEmpty() ? null : List.copyOf(record.getDependencies()))
            .logPath(layout.logDirectory().toString())
            .log(HostToolConfig.LogSettings.rollBySize())
            .stopParentProcessFirst(Boolean.TRUE)
            .onFailure(onFailure)
            .build();
    }
    
    public String render(ServiceRecord record, SandboxLayout layout) throws IOException {
        return xmlMapper.writeValueAsString(buildConfig(record, layout));
    }
    
    /**
     * Writes {@code <id>.xml} into the sandbox, replacing any previous version.
     */
    public Path write(ServiceRecord record, SandboxLayout layout) throws IOException {
        Path target = layout.configPath();
        Files.writeString(target, render(record, layout));
        log.debug("Wrote host tool configuration {}", target);
        return target;
    }
    
    static String wrapperArguments(ServiceRecord record) {
        StringBuilder sb = new StringBuilder();
        sb.append('"').append(record.getExecutablePath()).append('"');
        String full = record.getFullArguments();
        if (!full.isEmpty()) {
            sb.append(' ').append(full);
        }
        sb.append(' ').append(record.getRestartPolicy().triggerExitCode());
        return sb.toString();
    }
    
    private static String resolveWorkingDirectory(ServiceRecord record) {
        if (!isBlank(record.getWorkingDirectory())) {
            return record.getWorkingDirectory();
        }
        Path parent = Path.of(record.getExecutablePath()).getParent();
        return parent != null ? parent.toString() : null;
    }
    
    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
