package com.platform.servicehost.host;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * XML configuration consumed by the service-host tool ({@code <id>.xml} next to the binary).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JacksonXmlRootElement(localName = "service")
@JsonPropertyOrder({"id", "name", "description", "executable", "arguments", "workingdirectory",
    "startmode", "stoptimeout", "serviceaccount", "env", "depend", "logpath", "log",
    "stopparentprocessfirst", "onfailure"})
public class HostToolConfig {
    
    public static final int LOG_SIZE_THRESHOLD_KB = 10240;
    public static final int LOG_KEEP_FILES = 8;
    
    private String id;
    
    private String name;
    
    private String description;
    
    private String executable;
    
    private String arguments;
    
    @JacksonXmlProperty(localName = "workingdirectory")
    private String workingDirectory;
    
    @JacksonXmlProperty(localName = "startmode")
    private String startMode;
    
    @JacksonXmlProperty(localName = "stoptimeout")
    private String stopTimeout;
    
    @JacksonXmlProperty(localName = "serviceaccount")
    private ServiceAccount serviceAccount;
    
    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "env")
    private List<EnvironmentVariable> environment;
    
    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "depend")
    private List<String> dependencies;
    
    @JacksonXmlProperty(localName = "logpath")
    private String logPath;
    
    private LogSettings log;
    
    @JacksonXmlProperty(localName = "stopparentprocessfirst")
    private Boolean stopParentProcessFirst;
    
    @JacksonXmlProperty(localName = "onfailure")
    private FailureAction onFailure;
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ServiceAccount {
        private String username;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"name", "value"})
    public static class EnvironmentVariable {
        @JacksonXmlProperty(isAttribute = true)
        private String name;
        
        @JacksonXmlProperty(isAttribute = true)
        private String value;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"mode", "sizeThreshold", "keepFiles"})
    public static class LogSettings {
        @JacksonXmlProperty(isAttribute = true)
        private String mode;
        
        private int sizeThreshold;
        
        private int keepFiles;
        
        public static LogSettings rollBySize() {
            return new LogSettings("roll-by-size", LOG_SIZE_THRESHOLD_KB, LOG_KEEP_FILES);
        }
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FailureAction {
        @JacksonXmlProperty(isAttribute = true)
        private String action;
        
        public static FailureAction restart() {
            return new FailureAction("restart");
        }
    }
}
