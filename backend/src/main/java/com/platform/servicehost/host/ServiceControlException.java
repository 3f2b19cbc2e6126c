package com.platform.servicehost.host;

/**
 * Failure reported by the OS service-control interface.
 */
public class ServiceControlException extends Exception {
    
    public enum Kind {
        /**
         * No OS service is registered under the name.
         */
        NOT_FOUND,
        FAILED,
        TIMEOUT
    }
    
    private final Kind kind;
    private final String serviceName;
    
    public ServiceControlException(Kind kind, String serviceName, String message) {
        super(message);
        this.kind = kind;
        this.serviceName = serviceName;
    }
    
    public static ServiceControlException notFound(String serviceName) {
        return new ServiceControlException(Kind.NOT_FOUND, serviceName, "Service not found: " + serviceName);
    }
    
    public Kind getKind() {
        return kind;
    }
    
    public String getServiceName() {
        return serviceName;
    }
    
    public boolean isNotFound() {
        return kind == Kind.NOT_FOUND;
    }
}
