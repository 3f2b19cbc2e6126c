package com.platform.servicehost.error;

import com.platform.servicehost.state.ServiceStatus;

/**
 * Requested operation is illegal for the record's current status, or another
 * operation already holds the service.
 */
public class OperationConflictException extends ServiceHostException {
    
    private final String serviceId;
    private final ServiceStatus currentStatus;
    
    public OperationConflictException(ErrorCode errorCode, String serviceId, ServiceStatus currentStatus, String message) {
        super(errorCode, message);
        this.serviceId = serviceId;
        this.currentStatus = currentStatus;
    }
    
    public String getServiceId() {
        return serviceId;
    }
    
    public ServiceStatus getCurrentStatus() {
        return currentStatus;
    }
}
