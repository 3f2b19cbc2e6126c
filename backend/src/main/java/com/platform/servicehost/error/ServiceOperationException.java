package com.platform.servicehost.error;

import com.platform.servicehost.model.OperationResult;
import com.platform.servicehost.model.OperationType;

/**
 * A failed {@link OperationResult} raised at the REST boundary.
 */
public class ServiceOperationException extends ServiceHostException {
    
    private final String serviceId;
    private final OperationType operation;
    private final String detail;
    private final long elapsedMs;
    
    public ServiceOperationException(OperationResult<?> result) {
        super(result.errorCode() != null ? result.errorCode() : ErrorCode.INTERNAL_ERROR, result.message());
        this.serviceId = result.serviceId();
        this.operation = result.operation();
        this.detail = result.detail();
        this.elapsedMs = result.elapsedMs();
    }
    
    public String getServiceId() {
        return serviceId;
    }
    
    public OperationType getOperation() {
        return operation;
    }
    
    public String getDetail() {
        return detail;
    }
    
    public long getElapsedMs() {
        return elapsedMs;
    }
}
