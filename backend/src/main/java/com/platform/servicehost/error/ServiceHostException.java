package com.platform.servicehost.error;

/**
 * Base exception for all service host exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class ServiceHostException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected ServiceHostException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected ServiceHostException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected ServiceHostException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
