package com.platform.servicehost.error;

/**
 * Exception for validation errors.
 */
public class ValidationException extends ServiceHostException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ValidationException(ErrorCode errorCode, String field, Object rejectedValue, String message) {
        super(errorCode, String.format("Invalid value for field '%s': %s", field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
