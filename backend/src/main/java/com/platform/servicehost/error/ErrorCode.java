package com.platform.servicehost.error;

/**
 * Standardized error codes for the service host manager.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: SH-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: External errors (host tool, OS service control, sandbox I/O)
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("SH-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("SH-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("SH-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_PATH("SH-110", "Path rejected", ErrorCategory.RECOVERABLE),
    UNSAFE_ARGUMENTS("SH-111", "Arguments rejected", ErrorCategory.RECOVERABLE),
    INVALID_EXECUTABLE("SH-112", "Executable type not allowed", ErrorCategory.RECOVERABLE),
    INVALID_DEPENDENCY("SH-120", "Invalid service dependency", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    SERVICE_NOT_FOUND("SH-300", "Service not found", ErrorCategory.RECOVERABLE),
    OPERATION_CONFLICT("SH-310", "Operation not allowed in current status", ErrorCategory.RECOVERABLE),
    OPERATION_IN_PROGRESS("SH-311", "Another operation is in progress for this service", ErrorCategory.RECOVERABLE),
    
    // ==================== External Errors (4xx) ====================
    
    HOST_TOOL_FAILED("SH-400", "Service host tool failed", ErrorCategory.RECOVERABLE),
    SERVICE_CONTROL_FAILED("SH-410", "OS service control failed", ErrorCategory.RECOVERABLE),
    SANDBOX_IO_ERROR("SH-420", "Sandbox directory operation failed", ErrorCategory.RECOVERABLE),
    PERSISTENCE_ERROR("SH-430", "Service metadata could not be saved", ErrorCategory.FATAL),
    OPERATION_TIMEOUT("SH-440", "Operation timed out", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("SH-900", "Internal server error", ErrorCategory.FATAL),
    UNEXPECTED_ERROR("SH-901", "Unexpected error occurred", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("SH-902", "Configuration error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }
    
    /**
     * Validation-class codes never reach an external call.
     */
    public boolean isValidation() {
        return code.startsWith("SH-1");
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can refresh, fix the request, or retry.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - local state may be inconsistent, needs intervention.
         */
        FATAL
    }
}
