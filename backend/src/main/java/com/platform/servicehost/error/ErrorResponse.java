package com.platform.servicehost.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON body of every failed API call.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /**
     * Error code, e.g. SH-310.
     */
    private String code;
    
    private String message;
    
    /**
     * Captured diagnostic output (tool stdout/stderr, exception text).
     */
    private String detail;
    
    private boolean fatal;
    
    private int status;
    
    private Instant timestamp;
    
    private String path;
    
    private String traceId;
    
    private String serviceId;
    
    private String operation;
    
    private Long elapsedMs;
    
    private List<FieldError> fieldErrors;
    
    private Map<String, Object> metadata;
    
    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }
    
    public static ErrorResponse of(ErrorCode errorCode, String message, int status, String path, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message != null ? message : errorCode.getDefaultMessage())
            .fatal(errorCode.isFatal())
            .status(status)
            .timestamp(Instant.now())
            .path(path)
            .traceId(traceId)
            .build();
    }
}
