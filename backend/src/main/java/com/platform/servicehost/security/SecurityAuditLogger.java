package com.platform.servicehost.security;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Audit trail for security-relevant events: rejected paths or arguments,
 * and every create, update and uninstall.
 */
@Slf4j
@Component
public class SecurityAuditLogger {
    
    private static final String AUDIT_PREFIX = "[AUDIT]";
    
    private final CommandGuard commandGuard;
    
    public SecurityAuditLogger(CommandGuard commandGuard) {
        this.commandGuard = commandGuard;
    }
    
    /**
     * Log a field rejected by PathGuard or CommandGuard. The offending value is
     * logged in sanitized form so it cannot forge log lines.
     */
    public void logInputRejected(String serviceId, String field, String rejectedValue, String reason) {
        logAuditEvent(AuditEvent.builder()
            .eventType(AuditEventType.INPUT_REJECTED)
            .action("REJECT")
            .serviceId(serviceId)
            .success(false)
            .detail(String.format("field=%s value='%s' reason=%s",
                field, commandGuard.sanitize(rejectedValue), reason))
            .build());
    }
    
    public void logServiceCreate(String serviceId, String executablePath, boolean success, String detail) {
        logAuditEvent(AuditEvent.builder()
            .eventType(AuditEventType.SERVICE_CREATE)
            .action("CREATE")
            .serviceId(serviceId)
            .success(success)
            .detail("executable=" + commandGuard.sanitize(executablePath) + (detail != null ? " " + detail : ""))
            .build());
    }
    
    public void logServiceUpdate(String serviceId, boolean success, String detail) {
        logAuditEvent(AuditEvent.builder()
            .eventType(AuditEventType.SERVICE_UPDATE)
            .action("UPDATE")
            .serviceId(serviceId)
            .success(success)
            .detail(detail)
            .build());
    }
    
    public void logServiceUninstall(String serviceId, boolean success, String detail) {
        logAuditEvent(AuditEvent.builder()
            .eventType(AuditEventType.SERVICE_UNINSTALL)
            .action("UNINSTALL")
            .serviceId(serviceId)
            .success(success)
            .detail(detail)
            .build());
    }
    
    public void logRateLimitViolation(String clientIp, String path) {
        logAuditEvent(AuditEvent.builder()
            .eventType(AuditEventType.RATE_LIMIT_EXCEEDED)
            .action("BLOCK")
            .clientIp(clientIp)
            .success(false)
            .detail("Rate limit exceeded for " + path)
            .build());
    }
    
    private void logAuditEvent(AuditEvent event) {
        MDC.put("auditEventType", event.eventType().name());
        MDC.put("auditAction", event.action());
        if (event.serviceId() != null) MDC.put("auditServiceId", event.serviceId());
        if (event.clientIp() != null) MDC.put("auditClientIp", event.clientIp());
        
        try {
            String logMessage = String.format(
                "%s %s %s %s service=%s ip=%s success=%s detail=\"%s\"",
                AUDIT_PREFIX,
                event.eventType(),
                event.action(),
                event.timestamp(),
                event.serviceId() != null ? event.serviceId() : "-",
                event.clientIp() != null ? event.clientIp() : "-",
                event.success(),
                event.detail() != null ? event.detail() : ""
            );
            
            if (event.success()) {
                log.info(logMessage);
            } else {
                log.warn(logMessage);
            }
        } finally {
            MDC.remove("auditEventType");
            MDC.remove("auditAction");
            MDC.remove("auditServiceId");
            MDC.remove("auditClientIp");
        }
    }
    
    public enum AuditEventType {
        SERVICE_CREATE,
        SERVICE_UPDATE,
        SERVICE_UNINSTALL,
        INPUT_REJECTED,
        RATE_LIMIT_EXCEEDED
    }
    
    @lombok.Builder
    public record AuditEvent(
        AuditEventType eventType,
        String action,
        String serviceId,
        String clientIp,
        boolean success,
        String detail,
        Instant timestamp
    ) {
        public AuditEvent {
            if (timestamp == null) {
                timestamp = Instant.now();
            }
        }
    }
}
