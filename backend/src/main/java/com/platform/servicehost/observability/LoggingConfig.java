package com.platform.servicehost.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Correlation ids for REST requests and MDC helpers for lifecycle operations.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_SERVICE_ID = "serviceId";
    public static final String MDC_OPERATION = "operation";
    
    @Value("${spring.application.name:service-host-manager}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);
        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_CORRELATION_ID = "correlationId";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank() || correlationId.length() > 64) {
                    correlationId = UUID.randomUUID().toString();
                }
                
                MDC.put(MDC_CORRELATION_ID, correlationId);
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }
    
    /**
     * Tag log lines of the current thread with the service and operation being run.
     */
    public static void setOperationContext(String serviceId, String operation) {
        MDC.put(MDC_SERVICE_ID, serviceId);
        MDC.put(MDC_OPERATION, operation);
    }
    
    public static void clearOperationContext() {
        MDC.remove(MDC_SERVICE_ID);
        MDC.remove(MDC_OPERATION);
    }
}
