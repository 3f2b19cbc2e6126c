package com.platform.servicehost.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.servicehost.error.ErrorResponse;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Token-bucket rate limit per client IP on mutating service endpoints.
 * Each accepted request can end in several OS service-control calls, so bursts are cut here.
 * {@code X-Forwarded-For} is honoured only when the direct peer is a configured trusted proxy.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RateLimitingFilter implements Filter {
    
    private static final String SERVICES_PATH = "/api/services";
    
    private final Map<String, Bucket> mutationBuckets = new ConcurrentHashMap<>();
    private final SecurityAuditLogger auditLogger;
    private final ObjectMapper objectMapper;
    
    @Value("${servicehost.security.rate-limit.mutations.requests-per-minute:60}")
    private int mutationRequestsPerMinute;
    
    @Value("${servicehost.security.rate-limit.enabled:true}")
    private boolean enabled;
    
    @Value("${servicehost.security.rate-limit.trusted-proxies:}")
    private List<String> trustedProxies = List.of();
    
    public RateLimitingFilter(SecurityAuditLogger auditLogger, ObjectMapper objectMapper) {
        this.auditLogger = auditLogger;
        this.objectMapper = objectMapper;
    }
    
    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        String path = httpRequest.getRequestURI();
        
        if (!enabled || !path.startsWith(SERVICES_PATH) || !isMutatingMethod(httpRequest.getMethod())) {
            chain.doFilter(request, response);
            return;
        }
        
        String clientIp = getClientIp(httpRequest);
        Bucket bucket = mutationBuckets.computeIfAbsent(clientIp, ip -> createBucket(mutationRequestsPerMinute));
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);
        
        if (probe.isConsumed()) {
            chain.doFilter(request, response);
            return;
        }
        
        long retryAfterSeconds = Math.max(1, TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill()));
        log.warn("[RATE_LIMIT] Blocked {} {} from {}", httpRequest.getMethod(), path, clientIp);
        auditLogger.logRateLimitViolation(clientIp, path);
        
        HttpServletResponse httpResponse = (HttpServletResponse) response;
        httpResponse.setStatus(429);
        httpResponse.setContentType(MediaType.APPLICATION_JSON_VALUE);
        httpResponse.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        httpResponse.setHeader("X-RateLimit-Limit", String.valueOf(mutationRequestsPerMinute));
        httpResponse.setHeader("X-RateLimit-Remaining", "0");
        
        ErrorResponse error = ErrorResponse.builder()
            .code("SH-429")
            .message("Rate limit exceeded")
            .detail("Too many service operations from this client")
            .fatal(false)
            .status(429)
            .timestamp(Instant.now())
            .path(path)
            .metadata(Map.of("retryAfterSeconds", retryAfterSeconds))
            .build();
        
        objectMapper.writeValue(httpResponse.getWriter(), error);
    }
    
    private Bucket createBucket(int requestsPerMinute) {
        Bandwidth limit = Bandwidth.classic(
            requestsPerMinute,
            Refill.greedy(requestsPerMinute, Duration.ofMinutes(1))
        );
        return Bucket.builder().addLimit(limit).build();
    }
    
    private boolean isMutatingMethod(String method) {
        return "POST".equals(method) || "PUT".equals(method) ||
               "PATCH".equals(method) || "DELETE".equals(method);
    }
    
    private String getClientIp(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (!trustedProxies.contains(remoteAddr)) {
            return remoteAddr;
        }
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return remoteAddr;
    }
}
