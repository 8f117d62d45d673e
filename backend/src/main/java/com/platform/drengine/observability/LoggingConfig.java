package com.platform.drengine.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: request correlation IDs and the MDC keys used by DR operations.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_BACKUP_JOB_ID = "backupJobId";
    public static final String MDC_EXECUTION_ID = "executionId";
    public static final String MDC_FAILOVER_EVENT_ID = "failoverEventId";
    public static final String MDC_PRIMARY_REGION = "primaryRegion";
    public static final String MDC_RECOVERY_TEST_ID = "recoveryTestId";
    
    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_REQUEST_PATH = "requestPath";
        private static final String MDC_REQUEST_METHOD = "requestMethod";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }
                
                MDC.put(MDC_CORRELATION_ID, correlationId);
                MDC.put(MDC_REQUEST_PATH, request.getRequestURI());
                MDC.put(MDC_REQUEST_METHOD, request.getMethod());
                
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
                
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
                MDC.remove(MDC_REQUEST_PATH);
                MDC.remove(MDC_REQUEST_METHOD);
            }
        }
    }
    
    /**
     * Set failover context in MDC for logging.
     */
    public static void setFailoverContext(String eventId, String primaryRegion) {
        MDC.put(MDC_FAILOVER_EVENT_ID, eventId);
        MDC.put(MDC_PRIMARY_REGION, primaryRegion);
    }
    
    public static void clearFailoverContext() {
        MDC.remove(MDC_FAILOVER_EVENT_ID);
        MDC.remove(MDC_PRIMARY_REGION);
    }
    
    /**
     * Set backup context in MDC for logging.
     */
    public static void setBackupContext(String jobId, String executionId) {
        MDC.put(MDC_BACKUP_JOB_ID, jobId);
        MDC.put(MDC_EXECUTION_ID, executionId);
    }
    
    public static void clearBackupContext() {
        MDC.remove(MDC_BACKUP_JOB_ID);
        MDC.remove(MDC_EXECUTION_ID);
    }
    
    public static void setRecoveryTestContext(String testId) {
        MDC.put(MDC_RECOVERY_TEST_ID, testId);
    }
    
    public static void clearRecoveryTestContext() {
        MDC.remove(MDC_RECOVERY_TEST_ID);
    }
}
