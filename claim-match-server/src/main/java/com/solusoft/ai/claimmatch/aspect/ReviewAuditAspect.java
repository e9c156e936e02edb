package com.solusoft.ai.claimmatch.aspect;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.MDC;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Audit trail for every MCP tool call: who, what, how long. Each call gets a
 * {@code trace_id} in the MDC so its log lines can be grouped.
 */
@Aspect
@Component
@Slf4j
public class ReviewAuditAspect {

    static final String TRACE_ID = "trace_id";

    @Around("@annotation(org.springaicommunity.mcp.annotation.McpTool)")
    public Object auditToolCall(ProceedingJoinPoint joinPoint) throws Throwable {

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        String reviewer = (auth != null) ? auth.getName() : "Anonymous";
        String authorities = (auth != null) ? auth.getAuthorities().toString() : "[]";
        String action = joinPoint.getSignature().getName();

        // Nested tool calls keep the outer trace id
        boolean ownsTrace = MDC.get(TRACE_ID) == null;
        if (ownsTrace) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString());
        }

        log.info("🕵️ [AUDIT START] Reviewer='{}' Role={} Action='{}'", reviewer, authorities, action);

        Instant start = Instant.now();
        boolean success = true;
        String errorMessage = null;

        try {
            return joinPoint.proceed();
        } catch (Throwable ex) {
            success = false;
            errorMessage = ex.getMessage();
            throw ex;
        } finally {
            long timeTaken = Duration.between(start, Instant.now()).toMillis();
            if (success) {
                log.info("✅ [AUDIT SUCCESS] Reviewer='{}' Action='{}' Time={}ms", reviewer, action, timeTaken);
            } else {
                log.error("❌ [AUDIT FAILURE] Reviewer='{}' Action='{}' Error='{}'", reviewer, action, errorMessage);
            }
            if (ownsTrace) {
                MDC.remove(TRACE_ID);
            }
        }
    }
}
