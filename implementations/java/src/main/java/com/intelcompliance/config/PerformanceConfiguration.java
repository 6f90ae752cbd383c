package com.intelcompliance.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance Monitoring Configuration.
 *
 * Tracks:
 * - Repository adapter latency
 * - Cryptographic operation latency and failure rate
 * - Incident operation latency
 * - Business counters (incidents, containment failures, audit volume, authentication failures)
 *
 * Security: No sensitive data in metrics. Tags carry method names and enum values only.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    private static Object timed(MeterRegistry meterRegistry, String metric, String description,
                                ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "failure";
        try {
            Object result = joinPoint.proceed();
            outcome = "success";
            return result;
        } finally {
            sample.stop(Timer.builder(metric)
                .tag("method", methodName)
                .tag("outcome", outcome)
                .description(description)
                .register(meterRegistry));
        }
    }

    /**
     * Aspect for timing repository adapters.
     */
    @Aspect
    @Component
    public static class RepositoryPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public RepositoryPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.intelcompliance.infrastructure.persistence.*RepositoryAdapter.*(..))")
        public Object timeRepositoryMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "repository.operation", "Repository operation timing", joinPoint);
        }
    }

    /**
     * Aspect for timing crypto operations.
     */
    @Aspect
    @Component
    public static class CryptoPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public CryptoPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        /**
         * Time encryption, decryption, hashing and signing.
         */
        @Around("execution(* com.intelcompliance.infrastructure.crypto.CryptoService.*(..))")
        public Object timeCryptoOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "crypto.operation", "Cryptographic operation timing", joinPoint);
        }
    }

    /**
     * Aspect for timing incident response operations.
     */
    @Aspect
    @Component
    public static class IncidentPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public IncidentPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(public * com.intelcompliance.application.incident.IncidentResponseService.*(..))")
        public Object timeIncidentOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "incident.operation", "Incident operation timing", joinPoint);
        }
    }

    /**
     * Custom metrics for business operations.
     */
    @Component
    @Slf4j
    public static class BusinessMetrics {

        private final MeterRegistry meterRegistry;

        public BusinessMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized business metrics");
        }

        public void recordIncidentCreated(String type, String severity) {
            meterRegistry.counter("business.incidents.created",
                "type", type, "severity", severity).increment();
        }

        public void recordIncidentEscalated(String severity) {
            meterRegistry.counter("business.incidents.escalated", "severity", severity).increment();
        }

        /**
         * Record a containment action that did not succeed.
         */
        public void recordContainmentFailure(String actionType) {
            meterRegistry.counter("business.containment.failures", "action", actionType).increment();
        }

        public void recordAuditEvent(String outcome) {
            meterRegistry.counter("business.audit.events", "outcome", outcome).increment();
        }

        public void recordAuthenticationFailure(String operation) {
            meterRegistry.counter("security.authentication.failures", "operation", operation).increment();
        }
    }
}
