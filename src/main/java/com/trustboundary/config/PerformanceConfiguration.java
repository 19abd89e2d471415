package com.trustboundary.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance monitoring for ledger and seal operations.
 *
 * <p>Ledger writes rewrite a whole file and seal operations run a MAC over
 * whole documents, so both are timed. No record content ends up in tags.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * In-process registry used when no monitoring backend is configured.
     */
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        log.info("No meter registry configured - using in-memory SimpleMeterRegistry");
        return new SimpleMeterRegistry();
    }

    /**
     * Aspect for timing ledger repository operations.
     */
    @Aspect
    @Component
    public static class LedgerPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public LedgerPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.trustboundary.infrastructure.persistence.*Repository.*(..))")
        public Object timeLedgerOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return time(meterRegistry, "ledger.operation", "Ledger operation timing", joinPoint);
        }
    }

    /**
     * Aspect for timing seal creation and verification.
     */
    @Aspect
    @Component
    public static class SealPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public SealPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.trustboundary.infrastructure.crypto.SealService.*(..))")
        public Object timeSealOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return time(meterRegistry, "seal.operation", "Seal operation timing", joinPoint);
        }
    }

    private static Object time(MeterRegistry registry, String name, String description,
                               ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();
        Timer.Sample sample = Timer.start(registry);
        String outcome = "failure";
        try {
            Object result = joinPoint.proceed();
            outcome = "success";
            return result;
        } finally {
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", outcome)
                .description(description)
                .register(registry));
        }
    }
}
