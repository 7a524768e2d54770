package com.supportchat.config;

import com.supportchat.domain.analysis.UrgencyLevel;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Performance Monitoring Configuration.
 *
 * Tracks:
 * - Engine operation latency (analyze, record reply, rebuild)
 * - Conversation store latency and failures
 * - Response generation latency
 * - Business counters (analyzed messages, crisis detections, degraded mode, fallbacks)
 *
 * No message text or user identifiers are used as metric tags.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    private static Object time(MeterRegistry meterRegistry, String metric, String description,
                               ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();

        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Object result = joinPoint.proceed();

            sample.stop(Timer.builder(metric)
                .tag("method", methodName)
                .tag("outcome", "success")
                .description(description)
                .register(meterRegistry));

            return result;

        } catch (Exception e) {
            sample.stop(Timer.builder(metric)
                .tag("method", methodName)
                .tag("outcome", "failure")
                .description(description)
                .register(meterRegistry));

            throw e;
        }
    }

    /**
     * Aspect for timing conversation store operations.
     */
    @Aspect
    @Component
    public static class StorePerformanceAspect {

        private final MeterRegistry meterRegistry;

        public StorePerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.supportchat.domain.repository.ConversationStore+.*(..))")
        public Object timeStoreOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return time(meterRegistry, "store.operation", "Conversation store operation timing", joinPoint);
        }
    }

    /**
     * Aspect for timing engine entry points, lock wait included.
     */
    @Aspect
    @Component
    public static class EnginePerformanceAspect {

        private final MeterRegistry meterRegistry;

        public EnginePerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(public * com.supportchat.application.ContextAnalysisEngine.*(..))")
        public Object timeEngineOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return time(meterRegistry, "engine.operation", "Context analysis engine timing", joinPoint);
        }
    }

    /**
     * Aspect for timing calls to the response generator.
     */
    @Aspect
    @Component
    public static class GenerationPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public GenerationPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.supportchat.infrastructure.generation.ResponseGenerator+.generate(..))")
        public Object timeGeneration(ProceedingJoinPoint joinPoint) throws Throwable {
            return time(meterRegistry, "generation.request", "Response generation timing", joinPoint);
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

        public void recordMessageAnalyzed(UrgencyLevel urgency) {
            meterRegistry.counter("business.messages.analyzed",
                "urgency", tag(urgency)).increment();
        }

        public void recordCrisisDetected(UrgencyLevel urgency) {
            meterRegistry.counter("business.crisis.detected",
                "urgency", tag(urgency)).increment();
        }

        public void recordDegradedClassification() {
            meterRegistry.counter("business.classification.degraded").increment();
        }

        public void recordReplyRecorded() {
            meterRegistry.counter("business.replies.recorded").increment();
        }

        public void recordGenerationFallback(String reason) {
            meterRegistry.counter("business.generation.fallback", "reason", reason).increment();
        }

        private static String tag(UrgencyLevel urgency) {
            return urgency.name().toLowerCase(Locale.ROOT);
        }
    }
}
