package com.williamcallahan.gvtakeout.logging;

import com.williamcallahan.gvtakeout.extract.ExtractionOutcome;
import java.util.List;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Step timing for the import and grouping pipeline, written to the {@code PIPELINE} logger.
 */
@Aspect
@Component
public class ImportPipelineLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    // Thread-local id so interleaved runs can be told apart
    private static final ThreadLocal<String> RUN_ID = ThreadLocal.withInitial(() ->
        "RUN-" + System.currentTimeMillis() + "-" + Thread.currentThread().getId()
    );

    /**
     * Log document extraction
     */
    @Around("execution(* com.williamcallahan.gvtakeout.extract.ConversationExtractor.extract(..))")
    public Object logExtraction(ProceedingJoinPoint joinPoint) throws Throwable {
        String runId = RUN_ID.get();
        long startTime = System.currentTimeMillis();

        Object[] args = joinPoint.getArgs();
        if (args.length > 0 && args[0] instanceof Document document) {
            PIPELINE_LOG.debug("[{}] STEP 1: EXTRACTION - Starting {}", runId, document.location());
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (result instanceof ExtractionOutcome.Extracted extracted) {
                PIPELINE_LOG.info("[{}] STEP 1: EXTRACTION - {} in {}ms",
                    runId, extracted.value().type().wireName(), duration);
            } else {
                PIPELINE_LOG.info("[{}] STEP 1: EXTRACTION - Unrecognized document in {}ms", runId, duration);
            }
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] STEP 1: EXTRACTION - Failed: {}", runId, e.getMessage());
            throw e;
        }
    }

    /**
     * Log conversation storage
     */
    @Around("execution(* com.williamcallahan.gvtakeout.storage.ConversationStore.save(..))")
    public Object logStorage(ProceedingJoinPoint joinPoint) throws Throwable {
        String runId = RUN_ID.get();
        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            PIPELINE_LOG.info("[{}] STEP 2: STORAGE - Conversation {} written in {}ms", runId, result, duration);
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] STEP 2: STORAGE - Rolled back: {}", runId, e.getMessage());
            throw e;
        }
    }

    /**
     * Log group queries
     */
    @Around("execution(public * com.williamcallahan.gvtakeout.reconcile.GroupQueryService.*(..))")
    public Object logGrouping(ProceedingJoinPoint joinPoint) throws Throwable {
        String runId = RUN_ID.get();
        long startTime = System.currentTimeMillis();
        String operation = joinPoint.getSignature().getName();

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (result instanceof List<?> groups) {
                PIPELINE_LOG.info("[{}] STEP 3: GROUPING - {} returned {} groups in {}ms",
                    runId, operation, groups.size(), duration);
            } else {
                PIPELINE_LOG.info("[{}] STEP 3: GROUPING - {} completed in {}ms", runId, operation, duration);
            }
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] STEP 3: GROUPING - {} failed: {}", runId, operation, e.getMessage());
            throw e;
        }
    }
}
