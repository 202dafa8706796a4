package com.williamcallahan.hwcc.logging;

import com.williamcallahan.hwcc.domain.chunking.Chunk;
import com.williamcallahan.hwcc.domain.chunking.HardwareDocument;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logging aspect for the chunking stages of the ingestion pipeline.
 * Logs each step with timings and a content-type breakdown on the PIPELINE logger.
 */
@Aspect
@Component
public class ProcessingLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    private final AtomicLong runSequence = new AtomicLong();

    /**
     * Log document chunking
     */
    @Around("execution(* com.williamcallahan.hwcc.service.chunking.DocumentChunker+.chunk(..)) && args(document,..)")
    public Object logDocumentChunking(ProceedingJoinPoint joinPoint, HardwareDocument document) throws Throwable {
        String runId = "CHUNK-" + runSequence.incrementAndGet();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] CHUNKING {} - Starting", runId, document.docId());
        PIPELINE_LOG.debug("[{}] Input content length: {}", runId, document.content().length());

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (result instanceof List<?> chunks) {
                PIPELINE_LOG.info("[{}] CHUNKING {} - Produced {} chunks in {}ms",
                    runId, document.docId(), chunks.size(), duration);
                PIPELINE_LOG.debug("[{}] Content types: {}", runId, contentTypeBreakdown(chunks));
            }

            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] CHUNKING {} - Failed: {}", runId, document.docId(), e.getMessage());
            throw e;
        }
    }

    /**
     * Log batch chunking
     */
    @Around("execution(* com.williamcallahan.hwcc.service.ChunkingService.chunkAll(..))")
    public Object logBatchChunking(ProceedingJoinPoint joinPoint) throws Throwable {
        long startTime = System.currentTimeMillis();
        Object[] args = joinPoint.getArgs();
        int documentCount = args.length > 0 && args[0] instanceof List<?> documents ? documents.size() : 0;

        PIPELINE_LOG.info("BATCH CHUNKING - Starting {} documents", documentCount);
        try {
            Object result = joinPoint.proceed();
            PIPELINE_LOG.info("BATCH CHUNKING - Completed {} documents in {}ms",
                documentCount, System.currentTimeMillis() - startTime);
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("BATCH CHUNKING - Failed: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Counts chunks per content type label, e.g. {@code {register_table=3, prose=5}}.
     */
    static Map<String, Integer> contentTypeBreakdown(List<?> chunks) {
        Map<String, Integer> counts = new TreeMap<>();
        for (Object element : chunks) {
            if (element instanceof Chunk chunk) {
                counts.merge(chunk.metadata().contentType(), 1, Integer::sum);
            }
        }
        return counts;
    }
}
