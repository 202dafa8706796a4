package com.williamcallahan.hwcc.service;

import com.williamcallahan.hwcc.config.ChunkingProperties;
import com.williamcallahan.hwcc.domain.chunking.Chunk;
import com.williamcallahan.hwcc.domain.chunking.ChunkConfig;
import com.williamcallahan.hwcc.domain.chunking.HardwareDocument;
import com.williamcallahan.hwcc.service.chunking.ChunkingException;
import com.williamcallahan.hwcc.service.chunking.DocumentChunker;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Chunks documents with the configured token budget.
 *
 * <p>Batches fan out across a bounded worker pool. Each worker owns its own chunking call, so
 * heading state never crosses documents. A batch either completes for every document or fails
 * as a whole.</p>
 */
@Service
public class ChunkingService {

    private static final Logger log = LoggerFactory.getLogger(ChunkingService.class);

    private final DocumentChunker chunker;
    private final ChunkConfig chunkConfig;
    private final Duration batchTimeout;
    private final ExecutorService workers;

    /**
     * Creates the service from bound chunking properties.
     *
     * @param chunker chunking engine
     * @param chunkingProperties validated chunking settings
     */
    public ChunkingService(DocumentChunker chunker, ChunkingProperties chunkingProperties) {
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.chunkConfig = chunkingProperties.toChunkConfig();
        this.batchTimeout = chunkingProperties.getBatchTimeout();
        this.workers = Executors.newFixedThreadPool(chunkingProperties.getParallelism());
    }

    /**
     * Chunks one document with the configured budget.
     *
     * @param document parsed document
     * @return chunks in document order
     * @throws ChunkingException if chunking fails
     */
    public List<Chunk> chunk(HardwareDocument document) {
        return chunker.chunk(document, chunkConfig);
    }

    /**
     * Chunks one document after applying caller-supplied type and chip overrides.
     *
     * @param document parsed document
     * @param docType document type override, blank to keep the parser's value
     * @param chip chip override, blank to keep the parser's value
     * @return chunks in document order
     * @throws ChunkingException if chunking fails
     */
    public List<Chunk> chunk(HardwareDocument document, String docType, String chip) {
        return chunk(document.withOverrides(docType, chip));
    }

    /**
     * Chunks several documents concurrently.
     *
     * @param documents parsed documents
     * @return chunks keyed by document id, in input order
     * @throws ChunkingException for the first document that failed or did not finish in time
     * @throws IllegalArgumentException if two documents share an id
     */
    public Map<String, List<Chunk>> chunkAll(List<HardwareDocument> documents) {
        Objects.requireNonNull(documents, "documents");
        long distinctIds = documents.stream().map(HardwareDocument::docId).distinct().count();
        if (distinctIds != documents.size()) {
            throw new IllegalArgumentException("Document ids must be unique within a batch");
        }
        List<CompletableFuture<List<Chunk>>> futures = new ArrayList<>(documents.size());
        for (HardwareDocument document : documents) {
            futures.add(CompletableFuture.supplyAsync(() -> chunk(document), workers));
        }

        long deadlineNanos = System.nanoTime() + batchTimeout.toNanos();
        Map<String, List<Chunk>> chunksByDocument = new LinkedHashMap<>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                HardwareDocument document = documents.get(i);
                chunksByDocument.put(document.docId(), awaitChunks(futures.get(i), document, deadlineNanos));
            }
        } catch (ChunkingException failure) {
            futures.forEach(future -> future.cancel(true));
            throw failure;
        }

        log.info("Chunked batch of {} documents into {} chunks",
                documents.size(),
                chunksByDocument.values().stream().mapToInt(List::size).sum());
        return chunksByDocument;
    }

    private List<Chunk> awaitChunks(
            CompletableFuture<List<Chunk>> future, HardwareDocument document, long deadlineNanos) {
        long remainingNanos = Math.max(deadlineNanos - System.nanoTime(), 0L);
        try {
            return future.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new ChunkingException(document.docId(),
                    "Interrupted while chunking document " + document.docId(), interrupted);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause();
            if (cause instanceof ChunkingException chunkingException) {
                throw chunkingException;
            }
            throw new ChunkingException(document.docId(),
                    "Failed to chunk document " + document.docId(), cause == null ? executionException : cause);
        } catch (TimeoutException timeout) {
            log.warn("Chunking of {} exceeded batch timeout {}ms", document.docId(), batchTimeout.toMillis());
            throw new ChunkingException(document.docId(),
                    "Chunking of document " + document.docId() + " exceeded " + batchTimeout.toMillis() + "ms",
                    timeout);
        }
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }
}
