package com.williamcallahan.hwcc.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.hwcc.config.ChunkingProperties;
import com.williamcallahan.hwcc.domain.chunking.Chunk;
import com.williamcallahan.hwcc.domain.chunking.ChunkConfig;
import com.williamcallahan.hwcc.domain.chunking.ChunkMetadata;
import com.williamcallahan.hwcc.domain.chunking.HardwareDocument;
import com.williamcallahan.hwcc.service.chunking.ChunkingException;
import com.williamcallahan.hwcc.service.chunking.DocumentChunker;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies configuration wiring and batch behavior of {@link ChunkingService}.
 */
class ChunkingServiceTest {

    private DocumentChunker chunker;
    private ChunkingProperties properties;
    private ChunkingService service;

    @BeforeEach
    void setUp() {
        chunker = mock(DocumentChunker.class);
        properties = new ChunkingProperties();
        properties.setMaxTokens(256);
        properties.setOverlapTokens(20);
        properties.setMinTokens(30);
        properties.setParallelism(2);
        service = new ChunkingService(chunker, properties);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void chunkUsesConfiguredBudget() {
        HardwareDocument document = document("uart_rm");
        List<Chunk> expected = List.of(chunkFor("uart_rm"));
        when(chunker.chunk(document, new ChunkConfig(256, 20, 30))).thenReturn(expected);

        assertSame(expected, service.chunk(document));
    }

    @Test
    void chunkAppliesNonBlankOverrides() {
        HardwareDocument document = document("uart_rm");
        when(chunker.chunk(any(), any())).thenReturn(List.of());

        service.chunk(document, "datasheet", "");

        verify(chunker).chunk(
                argThat(doc -> "datasheet".equals(doc.docType()) && "STM32F407".equals(doc.chip())),
                eq(new ChunkConfig(256, 20, 30)));
    }

    @Test
    void chunkAllPreservesInputOrder() {
        List<HardwareDocument> documents = List.of(document("c"), document("a"), document("b"));
        for (HardwareDocument document : documents) {
            when(chunker.chunk(eq(document), any())).thenReturn(List.of(chunkFor(document.docId())));
        }

        Map<String, List<Chunk>> chunksByDocument = service.chunkAll(documents);

        assertEquals(List.of("c", "a", "b"), List.copyOf(chunksByDocument.keySet()));
        assertEquals("a_chunk_0000_00000000", chunksByDocument.get("a").get(0).chunkId());
    }

    @Test
    void chunkAllFailsWholeBatchWhenOneDocumentFails() {
        HardwareDocument good = document("good");
        HardwareDocument bad = document("bad");
        ChunkingException failure = new ChunkingException("bad", "broken table", new IllegalStateException("boom"));
        when(chunker.chunk(eq(good), any())).thenReturn(List.of(chunkFor("good")));
        when(chunker.chunk(eq(bad), any())).thenThrow(failure);

        ChunkingException thrown = assertThrows(ChunkingException.class, () -> service.chunkAll(List.of(good, bad)));

        assertSame(failure, thrown);
        assertEquals("bad", thrown.docId());
    }

    @Test
    void chunkAllRejectsDuplicateIds() {
        assertThrows(IllegalArgumentException.class,
                () -> service.chunkAll(List.of(document("dup"), document("dup"))));
        verify(chunker, never()).chunk(any(), any());
    }

    @Test
    void chunkAllTimesOutSlowDocuments() {
        properties.setBatchTimeout(Duration.ofMillis(50));
        ChunkingService slowService = new ChunkingService(chunker, properties);
        when(chunker.chunk(any(), any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return List.of();
        });

        try {
            ChunkingException thrown = assertThrows(ChunkingException.class,
                    () -> slowService.chunkAll(List.of(document("slow"))));
            assertEquals("slow", thrown.docId());
            assertInstanceOf(TimeoutException.class, thrown.getCause());
        } finally {
            slowService.shutdown();
        }
    }

    private static HardwareDocument document(String docId) {
        return new HardwareDocument(docId, "Body text for " + docId, "reference_manual", "STM32F407");
    }

    private static Chunk chunkFor(String docId) {
        ChunkMetadata metadata = new ChunkMetadata(docId, "reference_manual", "STM32F407", "", 0, "prose");
        return new Chunk(docId + "_chunk_0000_00000000", "Body text for " + docId, 4, metadata);
    }
}
