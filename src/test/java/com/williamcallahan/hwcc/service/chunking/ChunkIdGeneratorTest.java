package com.williamcallahan.hwcc.service.chunking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.Test;

/**
 * Verifies chunk id layout and determinism.
 */
class ChunkIdGeneratorTest {

    private final ChunkIdGenerator generator = new ChunkIdGenerator();

    @Test
    void formatsIndexAndContentHashPrefix() {
        String chunkId = generator.chunkId("stm32f4_rm", 7, "hello");

        // sha256("hello") = 2cf24dba5fb0a30e...
        assertEquals("stm32f4_rm_chunk_0007_2cf24dba", chunkId);
    }

    @Test
    void sameContentAtDifferentIndexesGetsDistinctIds() {
        assertNotEquals(generator.chunkId("doc", 0, "same"), generator.chunkId("doc", 1, "same"));
    }
}
