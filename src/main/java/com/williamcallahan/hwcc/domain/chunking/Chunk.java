package com.williamcallahan.hwcc.domain.chunking;

import java.util.Objects;

/**
 * A bounded fragment of a hardware document, ready for embedding.
 *
 * @param chunkId storage key, {@code {docId}_chunk_{index}_{hash}}
 * @param content chunk text with page markers removed
 * @param tokenCount token count of {@code content}
 * @param metadata retrieval metadata
 */
public record Chunk(String chunkId, String content, int tokenCount, ChunkMetadata metadata) {

    public Chunk {
        Objects.requireNonNull(chunkId, "chunkId");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(metadata, "metadata");
    }
}
