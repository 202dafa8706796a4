package com.williamcallahan.hwcc.service.chunking;

import com.williamcallahan.hwcc.domain.chunking.Chunk;
import com.williamcallahan.hwcc.domain.chunking.ChunkConfig;
import com.williamcallahan.hwcc.domain.chunking.HardwareDocument;

import java.util.List;

/**
 * Splits a {@link HardwareDocument} into {@link Chunk}s ready for embedding.
 *
 * <p>Implementations must be stateless between calls and safe for concurrent use.</p>
 */
public interface DocumentChunker {

    /**
     * Produces chunks from the normalized document content.
     *
     * @param document the parsed document
     * @param config token budget for this run
     * @return chunks in document order, empty for blank content
     * @throws ChunkingException if chunking fails
     */
    List<Chunk> chunk(HardwareDocument document, ChunkConfig config);
}
