package com.williamcallahan.hwcc.domain.chunking;

import java.util.Objects;

/**
 * Retrieval metadata attached to every chunk.
 *
 * @param docId owning document identifier
 * @param docType document type hint copied from the document
 * @param chip chip identifier copied from the document
 * @param sectionPath active heading hierarchy, joined with {@code " > "}
 * @param page first page marker found in the chunk, or 0
 * @param contentType content type label, see {@link ContentType#label()}
 */
public record ChunkMetadata(
        String docId,
        String docType,
        String chip,
        String sectionPath,
        int page,
        String contentType
) {

    public ChunkMetadata {
        Objects.requireNonNull(docId, "docId");
        docType = docType == null ? "" : docType;
        chip = chip == null ? "" : chip;
        sectionPath = sectionPath == null ? "" : sectionPath;
        contentType = contentType == null ? "" : contentType;
    }
}
