package com.williamcallahan.hwcc.service.chunking;

import java.io.Serial;
import java.util.Objects;

/**
 * Signals that a document could not be chunked.
 *
 * <p>The only failure the chunking engine reports. Callers never receive a partial chunk list
 * alongside it.</p>
 */
public class ChunkingException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String docId;

    /**
     * Creates a chunking failure for a document.
     *
     * @param docId id of the document that failed
     * @param message human-readable failure summary
     * @param cause underlying failure
     */
    public ChunkingException(String docId, String message, Throwable cause) {
        super(message, cause);
        this.docId = Objects.requireNonNull(docId, "docId");
    }

    /**
     * Returns the id of the document that failed.
     *
     * @return document id
     */
    public String docId() {
        return docId;
    }
}
