package com.williamcallahan.hwcc.domain.chunking;

import java.util.Objects;

/**
 * Normalized hardware document handed over by a format parser.
 *
 * <p>The content is markdown: headings, fenced code blocks, pipe tables and, for paginated
 * sources, {@code <!-- PAGE:N -->} markers. Instances are never mutated by the chunker.</p>
 *
 * @param docId unique document identifier, used as the chunk id prefix
 * @param content normalized markdown content
 * @param docType document type hint such as {@code datasheet} or {@code svd}
 * @param chip chip or device identifier
 * @param title human-readable title reported by the parser
 * @param sourcePath path of the source file the content was parsed from
 */
public record HardwareDocument(
        String docId,
        String content,
        String docType,
        String chip,
        String title,
        String sourcePath
) {

    public HardwareDocument {
        Objects.requireNonNull(docId, "docId");
        Objects.requireNonNull(content, "content");
        docType = docType == null ? "" : docType;
        chip = chip == null ? "" : chip;
        title = title == null ? "" : title;
        sourcePath = sourcePath == null ? "" : sourcePath;
    }

    /**
     * Creates a document without title or source path.
     *
     * @param docId unique document identifier
     * @param content normalized markdown content
     * @param docType document type hint
     * @param chip chip or device identifier
     */
    public HardwareDocument(String docId, String content, String docType, String chip) {
        this(docId, content, docType, chip, "", "");
    }

    /**
     * Returns a copy with caller-supplied type and chip overrides; blank overrides keep the
     * parser's values.
     *
     * @param docTypeOverride document type to apply, or blank to keep the current one
     * @param chipOverride chip to apply, or blank to keep the current one
     * @return document carrying the overridden metadata
     */
    public HardwareDocument withOverrides(String docTypeOverride, String chipOverride) {
        String resolvedType = docTypeOverride == null || docTypeOverride.isBlank() ? docType : docTypeOverride;
        String resolvedChip = chipOverride == null || chipOverride.isBlank() ? chip : chipOverride;
        return new HardwareDocument(docId, content, resolvedType, resolvedChip, title, sourcePath);
    }
}
