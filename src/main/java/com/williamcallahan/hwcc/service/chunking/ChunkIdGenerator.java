package com.williamcallahan.hwcc.service.chunking;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Builds deterministic chunk identifiers used as storage primary keys.
 */
final class ChunkIdGenerator {

    private static final int HASH_PREFIX_LENGTH = 8;

    /**
     * Generates SHA-256 hash for any text content.
     *
     * @param text The text to hash
     * @return Hexadecimal string representation of the hash
     */
    String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Generates the id for one chunk of a document.
     *
     * @param docId owning document id
     * @param chunkIndex position of the fragment within the document
     * @param content final chunk content
     * @return {@code {docId}_chunk_{index:04d}_{first 8 hex of sha256(content)}}
     */
    String chunkId(String docId, int chunkIndex, String content) {
        String contentHash = sha256(content).substring(0, HASH_PREFIX_LENGTH);
        return String.format(Locale.ROOT, "%s_chunk_%04d_%s", docId, chunkIndex, contentHash);
    }
}
