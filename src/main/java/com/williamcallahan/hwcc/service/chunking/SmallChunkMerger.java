package com.williamcallahan.hwcc.service.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Folds undersized chunks into a neighbor while the merged text stays within budget.
 *
 * <p>A trailing chunk that cannot be merged anywhere without exceeding the maximum is emitted
 * below the minimum.</p>
 */
final class SmallChunkMerger {

    private static final String MERGE_SEPARATOR = "\n\n";

    private final Tokenizer tokenizer;

    SmallChunkMerger(Tokenizer tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    }

    /**
     * Merges chunks smaller than {@code minTokens} with their neighbors.
     *
     * @param chunks chunk texts in order
     * @param minTokens minimum preferred chunk size
     * @param maxTokens merged chunks never exceed this size
     * @return merged chunk texts in order
     */
    List<String> merge(List<String> chunks, int minTokens, int maxTokens) {
        if (chunks.isEmpty() || minTokens <= 0) {
            return chunks;
        }

        List<String> merged = new ArrayList<>();
        String current = "";

        for (String chunkText : chunks) {
            if (current.isEmpty()) {
                current = chunkText;
                continue;
            }
            if (tokenizer.count(current) < minTokens) {
                String candidate = current + MERGE_SEPARATOR + chunkText;
                if (tokenizer.count(candidate) <= maxTokens) {
                    current = candidate;
                    continue;
                }
            }
            merged.add(current);
            current = chunkText;
        }

        if (!current.isEmpty()) {
            if (!merged.isEmpty() && tokenizer.count(current) < minTokens) {
                int lastIndex = merged.size() - 1;
                String candidate = merged.get(lastIndex) + MERGE_SEPARATOR + current;
                if (tokenizer.count(candidate) <= maxTokens) {
                    merged.set(lastIndex, candidate);
                } else {
                    merged.add(current);
                }
            } else {
                merged.add(current);
            }
        }
        return merged;
    }
}
