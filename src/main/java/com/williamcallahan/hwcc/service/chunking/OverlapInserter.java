package com.williamcallahan.hwcc.service.chunking;

import com.knuddels.jtokkit.api.IntArrayList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Prepends the token tail of each chunk to the chunk that follows it.
 *
 * <p>Atomic chunks never receive a prefix: they must stay byte-identical to the source table or
 * code block and may already exceed the budget.</p>
 */
final class OverlapInserter {

    private final Tokenizer tokenizer;

    OverlapInserter(Tokenizer tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    }

    /**
     * Applies overlap between consecutive chunks.
     *
     * @param chunks chunk texts in order
     * @param overlapTokens tail size in tokens
     * @param atomicIndices positions of atomic chunks
     * @return chunk texts with overlap prefixes
     */
    List<String> apply(List<String> chunks, int overlapTokens, Set<Integer> atomicIndices) {
        if (overlapTokens <= 0 || chunks.size() < 2) {
            return chunks;
        }

        List<String> overlapped = new ArrayList<>(chunks.size());
        overlapped.add(chunks.get(0));

        for (int i = 1; i < chunks.size(); i++) {
            String chunkText = chunks.get(i);
            if (atomicIndices.contains(i)) {
                overlapped.add(chunkText);
                continue;
            }
            IntArrayList previousTokens = tokenizer.encode(chunks.get(i - 1));
            if (previousTokens.size() > overlapTokens) {
                String tail = tokenizer.decode(previousTokens, previousTokens.size() - overlapTokens, previousTokens.size());
                overlapped.add(tail + chunkText);
            } else {
                overlapped.add(chunkText);
            }
        }
        return overlapped;
    }
}
