package com.williamcallahan.hwcc.domain.chunking;

import java.util.Locale;

/**
 * Token budget for one chunking run.
 *
 * @param maxTokens upper bound on tokens per non-atomic chunk
 * @param overlapTokens tokens of the previous chunk prepended to the next one
 * @param minTokens chunks below this size are merged into a neighbor when the budget allows
 */
public record ChunkConfig(int maxTokens, int overlapTokens, int minTokens) {

    public static final int DEFAULT_MAX_TOKENS = 512;
    public static final int DEFAULT_OVERLAP_TOKENS = 50;
    public static final int DEFAULT_MIN_TOKENS = 50;

    private static final String NON_NEG_FMT = "%s must be 0 or greater (got %d).";

    public ChunkConfig {
        if (maxTokens < 1) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, "maxTokens must be greater than 0 (got %d).", maxTokens));
        }
        if (overlapTokens < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, "overlapTokens", overlapTokens));
        }
        if (minTokens < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, "minTokens", minTokens));
        }
    }

    /**
     * Returns the default budget: 512 max, 50 overlap, 50 min.
     *
     * @return default chunk configuration
     */
    public static ChunkConfig defaults() {
        return new ChunkConfig(DEFAULT_MAX_TOKENS, DEFAULT_OVERLAP_TOKENS, DEFAULT_MIN_TOKENS);
    }

    /**
     * Budget used for splitting, leaving room for the overlap prefix added afterwards.
     *
     * @return split budget, at least 1
     */
    public int splitBudget() {
        return overlapTokens > 0 ? Math.max(maxTokens - overlapTokens, 1) : maxTokens;
    }
}
