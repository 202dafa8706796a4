package com.williamcallahan.hwcc.config;

import com.williamcallahan.hwcc.domain.chunking.ChunkConfig;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Locale;

/**
 * Chunking settings bound from {@code app.chunk.*}.
 */
@ConfigurationProperties(prefix = "app.chunk")
public class ChunkingProperties {

    private static final String ENCODING_DEF = "cl100k_base";
    private static final int PARALLELISM_DEF = 4;
    private static final Duration BATCH_TIMEOUT_DEF = Duration.ofMinutes(2);
    private static final int MIN_POSITIVE = 1;
    private static final int MIN_NON_NEG = 0;
    private static final String MAX_KEY = "app.chunk.max-tokens";
    private static final String OVERLAP_KEY = "app.chunk.overlap-tokens";
    private static final String MIN_KEY = "app.chunk.min-tokens";
    private static final String ENCODING_KEY = "app.chunk.encoding";
    private static final String PARALLELISM_KEY = "app.chunk.parallelism";
    private static final String BATCH_TIMEOUT_KEY = "app.chunk.batch-timeout";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";
    private static final String BLANK_FMT = "%s must not be blank.";

    private int maxTokens = ChunkConfig.DEFAULT_MAX_TOKENS;
    private int overlapTokens = ChunkConfig.DEFAULT_OVERLAP_TOKENS;
    private int minTokens = ChunkConfig.DEFAULT_MIN_TOKENS;
    private String encoding = ENCODING_DEF;
    private int parallelism = PARALLELISM_DEF;
    private Duration batchTimeout = BATCH_TIMEOUT_DEF;

    /**
     * Validates chunking settings.
     */
    @PostConstruct
    public void validateConfiguration() {
        requirePositiveCount(MAX_KEY, maxTokens);
        requireNonNegativeCount(OVERLAP_KEY, overlapTokens);
        requireNonNegativeCount(MIN_KEY, minTokens);
        requirePositiveCount(PARALLELISM_KEY, parallelism);
        if (encoding == null || encoding.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_FMT, ENCODING_KEY));
        }
        if (batchTimeout == null || batchTimeout.isNegative() || batchTimeout.isZero()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, BATCH_TIMEOUT_KEY));
        }
    }

    /**
     * Returns the token budget described by these properties.
     *
     * @return chunk configuration
     */
    public ChunkConfig toChunkConfig() {
        return new ChunkConfig(maxTokens, overlapTokens, minTokens);
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(final int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public int getOverlapTokens() {
        return overlapTokens;
    }

    public void setOverlapTokens(final int overlapTokens) {
        this.overlapTokens = overlapTokens;
    }

    public int getMinTokens() {
        return minTokens;
    }

    public void setMinTokens(final int minTokens) {
        this.minTokens = minTokens;
    }

    public String getEncoding() {
        return encoding;
    }

    public void setEncoding(final String encoding) {
        this.encoding = encoding;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(final int parallelism) {
        this.parallelism = parallelism;
    }

    public Duration getBatchTimeout() {
        return batchTimeout;
    }

    public void setBatchTimeout(final Duration batchTimeout) {
        this.batchTimeout = batchTimeout;
    }

    private static void requirePositiveCount(final String propertyKey, final int count) {
        if (count < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }

    private static void requireNonNegativeCount(final String propertyKey, final int count) {
        if (count < MIN_NON_NEG) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, propertyKey));
        }
    }
}
