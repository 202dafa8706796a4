package com.williamcallahan.hwcc.service.chunking;

import com.knuddels.jtokkit.api.IntArrayList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits non-atomic text into pieces that fit a token budget.
 *
 * <p>Tries each {@link SplitSeparator} in priority order, greedily packing the parts of the
 * first separator that actually divides the text. Parts that are still too large recurse with
 * the separators after the current one. Once every separator is used up, the text is cut at
 * token boundaries, which always terminates and always fits.</p>
 */
final class RecursiveSplitter {

    private final Tokenizer tokenizer;
    private final List<SplitSeparator> separators;

    RecursiveSplitter(Tokenizer tokenizer) {
        this(tokenizer, SplitSeparator.PRIORITY);
    }

    RecursiveSplitter(Tokenizer tokenizer, List<SplitSeparator> separators) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.separators = List.copyOf(separators);
    }

    /**
     * Splits the text into pieces of at most {@code maxTokens} tokens.
     *
     * @param text text to split
     * @param maxTokens token budget per piece, at least 1
     * @return pieces in document order
     */
    List<String> split(String text, int maxTokens) {
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be greater than 0");
        }
        return split(text, maxTokens, 0);
    }

    private List<String> split(String text, int maxTokens, int separatorIndex) {
        int currentIndex = separatorIndex;
        while (true) {
            if (tokenizer.count(text) <= maxTokens) {
                return List.of(text);
            }
            if (currentIndex >= separators.size()) {
                return hardSplit(text, maxTokens);
            }
            SplitSeparator separator = separators.get(currentIndex);
            List<String> parts = separator.split(text);
            if (parts.size() > 1) {
                return packParts(parts, separator.rejoinDelimiter(), maxTokens, currentIndex + 1);
            }
            currentIndex++;
        }
    }

    private List<String> packParts(List<String> parts, String rejoin, int maxTokens, int nextSeparatorIndex) {
        List<String> pieces = new ArrayList<>();
        String current = "";

        for (String part : parts) {
            String candidate = current.isEmpty() ? part : current + rejoin + part;
            if (tokenizer.count(candidate) <= maxTokens) {
                current = candidate;
                continue;
            }
            if (!current.isEmpty()) {
                pieces.add(current);
            }
            if (tokenizer.count(part) > maxTokens) {
                pieces.addAll(split(part, maxTokens, nextSeparatorIndex));
                current = "";
            } else {
                current = part;
            }
        }

        if (!current.isEmpty()) {
            pieces.add(current);
        }
        return pieces;
    }

    private List<String> hardSplit(String text, int maxTokens) {
        IntArrayList tokens = tokenizer.encode(text);
        List<String> pieces = new ArrayList<>();
        for (int start = 0; start < tokens.size(); start += maxTokens) {
            int end = Math.min(start + maxTokens, tokens.size());
            pieces.add(tokenizer.decode(tokens, start, end));
        }
        return pieces;
    }
}
