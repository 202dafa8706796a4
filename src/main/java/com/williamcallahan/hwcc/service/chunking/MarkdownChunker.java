package com.williamcallahan.hwcc.service.chunking;

import com.williamcallahan.hwcc.domain.chunking.Chunk;
import com.williamcallahan.hwcc.domain.chunking.ChunkConfig;
import com.williamcallahan.hwcc.domain.chunking.ChunkMetadata;
import com.williamcallahan.hwcc.domain.chunking.HardwareDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * {@link DocumentChunker} that respects markdown structure.
 *
 * <p>Tables and fenced code blocks pass through whole, even when they exceed the budget. Other
 * text is split recursively, preferring heading boundaries, then paragraphs, lines and words,
 * and finally raw token windows. Consecutive non-atomic chunks share a token overlap, small
 * chunks are merged into neighbors, and every chunk records the heading path active at its
 * end, its first page marker and its content type.</p>
 */
@Service
public class MarkdownChunker implements DocumentChunker {

    private static final Logger log = LoggerFactory.getLogger(MarkdownChunker.class);

    private final Tokenizer tokenizer;
    private final SegmentExtractor segmentExtractor;
    private final RecursiveSplitter splitter;
    private final OverlapInserter overlapInserter;
    private final SmallChunkMerger smallChunkMerger;
    private final ContentTypeClassifier classifier;
    private final ChunkIdGenerator idGenerator;

    /**
     * Creates a chunker that budgets with the given tokenizer.
     *
     * @param tokenizer shared tokenizer
     */
    public MarkdownChunker(Tokenizer tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.segmentExtractor = new SegmentExtractor();
        this.splitter = new RecursiveSplitter(tokenizer);
        this.overlapInserter = new OverlapInserter(tokenizer);
        this.smallChunkMerger = new SmallChunkMerger(tokenizer);
        this.classifier = new ContentTypeClassifier();
        this.idGenerator = new ChunkIdGenerator();
    }

    @Override
    public List<Chunk> chunk(HardwareDocument document, ChunkConfig config) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(config, "config");
        try {
            return doChunk(document, config);
        } catch (ChunkingException chunkingException) {
            throw chunkingException;
        } catch (RuntimeException failure) {
            log.error("Failed to chunk document {}: {}", document.docId(), failure.getMessage());
            throw new ChunkingException(
                    document.docId(),
                    "Failed to chunk document " + document.docId() + ": " + failure.getMessage(),
                    failure);
        }
    }

    private List<Chunk> doChunk(HardwareDocument document, ChunkConfig config) {
        String content = document.content().strip();
        if (content.isEmpty()) {
            return List.of();
        }

        int splitBudget = config.splitBudget();
        List<Segment> segments = segmentExtractor.extract(content);

        List<String> fragments = new ArrayList<>();
        Set<Integer> atomicIndices = new HashSet<>();
        for (Segment segment : segments) {
            String segmentText = segment.text().strip();
            if (segmentText.isEmpty()) {
                continue;
            }
            if (segment.atomic()) {
                atomicIndices.add(fragments.size());
                fragments.add(segmentText);
            } else {
                fragments.addAll(splitter.split(segmentText, splitBudget));
            }
        }
        log.debug("Document {}: {} segments ({} atomic), {} fragments before overlap",
                document.docId(), segments.size(), atomicIndices.size(), fragments.size());

        List<String> overlapped = overlapInserter.apply(fragments, config.overlapTokens(), atomicIndices);
        List<String> merged = smallChunkMerger.merge(overlapped, config.minTokens(), config.maxTokens());

        SectionPathTracker sectionTracker = new SectionPathTracker();
        List<Chunk> chunks = new ArrayList<>(merged.size());
        for (int fragmentIndex = 0; fragmentIndex < merged.size(); fragmentIndex++) {
            Chunk chunk = buildChunk(document, merged.get(fragmentIndex), fragmentIndex, sectionTracker);
            if (chunk != null) {
                chunks.add(chunk);
            }
        }

        log.info("Chunked {} into {} chunks (max_tokens={}, overlap={})",
                document.docId(), chunks.size(), config.maxTokens(), config.overlapTokens());
        return chunks;
    }

    /**
     * Finalizes one fragment, or returns null when only page markers remain.
     */
    private Chunk buildChunk(
            HardwareDocument document, String fragment, int fragmentIndex, SectionPathTracker sectionTracker) {
        String chunkText = fragment.strip();
        if (chunkText.isEmpty()) {
            return null;
        }

        int page = firstPage(chunkText);
        chunkText = MarkdownPatterns.PAGE_MARKER_STRIP.matcher(chunkText).replaceAll("").strip();
        if (chunkText.isEmpty()) {
            return null;
        }

        sectionTracker.update(chunkText);

        ChunkMetadata metadata = new ChunkMetadata(
                document.docId(),
                document.docType(),
                document.chip(),
                sectionTracker.path(),
                page,
                classifier.classify(chunkText).label());
        return new Chunk(
                idGenerator.chunkId(document.docId(), fragmentIndex, chunkText),
                chunkText,
                tokenizer.count(chunkText),
                metadata);
    }

    private static int firstPage(String text) {
        Matcher pageMatcher = MarkdownPatterns.PAGE_MARKER.matcher(text);
        if (!pageMatcher.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(pageMatcher.group(1));
        } catch (NumberFormatException overflow) {
            log.warn("Ignoring out-of-range page marker {}", pageMatcher.group());
            return 0;
        }
    }
}
