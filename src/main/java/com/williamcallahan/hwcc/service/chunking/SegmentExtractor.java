package com.williamcallahan.hwcc.service.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Splits document text into ordinary and atomic segments.
 *
 * <p>Fenced code blocks and pipe tables that carry a separator row are atomic: the recursive
 * splitter never sees them. Pipe-delimited lines without a separator row are prose that
 * happens to contain pipes and stay in the surrounding text.</p>
 */
final class SegmentExtractor {

    private static final char NEWLINE = '\n';

    List<Segment> extract(String text) {
        String[] lines = text.split("\n", -1);
        List<Segment> segments = new ArrayList<>();
        List<String> pendingText = new ArrayList<>();
        int lineIndex = 0;

        while (lineIndex < lines.length) {
            String line = lines[lineIndex];

            Matcher fenceMatcher = MarkdownPatterns.FENCE.matcher(line);
            if (fenceMatcher.lookingAt()) {
                flushText(pendingText, segments);
                String fenceMarker = fenceMatcher.group(1);
                List<String> codeLines = new ArrayList<>();
                codeLines.add(line);
                lineIndex++;
                while (lineIndex < lines.length) {
                    String codeLine = lines[lineIndex];
                    codeLines.add(codeLine);
                    lineIndex++;
                    if (closesFence(codeLine, fenceMarker.charAt(0), fenceMarker.length())) {
                        break;
                    }
                }
                segments.add(new Segment(String.join(String.valueOf(NEWLINE), codeLines), true));
                continue;
            }

            if (MarkdownPatterns.TABLE_ROW.matcher(line).matches()) {
                List<String> tableLines = new ArrayList<>();
                while (lineIndex < lines.length && MarkdownPatterns.TABLE_ROW.matcher(lines[lineIndex]).matches()) {
                    tableLines.add(lines[lineIndex]);
                    lineIndex++;
                }
                String tableText = String.join(String.valueOf(NEWLINE), tableLines);
                if (MarkdownPatterns.TABLE_SEPARATOR.matcher(tableText).find()) {
                    flushText(pendingText, segments);
                    segments.add(new Segment(tableText, true));
                } else {
                    pendingText.addAll(tableLines);
                }
                continue;
            }

            pendingText.add(line);
            lineIndex++;
        }

        flushText(pendingText, segments);
        return segments;
    }

    private static boolean closesFence(String line, char fenceChar, int fenceLength) {
        if (line.length() < fenceLength) {
            return false;
        }
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) != fenceChar) {
                return false;
            }
        }
        return true;
    }

    private static void flushText(List<String> pendingText, List<Segment> segments) {
        if (pendingText.isEmpty()) {
            return;
        }
        segments.add(new Segment(String.join(String.valueOf(NEWLINE), pendingText), false));
        pendingText.clear();
    }
}
