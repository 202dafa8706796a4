package com.williamcallahan.hwcc.service.chunking;

import java.util.regex.Pattern;

/**
 * Structural markdown patterns shared by the segment extractor, the classifier and the
 * section tracker.
 */
final class MarkdownPatterns {

    /** Heading line: one to six {@code #}, whitespace, title. */
    static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+)$", Pattern.MULTILINE);

    /** Fence opening: a run of 3+ backticks or 3+ tildes at line start. */
    static final Pattern FENCE = Pattern.compile("^(`{3,}|~{3,})", Pattern.MULTILINE);

    /** Pipe row: a line that starts and ends with {@code |}. */
    static final Pattern TABLE_ROW = Pattern.compile("^\\|.+\\|\\s*$");

    /** Table separator row such as {@code |---|:--:|}. */
    static final Pattern TABLE_SEPARATOR = Pattern.compile("^\\|[\\s:]*-+[\\s:]*\\|", Pattern.MULTILINE);

    /** PDF page marker; group 1 is the page number. */
    static final Pattern PAGE_MARKER = Pattern.compile("<!-- PAGE:(\\d+) -->");

    /** Page marker plus the newline that usually follows it. */
    static final Pattern PAGE_MARKER_STRIP = Pattern.compile("<!-- PAGE:\\d+ -->\\n?");

    private MarkdownPatterns() {
    }
}
