package com.williamcallahan.hwcc.service.chunking;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Split boundaries in priority order, coarsest first.
 *
 * <p>Heading boundaries split on the newline before the heading line so the heading stays with
 * the content it introduces; the parts are rejoined with a plain newline.</p>
 */
enum SplitSeparator {
    HEADING_1(Pattern.compile("\\n(?=# )"), "\n"),
    HEADING_2(Pattern.compile("\\n(?=## )"), "\n"),
    HEADING_3_OR_DEEPER(Pattern.compile("\\n(?=#{3,} )"), "\n"),
    PARAGRAPH(Pattern.compile(Pattern.quote("\n\n")), "\n\n"),
    LINE(Pattern.compile(Pattern.quote("\n")), "\n"),
    WORD(Pattern.compile(Pattern.quote(" ")), " ");

    /** All separators in the order the splitter tries them. */
    static final List<SplitSeparator> PRIORITY = List.of(values());

    private final Pattern boundary;
    private final String rejoinDelimiter;

    SplitSeparator(Pattern boundary, String rejoinDelimiter) {
        this.boundary = boundary;
        this.rejoinDelimiter = rejoinDelimiter;
    }

    /**
     * Splits the text at this boundary, dropping blank parts.
     */
    List<String> split(String text) {
        return boundary.splitAsStream(text)
                .filter(part -> !part.isBlank())
                .toList();
    }

    String rejoinDelimiter() {
        return rejoinDelimiter;
    }
}
