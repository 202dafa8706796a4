package com.williamcallahan.hwcc.service.chunking;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.StringJoiner;
import java.util.regex.Matcher;

/**
 * Tracks the active heading hierarchy while chunks are emitted in document order.
 *
 * <p>The stack is strictly increasing in level from bottom to top: a new heading pops every
 * entry at the same or a deeper level before it is pushed. One tracker belongs to one chunking
 * call and is never shared across documents or threads.</p>
 */
public final class SectionPathTracker {

    /** Delimiter between heading titles in a section path. */
    public static final String PATH_DELIMITER = " > ";

    private final Deque<HeadingEntry> headings = new ArrayDeque<>();

    /**
     * Applies every heading found in the text, in order of appearance.
     *
     * @param text finalized chunk text
     */
    public void update(String text) {
        Matcher headingMatcher = MarkdownPatterns.HEADING.matcher(text);
        while (headingMatcher.find()) {
            int level = headingMatcher.group(1).length();
            String title = headingMatcher.group(2).trim();
            while (!headings.isEmpty() && headings.peek().level() >= level) {
                headings.pop();
            }
            headings.push(new HeadingEntry(level, title));
        }
    }

    /**
     * Returns the current section path, outermost heading first.
     *
     * @return titles joined with {@value #PATH_DELIMITER}, or empty before any heading
     */
    public String path() {
        StringJoiner joiner = new StringJoiner(PATH_DELIMITER);
        Iterator<HeadingEntry> outermostFirst = headings.descendingIterator();
        while (outermostFirst.hasNext()) {
            joiner.add(outermostFirst.next().title());
        }
        return joiner.toString();
    }

    private record HeadingEntry(int level, String title) {}
}
