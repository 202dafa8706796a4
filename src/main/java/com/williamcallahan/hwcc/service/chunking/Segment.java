package com.williamcallahan.hwcc.service.chunking;

/**
 * A run of document text and whether it must stay whole.
 *
 * @param text segment text, lines joined with {@code \n}
 * @param atomic true for fenced code blocks and real tables
 */
record Segment(String text, boolean atomic) {}
