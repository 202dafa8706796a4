package com.williamcallahan.hwcc.service.chunking;

import com.williamcallahan.hwcc.domain.chunking.ContentType;

import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Assigns a {@link ContentType} to chunk text through an ordered rule cascade.
 *
 * <p>Rules are evaluated top to bottom and the first match wins, so order encodes the
 * tie-breaks: code beats tables, table subtypes are refined by keyword family, errata beats
 * configuration procedures, which beat register prose. Chunks with no domain signal fall back
 * to {@code section} when they carry a heading and {@code prose} otherwise.</p>
 *
 * <p>{@link ContentType#API_REFERENCE} is never assigned here. Bold text at body font size is
 * deliberately not treated as a sub-heading signal; it proved too unreliable.</p>
 */
public final class ContentTypeClassifier {

    private static final List<Rule> RULES = List.of(
            new Rule(contains(MarkdownPatterns.FENCE), ContentType.CODE),
            tableRule(HardwareKeywordPatterns.REGISTER, ContentType.REGISTER_TABLE),
            tableRule(HardwareKeywordPatterns.PIN_MAPPING, ContentType.PIN_MAPPING),
            tableRule(HardwareKeywordPatterns.ELECTRICAL, ContentType.ELECTRICAL_SPEC),
            tableRule(HardwareKeywordPatterns.TIMING, ContentType.TIMING_SPEC),
            new Rule(contains(MarkdownPatterns.TABLE_SEPARATOR), ContentType.TABLE),
            new Rule(contains(HardwareKeywordPatterns.ERRATA), ContentType.ERRATA),
            new Rule(contains(HardwareKeywordPatterns.CONFIG_PROCEDURE), ContentType.CONFIG_PROCEDURE),
            new Rule(contains(HardwareKeywordPatterns.REGISTER), ContentType.REGISTER_DESCRIPTION),
            new Rule(contains(HardwareKeywordPatterns.TIMING), ContentType.TIMING_SPEC),
            new Rule(contains(HardwareKeywordPatterns.PIN_MAPPING), ContentType.PIN_MAPPING),
            new Rule(contains(HardwareKeywordPatterns.ELECTRICAL), ContentType.ELECTRICAL_SPEC),
            new Rule(contains(MarkdownPatterns.HEADING), ContentType.SECTION));

    /**
     * Classifies chunk text.
     *
     * @param text chunk text
     * @return first matching content type, {@link ContentType#PROSE} when nothing matches
     */
    public ContentType classify(String text) {
        for (Rule rule : RULES) {
            if (rule.matches().test(text)) {
                return rule.contentType();
            }
        }
        return ContentType.PROSE;
    }

    private static Predicate<String> contains(Pattern pattern) {
        return text -> pattern.matcher(text).find();
    }

    private static Rule tableRule(Pattern keywords, ContentType contentType) {
        return new Rule(contains(MarkdownPatterns.TABLE_SEPARATOR).and(contains(keywords)), contentType);
    }

    /**
     * One step of the cascade.
     *
     * @param matches predicate over chunk text
     * @param contentType type assigned when the predicate holds
     */
    private record Rule(Predicate<String> matches, ContentType contentType) {}
}
