package com.williamcallahan.hwcc.service.chunking;

import java.util.regex.Pattern;

/**
 * Keyword families that identify hardware-domain content.
 */
final class HardwareKeywordPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    static final Pattern REGISTER = Pattern.compile(
            "\\b(?:register|offset|reset\\s*value|bit\\s*field"
                    + "|read[/\\s-]write|read[/\\s-]only|write[/\\s-]only|base\\s*address)\\b"
                    + "|0x[0-9A-Fa-f]{8}",
            FLAGS);

    static final Pattern TIMING = Pattern.compile(
            "\\b\\d+\\s*(?:ns|µs|us|ms|MHz|kHz|GHz)\\b"
                    + "|\\b(?:setup\\s*time|hold\\s*time|propagation\\s*delay"
                    + "|clock\\s*(?:speed|frequency|period)|baud\\s*rate)\\b",
            FLAGS);

    static final Pattern CONFIG_PROCEDURE = Pattern.compile(
            "\\b(?:step\\s*\\d|initialization\\s*sequence|programming\\s*procedure"
                    + "|following\\s*steps|must\\s*be\\s*set|should\\s*be\\s*configured)\\b",
            FLAGS);

    static final Pattern ERRATA = Pattern.compile(
            "\\b(?:errat(?:a|um)|workaround|limitation|silicon\\s*bug|advisory|known\\s*issue)\\b"
                    + "|ES\\d{4}",
            FLAGS);

    static final Pattern PIN_MAPPING = Pattern.compile(
            "\\b(?:alternate\\s*function|AF\\d+|pin\\s*(?:mapping|assignment|configuration)|remap)\\b"
                    + "|\\bGPIO[A-Z]\\d*\\b",
            FLAGS);

    static final Pattern ELECTRICAL = Pattern.compile(
            "\\b\\d+\\.?\\d*\\s*(?:mA|µA|uA|kΩ)\\b"
                    + "|\\b(?:power\\s*supply|current\\s*consumption|voltage\\s*(?:range|level))\\b"
                    + "|\\bV(?:DD|CC|SS|DDA|BAT|REF)\\b",
            FLAGS);

    private HardwareKeywordPatterns() {
    }
}
