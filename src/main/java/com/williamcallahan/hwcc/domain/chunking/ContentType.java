package com.williamcallahan.hwcc.domain.chunking;

import java.util.Arrays;
import java.util.Optional;

/**
 * Hardware-domain content taxonomy assigned to each chunk.
 *
 * <p>Downstream stages filter and display on {@link #label()}, so labels are stable.</p>
 */
public enum ContentType {
    CODE("code"),
    REGISTER_TABLE("register_table"),
    REGISTER_DESCRIPTION("register_description"),
    TIMING_SPEC("timing_spec"),
    CONFIG_PROCEDURE("config_procedure"),
    ERRATA("errata"),
    PIN_MAPPING("pin_mapping"),
    ELECTRICAL_SPEC("electrical_spec"),
    /**
     * Reserved for C header parsing; the markdown classifier never assigns it.
     */
    API_REFERENCE("api_reference"),
    TABLE("table"),
    SECTION("section"),
    PROSE("prose");

    private final String label;

    ContentType(String label) {
        this.label = label;
    }

    /**
     * Returns the wire label stored in chunk metadata.
     *
     * @return lowercase label
     */
    public String label() {
        return label;
    }

    /**
     * Resolves a stored label back to its type.
     *
     * @param label metadata label
     * @return matching type, or empty for unknown labels
     */
    public static Optional<ContentType> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(type -> type.label.equals(label))
                .findFirst();
    }
}
