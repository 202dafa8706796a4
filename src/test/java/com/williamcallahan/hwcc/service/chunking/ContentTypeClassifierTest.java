package com.williamcallahan.hwcc.service.chunking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import com.williamcallahan.hwcc.domain.chunking.ContentType;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies the content-type cascade and its tie-breaks.
 */
class ContentTypeClassifierTest {

    private final ContentTypeClassifier classifier = new ContentTypeClassifier();

    @Test
    void fencedBlockIsCode() {
        assertEquals(ContentType.CODE, classifier.classify("```c\nvoid init(void) { }\n```"));
    }

    @Test
    void codeBeatsTable() {
        String text = "| Register | Offset |\n|---|---|\n| CR1 | 0x00 |\n```c\nREG = 1;\n```";

        assertEquals(ContentType.CODE, classifier.classify(text));
    }

    @Test
    void tableWithRegisterKeywordsIsRegisterTable() {
        String table = "| Register | Offset | Reset | Access |\n|---|---|---|---|\n| CR1 | 0x00 | 0x0000 | RW |";

        assertEquals(ContentType.REGISTER_TABLE, classifier.classify(table));
    }

    @Test
    void tableWithEightDigitHexAddressIsRegisterTable() {
        String table = "| Peripheral | Boundary |\n|---|---|\n| USART1 | 0x40011000 |";

        assertEquals(ContentType.REGISTER_TABLE, classifier.classify(table));
    }

    @Test
    void tableWithAlternateFunctionsIsPinMapping() {
        String table = "| Pin | Alternate function |\n|---|---|\n| PA9 | USART1_TX |";

        assertEquals(ContentType.PIN_MAPPING, classifier.classify(table));
    }

    @Test
    void tableWithSupplyRailsIsElectricalSpec() {
        String table = "| Parameter | Min | Max |\n|---|---|---|\n| VDD | 1.8 | 3.6 |";

        assertEquals(ContentType.ELECTRICAL_SPEC, classifier.classify(table));
    }

    @Test
    void tableWithTimingValuesIsTimingSpec() {
        String table = "| Parameter | Value |\n|---|---|\n| Setup time | 5 ns |";

        assertEquals(ContentType.TIMING_SPEC, classifier.classify(table));
    }

    @Test
    void tableWithoutDomainKeywordsIsTable() {
        assertEquals(ContentType.TABLE, classifier.classify("| A | B |\n|---|---|\n| 1 | 2 |"));
    }

    @Test
    void errataBeatsRegisterDescription() {
        String text = "Erratum: the SPI may hang. Workaround: write the register twice.";

        assertEquals(ContentType.ERRATA, classifier.classify(text));
    }

    @Test
    void errataSheetCodeIsErrata() {
        assertEquals(ContentType.ERRATA, classifier.classify("See ES0182 for details."));
    }

    @Test
    void initializationSequenceIsConfigProcedure() {
        assertEquals(ContentType.CONFIG_PROCEDURE,
                classifier.classify("Follow the initialization sequence below before enabling the clock."));
    }

    @Test
    void registerProseIsRegisterDescription() {
        assertEquals(ContentType.REGISTER_DESCRIPTION,
                classifier.classify("The CR1 register controls the peripheral."));
    }

    @Test
    void frequencyProseIsTimingSpec() {
        assertEquals(ContentType.TIMING_SPEC, classifier.classify("The bus runs at 48 MHz."));
    }

    @Test
    void gpioProseIsPinMapping() {
        assertEquals(ContentType.PIN_MAPPING, classifier.classify("Connect GPIOA5 to the LED."));
    }

    @Test
    void currentProseIsElectricalSpec() {
        assertEquals(ContentType.ELECTRICAL_SPEC,
                classifier.classify("Current consumption is 12 mA in run mode."));
    }

    @Test
    void headingWithoutDomainKeywordsIsSection() {
        assertEquals(ContentType.SECTION, classifier.classify("# Overview\nThis chapter introduces the device."));
    }

    @Test
    void plainTextIsProse() {
        assertEquals(ContentType.PROSE, classifier.classify("This chapter introduces the device."));
    }

    @Test
    void neverAssignsApiReference() {
        List<String> samples = List.of(
                "```c\n#define GPIO_PIN_5 (1U << 5)\n```",
                "void HAL_GPIO_Init(GPIO_TypeDef *port);",
                "# API\nFunctions exported by the driver.");

        for (String sample : samples) {
            assertNotEquals(ContentType.API_REFERENCE, classifier.classify(sample));
        }
    }

    @Test
    void classificationIsDeterministic() {
        String text = "## Timing\nThe SPI clock frequency must not exceed 18 MHz.";

        assertEquals(classifier.classify(text), classifier.classify(text));
    }

    @Test
    void labelsRoundTripThroughContentType() {
        assertEquals("register_table", ContentType.REGISTER_TABLE.label());
        assertEquals(ContentType.ERRATA, ContentType.fromLabel("errata").orElseThrow());
    }
}
