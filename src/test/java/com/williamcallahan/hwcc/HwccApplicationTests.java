package com.williamcallahan.hwcc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.hwcc.config.ChunkingProperties;
import com.williamcallahan.hwcc.domain.chunking.Chunk;
import com.williamcallahan.hwcc.domain.chunking.HardwareDocument;
import com.williamcallahan.hwcc.service.ChunkingService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "app.chunk.max-tokens=128",
        "app.chunk.overlap-tokens=16",
        "app.chunk.min-tokens=8",
        "app.chunk.parallelism=2"
})
class HwccApplicationTests {

    @Autowired
    private ChunkingProperties chunkingProperties;

    @Autowired
    private ChunkingService chunkingService;

    @Test
    void bindsChunkingProperties() {
        assertEquals(128, chunkingProperties.getMaxTokens());
        assertEquals(16, chunkingProperties.getOverlapTokens());
        assertEquals(8, chunkingProperties.getMinTokens());
        assertEquals("cl100k_base", chunkingProperties.getEncoding());
    }

    @Test
    void chunksDocumentThroughWiredPipeline() {
        String content = "# RCC\nThe RCC_CR register at offset 0x00 enables the HSE oscillator.\n\n"
                + "| Bit | Name | Access |\n|---|---|---|\n| 16 | HSEON | RW |";
        HardwareDocument document = new HardwareDocument("rcc_rm", content, "reference_manual", "STM32F407");

        List<Chunk> chunks = chunkingService.chunk(document);

        assertFalse(chunks.isEmpty());
        assertTrue(chunks.stream().allMatch(chunk -> chunk.chunkId().startsWith("rcc_rm_chunk_")));
        assertTrue(chunks.stream().allMatch(chunk -> "STM32F407".equals(chunk.metadata().chip())));
    }

    @Test
    void chunksBatchKeyedByDocument() {
        Map<String, List<Chunk>> chunksByDocument = chunkingService.chunkAll(List.of(
                new HardwareDocument("first", "# GPIO\nPort configuration.", "datasheet", "RP2040"),
                new HardwareDocument("second", "# UART\nBaud rate setup.", "datasheet", "RP2040")));

        assertEquals(List.of("first", "second"), List.copyOf(chunksByDocument.keySet()));
        assertEquals("GPIO", chunksByDocument.get("first").get(0).metadata().sectionPath());
    }
}
