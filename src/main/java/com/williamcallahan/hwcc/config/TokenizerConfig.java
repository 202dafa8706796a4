package com.williamcallahan.hwcc.config;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.williamcallahan.hwcc.service.chunking.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the shared {@link Tokenizer} once per application context.
 */
@Configuration
public class TokenizerConfig {

    private static final Logger log = LoggerFactory.getLogger(TokenizerConfig.class);

    @Bean
    public Tokenizer tokenizer(ChunkingProperties chunkingProperties) {
        String encodingName = chunkingProperties.getEncoding();
        EncodingType encodingType = EncodingType.fromName(encodingName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "app.chunk.encoding names an unknown encoding: " + encodingName));
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        log.info("Using {} tokenizer for chunk budgets", encodingType.getName());
        return new Tokenizer(registry.getEncoding(encodingType));
    }
}
