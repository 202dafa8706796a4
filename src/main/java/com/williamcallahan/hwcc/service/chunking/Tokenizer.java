package com.williamcallahan.hwcc.service.chunking;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;

import java.util.Objects;

/**
 * Counts, encodes and decodes BPE tokens for chunk budgeting.
 *
 * <p>Holds no mutable state after construction, so one instance is shared across concurrent
 * chunking calls. Special-token text such as {@code <|endoftext|>} is encoded as ordinary text
 * since datasheet content may legitimately contain it.</p>
 */
public class Tokenizer {

    private final Encoding encoding;

    /**
     * Creates a tokenizer backed by the given encoding.
     *
     * @param encoding jtokkit encoding
     */
    public Tokenizer(Encoding encoding) {
        this.encoding = Objects.requireNonNull(encoding, "encoding");
    }

    /**
     * Creates a tokenizer for the {@code cl100k_base} encoding.
     *
     * @return cl100k_base tokenizer
     */
    public static Tokenizer cl100kBase() {
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        return new Tokenizer(registry.getEncoding(EncodingType.CL100K_BASE));
    }

    /**
     * Counts tokens in the text.
     *
     * @param text text to measure, may be empty
     * @return token count, 0 for empty text
     */
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokensOrdinary(text);
    }

    /**
     * Encodes the text into token ids.
     *
     * @param text text to encode
     * @return token ids in order
     */
    public IntArrayList encode(String text) {
        if (text == null || text.isEmpty()) {
            return new IntArrayList();
        }
        return encoding.encodeOrdinary(text);
    }

    /**
     * Decodes token ids back to text.
     *
     * @param tokens token ids
     * @return decoded text
     */
    public String decode(IntArrayList tokens) {
        return encoding.decode(tokens);
    }

    /**
     * Decodes the token range {@code [fromIndex, toIndex)}.
     *
     * @param tokens token ids
     * @param fromIndex first token, inclusive
     * @param toIndex last token, exclusive
     * @return decoded text of the window
     */
    public String decode(IntArrayList tokens, int fromIndex, int toIndex) {
        IntArrayList window = new IntArrayList(toIndex - fromIndex);
        for (int i = fromIndex; i < toIndex; i++) {
            window.add(tokens.get(i));
        }
        return encoding.decode(window);
    }

    /**
     * Returns the encoding name, such as {@code cl100k_base}.
     *
     * @return encoding name
     */
    public String encodingName() {
        return encoding.getName();
    }
}
