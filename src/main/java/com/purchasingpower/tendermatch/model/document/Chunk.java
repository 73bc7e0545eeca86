package com.purchasingpower.tendermatch.model.document;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * A retrieval-sized segment of a document, ready for embedding.
 *
 * <p>{@code page} is the page holding the chunk's first character in the original
 * text, resolved through the document's {@link com.purchasingpower.tendermatch.chunking.PageMap}.
 * {@code offset} is that first character's position in the original text.
 */
@Value
@Builder
public class Chunk {

    String text;

    ChunkType chunkType;

    int page;

    int offset;

    /**
     * Leading numeral sequence of the clause ({@code "3.2"}); null for fallback chunks
     * and for clauses that start with a header instead of a number.
     */
    String clauseNumber;

    /**
     * Caller-supplied document metadata, shared by every chunk of the document.
     */
    @Builder.Default
    Map<String, Object> sourceMetadata = Map.of();

    public Optional<String> clauseNumber() {
        return Optional.ofNullable(clauseNumber);
    }

    public int length() {
        return text.length();
    }
}
