package com.purchasingpower.tendermatch.model.document;

import java.util.Locale;

/**
 * Strategy that produced a document chunk.
 */
public enum ChunkType {
    /**
     * Text between two structural boundaries (numbered clause, section or schedule header),
     * or a sentence-aligned piece of such a span when it was too long.
     */
    CLAUSE,

    /**
     * Sentence-window chunk used when the document has no usable clause structure.
     */
    FALLBACK;

    /**
     * Value stored in vector metadata ({@code clause}, {@code fallback}).
     */
    public String metadataValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
