package com.purchasingpower.tendermatch.chunking;

import com.purchasingpower.tendermatch.model.document.Chunk;

import java.util.List;
import java.util.Map;

/**
 * Splits extracted document text into chunks for embedding.
 *
 * <p>Implementations are deterministic: identical input yields an identical
 * chunk sequence. Empty or unusable text yields an empty list, never an exception.
 *
 * @since 1.0.0
 */
public interface DocumentChunker {

    /**
     * @param text         original extracted text, optionally carrying {@code [Page N]} markers
     * @param baseMetadata document-level metadata copied onto every chunk (may be null)
     * @return chunks in document order
     */
    List<Chunk> chunkDocument(String text, Map<String, Object> baseMetadata);
}
