package com.purchasingpower.tendermatch.ingest;

import com.purchasingpower.tendermatch.model.ingest.ExtractedDocument;

import java.util.Map;
import java.util.Optional;

/**
 * Reads uploaded files into plain text for the chunker.
 *
 * <p>PDF text gets a {@code [Page N]} marker at the start of every page so chunk pages
 * can be resolved later. Unreadable, unsupported, oversized or near-empty files yield
 * an empty result instead of an exception.
 *
 * @since 1.0.0
 */
public interface DocumentTextExtractor {

    /**
     * @param userMetadata caller metadata; wins over metadata derived from the file
     */
    Optional<ExtractedDocument> extract(String filename, String contentType, byte[] content,
                                        Map<String, Object> userMetadata);

    default Optional<ExtractedDocument> extract(String filename, String contentType, byte[] content) {
        return extract(filename, contentType, content, Map.of());
    }
}
