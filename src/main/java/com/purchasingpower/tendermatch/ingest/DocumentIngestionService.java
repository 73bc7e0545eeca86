package com.purchasingpower.tendermatch.ingest;

import com.purchasingpower.tendermatch.model.ingest.IngestionResult;

import java.util.Map;

/**
 * Turns an uploaded company document into searchable chunks in the documents namespace:
 * extract, chunk, embed, store.
 *
 * @since 1.0.0
 */
public interface DocumentIngestionService {

    IngestionResult ingest(String filename, String contentType, byte[] content,
                           String ownerId, Map<String, Object> userMetadata);
}
