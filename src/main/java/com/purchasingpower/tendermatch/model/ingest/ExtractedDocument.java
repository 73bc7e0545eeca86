package com.purchasingpower.tendermatch.model.ingest;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Text pulled out of an uploaded file, with page markers for PDFs, plus merged metadata.
 */
@Value
@Builder
public class ExtractedDocument {

    String filename;

    FileType fileType;

    String text;

    /**
     * Number of pages for PDFs; 1 for plain text.
     */
    int pageCount;

    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
