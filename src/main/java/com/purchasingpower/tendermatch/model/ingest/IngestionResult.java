package com.purchasingpower.tendermatch.model.ingest;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IngestionResult {

    String documentId;

    String filename;

    int totalChunks;

    int storedChunks;

    int failedChunks;

    @Singular
    List<String> warnings;

    public boolean isSuccess() {
        return storedChunks > 0;
    }
}
