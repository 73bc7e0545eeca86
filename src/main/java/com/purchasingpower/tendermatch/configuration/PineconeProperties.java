package com.purchasingpower.tendermatch.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class PineconeProperties {

    @NotBlank
    private String apiKey;

    @NotBlank
    private String indexName;

    /**
     * Namespace holding contract notice vectors written by the ingestion jobs.
     */
    @NotBlank
    private String contractsNamespace = "contracts";

    @NotBlank
    private String capabilitiesNamespace = "capabilities";

    @NotBlank
    private String documentsNamespace = "documents";
}
