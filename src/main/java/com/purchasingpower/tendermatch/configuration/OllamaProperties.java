package com.purchasingpower.tendermatch.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OllamaProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    /**
     * nomic-embed-text produces 768-dimensional vectors, matching the index dimension.
     */
    @NotBlank
    private String embeddingModel = "nomic-embed-text";

    @Min(1)
    private int timeoutSeconds = 30;

    @Min(0)
    private int maxRetries = 3;
}
