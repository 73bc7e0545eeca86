package com.purchasingpower.tendermatch.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Size limits for legal document chunking.
 *
 * <p>Properties are loaded from the {@code app.chunking} namespace in
 * application.yml. Example configuration:
 * <pre>
 * app:
 *   chunking:
 *     max-chunk-size: 800
 *     min-chunk-size: 100
 *     min-clause-length: 50
 *     overlap-sentences: 1
 * </pre>
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.chunking")
public class ChunkingConfig {

    /**
     * Upper bound on chunk length in characters. Longer clauses are split at
     * sentence boundaries.
     * Default: 800
     */
    @Min(100)
    private int maxChunkSize = 800;

    /**
     * Average clause chunk length below which the clause result is considered
     * poorly structured and the sentence fallback is used instead.
     * Default: 100
     */
    @Min(1)
    private int minChunkSize = 100;

    /**
     * Clause chunks shorter than this are treated as false-positive boundaries
     * (a stray numeral at line start) and dropped.
     * Default: 50
     */
    @Min(0)
    private int minClauseLength = 50;

    /**
     * Number of trailing sentences carried into the next fallback chunk.
     * Default: 1
     */
    @Min(0)
    private int overlapSentences = 1;
}
