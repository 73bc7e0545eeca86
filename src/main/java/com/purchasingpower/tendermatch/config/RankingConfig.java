package com.purchasingpower.tendermatch.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Batch ranking settings under {@code app.ranking}.
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.ranking")
public class RankingConfig {

    /**
     * Minimum total score for a contract to appear in the periodic digest.
     * Default: 0.5
     */
    private double digestMinScore = 0.5;

    @Min(1)
    private int defaultLimit = 10;

    /**
     * Candidates fetched per requested result before scoring drops excluded ones.
     */
    @Min(1)
    private int candidateMultiplier = 2;

    @Min(1)
    private int corePoolSize = 4;

    @Min(1)
    private int maxPoolSize = 8;

    @Min(0)
    private int queueCapacity = 500;
}
