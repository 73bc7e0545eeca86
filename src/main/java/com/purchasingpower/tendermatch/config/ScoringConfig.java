package com.purchasingpower.tendermatch.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Weights and constants for contract match scoring.
 *
 * <p>Properties are loaded from the {@code app.scoring} namespace. The defaults
 * reproduce the production ranking; changing any of them changes ranked output.
 * <pre>
 * app:
 *   scoring:
 *     capability-weight: 0.4
 *     past-win-weight: 0.3
 *     preference-weight: 0.3
 *     top-capability-matches: 3
 *     past-win:
 *       exact-buyer-boost: 0.6
 *       partial-buyer-boost: 0.4
 *     preference:
 *       region-boost: 0.2
 *       region-penalty-multiplier: 0.6
 *       keyword-boost: 0.15
 * </pre>
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.scoring")
public class ScoringConfig {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double capabilityWeight = 0.4;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double pastWinWeight = 0.3;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double preferenceWeight = 0.3;

    /**
     * Number of best capability similarities averaged into the capability score.
     * Default: 3
     */
    @Min(1)
    private int topCapabilityMatches = 3;

    private CapabilityBands capabilityBands = new CapabilityBands();

    private PastWin pastWin = new PastWin();

    private Preference preference = new Preference();

    /**
     * Thresholds that select the capability match reason shown to the user.
     * They do not affect the score.
     */
    @Data
    public static class CapabilityBands {
        private double strong = 0.6;
        private double good = 0.4;
        private double moderate = 0.25;
    }

    @Data
    public static class PastWin {

        /**
         * Added per past win whose buyer equals the contract buyer, ignoring case.
         */
        private double exactBuyerBoost = 0.6;

        /**
         * Added per past win whose buyer name contains, or is contained in, the contract buyer.
         */
        private double partialBuyerBoost = 0.4;

        private double valueMatchBoost = 0.3;

        /**
         * min/max value ratio above which a past win counts as comparable (within 2x).
         */
        private double valueRatioThreshold = 0.5;

        /**
         * min/max value ratio above which a "similar value" reason is shown.
         */
        private double similarValueRatio = 0.8;
    }

    @Data
    public static class Preference {
        private double regionBoost = 0.2;
        private double regionPenaltyMultiplier = 0.6;
        private double keywordBoost = 0.15;
    }
}
