package com.purchasingpower.tendermatch.model.match;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of scoring one contract against one company profile.
 *
 * <p>When {@code passesFilters} is false the contract was excluded by a hard
 * filter and {@code totalScore} is 0; the component scores are still reported
 * for diagnostics. Not persisted.
 */
@Value
@Builder
public class MatchResult {

    double capabilityScore;

    double pastWinScore;

    double preferenceScore;

    double totalScore;

    /**
     * Display strings in component order: capability, past wins, preferences.
     */
    @Singular
    List<String> matchReasons;

    boolean passesFilters;
}
