package com.purchasingpower.tendermatch.model.match;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Why a contract scored the way it did against a profile, with advisory fixes.
 */
@Value
@Builder
public class MatchExplanation {

    String noticeId;

    MatchResult matchResult;

    @Singular("capabilitySimilarity")
    List<CapabilitySimilarity> capabilityBreakdown;

    @Singular
    List<String> issues;

    @Singular
    List<String> recommendations;

    public boolean isExcluded() {
        return !matchResult.isPassesFilters();
    }
}
