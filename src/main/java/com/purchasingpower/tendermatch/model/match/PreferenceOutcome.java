package com.purchasingpower.tendermatch.model.match;

import java.util.List;

/**
 * Preference score plus the hard-filter verdict.
 */
public record PreferenceOutcome(double score, boolean passesFilters, List<String> reasons) {

    public static PreferenceOutcome unconstrained() {
        return new PreferenceOutcome(1.0, true, List.of());
    }
}
