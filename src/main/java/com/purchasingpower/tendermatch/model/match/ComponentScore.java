package com.purchasingpower.tendermatch.model.match;

import java.util.List;

/**
 * Score of a single scoring component with the reasons it produced.
 */
public record ComponentScore(double score, List<String> reasons) {

    public static ComponentScore zero() {
        return new ComponentScore(0.0, List.of());
    }
}
