package com.purchasingpower.tendermatch.model.advice;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One suggested profile change, with the score share it currently earns and could earn.
 * Scores are percentage points of the total match score.
 */
@Value
@Builder
public class Recommendation {

    RecommendationCategory category;

    double currentScore;

    double potentialScore;

    RecommendationPriority priority;

    String action;

    String impact;

    @Singular
    List<String> specificActions;
}
