package com.purchasingpower.tendermatch.model.match;

import lombok.Builder;
import lombok.Value;

/**
 * Similarity of one capability to a contract, for the match explanation view.
 */
@Value
@Builder
public class CapabilitySimilarity {
    Long capabilityId;
    String capabilityText;
    String vectorId;
    double similarity;
    double vectorNorm;
    int dimensions;
}
