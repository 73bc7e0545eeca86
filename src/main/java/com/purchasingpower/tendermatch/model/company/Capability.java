package com.purchasingpower.tendermatch.model.company;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A declared company capability ("Cloud infrastructure migration for local government").
 */
@Value
@Builder(toBuilder = true)
public class Capability {

    Long id;

    String text;

    String category;

    Integer yearsExperience;

    /**
     * Record id in the capabilities namespace; null until the capability is embedded.
     */
    String vectorId;

    /**
     * Fetched vector, populated by the caller before scoring.
     */
    List<Double> embedding;

    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }
}
