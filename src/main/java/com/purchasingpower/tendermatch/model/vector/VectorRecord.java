package com.purchasingpower.tendermatch.model.vector;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A vector to write to the store, with flat string metadata.
 */
@Value
@Builder
public class VectorRecord {

    String id;

    List<Double> values;

    @Builder.Default
    Map<String, String> metadata = Map.of();
}
