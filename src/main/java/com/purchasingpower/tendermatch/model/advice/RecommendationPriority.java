package com.purchasingpower.tendermatch.model.advice;

import java.util.Locale;

/**
 * Declared most urgent first; recommendations sort by ordinal.
 */
public enum RecommendationPriority {
    HIGH,
    MEDIUM,
    LOW;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
