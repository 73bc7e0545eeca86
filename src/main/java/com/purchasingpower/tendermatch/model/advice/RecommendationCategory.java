package com.purchasingpower.tendermatch.model.advice;

import java.util.Locale;

public enum RecommendationCategory {
    PAST_WINS,
    CAPABILITIES,
    PREFERENCES;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
