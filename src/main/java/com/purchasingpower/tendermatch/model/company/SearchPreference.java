package com.purchasingpower.tendermatch.model.company;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A company's search preferences.
 *
 * <p>Value bounds and excluded categories are hard filters; regions and keywords
 * only adjust the preference score. A null or zero bound means "no bound".
 */
@Value
@Builder
public class SearchPreference {

    BigDecimal minContractValue;

    BigDecimal maxContractValue;

    @Singular
    List<String> preferredRegions;

    @Singular("excludedCategory")
    List<String> excludedCategories;

    @Singular
    List<String> keywords;

    public boolean hasMinValue() {
        return isSet(minContractValue);
    }

    public boolean hasMaxValue() {
        return isSet(maxContractValue);
    }

    private static boolean isSet(BigDecimal bound) {
        return bound != null && bound.signum() != 0;
    }
}
