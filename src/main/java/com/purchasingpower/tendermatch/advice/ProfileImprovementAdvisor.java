package com.purchasingpower.tendermatch.advice;

import com.purchasingpower.tendermatch.model.advice.Recommendation;
import com.purchasingpower.tendermatch.model.company.CompanyProfile;

import java.util.List;

/**
 * Suggests profile changes that would raise a company's match scores.
 *
 * @since 1.0.0
 */
public interface ProfileImprovementAdvisor {

    /**
     * @return recommendations ordered high, medium, then low priority
     */
    List<Recommendation> recommend(CompanyProfile profile);
}
