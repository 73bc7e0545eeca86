package com.purchasingpower.tendermatch.diagnostics;

import com.purchasingpower.tendermatch.model.company.CompanyProfile;
import com.purchasingpower.tendermatch.model.contract.Contract;
import com.purchasingpower.tendermatch.model.match.MatchExplanation;

/**
 * Explains a single contract/profile score for troubleshooting poor matches.
 *
 * @since 1.0.0
 */
public interface MatchExplanationService {

    /**
     * Always returns an explanation, including for contracts the preference filters exclude.
     */
    MatchExplanation explain(Contract contract, CompanyProfile profile);
}
