package com.purchasingpower.tendermatch.scoring;

import com.purchasingpower.tendermatch.model.company.CompanyProfile;
import com.purchasingpower.tendermatch.model.contract.Contract;
import com.purchasingpower.tendermatch.model.match.MatchResult;

import java.util.Optional;

/**
 * Scores a contract against a company profile.
 *
 * <p>Pure and thread-safe: the contract and profile (with their embeddings already
 * fetched) are the only inputs. A contract that fails a hard filter is excluded,
 * which is distinct from scoring 0.0.
 *
 * @since 1.0.0
 */
public interface MatchScorer {

    /**
     * @return the match, or empty when a hard filter excludes the contract
     */
    Optional<MatchResult> score(Contract contract, CompanyProfile profile);

    /**
     * Like {@link #score} but always returns a result; excluded contracts come back
     * with {@code passesFilters = false} and a total of 0.
     */
    MatchResult evaluate(Contract contract, CompanyProfile profile);
}
