package com.purchasingpower.tendermatch.ranking;

import com.purchasingpower.tendermatch.model.company.CompanyProfile;
import com.purchasingpower.tendermatch.model.contract.Contract;
import com.purchasingpower.tendermatch.model.match.RankedContract;

import java.util.List;

/**
 * Scores a batch of candidate contracts for one company and orders them.
 *
 * <p>Excluded contracts never appear in the output. Ties keep input order.
 *
 * @since 1.0.0
 */
public interface ContractRankingService {

    /**
     * @param limit maximum results; values below 1 fall back to {@code app.ranking.default-limit}
     */
    List<RankedContract> rank(List<Contract> contracts, CompanyProfile profile, int limit);

    /**
     * Every non-excluded contract scoring at least {@code app.ranking.digest-min-score}, best first.
     */
    List<RankedContract> digest(List<Contract> contracts, CompanyProfile profile);

    /**
     * How many candidates a caller should retrieve to fill {@code limit} results
     * after exclusions.
     */
    int candidatePoolSize(int limit);
}
