package com.purchasingpower.tendermatch.scoring.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.tendermatch.config.ScoringConfig;
import com.purchasingpower.tendermatch.model.company.CompanyProfile;
import com.purchasingpower.tendermatch.model.contract.Contract;
import com.purchasingpower.tendermatch.model.match.ComponentScore;
import com.purchasingpower.tendermatch.model.match.MatchResult;
import com.purchasingpower.tendermatch.model.match.PreferenceOutcome;
import com.purchasingpower.tendermatch.scoring.MatchScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Weighted multi-factor contract relevance.
 *
 * <p>Total = capability x 0.4 + past wins x 0.3 + preferences x 0.3 (weights from
 * {@link ScoringConfig}). Each component is capped at 1.0 before weighting, so the
 * total stays in [0, 1]. Hard-filter failures exclude the contract instead of
 * lowering its score.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class ContractMatchScorer implements MatchScorer {

    private final ScoringConfig config;
    private final CapabilityMatcher capabilityMatcher;
    private final PastWinMatcher pastWinMatcher;
    private final PreferenceFilter preferenceFilter;

    public ContractMatchScorer(ScoringConfig config) {
        this.config = config;
        this.capabilityMatcher = new CapabilityMatcher(config);
        this.pastWinMatcher = new PastWinMatcher(config);
        this.preferenceFilter = new PreferenceFilter(config);
    }

    @Override
    public Optional<MatchResult> score(Contract contract, CompanyProfile profile) {
        MatchResult result = evaluate(contract, profile);
        if (!result.isPassesFilters()) {
            log.debug("Contract {} failed preference filters for firm {}",
                    contract.getNoticeId(), profile.getFirmId());
            return Optional.empty();
        }
        log.info("Contract {} scored {} for firm {}", contract.getNoticeId(),
                String.format(Locale.ROOT, "%.2f%%", result.getTotalScore() * 100), profile.getFirmId());
        return Optional.of(result);
    }

    @Override
    public MatchResult evaluate(Contract contract, CompanyProfile profile) {
        Preconditions.checkNotNull(contract, "Contract cannot be null");
        Preconditions.checkNotNull(profile, "Company profile cannot be null");

        ComponentScore capability = capabilityMatcher.score(contract, profile.getCapabilities());
        ComponentScore pastWins = pastWinMatcher.score(contract, profile.getPastWins());
        PreferenceOutcome preferences = preferenceFilter.evaluate(contract, profile.getSearchPreference());

        MatchResult.MatchResultBuilder result = MatchResult.builder()
                .capabilityScore(capability.score())
                .pastWinScore(pastWins.score())
                .preferenceScore(preferences.score())
                .matchReasons(capability.reasons())
                .matchReasons(pastWins.reasons())
                .matchReasons(preferences.reasons())
                .passesFilters(preferences.passesFilters());

        if (!preferences.passesFilters()) {
            return result.totalScore(0.0).build();
        }

        double total = capability.score() * config.getCapabilityWeight()
                + pastWins.score() * config.getPastWinWeight()
                + preferences.score() * config.getPreferenceWeight();

        return result.totalScore(Math.min(total, 1.0)).build();
    }
}
