package com.purchasingpower.tendermatch.scoring.impl;

import com.purchasingpower.tendermatch.config.ScoringConfig;
import com.purchasingpower.tendermatch.model.company.SearchPreference;
import com.purchasingpower.tendermatch.model.contract.Contract;
import com.purchasingpower.tendermatch.model.match.PreferenceOutcome;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies search preferences: hard filters first, then soft adjustments.
 *
 * <p>Hard filters (any failure excludes the contract): value below the minimum,
 * value above the maximum, title or description containing an excluded category.
 * A contract without a value passes the value filters.
 *
 * <p>Soft adjustments start from 1.0: a preferred region adds the region boost,
 * any other region multiplies by the penalty; each matched keyword adds the keyword
 * boost. The result is capped at 1.0.
 */
@Slf4j
class PreferenceFilter {

    private static final int MAX_KEYWORDS_IN_REASON = 3;

    private final ScoringConfig.Preference config;

    PreferenceFilter(ScoringConfig config) {
        this.config = config.getPreference();
    }

    PreferenceOutcome evaluate(Contract contract, SearchPreference preferences) {
        if (preferences == null) {
            return PreferenceOutcome.unconstrained();
        }

        List<String> reasons = new ArrayList<>();
        String contractText = contract.searchableText();

        if (!passesValueRange(contract, preferences, reasons) || containsExcludedCategory(contract, contractText, preferences)) {
            return new PreferenceOutcome(0.0, false, reasons);
        }

        double score = 1.0;

        List<String> regions = preferences.getPreferredRegions();
        String region = contract.getRegion();
        if (!regions.isEmpty() && region != null && !region.isBlank()) {
            if (regions.contains(region)) {
                score += config.getRegionBoost();
                reasons.add("Located in preferred region (" + region + ")");
            } else {
                score *= config.getRegionPenaltyMultiplier();
            }
        }

        List<String> matched = new ArrayList<>();
        for (String keyword : preferences.getKeywords()) {
            if (keyword != null && !keyword.isBlank() && contractText.contains(keyword.toLowerCase(Locale.ROOT))) {
                matched.add(keyword);
            }
        }
        if (!matched.isEmpty()) {
            score += matched.size() * config.getKeywordBoost();
            reasons.add("Matches keywords: "
                    + String.join(", ", matched.subList(0, Math.min(MAX_KEYWORDS_IN_REASON, matched.size()))));
        }

        return new PreferenceOutcome(Math.min(score, 1.0), true, reasons);
    }

    private boolean passesValueRange(Contract contract, SearchPreference preferences, List<String> reasons) {
        BigDecimal value = contract.getValue();
        if (value == null || value.signum() == 0) {
            return true;
        }
        if (preferences.hasMinValue() && value.compareTo(preferences.getMinContractValue()) < 0) {
            log.debug("Contract {} value {} below minimum {}",
                    contract.getNoticeId(), value, preferences.getMinContractValue());
            return false;
        }
        if (preferences.hasMaxValue() && value.compareTo(preferences.getMaxContractValue()) > 0) {
            log.debug("Contract {} value {} above maximum {}",
                    contract.getNoticeId(), value, preferences.getMaxContractValue());
            return false;
        }
        if (preferences.hasMinValue() || preferences.hasMaxValue()) {
            reasons.add(String.format(Locale.UK, "Contract value (£%,.0f) matches preferences", value));
        }
        return true;
    }

    private boolean containsExcludedCategory(Contract contract, String contractText, SearchPreference preferences) {
        for (String category : preferences.getExcludedCategories()) {
            if (category != null && !category.isBlank() && contractText.contains(category.toLowerCase(Locale.ROOT))) {
                log.debug("Contract {} contains excluded category: {}", contract.getNoticeId(), category);
                return true;
            }
        }
        return false;
    }
}
