package com.purchasingpower.tendermatch.scoring.impl;

import com.purchasingpower.tendermatch.config.ScoringConfig;
import com.purchasingpower.tendermatch.model.company.PastWin;
import com.purchasingpower.tendermatch.model.contract.Contract;
import com.purchasingpower.tendermatch.model.match.ComponentScore;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Track record with the same buyer and with contracts of a similar size.
 *
 * <p>Every past win contributes independently: a buyer match (exact, else partial)
 * and a comparable value. The sum is capped at 1.0.
 */
class PastWinMatcher {

    private final ScoringConfig.PastWin config;

    PastWinMatcher(ScoringConfig config) {
        this.config = config.getPastWin();
    }

    ComponentScore score(Contract contract, List<PastWin> pastWins) {
        if (pastWins.isEmpty()) {
            return ComponentScore.zero();
        }

        double score = 0.0;
        List<String> reasons = new ArrayList<>();

        for (PastWin win : pastWins) {
            score += scoreBuyer(contract.getBuyerName(), win.getBuyerName(), reasons);
            score += scoreValue(contract.getValue(), win.getValue(), reasons);
        }

        return new ComponentScore(Math.min(score, 1.0), reasons);
    }

    private double scoreBuyer(String contractBuyer, String winBuyer, List<String> reasons) {
        if (isBlank(contractBuyer) || isBlank(winBuyer)) {
            return 0.0;
        }
        String buyer = contractBuyer.toLowerCase(Locale.ROOT);
        String previous = winBuyer.toLowerCase(Locale.ROOT);

        if (previous.equals(buyer)) {
            reasons.add("Previously won contract with " + winBuyer);
            return config.getExactBuyerBoost();
        }
        // Renamed or abbreviated organisations: "Manchester City Council" vs "Manchester City Council Procurement"
        if (previous.contains(buyer) || buyer.contains(previous)) {
            reasons.add("Previously worked with similar buyer (" + winBuyer + ")");
            return config.getPartialBuyerBoost();
        }
        return 0.0;
    }

    private double scoreValue(BigDecimal contractValue, BigDecimal winValue, List<String> reasons) {
        if (!isPositive(contractValue) || !isPositive(winValue)) {
            return 0.0;
        }
        double a = contractValue.doubleValue();
        double b = winValue.doubleValue();
        double ratio = Math.min(a, b) / Math.max(a, b);
        if (ratio <= config.getValueRatioThreshold()) {
            return 0.0;
        }
        if (ratio > config.getSimilarValueRatio()) {
            reasons.add(String.format(Locale.UK, "Similar contract value to past win (£%,.0f)", winValue));
        }
        return config.getValueMatchBoost();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
