package com.purchasingpower.tendermatch.scoring.impl;

import com.google.common.collect.Ordering;
import com.purchasingpower.tendermatch.config.ScoringConfig;
import com.purchasingpower.tendermatch.model.company.Capability;
import com.purchasingpower.tendermatch.model.contract.Contract;
import com.purchasingpower.tendermatch.model.match.ComponentScore;
import com.purchasingpower.tendermatch.scoring.CosineSimilarity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Semantic fit between a contract and the company's capabilities.
 *
 * <p>Averages the best {@code topCapabilityMatches} cosine similarities, so a firm
 * with several relevant capabilities outranks one with a single narrow match.
 * Negative similarities count as 0. No contract vector, or no capability with a
 * vector, scores exactly 0.0.
 */
@Slf4j
class CapabilityMatcher {

    private final ScoringConfig config;

    CapabilityMatcher(ScoringConfig config) {
        this.config = config;
    }

    ComponentScore score(Contract contract, List<Capability> capabilities) {
        if (capabilities.isEmpty() || !contract.hasEmbedding()) {
            log.debug("Missing capabilities ({}) or contract vector for {}",
                    capabilities.size(), contract.getNoticeId());
            return ComponentScore.zero();
        }

        List<Double> similarities = new ArrayList<>(capabilities.size());
        for (Capability capability : capabilities) {
            if (!capability.hasEmbedding()) {
                continue;
            }
            double similarity = Math.max(0.0,
                    CosineSimilarity.between(contract.getEmbedding(), capability.getEmbedding()));
            similarities.add(similarity);
            log.debug("Capability '{}' similarity: {}", abbreviate(capability.getText()),
                    String.format(Locale.ROOT, "%.3f", similarity));
        }

        if (similarities.isEmpty()) {
            return ComponentScore.zero();
        }

        List<Double> top = Ordering.<Double>natural().greatestOf(similarities, config.getTopCapabilityMatches());
        double average = top.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double score = Math.min(average, 1.0);

        log.debug("Capability score {} from {} capabilities",
                String.format(Locale.ROOT, "%.3f", score), similarities.size());
        return new ComponentScore(score, reasonFor(score));
    }

    private List<String> reasonFor(double score) {
        ScoringConfig.CapabilityBands bands = config.getCapabilityBands();
        String percent = String.format(Locale.ROOT, "%.0f%%", score * 100);
        if (score > bands.getStrong()) {
            return List.of("Strong capability match (" + percent + ")");
        }
        if (score > bands.getGood()) {
            return List.of("Good capability match (" + percent + ")");
        }
        if (score > bands.getModerate()) {
            return List.of("Moderate capability match (" + percent + ")");
        }
        return List.of();
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 50 ? text.substring(0, 50) : text;
    }
}
