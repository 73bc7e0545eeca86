package com.purchasingpower.tendermatch.advice.impl;

import com.purchasingpower.tendermatch.advice.ProfileImprovementAdvisor;
import com.purchasingpower.tendermatch.model.advice.Recommendation;
import com.purchasingpower.tendermatch.model.advice.RecommendationCategory;
import com.purchasingpower.tendermatch.model.advice.RecommendationPriority;
import com.purchasingpower.tendermatch.model.company.Capability;
import com.purchasingpower.tendermatch.model.company.CompanyProfile;
import com.purchasingpower.tendermatch.model.company.SearchPreference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Rule-based advisor over the three scoring factors.
 *
 * <p>Target profile: at least 3 past wins, at least 3 specific capabilities, and
 * search preferences with a value range, regions and keywords.
 */
@Slf4j
@Service
public class ProfileImprovementAdvisorImpl implements ProfileImprovementAdvisor {

    static final int TARGET_PAST_WINS = 3;
    static final int TARGET_CAPABILITIES = 3;
    static final int SPECIFICITY_CHECK_LIMIT = 5;

    static final List<String> GENERIC_TERMS =
            List.of("it", "software", "services", "solutions", "general", "consulting");

    @Override
    public List<Recommendation> recommend(CompanyProfile profile) {
        checkNotNull(profile, "profile");

        List<Recommendation> recommendations = new ArrayList<>();
        pastWinAdvice(profile).ifPresent(recommendations::add);
        capabilityAdvice(profile).ifPresent(recommendations::add);
        preferenceAdvice(profile).ifPresent(recommendations::add);

        // stable sort, so equal priorities keep factor order
        recommendations.sort(Comparator.comparing(Recommendation::getPriority));

        log.info("Generated {} recommendations for firm {}", recommendations.size(), profile.getFirmId());
        return recommendations;
    }

    Optional<Recommendation> pastWinAdvice(CompanyProfile profile) {
        int count = profile.getPastWins().size();

        if (count == 0) {
            return Optional.of(Recommendation.builder()
                    .category(RecommendationCategory.PAST_WINS)
                    .currentScore(0.0)
                    .potentialScore(30.0)
                    .priority(RecommendationPriority.HIGH)
                    .action("Add 1-2 similar past contract wins to demonstrate relevant experience")
                    .impact("+30% to total match score")
                    .specificAction("Add a past win in your main capability area")
                    .specificAction("Include contract value and buyer organization name")
                    .specificAction("Focus on government/public sector contracts")
                    .build());
        }
        if (count < TARGET_PAST_WINS) {
            int missing = TARGET_PAST_WINS - count;
            return Optional.of(Recommendation.builder()
                    .category(RecommendationCategory.PAST_WINS)
                    .currentScore(count * 10.0)
                    .potentialScore(30.0)
                    .priority(RecommendationPriority.MEDIUM)
                    .action("Add " + missing + " more past wins to strengthen your track record")
                    .impact("+" + missing * 10 + "% potential boost")
                    .specificAction("Add wins from different government buyers")
                    .specificAction("Include recent contracts (last 2-3 years)")
                    .specificAction("Aim for at least 3 past wins for credibility")
                    .build());
        }
        return Optional.empty();
    }

    Optional<Recommendation> capabilityAdvice(CompanyProfile profile) {
        List<Capability> capabilities = profile.getCapabilities();
        int count = capabilities.size();

        if (count < TARGET_CAPABILITIES) {
            int missing = TARGET_CAPABILITIES - count;
            return Optional.of(Recommendation.builder()
                    .category(RecommendationCategory.CAPABILITIES)
                    .currentScore(count * 10.0)
                    .potentialScore(40.0)
                    .priority(count < 2 ? RecommendationPriority.HIGH : RecommendationPriority.MEDIUM)
                    .action("Add " + missing + " domain-specific capabilities")
                    .impact("+" + Math.min(15, missing * 5) + "% potential boost")
                    .specificAction("Use specific terminology like 'Fleet Management Systems' instead of 'IT Services'")
                    .specificAction("Add 'Digital Transformation for Government' or 'Cloud Infrastructure Migration'")
                    .specificAction("Match language from contracts you're interested in")
                    .build());
        }

        if (count < SPECIFICITY_CHECK_LIMIT) {
            long generic = capabilities.stream().filter(ProfileImprovementAdvisorImpl::isGeneric).count();
            if (generic * 2 > count) {
                return Optional.of(Recommendation.builder()
                        .category(RecommendationCategory.CAPABILITIES)
                        .currentScore(count * 8.0)
                        .potentialScore(40.0)
                        .priority(RecommendationPriority.MEDIUM)
                        .action("Make capabilities more specific to improve semantic matching")
                        .impact("+10-15% better relevance scores")
                        .specificAction("Replace 'IT Services' with 'Cybersecurity Auditing & Compliance'")
                        .specificAction("Replace 'Software Development' with 'GOV.UK Service Standard Development'")
                        .specificAction("Use exact phrases from top-scoring contracts")
                        .build());
            }
        }
        return Optional.empty();
    }

    Optional<Recommendation> preferenceAdvice(CompanyProfile profile) {
        Optional<SearchPreference> preference = profile.searchPreference();
        if (preference.isEmpty()) {
            return Optional.of(Recommendation.builder()
                    .category(RecommendationCategory.PREFERENCES)
                    .currentScore(0.0)
                    .potentialScore(30.0)
                    .priority(RecommendationPriority.LOW)
                    .action("Set search preferences to filter and focus results")
                    .impact("+30% better targeted results")
                    .specificAction("Set minimum/maximum contract values")
                    .specificAction("Add preferred regions (e.g., London, South East)")
                    .specificAction("Add keywords for your specialization")
                    .build());
        }

        SearchPreference prefs = preference.get();
        List<String> missing = new ArrayList<>();
        int impact = 0;

        if (!prefs.hasMinValue() && !prefs.hasMaxValue()) {
            missing.add("contract value range");
            impact += 8;
        }
        if (prefs.getPreferredRegions().isEmpty()) {
            missing.add("preferred regions");
            impact += 10;
        }
        if (prefs.getKeywords().isEmpty()) {
            missing.add("target keywords");
            impact += 7;
        }
        if (missing.isEmpty()) {
            return Optional.empty();
        }

        Recommendation.RecommendationBuilder recommendation = Recommendation.builder()
                .category(RecommendationCategory.PREFERENCES)
                .currentScore(30.0 - impact)
                .potentialScore(30.0)
                .priority(RecommendationPriority.LOW)
                .action("Complete your search preferences: " + String.join(", ", missing))
                .impact("+" + impact + "% optimization");
        missing.forEach(m -> recommendation.specificAction("Add " + m));
        return Optional.of(recommendation.build());
    }

    /**
     * Plain substring match on the lower-cased text, so "security" contains "it".
     */
    static boolean isGeneric(Capability capability) {
        String text = capability.getText() == null ? "" : capability.getText().toLowerCase(Locale.ROOT);
        return GENERIC_TERMS.stream().anyMatch(text::contains);
    }
}
