package com.purchasingpower.tendermatch.diagnostics.impl;

import com.purchasingpower.tendermatch.diagnostics.MatchExplanationService;
import com.purchasingpower.tendermatch.knowledge.EmbeddingResolver;
import com.purchasingpower.tendermatch.model.company.Capability;
import com.purchasingpower.tendermatch.model.company.CompanyProfile;
import com.purchasingpower.tendermatch.model.contract.Contract;
import com.purchasingpower.tendermatch.model.match.CapabilitySimilarity;
import com.purchasingpower.tendermatch.model.match.MatchExplanation;
import com.purchasingpower.tendermatch.model.match.MatchResult;
import com.purchasingpower.tendermatch.scoring.CosineSimilarity;
import com.purchasingpower.tendermatch.scoring.MatchScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

@Slf4j
@Service
@RequiredArgsConstructor
public class MatchExplanationServiceImpl implements MatchExplanationService {

    static final double LOW_CAPABILITY_SCORE = 0.3;

    private static final int CAPABILITY_TEXT_PREVIEW = 50;

    private final MatchScorer matchScorer;
    private final EmbeddingResolver embeddingResolver;

    @Override
    public MatchExplanation explain(Contract contract, CompanyProfile profile) {
        checkNotNull(contract, "contract");
        checkNotNull(profile, "profile");

        Contract resolvedContract = embeddingResolver.resolveContract(contract);
        CompanyProfile resolvedProfile = embeddingResolver.resolveCapabilities(profile);

        MatchResult result = matchScorer.evaluate(resolvedContract, resolvedProfile);
        List<CapabilitySimilarity> breakdown = similarityBreakdown(resolvedContract, resolvedProfile);
        MatchExplanation.MatchExplanationBuilder explanation = MatchExplanation.builder()
                .noticeId(contract.getNoticeId())
                .matchResult(result)
                .capabilityBreakdown(breakdown);

        if (!result.isPassesFilters()) {
            explanation.issue("Contract failed preference filters (excluded or out of value range)");
        }
        if (resolvedProfile.getCapabilities().isEmpty()) {
            explanation.issue("No capabilities found");
            explanation.recommendation("Add 3-5 specific capabilities describing your services");
        }
        if (result.isPassesFilters() && result.getCapabilityScore() < LOW_CAPABILITY_SCORE) {
            explanation.issue("Low capability score - capabilities may not match contract well");
            explanation.recommendation("Review contract description and ensure capabilities are relevant");
        }
        if (!resolvedContract.hasEmbedding()) {
            explanation.issue("Contract has no embedding vector");
            explanation.recommendation("Re-sync contracts so the notice is embedded");
        }
        for (CapabilitySimilarity similarity : breakdown) {
            if (similarity.getSimilarity() == 0.0) {
                explanation.issue("Capability '" + preview(similarity.getCapabilityText()) + "' has 0% similarity");
            }
        }

        MatchExplanation built = explanation.build();
        log.debug("Explained contract {} for firm {}: total={}, {} issues",
                contract.getNoticeId(), profile.getFirmId(), result.getTotalScore(), built.getIssues().size());
        return built;
    }

    private static List<CapabilitySimilarity> similarityBreakdown(Contract contract, CompanyProfile profile) {
        if (!contract.hasEmbedding()) {
            return List.of();
        }
        List<CapabilitySimilarity> breakdown = new ArrayList<>();
        for (Capability capability : profile.getCapabilities()) {
            if (!capability.hasEmbedding()) {
                continue;
            }
            breakdown.add(CapabilitySimilarity.builder()
                    .capabilityId(capability.getId())
                    .capabilityText(capability.getText())
                    .vectorId(capability.getVectorId())
                    .similarity(round4(CosineSimilarity.between(contract.getEmbedding(), capability.getEmbedding())))
                    .vectorNorm(round4(CosineSimilarity.norm(capability.getEmbedding())))
                    .dimensions(capability.getEmbedding().size())
                    .build());
        }
        return breakdown;
    }

    private static double round4(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > CAPABILITY_TEXT_PREVIEW ? text.substring(0, CAPABILITY_TEXT_PREVIEW) : text;
    }
}
