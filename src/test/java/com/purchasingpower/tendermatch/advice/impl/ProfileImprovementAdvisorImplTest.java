package com.purchasingpower.tendermatch.advice.impl;

import com.purchasingpower.tendermatch.model.advice.Recommendation;
import com.purchasingpower.tendermatch.model.advice.RecommendationCategory;
import com.purchasingpower.tendermatch.model.advice.RecommendationPriority;
import com.purchasingpower.tendermatch.model.company.Capability;
import com.purchasingpower.tendermatch.model.company.CompanyProfile;
import com.purchasingpower.tendermatch.model.company.PastWin;
import com.purchasingpower.tendermatch.model.company.SearchPreference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("ProfileImprovementAdvisor")
class ProfileImprovementAdvisorImplTest {

    private final ProfileImprovementAdvisorImpl advisor = new ProfileImprovementAdvisorImpl();

    @Test
    @DisplayName("An empty profile gets high, high, low advice in that order")
    void emptyProfile() {
        // When
        List<Recommendation> recommendations = advisor.recommend(CompanyProfile.builder().firmId("firm-1").build());

        // Then
        assertThat(recommendations).extracting(Recommendation::getCategory).containsExactly(
                RecommendationCategory.PAST_WINS, RecommendationCategory.CAPABILITIES, RecommendationCategory.PREFERENCES);
        assertThat(recommendations).extracting(Recommendation::getPriority).containsExactly(
                RecommendationPriority.HIGH, RecommendationPriority.HIGH, RecommendationPriority.LOW);

        Recommendation pastWins = recommendations.get(0);
        assertEquals(0.0, pastWins.getCurrentScore());
        assertEquals(30.0, pastWins.getPotentialScore());
        assertEquals("+30% to total match score", pastWins.getImpact());

        Recommendation capabilities = recommendations.get(1);
        assertEquals("Add 3 domain-specific capabilities", capabilities.getAction());
        assertEquals("+15% potential boost", capabilities.getImpact());

        Recommendation preferences = recommendations.get(2);
        assertEquals(0.0, preferences.getCurrentScore());
        assertEquals(30.0, preferences.getPotentialScore());
    }

    @Test
    @DisplayName("One past win and two capabilities give medium advice")
    void partialProfile() {
        // Given
        CompanyProfile profile = CompanyProfile.builder()
                .firmId("firm-1")
                .pastWin(PastWin.builder().buyerName("HMRC").build())
                .capability(capability("Cloud infrastructure migration"))
                .capability(capability("Cyber incident response"))
                .build();

        // When
        List<Recommendation> recommendations = advisor.recommend(profile);

        // Then: factor order is kept within a priority
        assertThat(recommendations).extracting(Recommendation::getPriority).containsExactly(
                RecommendationPriority.MEDIUM, RecommendationPriority.MEDIUM, RecommendationPriority.LOW);

        Recommendation pastWins = recommendations.get(0);
        assertEquals(RecommendationCategory.PAST_WINS, pastWins.getCategory());
        assertEquals(10.0, pastWins.getCurrentScore());
        assertEquals("Add 2 more past wins to strengthen your track record", pastWins.getAction());
        assertEquals("+20% potential boost", pastWins.getImpact());

        Recommendation capabilities = recommendations.get(1);
        assertEquals(20.0, capabilities.getCurrentScore());
        assertEquals(40.0, capabilities.getPotentialScore());
        assertEquals("+5% potential boost", capabilities.getImpact());
    }

    @Test
    @DisplayName("Mostly generic capabilities are flagged as too vague")
    void genericCapabilities() {
        // Given
        CompanyProfile profile = completeProfile()
                .clearCapabilities()
                .capability(capability("IT Services"))
                .capability(capability("Software development"))
                .capability(capability("Fleet telematics"))
                .build();

        // When
        List<Recommendation> recommendations = advisor.recommend(profile);

        // Then
        assertThat(recommendations).hasSize(1);
        Recommendation advice = recommendations.get(0);
        assertEquals(RecommendationCategory.CAPABILITIES, advice.getCategory());
        assertEquals(RecommendationPriority.MEDIUM, advice.getPriority());
        assertEquals(24.0, advice.getCurrentScore());
        assertEquals("Make capabilities more specific to improve semantic matching", advice.getAction());
    }

    @Test
    @DisplayName("Partially filled preferences list what is missing")
    void incompletePreferences() {
        // Given
        CompanyProfile profile = completeProfile()
                .searchPreference(SearchPreference.builder().keyword("cloud").build())
                .build();

        // When
        List<Recommendation> recommendations = advisor.recommend(profile);

        // Then: value range 8 + regions 10 missing
        assertThat(recommendations).hasSize(1);
        Recommendation advice = recommendations.get(0);
        assertEquals(RecommendationPriority.LOW, advice.getPriority());
        assertEquals(12.0, advice.getCurrentScore());
        assertEquals("Complete your search preferences: contract value range, preferred regions", advice.getAction());
        assertEquals("+18% optimization", advice.getImpact());
        assertThat(advice.getSpecificActions()).containsExactly("Add contract value range", "Add preferred regions");
    }

    @Test
    @DisplayName("A complete profile needs no advice")
    void completeProfile_noAdvice() {
        assertThat(advisor.recommend(completeProfile().build())).isEmpty();
    }

    @Test
    @DisplayName("Generic detection is a lower-case substring match")
    void isGeneric() {
        assertThat(ProfileImprovementAdvisorImpl.isGeneric(capability("Managed IT support"))).isTrue();
        assertThat(ProfileImprovementAdvisorImpl.isGeneric(capability("Fleet telematics"))).isFalse();
    }

    private static CompanyProfile.CompanyProfileBuilder completeProfile() {
        PastWin win = PastWin.builder().buyerName("Cabinet Office").build();
        return CompanyProfile.builder()
                .firmId("firm-1")
                .pastWin(win).pastWin(win).pastWin(win)
                .capability(capability("Fleet telematics"))
                .capability(capability("Bridge inspection drones"))
                .capability(capability("Flood modelling"))
                .searchPreference(SearchPreference.builder()
                        .minContractValue(new BigDecimal("10000"))
                        .preferredRegion("North West")
                        .keyword("fleet")
                        .build());
    }

    private static Capability capability(String text) {
        return Capability.builder().text(text).build();
    }
}
