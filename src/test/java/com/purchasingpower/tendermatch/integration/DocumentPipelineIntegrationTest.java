package com.purchasingpower.tendermatch.integration;

import com.purchasingpower.tendermatch.capability.CapabilityVectorSyncService;
import com.purchasingpower.tendermatch.ingest.DocumentIngestionService;
import com.purchasingpower.tendermatch.model.company.Capability;
import com.purchasingpower.tendermatch.model.company.CompanyProfile;
import com.purchasingpower.tendermatch.model.contract.Contract;
import com.purchasingpower.tendermatch.model.ingest.IngestionResult;
import com.purchasingpower.tendermatch.model.match.RankedContract;
import com.purchasingpower.tendermatch.ranking.ContractRankingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs ingestion, capability sync and ranking against live Pinecone and Ollama.
 *
 * REQUIRES: PINECONE_KEY and OLLAMA_BASE_URL environment variables
 */
@SpringBootTest
@DisplayName("Document Pipeline Integration Tests")
@EnabledIfEnvironmentVariable(named = "PINECONE_KEY", matches = ".+")
@EnabledIfEnvironmentVariable(named = "OLLAMA_BASE_URL", matches = ".+")
class DocumentPipelineIntegrationTest {

    private static final String CONTRACT_TEXT = """
            1. Scope of Services. The supplier shall migrate the council's hosting estate to a managed cloud platform.

            2. Term. This agreement commences on the start date and continues for thirty six months unless terminated.

            3. Payment. The council shall pay undisputed invoices within thirty days of receipt by the finance team.
            """;

    @Autowired
    private DocumentIngestionService ingestionService;

    @Autowired
    private CapabilityVectorSyncService capabilitySync;

    @Autowired
    private ContractRankingService rankingService;

    @Test
    @DisplayName("A plain-text contract is chunked by clause and stored")
    void ingest_plainTextContract() {
        IngestionResult result = ingestionService.ingest("cloud_contract.txt", "text/plain",
                CONTRACT_TEXT.getBytes(StandardCharsets.UTF_8), "integration-test", Map.of());

        assertTrue(result.isSuccess(), "Ingestion should store chunks: " + result.getWarnings());
        assertEquals(3, result.getTotalChunks());
        assertEquals(0, result.getFailedChunks());
    }

    @Test
    @DisplayName("A freshly embedded capability lifts the semantic score")
    void rank_withEmbeddedCapability() {
        Capability capability = capabilitySync.embedCapability("integration-test", Capability.builder()
                .id(1L)
                .text("Cloud hosting migration for local councils")
                .category("IT")
                .build());
        assertNotNull(capability.getVectorId());

        try {
            Contract contract = Contract.builder()
                    .noticeId("IT-1")
                    .title("Cloud migration services")
                    .description("Migration of council hosting to a managed cloud platform")
                    .embedding(capability.getEmbedding())
                    .build();
            CompanyProfile profile = CompanyProfile.builder()
                    .firmId("integration-test")
                    .capability(capability)
                    .build();

            List<RankedContract> ranked = rankingService.rank(List.of(contract), profile, 5);

            assertEquals(1, ranked.size());
            assertTrue(ranked.get(0).getMatchResult().getCapabilityScore() > 0.9);
        } finally {
            capabilitySync.remove(capability);
        }
    }
}
