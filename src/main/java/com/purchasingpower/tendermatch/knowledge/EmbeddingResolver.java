package com.purchasingpower.tendermatch.knowledge;

import com.purchasingpower.tendermatch.configuration.AppProperties;
import com.purchasingpower.tendermatch.exception.VectorStoreException;
import com.purchasingpower.tendermatch.model.company.Capability;
import com.purchasingpower.tendermatch.model.company.CompanyProfile;
import com.purchasingpower.tendermatch.model.contract.Contract;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Attaches stored vectors to contracts and capabilities before scoring.
 *
 * Items that already carry an embedding are left alone. Items whose vector cannot be
 * fetched keep a null embedding and score as having no semantic signal.
 */
@Slf4j
@Component
public class EmbeddingResolver {

    private final VectorLookup vectorLookup;
    private final String contractsNamespace;
    private final String capabilitiesNamespace;

    @Autowired
    public EmbeddingResolver(VectorLookup vectorLookup, AppProperties props) {
        this(vectorLookup,
                props.getPinecone().getContractsNamespace(),
                props.getPinecone().getCapabilitiesNamespace());
    }

    public EmbeddingResolver(VectorLookup vectorLookup, String contractsNamespace, String capabilitiesNamespace) {
        this.vectorLookup = vectorLookup;
        this.contractsNamespace = contractsNamespace;
        this.capabilitiesNamespace = capabilitiesNamespace;
    }

    public List<Contract> resolveContracts(List<Contract> contracts) {
        List<String> missing = contracts.stream()
                .filter(c -> !c.hasEmbedding() && c.getVectorId() != null)
                .map(Contract::getVectorId)
                .toList();

        Map<String, List<Double>> vectors = fetchQuietly(contractsNamespace, missing);
        return contracts.stream()
                .map(c -> c.hasEmbedding() || !isResolved(vectors, c.getVectorId())
                        ? c
                        : c.toBuilder().embedding(vectors.get(c.getVectorId())).build())
                .toList();
    }

    public Contract resolveContract(Contract contract) {
        return resolveContracts(List.of(contract)).get(0);
    }

    public CompanyProfile resolveCapabilities(CompanyProfile profile) {
        List<String> missing = profile.getCapabilities().stream()
                .filter(c -> !c.hasEmbedding() && c.getVectorId() != null)
                .map(Capability::getVectorId)
                .toList();
        if (missing.isEmpty()) {
            return profile;
        }

        Map<String, List<Double>> vectors = fetchQuietly(capabilitiesNamespace, missing);
        List<Capability> resolved = profile.getCapabilities().stream()
                .map(c -> c.hasEmbedding() || !isResolved(vectors, c.getVectorId())
                        ? c
                        : c.toBuilder().embedding(vectors.get(c.getVectorId())).build())
                .toList();

        return profile.toBuilder()
                .clearCapabilities()
                .capabilities(resolved)
                .build();
    }

    private Map<String, List<Double>> fetchQuietly(String namespace, Collection<String> ids) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        try {
            Map<String, List<Double>> vectors =
                    Objects.requireNonNullElse(vectorLookup.fetch(namespace, ids), Map.of());
            long unresolved = ids.stream().filter(id -> !vectors.containsKey(id)).count();
            if (unresolved > 0) {
                log.warn("{} of {} vectors not found in '{}'", unresolved, ids.size(), namespace);
            }
            return vectors;
        } catch (VectorStoreException e) {
            log.warn("Could not fetch {} vectors from '{}', scoring without them: {}",
                    ids.size(), namespace, e.getMessage());
            return Map.of();
        }
    }

    private static boolean isResolved(Map<String, List<Double>> vectors, String vectorId) {
        return vectorId != null && vectors.containsKey(vectorId);
    }
}
