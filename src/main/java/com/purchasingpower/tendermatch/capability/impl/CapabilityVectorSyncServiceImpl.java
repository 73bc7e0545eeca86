package com.purchasingpower.tendermatch.capability.impl;

import com.purchasingpower.tendermatch.capability.CapabilityVectorSyncService;
import com.purchasingpower.tendermatch.configuration.AppProperties;
import com.purchasingpower.tendermatch.knowledge.Embedder;
import com.purchasingpower.tendermatch.knowledge.VectorStore;
import com.purchasingpower.tendermatch.model.company.Capability;
import com.purchasingpower.tendermatch.model.vector.SyncResult;
import com.purchasingpower.tendermatch.model.vector.VectorRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

@Slf4j
@Service
public class CapabilityVectorSyncServiceImpl implements CapabilityVectorSyncService {

    private final Embedder embedder;
    private final VectorStore vectorStore;
    private final String namespace;

    @Autowired
    public CapabilityVectorSyncServiceImpl(Embedder embedder, VectorStore vectorStore, AppProperties props) {
        this(embedder, vectorStore, props.getPinecone().getCapabilitiesNamespace());
    }

    public CapabilityVectorSyncServiceImpl(Embedder embedder, VectorStore vectorStore, String namespace) {
        this.embedder = embedder;
        this.vectorStore = vectorStore;
        this.namespace = namespace;
    }

    @Override
    public Capability embedCapability(String firmId, Capability capability) {
        checkNotNull(capability, "capability");
        checkArgument(capability.getText() != null && !capability.getText().isBlank(),
                "Capability %s has no text to embed", capability.getId());

        List<Double> embedding = embedder.embed(capability.getText());
        String vectorId = UUID.randomUUID().toString();

        vectorStore.upsert(namespace, List.of(VectorRecord.builder()
                .id(vectorId)
                .values(embedding)
                .metadata(payload(firmId, capability))
                .build()));

        log.info("Embedded capability {} as vector {}", capability.getId(), vectorId);
        return capability.toBuilder()
                .vectorId(vectorId)
                .embedding(embedding)
                .build();
    }

    @Override
    public Capability reembed(String firmId, Capability capability) {
        String oldVectorId = capability.getVectorId();

        Capability updated = embedCapability(firmId, capability);

        if (oldVectorId != null && !oldVectorId.equals(updated.getVectorId())) {
            try {
                vectorStore.delete(namespace, List.of(oldVectorId));
                log.debug("Deleted superseded vector {} for capability {}", oldVectorId, capability.getId());
            } catch (RuntimeException e) {
                log.warn("Capability {} now uses vector {}, but old vector {} could not be deleted: {}",
                        capability.getId(), updated.getVectorId(), oldVectorId, e.getMessage());
            }
        }
        return updated;
    }

    @Override
    public SyncResult syncMissing(String firmId, List<Capability> capabilities) {
        SyncResult.SyncResultBuilder result = SyncResult.builder();
        int synced = 0;
        int failed = 0;

        for (Capability capability : capabilities) {
            if (capability.getVectorId() != null) {
                result.capability(capability);
                continue;
            }
            try {
                result.capability(embedCapability(firmId, capability));
                synced++;
            } catch (RuntimeException e) {
                log.error("Failed to embed capability {}: {}", capability.getId(), e.getMessage());
                result.capability(capability);
                result.failedId(capability.getId());
                failed++;
            }
        }

        log.info("Capability sync for firm {}: {} synced, {} failed", firmId, synced, failed);
        return result.synced(synced).failed(failed).build();
    }

    @Override
    public void remove(Capability capability) {
        if (capability.getVectorId() == null) {
            return;
        }
        vectorStore.delete(namespace, List.of(capability.getVectorId()));
        log.info("Removed vector {} for capability {}", capability.getVectorId(), capability.getId());
    }

    private static Map<String, String> payload(String firmId, Capability capability) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("capability_text", capability.getText());
        if (capability.getCategory() != null) {
            metadata.put("category", capability.getCategory());
        }
        if (capability.getYearsExperience() != null) {
            metadata.put("years_experience", String.valueOf(capability.getYearsExperience()));
        }
        if (firmId != null) {
            metadata.put("firm_id", firmId);
        }
        return metadata;
    }
}
