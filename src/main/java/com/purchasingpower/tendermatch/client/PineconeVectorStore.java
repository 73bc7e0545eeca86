package com.purchasingpower.tendermatch.client;

import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.purchasingpower.tendermatch.configuration.AppProperties;
import com.purchasingpower.tendermatch.exception.VectorStoreException;
import com.purchasingpower.tendermatch.knowledge.VectorStore;
import com.purchasingpower.tendermatch.model.vector.VectorRecord;
import io.pinecone.clients.Index;
import io.pinecone.clients.Pinecone;
import io.pinecone.proto.FetchResponse;
import io.pinecone.unsigned_indices_model.VectorWithUnsignedIndices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pinecone-backed {@link VectorStore}.
 *
 * Writes go out in batches of {@value #UPSERT_BATCH_SIZE}. Metadata values are stored as strings.
 */
@Slf4j
@Component
public class PineconeVectorStore implements VectorStore {

    static final int UPSERT_BATCH_SIZE = 100;

    private final Pinecone pineconeClient;
    private final String indexName;

    @Autowired
    public PineconeVectorStore(AppProperties props) {
        this(new Pinecone.Builder(props.getPinecone().getApiKey()).build(),
                props.getPinecone().getIndexName());
    }

    public PineconeVectorStore(Pinecone pineconeClient, String indexName) {
        this.pineconeClient = pineconeClient;
        this.indexName = indexName;
    }

    @Override
    public Map<String, List<Double>> fetch(String namespace, Collection<String> ids) {
        List<String> wanted = ids == null ? List.of() : ids.stream()
                .filter(id -> id != null && !id.isBlank())
                .distinct()
                .toList();
        if (wanted.isEmpty()) {
            return Map.of();
        }

        log.debug("Fetching {} vectors from namespace '{}'", wanted.size(), namespace);
        try {
            FetchResponse response = index().fetch(wanted, namespace);
            Map<String, List<Double>> vectors = new LinkedHashMap<>();
            if (response == null) {
                return vectors;
            }
            response.getVectorsMap().forEach((id, vector) -> vectors.put(id,
                    vector.getValuesList().stream()
                            .map(Float::doubleValue)
                            .toList()));
            log.debug("Fetched {}/{} vectors from '{}'", vectors.size(), wanted.size(), namespace);
            return vectors;
        } catch (Exception e) {
            log.error("Failed to fetch vectors from '{}': {}", namespace, e.getMessage());
            throw new VectorStoreException("Vector fetch failed", namespace, e);
        }
    }

    @Override
    public void upsert(String namespace, List<VectorRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }

        List<VectorWithUnsignedIndices> vectors = records.stream()
                .map(PineconeVectorStore::toPineconeVector)
                .toList();

        int batchCount = (vectors.size() + UPSERT_BATCH_SIZE - 1) / UPSERT_BATCH_SIZE;
        for (int i = 0; i < vectors.size(); i += UPSERT_BATCH_SIZE) {
            List<VectorWithUnsignedIndices> batch =
                    vectors.subList(i, Math.min(i + UPSERT_BATCH_SIZE, vectors.size()));
            int batchNum = i / UPSERT_BATCH_SIZE + 1;
            try {
                index().upsert(batch, namespace);
                log.debug("Upserted batch {}/{} ({} vectors) into '{}'",
                        batchNum, batchCount, batch.size(), namespace);
            } catch (Exception e) {
                log.error("Failed to upsert batch {}/{} into '{}': {}",
                        batchNum, batchCount, namespace, e.getMessage());
                throw new VectorStoreException("Failed to upsert batch " + batchNum, namespace, e);
            }
        }
        log.info("Upserted {} vectors into '{}' in {} batches", vectors.size(), namespace, batchCount);
    }

    @Override
    public void delete(String namespace, Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        try {
            index().deleteByIds(new ArrayList<>(ids), namespace);
            log.info("Deleted {} vectors from '{}'", ids.size(), namespace);
        } catch (Exception e) {
            log.error("Failed to delete vectors from '{}': {}", namespace, e.getMessage());
            throw new VectorStoreException("Vector delete failed", namespace, e);
        }
    }

    private Index index() {
        return pineconeClient.getIndexConnection(indexName);
    }

    static VectorWithUnsignedIndices toPineconeVector(VectorRecord record) {
        List<Float> floatVector = record.getValues().stream()
                .map(Double::floatValue)
                .toList();

        Struct.Builder metadataBuilder = Struct.newBuilder();
        record.getMetadata().forEach((key, value) -> {
            if (value != null) {
                metadataBuilder.putFields(key, Value.newBuilder().setStringValue(value).build());
            }
        });

        return new VectorWithUnsignedIndices(record.getId(), floatVector, metadataBuilder.build(), null);
    }
}
