package com.purchasingpower.tendermatch.ingest.impl;

import com.google.common.hash.Hashing;
import com.purchasingpower.tendermatch.chunking.DocumentChunker;
import com.purchasingpower.tendermatch.configuration.AppProperties;
import com.purchasingpower.tendermatch.exception.EmbeddingException;
import com.purchasingpower.tendermatch.ingest.DocumentIngestionService;
import com.purchasingpower.tendermatch.ingest.DocumentTextExtractor;
import com.purchasingpower.tendermatch.knowledge.Embedder;
import com.purchasingpower.tendermatch.knowledge.VectorStore;
import com.purchasingpower.tendermatch.model.document.Chunk;
import com.purchasingpower.tendermatch.model.document.ChunkType;
import com.purchasingpower.tendermatch.model.ingest.ExtractedDocument;
import com.purchasingpower.tendermatch.model.ingest.IngestionResult;
import com.purchasingpower.tendermatch.model.vector.VectorRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Extract, chunk, embed and store a company document.
 *
 * <p>Chunks are embedded in one batch. If the batch fails they are embedded one at a
 * time, and a chunk whose embedding fails is skipped and counted. The rest are stored
 * in one upsert. Vector ids are {@code <documentId>_chunk_<index>}, so re-ingesting the same text overwrites it.
 */
@Slf4j
@Service
public class DocumentIngestionServiceImpl implements DocumentIngestionService {

    private final DocumentTextExtractor extractor;
    private final DocumentChunker chunker;
    private final Embedder embedder;
    private final VectorStore vectorStore;
    private final String namespace;

    @Autowired
    public DocumentIngestionServiceImpl(DocumentTextExtractor extractor, DocumentChunker chunker,
                                        Embedder embedder, VectorStore vectorStore, AppProperties props) {
        this(extractor, chunker, embedder, vectorStore, props.getPinecone().getDocumentsNamespace());
    }

    public DocumentIngestionServiceImpl(DocumentTextExtractor extractor, DocumentChunker chunker,
                                        Embedder embedder, VectorStore vectorStore, String namespace) {
        this.extractor = extractor;
        this.chunker = chunker;
        this.embedder = embedder;
        this.vectorStore = vectorStore;
        this.namespace = namespace;
    }

    @Override
    public IngestionResult ingest(String filename, String contentType, byte[] content,
                                  String ownerId, Map<String, Object> userMetadata) {
        checkArgument(ownerId != null && !ownerId.isBlank(), "ownerId is required");

        Optional<ExtractedDocument> extracted = extractor.extract(filename, contentType, content, userMetadata);
        if (extracted.isEmpty()) {
            return IngestionResult.builder()
                    .filename(filename)
                    .warning("No text could be extracted from " + filename)
                    .build();
        }

        ExtractedDocument document = extracted.get();
        String documentId = documentId(ownerId, document.getText());

        List<Chunk> chunks = chunker.chunkDocument(document.getText(), document.getMetadata());
        if (chunks.isEmpty()) {
            log.warn("Document {} produced no chunks", filename);
            return IngestionResult.builder()
                    .documentId(documentId)
                    .filename(filename)
                    .warning("Document produced no chunks")
                    .build();
        }

        log.info("Embedding {} chunks of {} as {}", chunks.size(), filename, documentId);

        List<VectorRecord> records = new ArrayList<>(chunks.size());
        IngestionResult.IngestionResultBuilder result = IngestionResult.builder()
                .documentId(documentId)
                .filename(filename)
                .totalChunks(chunks.size());

        Optional<List<List<Double>>> batch = embedBatch(chunks, documentId);
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            try {
                List<Double> values = batch.isPresent() ? batch.get().get(i) : embedder.embed(chunk.getText());
                records.add(VectorRecord.builder()
                        .id(documentId + "_chunk_" + i)
                        .values(values)
                        .metadata(chunkMetadata(chunk, i, chunks.size(), ownerId, documentId))
                        .build());
            } catch (EmbeddingException e) {
                log.warn("Skipping chunk {} of {}: {}", i, documentId, e.getMessage());
                result.warning("Chunk " + i + " could not be embedded");
            }
        }

        vectorStore.upsert(namespace, records);

        int failed = chunks.size() - records.size();
        log.info("Stored {}/{} chunks for {}", records.size(), chunks.size(), documentId);
        return result
                .storedChunks(records.size())
                .failedChunks(failed)
                .build();
    }

    static Map<String, String> chunkMetadata(Chunk chunk, int index, int total,
                                             String ownerId, String documentId) {
        Map<String, String> metadata = new LinkedHashMap<>();
        chunk.getSourceMetadata().forEach((key, value) -> {
            if (value != null) {
                metadata.put(key, String.valueOf(value));
            }
        });
        metadata.put("chunk_index", String.valueOf(index));
        metadata.put("total_chunks", String.valueOf(total));
        metadata.put("chunk_type", chunk.getChunkType().metadataValue());
        metadata.put("chunk_size", String.valueOf(chunk.length()));
        metadata.put("page", String.valueOf(chunk.getPage()));
        if (chunk.getChunkType() == ChunkType.CLAUSE) {
            chunk.clauseNumber().ifPresent(n -> metadata.put("clause_number", n));
        }
        metadata.put("owner_id", ownerId);
        metadata.put("document_id", documentId);
        metadata.put("text", chunk.getText());
        return metadata;
    }

    /**
     * Embeds all chunks in one call. Empty when the batch fails or comes back incomplete,
     * in which case the chunks are embedded one at a time.
     */
    private Optional<List<List<Double>>> embedBatch(List<Chunk> chunks, String documentId) {
        try {
            List<List<Double>> embeddings = embedder.embedAll(chunks.stream().map(Chunk::getText).toList());
            if (embeddings != null && embeddings.size() == chunks.size()) {
                return Optional.of(embeddings);
            }
            log.warn("Batch embedding for {} returned {} of {} vectors, embedding one at a time",
                    documentId, embeddings == null ? 0 : embeddings.size(), chunks.size());
        } catch (EmbeddingException e) {
            log.warn("Batch embedding failed for {}, embedding {} chunks one at a time: {}",
                    documentId, chunks.size(), e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * {@code owner_<ownerId>_doc_<first 12 hex chars of MD5(text)>}.
     */
    @SuppressWarnings("deprecation")
    static String documentId(String ownerId, String text) {
        String digest = Hashing.md5().hashString(text, StandardCharsets.UTF_8).toString();
        return "owner_" + ownerId + "_doc_" + digest.substring(0, 12);
    }
}
