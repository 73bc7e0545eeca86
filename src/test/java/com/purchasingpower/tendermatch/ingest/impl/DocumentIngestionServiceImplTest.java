package com.purchasingpower.tendermatch.ingest.impl;

import com.purchasingpower.tendermatch.chunking.impl.LegalDocumentChunker;
import com.purchasingpower.tendermatch.config.ChunkingConfig;
import com.purchasingpower.tendermatch.exception.EmbeddingException;
import com.purchasingpower.tendermatch.knowledge.Embedder;
import com.purchasingpower.tendermatch.knowledge.VectorStore;
import com.purchasingpower.tendermatch.model.ingest.IngestionResult;
import com.purchasingpower.tendermatch.model.vector.VectorRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentIngestionService")
class DocumentIngestionServiceImplTest {

    private static final String NAMESPACE = "documents";

    @Mock
    private Embedder embedder;

    @Mock
    private VectorStore vectorStore;

    private DocumentIngestionServiceImpl ingestionService;

    @BeforeEach
    void setUp() {
        ingestionService = new DocumentIngestionServiceImpl(
                new DefaultDocumentTextExtractor(),
                new LegalDocumentChunker(new ChunkingConfig()),
                embedder,
                vectorStore,
                NAMESPACE);
    }

    @Test
    @DisplayName("Chunks are embedded in one batch and stored with per-chunk metadata")
    @SuppressWarnings("unchecked")
    void ingest_storesChunksWithMetadata() {
        // Given
        String text = contractText();
        when(embedder.embedAll(anyList())).thenReturn(List.of(List.of(0.1), List.of(0.2), List.of(0.3)));

        // When
        IngestionResult result = ingestionService.ingest("MSA-2024-007_contract.txt", "text/plain",
                text.getBytes(StandardCharsets.UTF_8), "42", Map.of("department", "Legal"));

        // Then
        ArgumentCaptor<List<VectorRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(vectorStore).upsert(eq(NAMESPACE), captor.capture());
        List<VectorRecord> records = captor.getValue();

        assertEquals(3, result.getTotalChunks());
        assertEquals(3, result.getStoredChunks());
        assertEquals(0, result.getFailedChunks());
        assertThat(result.getDocumentId()).matches("owner_42_doc_[0-9a-f]{12}");
        assertThat(records).hasSize(3);

        Map<String, String> first = records.get(0).getMetadata();
        assertThat(first)
                .containsEntry("chunk_index", "0")
                .containsEntry("total_chunks", "3")
                .containsEntry("chunk_type", "clause")
                .containsEntry("page", "1")
                .containsEntry("clause_number", "1")
                .containsEntry("owner_id", "42")
                .containsEntry("document_id", result.getDocumentId())
                .containsEntry("case_id", "MSA-2024-007")
                .containsEntry("document_type", "contract")
                .containsEntry("department", "Legal")
                .containsKey("chunk_size");
        assertThat(records.get(2).getId()).isEqualTo(result.getDocumentId() + "_chunk_2");
        assertThat(records).extracting(VectorRecord::getValues)
                .containsExactly(List.of(0.1), List.of(0.2), List.of(0.3));
        verify(embedder, never()).embed(anyString());
    }

    @Test
    @DisplayName("The document id depends only on owner and text")
    void documentId_isStable() {
        String a = DocumentIngestionServiceImpl.documentId("42", "same text");
        String b = DocumentIngestionServiceImpl.documentId("42", "same text");
        String c = DocumentIngestionServiceImpl.documentId("43", "same text");

        assertEquals(a, b);
        assertThat(c).startsWith("owner_43_doc_").endsWith(a.substring(a.length() - 12));
    }

    @Test
    @DisplayName("When the batch fails, chunks are embedded one by one and failures skipped")
    void ingest_skipsFailedChunks() {
        // Given
        when(embedder.embedAll(anyList())).thenThrow(new EmbeddingException("batch timeout"));
        when(embedder.embed(anyString())).thenReturn(List.of(0.1, 0.2));
        when(embedder.embed(startsWith("2. Payment"))).thenThrow(new EmbeddingException("timeout"));

        // When
        IngestionResult result = ingestionService.ingest("contract.txt", "text/plain",
                contractText().getBytes(StandardCharsets.UTF_8), "42", Map.of());

        // Then
        assertEquals(3, result.getTotalChunks());
        assertEquals(2, result.getStoredChunks());
        assertEquals(1, result.getFailedChunks());
        assertThat(result.getWarnings()).containsExactly("Chunk 1 could not be embedded");
        assertThat(result.isSuccess()).isTrue();
        verify(embedder, times(3)).embed(anyString());
    }

    @Test
    @DisplayName("An incomplete batch response falls back to embedding each chunk")
    void ingest_incompleteBatchFallsBack() {
        when(embedder.embedAll(anyList())).thenReturn(List.of(List.of(0.1)));
        when(embedder.embed(anyString())).thenReturn(List.of(0.5));

        IngestionResult result = ingestionService.ingest("contract.txt", "text/plain",
                contractText().getBytes(StandardCharsets.UTF_8), "42", Map.of());

        assertEquals(3, result.getStoredChunks());
        verify(embedder, times(3)).embed(anyString());
    }

    @Test
    @DisplayName("The document id is the first 12 hex characters of the text's MD5")
    void documentId_usesMd5Prefix() {
        // MD5("hello") = 5d41402abc4b2a76b9719d911017c592
        assertEquals("owner_7_doc_5d41402abc4b", DocumentIngestionServiceImpl.documentId("7", "hello"));
    }

    @Test
    @DisplayName("An unreadable upload stores nothing")
    void ingest_unreadableUpload() {
        IngestionResult result = ingestionService.ingest("image.png", "image/png", new byte[]{1, 2, 3}, "42", Map.of());

        assertEquals(0, result.getStoredChunks());
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getWarnings()).isNotEmpty();
        verifyNoInteractions(embedder, vectorStore);
    }

    @Test
    @DisplayName("An owner id is required")
    void ingest_requiresOwner() {
        assertThatThrownBy(() -> ingestionService.ingest("a.txt", "text/plain", new byte[0], " ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static String contractText() {
        return String.join("\n\n", clause(1, "Scope"), clause(2, "Payment"), clause(3, "Termination"));
    }

    private static String clause(int number, String title) {
        return number + ". " + title + ". " + IntStream.rangeClosed(1, 2)
                .mapToObj(i -> "The parties agree to obligation " + number + "." + i
                        + " which is described in sufficient detail here.")
                .collect(Collectors.joining(" "));
    }
}
