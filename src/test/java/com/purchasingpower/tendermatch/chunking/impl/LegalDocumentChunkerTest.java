package com.purchasingpower.tendermatch.chunking.impl;

import com.purchasingpower.tendermatch.chunking.SentenceSplitter;
import com.purchasingpower.tendermatch.chunking.TextSpan;
import com.purchasingpower.tendermatch.config.ChunkingConfig;
import com.purchasingpower.tendermatch.model.document.Boundary;
import com.purchasingpower.tendermatch.model.document.BoundaryKind;
import com.purchasingpower.tendermatch.model.document.Chunk;
import com.purchasingpower.tendermatch.model.document.ChunkType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("LegalDocumentChunker")
class LegalDocumentChunkerTest {

    private static final Map<String, Object> METADATA = Map.of("filename", "EMP-2024-001_contract.pdf");

    private LegalDocumentChunker chunker;

    @BeforeEach
    void setUp() {
        chunker = new LegalDocumentChunker(new ChunkingConfig());
    }

    @Test
    @DisplayName("Three numbered clauses without page markers are all on page 1")
    void numberedClauses_noMarkers_allPageOne() {
        // Given
        String text = String.join("\n\n",
                clause("1", "Scope", 1, 2),
                clause("2", "Payment", 3, 2),
                clause("3", "Termination", 5, 2));

        // When
        List<Chunk> chunks = chunker.chunkDocument(text, METADATA);

        // Then
        assertThat(chunks).hasSize(3);
        assertThat(chunks).extracting(Chunk::getChunkType).containsOnly(ChunkType.CLAUSE);
        assertThat(chunks).extracting(Chunk::getPage).containsOnly(1);
        assertThat(chunks).extracting(Chunk::getClauseNumber).containsExactly("1", "2", "3");
        assertThat(chunks.get(1).getText()).startsWith("2. Payment.");
    }

    @Test
    @DisplayName("Each clause takes the page of its first character")
    void pageMarkers_resolvePerClause() {
        // Given
        String text = "[Page 1]\n" + clause("1", "Definitions", 1, 2)
                + "\n\n[Page 2]\n" + clause("2", "Payment", 3, 2)
                + "\n\n" + clause("3", "Termination", 5, 2);

        // When
        List<Chunk> chunks = chunker.chunkDocument(text, METADATA);

        // Then
        assertThat(chunks).extracting(Chunk::getPage).containsExactly(1, 2, 2);
        for (Chunk chunk : chunks) {
            assertEquals(text.indexOf(chunk.getText().substring(0, 20)), chunk.getOffset());
        }
    }

    @Test
    @DisplayName("An oversized clause is split at sentences, keeping its number and real pages")
    void oversizedClause_isSplitWithinLimits() {
        // Given: clause 1 runs from page 1 onto page 2
        String text = "[Page 1]\n1. Services. " + sentences(1, 12)
                + "\n[Page 2]\n" + sentences(13, 12)
                + "\n\n" + clause("2", "Payment", 1, 2);

        // When
        List<Chunk> chunks = chunker.chunkDocument(text, METADATA);

        // Then
        List<Chunk> clauseOne = chunks.stream().filter(c -> "1".equals(c.getClauseNumber())).toList();
        assertThat(clauseOne).hasSizeGreaterThan(1);
        assertThat(chunks).allSatisfy(c -> {
            assertThat(c.length()).isLessThanOrEqualTo(800);
            assertThat(c.length()).isGreaterThanOrEqualTo(50);
            assertThat(c.getChunkType()).isEqualTo(ChunkType.CLAUSE);
        });
        assertThat(clauseOne.get(0).getPage()).isEqualTo(1);
        assertThat(clauseOne.get(clauseOne.size() - 1).getPage()).isEqualTo(2);
        assertThat(chunks.get(chunks.size() - 1).getClauseNumber()).isEqualTo("2");
        assertThat(chunks.get(chunks.size() - 1).getPage()).isEqualTo(2);
    }

    @Test
    @DisplayName("A short heading sentence before a long sentence is not emitted as its own chunk")
    void oversizedClause_shortHeadingIsJoinedToNextSentence() {
        // Given: an 18-character heading and an 800-character sentence in one clause
        String longSentence = "the supplier shall invoice the authority monthly in arrears ".repeat(13)
                + "without any set-off.";
        String text = "1.1 Payment terms. " + longSentence
                + "\n1.2 Delivery. " + sentences(1, 2);

        // When
        List<Chunk> chunks = chunker.chunkDocument(text, METADATA);

        // Then
        assertEquals(800, longSentence.length());
        List<Chunk> clauseOne = chunks.stream().filter(c -> "1.1".equals(c.getClauseNumber())).toList();
        assertThat(clauseOne).hasSize(2);
        assertThat(clauseOne.get(0).getText()).startsWith("1.1 Payment terms. the supplier shall");
        assertThat(chunks).allSatisfy(c -> {
            assertThat(c.length()).isBetween(50, 800);
            assertThat(c.getChunkType()).isEqualTo(ChunkType.CLAUSE);
        });
        assertEquals(0, clauseOne.get(0).getOffset());
        assertEquals(text.indexOf("without any set-off."),
                clauseOne.get(1).getOffset() + clauseOne.get(1).getText().indexOf("without any set-off."));
        assertThat(chunks.get(chunks.size() - 1).getClauseNumber()).isEqualTo("1.2");
    }

    @Test
    @DisplayName("Unstructured prose falls back to overlapping sentence windows")
    void prose_usesFallbackWithOverlap() {
        // Given
        String text = IntStream.rangeClosed(1, 30)
                .mapToObj(i -> String.format("Sentence number %02d of the background narrative adds some padding words here.", i))
                .collect(Collectors.joining(" "));

        // When
        List<Chunk> chunks = chunker.chunkDocument(text, METADATA);

        // Then
        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).extracting(Chunk::getChunkType).containsOnly(ChunkType.FALLBACK);
        assertThat(chunks).allSatisfy(c -> assertThat(c.length()).isLessThanOrEqualTo(800));
        for (int i = 0; i + 1 < chunks.size(); i++) {
            List<TextSpan> previous = SentenceSplitter.split(chunks.get(i).getText(), 0);
            String carried = previous.get(previous.size() - 1).text();
            assertThat(chunks.get(i + 1).getText()).startsWith(carried);
        }
    }

    @Test
    @DisplayName("A single clause counts as poorly structured and falls back")
    void singleClause_fallsBack() {
        List<Chunk> chunks = chunker.chunkDocument(clause("1", "Scope", 1, 4), METADATA);

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).getChunkType()).isEqualTo(ChunkType.FALLBACK);
        assertThat(chunks.get(0).clauseNumber()).isEmpty();
    }

    @Test
    @DisplayName("Clause candidates shorter than the minimum are dropped")
    void shortClause_isDropped() {
        // Given
        String text = String.join("\n\n",
                clause("1", "Scope", 1, 2),
                "2. Notices. Short clause.",
                clause("3", "Termination", 5, 2));

        // When
        List<Chunk> chunks = chunker.chunkDocument(text, METADATA);

        // Then
        assertThat(chunks).extracting(Chunk::getClauseNumber).containsExactly("1", "3");
    }

    @Test
    @DisplayName("Empty or blank input yields no chunks")
    void emptyInput_yieldsNoChunks() {
        assertTrue(chunker.chunkDocument(null, METADATA).isEmpty());
        assertTrue(chunker.chunkDocument("", METADATA).isEmpty());
        assertTrue(chunker.chunkDocument("   \n\t", METADATA).isEmpty());
    }

    @Test
    @DisplayName("Chunking the same input twice gives identical chunks")
    void chunking_isDeterministic() {
        String text = "[Page 1]\n" + clause("1", "Scope", 1, 3) + "\n\n" + clause("2", "Payment", 4, 3);

        assertEquals(chunker.chunkDocument(text, METADATA), chunker.chunkDocument(text, METADATA));
    }

    @Test
    @DisplayName("Every chunk carries the caller's metadata")
    void chunks_carrySourceMetadata() {
        String text = String.join("\n\n", clause("1", "Scope", 1, 2), clause("2", "Payment", 3, 2));

        List<Chunk> chunks = chunker.chunkDocument(text, METADATA);

        assertThat(chunks).allSatisfy(c -> assertThat(c.getSourceMetadata()).isEqualTo(METADATA));
    }

    @Test
    @DisplayName("Overlapping boundaries from several matchers are reported once")
    void findBoundaries_deduplicatesOffsets() {
        // Given
        String text = "1. Scope of work\nbody\nSECTION 2 Pricing\nbody\nSchedule A\nrates";

        // When
        List<Boundary> boundaries = chunker.findBoundaries(text);

        // Then
        assertThat(boundaries).extracting(Boundary::getKind).containsExactly(
                BoundaryKind.NUMBERED_CLAUSE, BoundaryKind.SECTION_HEADER, BoundaryKind.SCHEDULE);
        assertThat(boundaries).extracting(Boundary::getOffset).isSorted();
    }

    @Test
    @DisplayName("Clause numbers are the leading numeral sequence")
    void extractClauseNumber() {
        assertEquals("3.2", LegalDocumentChunker.extractClauseNumber("3.2 Liability caps apply."));
        assertEquals("12", LegalDocumentChunker.extractClauseNumber("12. Governing Law"));
        assertNull(LegalDocumentChunker.extractClauseNumber("SCHEDULE 1 Prices"));
    }

    private static String clause(String number, String title, int firstSentence, int count) {
        return number + ". " + title + ". " + sentences(firstSentence, count);
    }

    private static String sentences(int first, int count) {
        return IntStream.range(first, first + count)
                .mapToObj(i -> String.format("Clause sentence %02d sets out the obligations of the supplier in plain terms.", i))
                .collect(Collectors.joining(" "));
    }
}
