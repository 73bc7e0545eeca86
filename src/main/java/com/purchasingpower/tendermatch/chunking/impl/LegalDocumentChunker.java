package com.purchasingpower.tendermatch.chunking.impl;

import com.purchasingpower.tendermatch.chunking.BoundaryMatcher;
import com.purchasingpower.tendermatch.chunking.DocumentChunker;
import com.purchasingpower.tendermatch.chunking.PageMap;
import com.purchasingpower.tendermatch.chunking.SentenceSplitter;
import com.purchasingpower.tendermatch.chunking.TextSpan;
import com.purchasingpower.tendermatch.config.ChunkingConfig;
import com.purchasingpower.tendermatch.model.document.Boundary;
import com.purchasingpower.tendermatch.model.document.BoundaryKind;
import com.purchasingpower.tendermatch.model.document.Chunk;
import com.purchasingpower.tendermatch.model.document.ChunkType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chunks legal and contract documents along their clause structure.
 *
 * <p>Strategy:
 * <ol>
 *   <li>Split at numbered clauses, section headers and schedule headers.
 *       Spans shorter than {@code minClauseLength} are false positives and dropped;
 *       spans longer than {@code maxChunkSize} are re-split at sentence boundaries.</li>
 *   <li>If that yields fewer than two chunks, or their average length is under
 *       {@code minChunkSize}, the whole document is re-chunked by sentence windows
 *       with an overlap of {@code overlapSentences}.</li>
 * </ol>
 *
 * <p>Every page number is resolved from an offset into the original text through
 * a {@link PageMap} built once per document.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class LegalDocumentChunker implements DocumentChunker {

    private static final Pattern CLAUSE_NUMBER = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)*)");

    private final ChunkingConfig config;
    private final List<BoundaryMatcher> boundaryMatchers;

    @Autowired
    public LegalDocumentChunker(ChunkingConfig config) {
        this(config, PatternBoundaryMatcher.defaults());
    }

    public LegalDocumentChunker(ChunkingConfig config, List<BoundaryMatcher> boundaryMatchers) {
        this.config = config;
        this.boundaryMatchers = List.copyOf(boundaryMatchers);
    }

    @Override
    public List<Chunk> chunkDocument(String text, Map<String, Object> baseMetadata) {
        if (text == null || text.isBlank()) {
            log.debug("Nothing to chunk: document text is empty");
            return List.of();
        }

        Map<String, Object> metadata = baseMetadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(baseMetadata));
        Object documentName = metadata.getOrDefault("filename", "unknown");

        PageMap pageMap = PageMap.fromText(text);
        log.debug("Page map for {}: {} markers", documentName, pageMap.markerCount());

        List<Chunk> chunks = chunkByClauses(text, metadata, pageMap);

        if (chunks.isEmpty() || isPoorlyStructured(chunks)) {
            log.info("Using fallback chunking for {}", documentName);
            chunks = chunkBySentences(text, metadata, pageMap);
        } else {
            log.info("Used clause-based chunking for {}, created {} chunks", documentName, chunks.size());
        }
        return chunks;
    }

    /**
     * Boundary offsets from every matcher, ascending, one per offset.
     * On an offset hit by several matchers the first matcher's kind is kept.
     */
    public List<Boundary> findBoundaries(String text) {
        Map<Integer, BoundaryKind> byOffset = new TreeMap<>();
        for (BoundaryMatcher matcher : boundaryMatchers) {
            for (Boundary boundary : matcher.findBoundaries(text)) {
                byOffset.putIfAbsent(boundary.getOffset(), boundary.getKind());
            }
        }
        List<Boundary> boundaries = new ArrayList<>(byOffset.size());
        byOffset.forEach((offset, kind) -> boundaries.add(new Boundary(offset, kind)));
        return boundaries;
    }

    List<Chunk> chunkByClauses(String text, Map<String, Object> metadata, PageMap pageMap) {
        List<Boundary> boundaries = findBoundaries(text);
        if (boundaries.isEmpty()) {
            return List.of();
        }
        log.debug("Detected {} clause boundaries", boundaries.size());

        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < boundaries.size(); i++) {
            int start = boundaries.get(i).getOffset();
            int end = i + 1 < boundaries.size() ? boundaries.get(i + 1).getOffset() : text.length();

            String raw = text.substring(start, end);
            String clauseText = raw.strip();
            if (clauseText.length() < config.getMinClauseLength()) {
                continue;
            }
            int clauseStart = start + (raw.length() - raw.stripLeading().length());
            String clauseNumber = extractClauseNumber(clauseText);

            if (clauseText.length() > config.getMaxChunkSize()) {
                chunks.addAll(splitLargeClause(clauseText, clauseStart, clauseNumber, metadata, pageMap));
            } else {
                chunks.add(Chunk.builder()
                        .text(clauseText)
                        .chunkType(ChunkType.CLAUSE)
                        .page(pageMap.pageAt(clauseStart))
                        .offset(clauseStart)
                        .clauseNumber(clauseNumber)
                        .sourceMetadata(metadata)
                        .build());
            }
        }
        return chunks;
    }

    List<Chunk> chunkBySentences(String text, Map<String, Object> metadata, PageMap pageMap) {
        List<TextSpan> sentences = SentenceSplitter.limitLength(
                SentenceSplitter.split(text, 0), config.getMaxChunkSize());

        List<List<TextSpan>> groups = SentenceSplitter.pack(sentences, config.getMaxChunkSize(),
                config.getOverlapSentences(), config.getMinClauseLength());

        List<Chunk> chunks = new ArrayList<>(groups.size());
        for (List<TextSpan> group : groups) {
            chunks.add(toChunk(group, ChunkType.FALLBACK, null, metadata, pageMap));
        }
        return chunks;
    }

    /**
     * Splits an oversized clause at sentence boundaries. A short leading sentence
     * such as a heading is joined to the head of the sentence after it. Each piece
     * takes its page from its own first sentence and keeps the clause's number.
     */
    private List<Chunk> splitLargeClause(String clauseText, int clauseStart, String clauseNumber,
                                         Map<String, Object> metadata, PageMap pageMap) {
        List<TextSpan> sentences = SentenceSplitter.limitLength(
                SentenceSplitter.split(clauseText, clauseStart), config.getMaxChunkSize());

        List<List<TextSpan>> groups = new ArrayList<>(
                SentenceSplitter.pack(sentences, config.getMaxChunkSize(), 0, config.getMinClauseLength()));
        absorbShortTail(groups);

        List<Chunk> pieces = new ArrayList<>(groups.size());
        for (List<TextSpan> group : groups) {
            pieces.add(toChunk(group, ChunkType.CLAUSE, clauseNumber, metadata, pageMap));
        }
        return pieces;
    }

    /**
     * A trailing piece shorter than the clause minimum is merged into its
     * predecessor when both fit, otherwise sentences move from the predecessor
     * into the tail while the tail stays within the size limit.
     */
    private void absorbShortTail(List<List<TextSpan>> groups) {
        if (groups.size() < 2) {
            return;
        }
        int last = groups.size() - 1;
        List<TextSpan> tail = new ArrayList<>(groups.get(last));
        List<TextSpan> previous = new ArrayList<>(groups.get(last - 1));
        if (SentenceSplitter.joinedLength(tail) >= config.getMinClauseLength()) {
            return;
        }

        if (SentenceSplitter.joinedLength(previous) + 1 + SentenceSplitter.joinedLength(tail)
                <= config.getMaxChunkSize()) {
            previous.addAll(tail);
            groups.remove(last);
            groups.set(last - 1, List.copyOf(previous));
            return;
        }

        while (previous.size() > 1 && SentenceSplitter.joinedLength(tail) < config.getMinClauseLength()) {
            TextSpan moved = previous.get(previous.size() - 1);
            if (SentenceSplitter.joinedLength(tail) + 1 + moved.length() > config.getMaxChunkSize()) {
                break;
            }
            previous.remove(previous.size() - 1);
            tail.add(0, moved);
        }
        groups.set(last - 1, List.copyOf(previous));
        groups.set(last, List.copyOf(tail));
    }

    private Chunk toChunk(List<TextSpan> group, ChunkType type, String clauseNumber,
                          Map<String, Object> metadata, PageMap pageMap) {
        int offset = group.get(0).offset();
        return Chunk.builder()
                .text(SentenceSplitter.join(group))
                .chunkType(type)
                .page(pageMap.pageAt(offset))
                .offset(offset)
                .clauseNumber(clauseNumber)
                .sourceMetadata(metadata)
                .build();
    }

    private boolean isPoorlyStructured(List<Chunk> chunks) {
        if (chunks.size() < 2) {
            return true;
        }
        double averageLength = chunks.stream().mapToInt(Chunk::length).average().orElse(0);
        return averageLength < config.getMinChunkSize();
    }

    static String extractClauseNumber(String clauseText) {
        Matcher matcher = CLAUSE_NUMBER.matcher(clauseText);
        return matcher.find() ? matcher.group(1) : null;
    }
}
