package com.purchasingpower.tendermatch.ingest.impl;

import com.purchasingpower.tendermatch.exception.DocumentExtractionException;
import com.purchasingpower.tendermatch.ingest.DocumentTextExtractor;
import com.purchasingpower.tendermatch.model.ingest.ExtractedDocument;
import com.purchasingpower.tendermatch.model.ingest.FileType;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
public class DefaultDocumentTextExtractor implements DocumentTextExtractor {

    static final long MAX_FILE_SIZE = 50L * 1024 * 1024;
    static final int MIN_TEXT_LENGTH = 10;

    private static final Pattern CASE_ID = Pattern.compile("([A-Z]{2,4}-\\d{4}-\\d{3})");

    /**
     * Filename keyword to document type, checked in order; first hit wins.
     */
    private static final Map<String, String> DOCUMENT_TYPES = new LinkedHashMap<>();

    static {
        DOCUMENT_TYPES.put("contract", "contract");
        DOCUMENT_TYPES.put("agreement", "agreement");
        DOCUMENT_TYPES.put("policy", "policy");
        DOCUMENT_TYPES.put("employment", "employment_contract");
        DOCUMENT_TYPES.put("nda", "non_disclosure_agreement");
        DOCUMENT_TYPES.put("lease", "commercial_lease");
        DOCUMENT_TYPES.put("terms", "terms_and_conditions");
    }

    private final Clock clock;

    public DefaultDocumentTextExtractor() {
        this(Clock.systemUTC());
    }

    public DefaultDocumentTextExtractor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<ExtractedDocument> extract(String filename, String contentType, byte[] content,
                                               Map<String, Object> userMetadata) {
        Optional<FileType> detected = FileType.detect(contentType, filename);
        if (detected.isEmpty()) {
            log.error("Unsupported file type for {}: {}", filename, contentType);
            return Optional.empty();
        }
        if (content == null || content.length == 0) {
            log.error("Empty upload: {}", filename);
            return Optional.empty();
        }
        if (content.length > MAX_FILE_SIZE) {
            log.error("File too large: {} ({} bytes)", filename, content.length);
            return Optional.empty();
        }

        FileType fileType = detected.get();
        String text;
        int pageCount;
        try {
            if (fileType == FileType.PDF) {
                List<String> pages = extractPdfPages(filename, content);
                pageCount = pages.size();
                text = String.join("\n\n", pages);
            } else {
                pageCount = 1;
                text = new String(content, StandardCharsets.UTF_8);
            }
        } catch (DocumentExtractionException e) {
            log.error("Text extraction failed for {}: {}", e.getFilename(), e.getMessage());
            return Optional.empty();
        }

        if (text.strip().length() < MIN_TEXT_LENGTH) {
            log.error("Extracted text too short or empty for {}", filename);
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>(fileMetadata(filename, fileType));
        if (userMetadata != null) {
            metadata.putAll(userMetadata);
        }

        log.info("Extracted {} characters from {} ({} pages)", text.length(), filename, pageCount);
        return Optional.of(ExtractedDocument.builder()
                .filename(filename)
                .fileType(fileType)
                .text(text)
                .pageCount(pageCount)
                .metadata(metadata)
                .build());
    }

    /**
     * One entry per page, each starting with its {@code [Page N]} marker.
     * Pages without text keep the bare marker.
     */
    List<String> extractPdfPages(String filename, byte[] content) {
        try (PDDocument pdf = Loader.loadPDF(content)) {
            int pageCount = pdf.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            List<String> pages = new ArrayList<>(pageCount);

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = stripper.getText(pdf);

                if (pageText == null || pageText.isBlank()) {
                    log.warn("Page {} of {} extracted no text", page, filename);
                    pages.add("[Page " + page + "]\n");
                } else {
                    pages.add("[Page " + page + "]\n" + pageText.strip());
                }
            }
            return pages;
        } catch (IOException e) {
            throw new DocumentExtractionException("PDF extraction failed", filename, e);
        }
    }

    Map<String, Object> fileMetadata(String filename, FileType fileType) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("filename", filename);
        metadata.put("file_type", fileType.metadataValue());
        metadata.put("upload_date", LocalDateTime.now(clock).toString());

        if (filename == null) {
            return metadata;
        }

        Matcher caseId = CASE_ID.matcher(filename);
        if (caseId.find()) {
            metadata.put("case_id", caseId.group(1));
        }

        String lower = filename.toLowerCase(Locale.ROOT);
        DOCUMENT_TYPES.entrySet().stream()
                .filter(e -> lower.contains(e.getKey()))
                .findFirst()
                .ifPresent(e -> metadata.put("document_type", e.getValue()));
        return metadata;
    }
}
