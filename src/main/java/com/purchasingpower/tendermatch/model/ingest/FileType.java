package com.purchasingpower.tendermatch.model.ingest;

import java.util.Locale;
import java.util.Optional;

/**
 * Document formats the extractor can read.
 */
public enum FileType {
    PDF("application/pdf", ".pdf"),
    TXT("text/plain", ".txt");

    private final String contentType;
    private final String extension;

    FileType(String contentType, String extension) {
        this.contentType = contentType;
        this.extension = extension;
    }

    public String metadataValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves by MIME type first, then by filename extension for generic uploads
     * such as {@code application/octet-stream}.
     */
    public static Optional<FileType> detect(String contentType, String filename) {
        String mime = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        for (FileType type : values()) {
            if (mime.startsWith(type.contentType)) {
                return Optional.of(type);
            }
        }
        for (FileType type : values()) {
            if (name.endsWith(type.extension)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
