package com.purchasingpower.tendermatch.exception;

import lombok.Getter;

@Getter
public class DocumentExtractionException extends RuntimeException {

    private final String filename;

    public DocumentExtractionException(String message, String filename, Throwable cause) {
        super(message, cause);
        this.filename = filename;
    }
}
