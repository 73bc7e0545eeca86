package com.purchasingpower.tendermatch.exception;

import lombok.Getter;

@Getter
public class VectorStoreException extends RuntimeException {

    private final String namespace;

    public VectorStoreException(String message, String namespace, Throwable cause) {
        super(message, cause);
        this.namespace = namespace;
    }
}
