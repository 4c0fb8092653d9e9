package com.nevis.dataroom.exception;

import lombok.Getter;

@Getter
public class RasterizationException extends RuntimeException {
    private final String docId;

    public RasterizationException(String docId, String message, Throwable cause) {
        super(message, cause);
        this.docId = docId;
    }
}
