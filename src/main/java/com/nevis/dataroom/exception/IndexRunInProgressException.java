package com.nevis.dataroom.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class IndexRunInProgressException extends RuntimeException {
    private final UUID runId;

    public IndexRunInProgressException(UUID runId) {
        super("Indexing run already in progress: " + runId);
        this.runId = runId;
    }
}
