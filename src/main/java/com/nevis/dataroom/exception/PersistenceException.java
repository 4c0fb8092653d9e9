package com.nevis.dataroom.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class PersistenceException extends RuntimeException {
    private final Path indexFile;

    public PersistenceException(Path indexFile, String message, Throwable cause) {
        super(message + ": " + indexFile, cause);
        this.indexFile = indexFile;
    }
}
