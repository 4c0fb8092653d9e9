package com.nevis.dataroom.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class ConversionException extends RuntimeException {
    private final Path source;

    public ConversionException(Path source, String message) {
        super(message);
        this.source = source;
    }

    public ConversionException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }
}
