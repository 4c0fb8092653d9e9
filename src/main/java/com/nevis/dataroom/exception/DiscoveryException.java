package com.nevis.dataroom.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class DiscoveryException extends RuntimeException {
    private final Path path;

    public DiscoveryException(Path path, Throwable cause) {
        super("Cannot read input file: " + path, cause);
        this.path = path;
    }
}
