package com.nevis.dataroom.exception;

public class ConverterUnavailableException extends RuntimeException {

    public ConverterUnavailableException(String message) {
        super(message);
    }

    public ConverterUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
