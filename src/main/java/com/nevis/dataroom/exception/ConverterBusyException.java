package com.nevis.dataroom.exception;

import java.nio.file.Path;

/**
 * The converter refused the job because another instance held its profile or a file lock.
 * Worth one more attempt.
 */
public class ConverterBusyException extends ConversionException {

    public ConverterBusyException(Path source, String message) {
        super(source, message);
    }
}
