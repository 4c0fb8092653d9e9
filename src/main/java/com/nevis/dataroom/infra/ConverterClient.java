package com.nevis.dataroom.infra;

import java.nio.file.Path;

/**
 * External document-to-PDF converter.
 */
public interface ConverterClient {

    /**
     * Converts {@code source} into a PDF written inside {@code outputDir}.
     *
     * @return path of the produced PDF
     * @throws com.nevis.dataroom.exception.ConverterBusyException when the converter reports a lock or busy profile
     * @throws com.nevis.dataroom.exception.ConversionException    on any other failure, including timeouts
     */
    Path convertToPdf(Path source, Path outputDir);

    /**
     * @throws com.nevis.dataroom.exception.ConverterUnavailableException when the executable cannot be run
     */
    void verifyAvailable();
}
