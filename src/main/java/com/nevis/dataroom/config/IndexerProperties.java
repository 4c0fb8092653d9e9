package com.nevis.dataroom.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Locations and rendering knobs of the data room.
 *
 * @param inputDir             folder with the source documents, read-only for the pipeline
 * @param outputDir            root of canonical PDFs, page images and the index file
 * @param dpi                  page image resolution
 * @param rasterConcurrency    documents rendered in parallel
 * @param indexFileName        name of the persisted index inside {@code outputDir}
 * @param retryFailedOnResume  whether documents failed by an earlier run are retried
 */
@Validated
@ConfigurationProperties(prefix = "app.indexer")
public record IndexerProperties(
    @NotBlank String inputDir,
    @NotBlank String outputDir,
    @NotNull @Min(36) @Max(600) Integer dpi,
    @NotNull @Min(1) @Max(32) Integer rasterConcurrency,
    @NotBlank String indexFileName,
    @NotNull Boolean retryFailedOnResume
) {

    public Path inputRoot() {
        return Path.of(inputDir);
    }

    public Path outputRoot() {
        return Path.of(outputDir);
    }

    public Path pdfDir() {
        return outputRoot().resolve("pdfs");
    }

    public Path pagesDir() {
        return outputRoot().resolve("pages");
    }

    public Path workDir() {
        return outputRoot().resolve("work");
    }

    public Path indexFile() {
        return outputRoot().resolve(indexFileName);
    }
}
