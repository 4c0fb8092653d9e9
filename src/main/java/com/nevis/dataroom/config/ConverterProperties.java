package com.nevis.dataroom.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Headless office converter used to turn non-PDF sources into PDFs.
 *
 * @param command         executable, e.g. {@code soffice} or {@code libreoffice}
 * @param timeout         upper bound for one conversion
 * @param probeTimeout    upper bound for the {@code --version} availability probe
 * @param concurrency     conversions running at the same time
 * @param busyRetryDelay  pause before the single retry of a busy/locked conversion
 * @param busySignatures  output fragments (case-insensitive) that identify a busy/locked converter
 */
@Validated
@ConfigurationProperties(prefix = "app.converter")
public record ConverterProperties(
    @NotBlank String command,
    @NotNull Duration timeout,
    @NotNull Duration probeTimeout,
    @NotNull @Min(1) @Max(16) Integer concurrency,
    @NotNull Duration busyRetryDelay,
    @NotNull List<String> busySignatures
) {
}
