package com.nevis.dataroom.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * AI summarization client and its retry policy.
 * The retry fields are read by {@code @Retryable} expressions under {@code app.summary.*}.
 */
@Validated
@ConfigurationProperties(prefix = "app.summary")
public record SummaryProperties(
    @NotBlank String model,
    @NotNull Duration timeout,
    @NotNull @Min(1) @Max(64) Integer concurrency,
    @NotNull @Min(1) Integer requestsPerMinute,
    @NotNull @Min(1) @Max(10) Integer maxAttempts,
    @NotNull @Min(0) Long initialBackoffMs,
    @NotNull @DecimalMin("1.0") Double multiplier,
    @NotNull @Min(0) Long maxBackoffMs
) {
}
