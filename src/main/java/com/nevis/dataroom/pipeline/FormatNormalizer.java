package com.nevis.dataroom.pipeline;

import com.nevis.dataroom.config.ConverterProperties;
import com.nevis.dataroom.config.IndexerProperties;
import com.nevis.dataroom.exception.ConversionException;
import com.nevis.dataroom.exception.ConverterBusyException;
import com.nevis.dataroom.infra.ConverterClient;
import com.nevis.dataroom.model.DocumentRecord;
import com.nevis.dataroom.model.DocumentStatus;
import com.nevis.dataroom.model.PipelineStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;

/**
 * Produces one canonical PDF per document under {@code <output>/pdfs/<docId>.pdf}.
 * <p>
 * PDF sources are copied as they are. Everything else goes through the external converter;
 * a busy converter gets one more attempt, any other failure marks only that document failed.
 */
@Service
@Slf4j
public class FormatNormalizer {

    private final ConverterClient converterClient;
    private final Executor converterExecutor;
    private final IndexerProperties indexerProperties;
    private final RetryTemplate busyRetry;

    public FormatNormalizer(
        ConverterClient converterClient,
        @Qualifier("converterTaskExecutor") Executor converterExecutor,
        IndexerProperties indexerProperties,
        ConverterProperties converterProperties
    ) {
        this.converterClient = converterClient;
        this.converterExecutor = converterExecutor;
        this.indexerProperties = indexerProperties;
        this.busyRetry = RetryTemplate.builder()
            .maxAttempts(2)
            .retryOn(ConverterBusyException.class)
            .fixedBackoff(Math.max(1L, converterProperties.busyRetryDelay().toMillis()))
            .build();
    }

    public void normalize(List<DocumentRecord> documents, RunContext context) {
        List<DocumentRecord> pending = documents.stream()
            .filter(doc -> doc.getStatus() == DocumentStatus.DISCOVERED)
            .toList();
        if (pending.isEmpty()) {
            log.info("Normalize: nothing to do");
            return;
        }
        if (pending.stream().anyMatch(doc -> !doc.isPdfSource())) {
            converterClient.verifyAvailable();
        }
        log.info("Normalize: {} documents", pending.size());

        CompletableFuture<?>[] futures = pending.stream()
            .map(doc -> CompletableFuture.runAsync(() -> normalizeOne(doc, context), converterExecutor))
            .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();
    }

    void normalizeOne(DocumentRecord doc, RunContext context) {
        if (context.isCancelled()) {
            log.debug("Run cancelled, leaving {} un-normalized", doc.getDocId());
            return;
        }
        Path target = indexerProperties.pdfDir().resolve(doc.getDocId() + ".pdf");
        try {
            Files.createDirectories(target.getParent());
            if (doc.isPdfSource()) {
                Files.copy(doc.getOriginalPath(), target, StandardCopyOption.REPLACE_EXISTING);
            } else {
                convert(doc, target);
            }
            doc.markNormalized(target);
            log.info("Doc {}: canonical PDF ready ({})", doc.getDocId(), doc.getRelativePath());
        } catch (ConversionException e) {
            log.warn("Doc {}: conversion of {} failed: {}", doc.getDocId(), doc.getRelativePath(), e.getMessage());
            doc.markFailed(PipelineStage.NORMALIZE, e.getMessage());
        } catch (IOException e) {
            log.warn("Doc {}: cannot write canonical PDF: {}", doc.getDocId(), e.getMessage());
            doc.markFailed(PipelineStage.NORMALIZE, "I/O error: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Doc {}: unexpected normalization error", doc.getDocId(), e);
            doc.markFailed(PipelineStage.NORMALIZE, e.getMessage());
        }
    }

    private void convert(DocumentRecord doc, Path target) throws IOException {
        Path workDir = indexerProperties.workDir().resolve(doc.getDocId());
        deleteRecursively(workDir);
        Files.createDirectories(workDir);
        try {
            Path produced = busyRetry.execute(retryContext -> {
                if (retryContext.getRetryCount() > 0) {
                    log.info("Doc {}: retrying busy converter (attempt {})", doc.getDocId(), retryContext.getRetryCount() + 1);
                }
                return converterClient.convertToPdf(doc.getOriginalPath(), workDir);
            });
            Files.move(produced, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            cleanup(workDir);
        }
    }

    private static void cleanup(Path workDir) {
        try {
            deleteRecursively(workDir);
        } catch (IOException e) {
            log.warn("Could not clean converter work dir {}: {}", workDir, e.getMessage());
        }
    }

    private static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
