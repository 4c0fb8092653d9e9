package com.nevis.dataroom.pipeline;

import com.nevis.dataroom.exception.RunCancelledException;
import com.nevis.dataroom.model.DocumentRecord;
import com.nevis.dataroom.model.DocumentStatus;
import com.nevis.dataroom.model.PageRecord;
import com.nevis.dataroom.service.PageSummary;
import com.nevis.dataroom.service.SummaryGeneratorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Fills in missing page and document summaries.
 * <p>
 * Pages are summarized in parallel. A document's roll-up starts once all of its own page
 * attempts have finished, independently of other documents. Completed summaries are never
 * requested again, so running the engine twice over the same index is cheap.
 */
@Service
@Slf4j
public class SummarizationEngine {

    static final String NO_PAGE_SUMMARIES = "no page summaries available";

    private final SummaryGeneratorService summaryGenerator;
    private final Executor summaryExecutor;

    public SummarizationEngine(
        SummaryGeneratorService summaryGenerator,
        @Qualifier("summaryTaskExecutor") Executor summaryExecutor
    ) {
        this.summaryGenerator = summaryGenerator;
        this.summaryExecutor = summaryExecutor;
    }

    public void summarize(List<DocumentRecord> documents, RunContext context) {
        List<DocumentRecord> pending = documents.stream()
            .filter(doc -> doc.getStatus() == DocumentStatus.RASTERIZED)
            .toList();
        log.info("Summarize: {} documents", pending.size());

        CompletableFuture<?>[] rollUps = pending.stream()
            .map(doc -> summarizeDocument(doc, context))
            .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(rollUps).join();
    }

    private CompletableFuture<Void> summarizeDocument(DocumentRecord doc, RunContext context) {
        CompletableFuture<?>[] pageCalls = doc.getPages().stream()
            .filter(PageRecord::needsSummary)
            .map(page -> CompletableFuture.runAsync(() -> summarizePage(doc, page, context), summaryExecutor))
            .toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(pageCalls)
            .thenRunAsync(() -> rollUp(doc, context), summaryExecutor);
    }

    void summarizePage(DocumentRecord doc, PageRecord page, RunContext context) {
        if (context.isCancelled()) {
            return;
        }
        try {
            String summary = summaryGenerator.summarizePage(page.getImagePath(), page.getPageNum(),
                context::isCancelled);
            page.completeSummary(summary);
            log.debug("Doc {}: page {} summarized", doc.getDocId(), page.getPageNum());
        } catch (RunCancelledException e) {
            log.debug("Doc {}: page {} left pending, run cancelled", doc.getDocId(), page.getPageNum());
        } catch (RuntimeException e) {
            log.warn("Doc {}: page {} summary failed: {}", doc.getDocId(), page.getPageNum(), rootCauseMessage(e));
            page.failSummary(rootCauseMessage(e));
        }
    }

    void rollUp(DocumentRecord doc, RunContext context) {
        if (context.isCancelled() || !doc.allPageAttemptsFinished()) {
            log.debug("Doc {}: roll-up deferred", doc.getDocId());
            return;
        }
        List<PageSummary> summaries = doc.getPages().stream()
            .filter(page -> page.getSummary().isDone())
            .map(page -> new PageSummary(page.getPageNum(), page.getSummary().asText().orElseThrow()))
            .toList();
        List<Integer> skipped = doc.getPages().stream()
            .filter(page -> !page.getSummary().isDone())
            .map(PageRecord::getPageNum)
            .toList();

        if (summaries.isEmpty()) {
            log.warn("Doc {}: {}", doc.getDocId(), NO_PAGE_SUMMARIES);
            doc.failSummary(NO_PAGE_SUMMARIES);
            return;
        }
        try {
            String summary = summaryGenerator.summarizeDocument(doc.getDocId(), summaries, skipped,
                context::isCancelled);
            doc.completeSummary(withSkippedNote(summary, skipped, doc.getPages().size()));
            log.info("Doc {}: summarized from {} of {} pages", doc.getDocId(), summaries.size(), doc.getPages().size());
        } catch (RunCancelledException e) {
            log.debug("Doc {}: roll-up left pending, run cancelled", doc.getDocId());
        } catch (RuntimeException e) {
            log.warn("Doc {}: roll-up failed: {}", doc.getDocId(), rootCauseMessage(e));
            doc.failSummary(rootCauseMessage(e));
        }
    }

    static String withSkippedNote(String summary, List<Integer> skipped, int totalPages) {
        if (skipped.isEmpty()) {
            return summary;
        }
        String pages = skipped.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return "%s\n\nNote: %d of %d pages could not be summarized (%s %s) and were skipped."
            .formatted(summary, skipped.size(), totalPages, skipped.size() == 1 ? "page" : "pages", pages);
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return message.length() > 300 ? message.substring(0, 300) + "..." : message;
    }
}
