package com.nevis.dataroom.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A source file travelling through the pipeline.
 * <p>
 * Each stage moves the record forward exactly once. Records are owned by one worker at a time
 * and are not thread-safe.
 */
@Getter
@ToString
@EqualsAndHashCode
public class DocumentRecord {

    private final String docId;
    private final Path originalPath;
    private final String relativePath;
    private final String contentHash;
    private Path canonicalPdfPath;
    private DocumentStatus status;
    private StageFailure failure;
    private SummaryState summary;
    @Getter(lombok.AccessLevel.NONE)
    private final List<PageRecord> pages;

    private DocumentRecord(String docId, Path originalPath, String relativePath, String contentHash,
                           Path canonicalPdfPath, DocumentStatus status, StageFailure failure,
                           SummaryState summary, List<PageRecord> pages) {
        this.docId = Objects.requireNonNull(docId, "docId");
        this.originalPath = Objects.requireNonNull(originalPath, "originalPath");
        this.relativePath = relativePath;
        this.contentHash = contentHash;
        this.canonicalPdfPath = canonicalPdfPath;
        this.status = Objects.requireNonNull(status, "status");
        this.failure = failure;
        this.summary = Objects.requireNonNull(summary, "summary");
        this.pages = new ArrayList<>(pages);
        checkContiguous(this.pages);
    }

    public static DocumentRecord discovered(String docId, Path originalPath, String relativePath, String contentHash) {
        return new DocumentRecord(docId, originalPath, relativePath, contentHash, null,
            DocumentStatus.DISCOVERED, null, SummaryState.pending(), List.of());
    }

    public static DocumentRecord restore(String docId, Path originalPath, String relativePath, String contentHash,
                                         Path canonicalPdfPath, DocumentStatus status, StageFailure failure,
                                         SummaryState summary, List<PageRecord> pages) {
        return new DocumentRecord(docId, originalPath, relativePath, contentHash, canonicalPdfPath,
            status, failure, summary, pages);
    }

    public String getFilename() {
        return originalPath.getFileName().toString();
    }

    public List<PageRecord> getPages() {
        return Collections.unmodifiableList(pages);
    }

    public boolean isFailed() {
        return status == DocumentStatus.FAILED;
    }

    public boolean isPdfSource() {
        return getFilename().toLowerCase(java.util.Locale.ROOT).endsWith(".pdf");
    }

    public void markNormalized(Path pdfPath) {
        requireStatus(DocumentStatus.DISCOVERED);
        if (canonicalPdfPath != null && !canonicalPdfPath.equals(pdfPath)) {
            throw new IllegalStateException("Canonical PDF of " + docId + " is already " + canonicalPdfPath);
        }
        canonicalPdfPath = Objects.requireNonNull(pdfPath, "pdfPath");
        status = DocumentStatus.NORMALIZED;
    }

    public void markRasterized(List<PageRecord> renderedPages) {
        requireStatus(DocumentStatus.NORMALIZED);
        checkContiguous(renderedPages);
        pages.clear();
        pages.addAll(renderedPages);
        status = DocumentStatus.RASTERIZED;
    }

    public void completeSummary(String text) {
        requireStatus(DocumentStatus.RASTERIZED);
        summary = summary.transitionTo(SummaryState.done(text));
        status = DocumentStatus.SUMMARIZED;
    }

    public void failSummary(String reason) {
        summary = summary.transitionTo(SummaryState.failed(PipelineStage.SUMMARIZE, reason));
        markFailed(PipelineStage.SUMMARIZE, reason);
    }

    public void markFailed(PipelineStage stage, String reason) {
        if (status == DocumentStatus.FAILED || status == DocumentStatus.SUMMARIZED) {
            throw new IllegalStateException("Document " + docId + " is already " + status);
        }
        failure = new StageFailure(stage, reason);
        status = DocumentStatus.FAILED;
    }

    /**
     * Re-opens a failed document so a new run can retry the stage that failed.
     * Work completed before the failure is kept.
     */
    public void reopenForRetry() {
        if (status != DocumentStatus.FAILED) {
            return;
        }
        switch (failure.stage()) {
            case DISCOVER, NORMALIZE -> {
                canonicalPdfPath = null;
                status = DocumentStatus.DISCOVERED;
            }
            case RASTERIZE -> {
                pages.clear();
                status = canonicalPdfPath != null ? DocumentStatus.NORMALIZED : DocumentStatus.DISCOVERED;
            }
            case SUMMARIZE -> status = DocumentStatus.RASTERIZED;
        }
        failure = null;
    }

    public boolean allPageAttemptsFinished() {
        return pages.stream().allMatch(page -> !page.hasImage() || !(page.getSummary() instanceof SummaryState.Pending));
    }

    /**
     * Whether a summarization pass could still make progress on this document.
     */
    public boolean hasOutstandingSummaries() {
        return status == DocumentStatus.RASTERIZED
            || (status == DocumentStatus.FAILED && failure.stage() == PipelineStage.SUMMARIZE);
    }

    private void requireStatus(DocumentStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Document " + docId + " must be " + expected + " but is " + status);
        }
    }

    private static void checkContiguous(List<PageRecord> pages) {
        for (int i = 0; i < pages.size(); i++) {
            if (pages.get(i).getPageNum() != i + 1) {
                throw new IllegalArgumentException(
                    "Pages must be numbered contiguously from 1, found " + pages.get(i).getPageNum() + " at slot " + (i + 1));
            }
        }
    }
}
