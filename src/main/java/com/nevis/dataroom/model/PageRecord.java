package com.nevis.dataroom.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One page of a canonical PDF. A page that could not be rendered keeps its slot with
 * {@code imagePath == null} and a raster error, so page numbers stay aligned with the PDF.
 */
@Getter
@ToString
@EqualsAndHashCode
public class PageRecord {

    private final int pageNum;
    private Path imagePath;
    private String rasterError;
    private SummaryState summary;

    private PageRecord(int pageNum, Path imagePath, String rasterError, SummaryState summary) {
        if (pageNum < 1) {
            throw new IllegalArgumentException("Page numbers are 1-based, got " + pageNum);
        }
        this.pageNum = pageNum;
        this.imagePath = imagePath;
        this.rasterError = rasterError;
        this.summary = Objects.requireNonNull(summary, "summary");
    }

    public static PageRecord rendered(int pageNum, Path imagePath) {
        return new PageRecord(pageNum, Objects.requireNonNull(imagePath, "imagePath"), null, SummaryState.pending());
    }

    public static PageRecord unrendered(int pageNum, String reason) {
        return new PageRecord(pageNum, null, reason == null ? "unknown error" : reason,
            SummaryState.failed(PipelineStage.RASTERIZE, reason));
    }

    public static PageRecord restore(int pageNum, Path imagePath, String rasterError, SummaryState summary) {
        return new PageRecord(pageNum, imagePath, rasterError, summary);
    }

    public boolean hasImage() {
        return imagePath != null;
    }

    public boolean needsSummary() {
        return hasImage() && !summary.isDone();
    }

    public void completeSummary(String text) {
        summary = summary.transitionTo(SummaryState.done(text));
    }

    public void failSummary(String reason) {
        summary = summary.transitionTo(SummaryState.failed(PipelineStage.SUMMARIZE, reason));
    }

    /**
     * Drops the reference to an image file that no longer exists on disk.
     */
    public void detachMissingImage() {
        if (imagePath == null) {
            return;
        }
        rasterError = "page image missing: " + imagePath.getFileName();
        imagePath = null;
    }
}
