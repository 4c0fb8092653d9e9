package com.nevis.dataroom.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.dataroom.model.DocumentRecord;
import com.nevis.dataroom.model.DocumentStatus;
import com.nevis.dataroom.model.StageFailure;

import java.util.List;

public record DocumentResponse(
    @JsonProperty("doc_id")
    String docId,

    String filename,

    @JsonProperty("original_file")
    String originalFile,

    @JsonProperty("relative_path")
    String relativePath,

    @JsonProperty("pdf_file")
    String pdfFile,

    DocumentStatus status,

    StageFailure failure,

    String summary,

    @JsonProperty("summary_status")
    String summaryStatus,

    List<PageResponse> pages
) {
    public static DocumentResponse from(DocumentRecord doc) {
        return new DocumentResponse(
            doc.getDocId(),
            doc.getFilename(),
            doc.getOriginalPath().toString(),
            doc.getRelativePath(),
            doc.getCanonicalPdfPath() == null ? null : doc.getCanonicalPdfPath().toString(),
            doc.getStatus(),
            doc.getFailure(),
            doc.getSummary().asText().orElse(null),
            doc.getSummary().code(),
            doc.getPages().stream().map(PageResponse::from).toList()
        );
    }
}
