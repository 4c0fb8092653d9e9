package com.nevis.dataroom.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * On-disk layout of the data room index. Field names are part of the contract with
 * downstream readers; new fields may be added, existing ones are never renamed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexFile(
    Metadata metadata,
    List<DocumentEntry> documents
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(
        @JsonProperty("total_documents")
        int totalDocuments,

        @JsonProperty("created_at")
        OffsetDateTime createdAt,

        @JsonProperty("updated_at")
        OffsetDateTime updatedAt,

        @JsonProperty("model_used")
        String modelUsed,

        long version
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocumentEntry(
        @JsonProperty("doc_id")
        String docId,

        String filename,

        @JsonProperty("original_file")
        String originalFile,

        @JsonProperty("relative_path")
        String relativePath,

        @JsonProperty("content_hash")
        String contentHash,

        @JsonProperty("pdf_file")
        String pdfFile,

        String status,

        Failure failure,

        String summary,

        @JsonProperty("summary_status")
        String summaryStatus,

        @JsonProperty("summary_error")
        Failure summaryError,

        List<PageEntry> pages
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PageEntry(
        @JsonProperty("page_num")
        int pageNum,

        String summary,

        @JsonProperty("summary_status")
        String summaryStatus,

        @JsonProperty("summary_error")
        Failure summaryError,

        @JsonProperty("page_image")
        String pageImage,

        @JsonProperty("raster_error")
        String rasterError
    ) {}

    public record Failure(
        String stage,
        String reason
    ) {}
}
