package com.nevis.dataroom.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.dataroom.model.DocumentRecord;
import com.nevis.dataroom.model.DocumentStatus;

public record DocumentListItem(
    @JsonProperty("doc_id")
    String docId,

    String filename,

    String summary,

    @JsonProperty("page_count")
    int pageCount,

    DocumentStatus status
) {
    public static DocumentListItem from(DocumentRecord doc) {
        return new DocumentListItem(
            doc.getDocId(),
            doc.getFilename(),
            doc.getSummary().asText().orElse(null),
            doc.getPages().size(),
            doc.getStatus()
        );
    }
}
