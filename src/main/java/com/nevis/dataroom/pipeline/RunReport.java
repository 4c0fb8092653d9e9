package com.nevis.dataroom.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.dataroom.model.DocumentRecord;
import com.nevis.dataroom.model.DocumentStatus;
import com.nevis.dataroom.model.PageRecord;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

public record RunReport(
    @JsonProperty("documents_in_run")
    int documentsInRun,

    @JsonProperty("documents_by_status")
    Map<DocumentStatus, Integer> documentsByStatus,

    @JsonProperty("pages_total")
    int pagesTotal,

    @JsonProperty("pages_summarized")
    int pagesSummarized,

    boolean cancelled
) {

    public static RunReport of(Collection<DocumentRecord> documents, boolean cancelled) {
        Map<DocumentStatus, Integer> byStatus = new EnumMap<>(DocumentStatus.class);
        int pages = 0;
        int summarized = 0;
        for (DocumentRecord doc : documents) {
            byStatus.merge(doc.getStatus(), 1, Integer::sum);
            for (PageRecord page : doc.getPages()) {
                pages++;
                if (page.getSummary().isDone()) {
                    summarized++;
                }
            }
        }
        return new RunReport(documents.size(), byStatus, pages, summarized, cancelled);
    }
}
