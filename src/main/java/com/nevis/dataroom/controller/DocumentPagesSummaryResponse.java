package com.nevis.dataroom.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DocumentPagesSummaryResponse(
    @JsonProperty("doc_id")
    String docId,

    String filename,

    @JsonProperty("pages_summary")
    String pagesSummary
) {}
