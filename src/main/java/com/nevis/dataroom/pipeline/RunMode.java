package com.nevis.dataroom.pipeline;

public enum RunMode {
    /** Discover, normalize, rasterize, summarize and assemble. */
    FULL,
    /** Fill in missing summaries of an existing index. */
    SUMMARIES_ONLY
}
