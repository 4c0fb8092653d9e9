package com.nevis.dataroom.service;

import java.nio.file.Path;
import java.util.List;
import java.util.function.BooleanSupplier;

public interface SummaryGeneratorService {

    /**
     * Describes one page image in a few factual sentences.
     *
     * @param cancelled checked before every attempt; once it reports {@code true} no further
     *                  model call is made and {@link com.nevis.dataroom.exception.RunCancelledException} is thrown
     */
    String summarizePage(Path imagePath, int pageNum, BooleanSupplier cancelled);

    /**
     * Folds the ordered page summaries of a document into one paragraph.
     *
     * @param skippedPages page numbers without a summary, mentioned to the model
     * @param cancelled    checked before every attempt, as for {@link #summarizePage}
     */
    String summarizeDocument(String docId, List<PageSummary> pageSummaries, List<Integer> skippedPages,
                             BooleanSupplier cancelled);

    String modelName();
}
