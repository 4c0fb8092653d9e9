package com.nevis.dataroom.pipeline;

import com.nevis.dataroom.config.IndexerProperties;
import com.nevis.dataroom.model.DataRoomIndex;
import com.nevis.dataroom.model.DocumentRecord;
import com.nevis.dataroom.model.PipelineStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.stream.Stream;

/**
 * Runs the indexing stages one after another over the documents of the input folder.
 * <p>
 * The index is persisted after discovery and after every stage, so an interrupted run resumes
 * from the last completed stage. Per-document failures are recorded on the documents; only
 * configuration and persistence errors abort the run.
 */
@Service
@Slf4j
public class IndexingPipeline {

    private final IndexerProperties properties;
    private final DocumentDiscoverer discoverer;
    private final FormatNormalizer normalizer;
    private final PageRasterizer rasterizer;
    private final SummarizationEngine summarizationEngine;
    private final IndexAssembler assembler;

    public IndexingPipeline(
        IndexerProperties properties,
        DocumentDiscoverer discoverer,
        FormatNormalizer normalizer,
        PageRasterizer rasterizer,
        SummarizationEngine summarizationEngine,
        IndexAssembler assembler
    ) {
        this.properties = properties;
        this.discoverer = discoverer;
        this.normalizer = normalizer;
        this.rasterizer = rasterizer;
        this.summarizationEngine = summarizationEngine;
        this.assembler = assembler;
    }

    public RunReport run(RunContext context) {
        log.info("Run {} started: mode={}, input={}, output={}",
            context.getRunId(), context.getMode(), properties.inputRoot(), properties.outputRoot());

        DataRoomIndex index = assembler.loadOrCreate();
        List<DocumentRecord> documents = context.getMode() == RunMode.FULL
            ? discover(index)
            : new ArrayList<>(index.documents());
        reopenFailed(documents, context.getMode());
        assembler.assemble(index);

        Map<String, BiConsumer<List<DocumentRecord>, RunContext>> stages = new LinkedHashMap<>();
        if (context.getMode() == RunMode.FULL) {
            stages.put("normalize", normalizer::normalize);
            stages.put("rasterize", rasterizer::rasterize);
        }
        stages.put("summarize", summarizationEngine::summarize);

        for (Map.Entry<String, BiConsumer<List<DocumentRecord>, RunContext>> stage : stages.entrySet()) {
            if (context.isCancelled()) {
                log.info("Run {} cancelled before stage {}", context.getRunId(), stage.getKey());
                break;
            }
            stage.getValue().accept(documents, context);
            assembler.assemble(index);
        }

        RunReport report = RunReport.of(documents, context.isCancelled());
        log.info("Run {} finished: {}", context.getRunId(), report);
        return report;
    }

    private List<DocumentRecord> discover(DataRoomIndex index) {
        try (Stream<DocumentRecord> discovered = discoverer.discover(properties.inputRoot(), index)) {
            List<DocumentRecord> documents = discovered.toList();
            documents.stream()
                .filter(doc -> !index.contains(doc.getDocId()))
                .forEach(index::add);
            log.info("Discovered {} documents", documents.size());
            return documents;
        }
    }

    private void reopenFailed(List<DocumentRecord> documents, RunMode mode) {
        if (!properties.retryFailedOnResume()) {
            return;
        }
        documents.stream()
            .filter(DocumentRecord::isFailed)
            .filter(doc -> mode == RunMode.FULL || doc.getFailure().stage() == PipelineStage.SUMMARIZE)
            .forEach(doc -> {
                log.info("Doc {}: retrying after earlier {} failure", doc.getDocId(), doc.getFailure().stage().code());
                doc.reopenForRetry();
            });
    }
}
