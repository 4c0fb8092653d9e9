package com.nevis.dataroom.pipeline;

import com.nevis.dataroom.model.DataRoomIndex;
import com.nevis.dataroom.model.DocumentRecord;
import com.nevis.dataroom.model.DocumentStatus;
import com.nevis.dataroom.model.IndexMetadata;
import com.nevis.dataroom.model.PageRecord;
import com.nevis.dataroom.model.PipelineStage;
import com.nevis.dataroom.repository.IndexRepository;
import com.nevis.dataroom.service.SummaryGeneratorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Merges the working index of a run into the persisted one and writes the result.
 * <p>
 * Documents that only the persisted index knows are kept, and a completed summary on disk is
 * never replaced by a missing one, so repeated runs over the same folder converge.
 */
@Service
@Slf4j
public class IndexAssembler {

    private final IndexRepository indexRepository;
    private final SummaryGeneratorService summaryGenerator;
    private final Clock clock;

    public IndexAssembler(IndexRepository indexRepository, SummaryGeneratorService summaryGenerator, Clock clock) {
        this.indexRepository = indexRepository;
        this.summaryGenerator = summaryGenerator;
        this.clock = clock;
    }

    /**
     * @return the persisted index, or a fresh empty one
     */
    public DataRoomIndex loadOrCreate() {
        return indexRepository.load()
            .orElseGet(() -> new DataRoomIndex(IndexMetadata.initial(now(), summaryGenerator.modelName())));
    }

    /**
     * Merges, validates and persists {@code working}, which is updated in place and returned.
     *
     * @throws com.nevis.dataroom.exception.PersistenceException when the index cannot be read or written
     */
    public DataRoomIndex assemble(DataRoomIndex working) {
        indexRepository.load().ifPresent(persisted -> merge(working, persisted));
        detachMissingImages(working);
        working.setMetadata(working.getMetadata().nextVersion(now(), summaryGenerator.modelName()));
        indexRepository.save(working);
        return working;
    }

    void merge(DataRoomIndex working, DataRoomIndex persisted) {
        if (persisted.getMetadata().createdAt().isBefore(working.getMetadata().createdAt())) {
            IndexMetadata current = working.getMetadata();
            working.setMetadata(new IndexMetadata(persisted.getMetadata().createdAt(), current.updatedAt(),
                current.modelUsed(), Math.max(current.version(), persisted.getMetadata().version())));
        }
        for (DocumentRecord stored : persisted.documents()) {
            working.find(stored.getDocId()).ifPresentOrElse(
                current -> absorbSummaries(current, stored),
                () -> working.add(stored)
            );
        }
    }

    private void absorbSummaries(DocumentRecord current, DocumentRecord stored) {
        if (current == stored || !samePages(current.getPages(), stored.getPages())) {
            return;
        }
        List<PageRecord> currentPages = current.getPages();
        List<PageRecord> storedPages = stored.getPages();
        for (int i = 0; i < currentPages.size(); i++) {
            PageRecord page = currentPages.get(i);
            PageRecord storedPage = storedPages.get(i);
            if (!page.getSummary().isDone() && storedPage.getSummary().isDone()) {
                page.completeSummary(storedPage.getSummary().asText().orElseThrow());
            }
        }
        if (!current.getSummary().isDone() && stored.getSummary().isDone() && awaitsRollUp(current)) {
            current.reopenForRetry();
            current.completeSummary(stored.getSummary().asText().orElseThrow());
            log.debug("Doc {}: kept persisted document summary", current.getDocId());
        }
    }

    private static boolean awaitsRollUp(DocumentRecord doc) {
        return doc.getStatus() == DocumentStatus.RASTERIZED
            || (doc.isFailed() && doc.getFailure().stage() == PipelineStage.SUMMARIZE);
    }

    private static boolean samePages(List<PageRecord> a, List<PageRecord> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!Objects.equals(a.get(i).getImagePath(), b.get(i).getImagePath())) {
                return false;
            }
        }
        return true;
    }

    private static void detachMissingImages(DataRoomIndex index) {
        for (DocumentRecord doc : index.documents()) {
            for (PageRecord page : doc.getPages()) {
                if (page.hasImage() && !Files.exists(page.getImagePath())) {
                    log.warn("Doc {}: page image {} is missing, detaching it", doc.getDocId(), page.getImagePath());
                    page.detachMissingImage();
                }
            }
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
