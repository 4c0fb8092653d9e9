package com.nevis.dataroom.worker;

import com.nevis.dataroom.exception.IndexRunInProgressException;
import com.nevis.dataroom.model.DataRoomIndex;
import com.nevis.dataroom.model.DocumentRecord;
import com.nevis.dataroom.pipeline.RunMode;
import com.nevis.dataroom.repository.IndexRepository;
import com.nevis.dataroom.service.IndexingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically resumes summarization for documents whose summaries are still pending or failed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.worker.summary", name = "enabled", havingValue = "true")
public class SummaryRetryWorker {

    private final IndexRepository indexRepository;
    private final IndexingService indexingService;

    @Scheduled(fixedDelayString = "${app.worker.summary.retry-check-interval-ms:300000}")
    public void retrySummaries() {
        if (indexingService.isRunning()) {
            log.debug("Indexing run active, skipping summary retry check");
            return;
        }

        long outstanding = indexRepository.load()
            .map(DataRoomIndex::documents)
            .map(docs -> docs.stream().filter(DocumentRecord::hasOutstandingSummaries).count())
            .orElse(0L);
        if (outstanding == 0) {
            log.debug("No outstanding summaries");
            return;
        }

        log.info("{} documents have outstanding summaries, starting summary retry run", outstanding);
        try {
            indexingService.startRun(RunMode.SUMMARIES_ONLY);
        } catch (IndexRunInProgressException e) {
            log.debug("Run {} started concurrently, retry postponed", e.getRunId());
        }
    }
}
