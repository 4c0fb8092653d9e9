package com.nevis.dataroom.listener;

import com.nevis.dataroom.event.IndexRunRequestedEvent;
import com.nevis.dataroom.service.IndexingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class IndexEventListener {

    private final IndexingService indexingService;

    @Async("pipelineTaskExecutor")
    @EventListener
    public void handleRunRequested(IndexRunRequestedEvent event) {
        log.info("Starting async indexing run {}", event.runId());
        indexingService.execute(event.runId());
    }
}
