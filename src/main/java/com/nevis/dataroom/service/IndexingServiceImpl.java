package com.nevis.dataroom.service;

import com.nevis.dataroom.event.IndexRunRequestedEvent;
import com.nevis.dataroom.exception.IndexRunInProgressException;
import com.nevis.dataroom.pipeline.IndexingPipeline;
import com.nevis.dataroom.pipeline.RunContext;
import com.nevis.dataroom.pipeline.RunMode;
import com.nevis.dataroom.pipeline.RunReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps track of the single indexing run the service allows at a time.
 */
@Service
@Slf4j
public class IndexingServiceImpl implements IndexingService {

    private final IndexingPipeline pipeline;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final AtomicReference<RunContext> activeRun = new AtomicReference<>();
    private final AtomicReference<IndexRunStatus> lastStatus = new AtomicReference<>();

    public IndexingServiceImpl(IndexingPipeline pipeline, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.pipeline = pipeline;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    public IndexRunStatus startRun(RunMode mode) {
        RunContext context = RunContext.start(mode, clock);
        if (!activeRun.compareAndSet(null, context)) {
            RunContext running = activeRun.get();
            throw new IndexRunInProgressException(running != null ? running.getRunId() : context.getRunId());
        }

        IndexRunStatus status = IndexRunStatus.running(context.getRunId(), mode, context.getStartedAt());
        lastStatus.set(status);
        log.info("Run {} requested ({})", context.getRunId(), mode);
        eventPublisher.publishEvent(new IndexRunRequestedEvent(context.getRunId()));
        return status;
    }

    @Override
    public void execute(UUID runId) {
        RunContext context = activeRun.get();
        if (context == null || !context.getRunId().equals(runId)) {
            log.warn("Run {} is no longer active, skipping", runId);
            return;
        }

        try {
            RunReport report = pipeline.run(context);
            lastStatus.set(lastStatus.get().finished(report, OffsetDateTime.now(clock)));
        } catch (RuntimeException e) {
            log.error("Run {} failed: {}", runId, e.getMessage(), e);
            lastStatus.set(lastStatus.get().failed(e.getMessage(), OffsetDateTime.now(clock)));
        } finally {
            activeRun.compareAndSet(context, null);
        }
    }

    @Override
    public Optional<IndexRunStatus> cancel() {
        RunContext context = activeRun.get();
        if (context == null) {
            return Optional.empty();
        }
        log.info("Run {}: cancellation requested", context.getRunId());
        context.cancel();
        return Optional.ofNullable(lastStatus.get());
    }

    @Override
    public Optional<IndexRunStatus> currentStatus() {
        return Optional.ofNullable(lastStatus.get());
    }

    @Override
    public boolean isRunning() {
        return activeRun.get() != null;
    }
}
