package com.nevis.dataroom.service;

import com.nevis.dataroom.pipeline.RunMode;

import java.util.Optional;
import java.util.UUID;

public interface IndexingService {

    /**
     * Registers a new run and hands it to the pipeline executor.
     *
     * @throws com.nevis.dataroom.exception.IndexRunInProgressException when another run is active
     */
    IndexRunStatus startRun(RunMode mode);

    void execute(UUID runId);

    Optional<IndexRunStatus> cancel();

    Optional<IndexRunStatus> currentStatus();

    boolean isRunning();
}
