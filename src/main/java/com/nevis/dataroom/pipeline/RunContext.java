package com.nevis.dataroom.pipeline;

import lombok.Getter;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State shared by all stages of one indexing run. Cancellation stops new external calls;
 * calls already in flight are allowed to finish.
 */
@Getter
public class RunContext {

    private final UUID runId;
    private final RunMode mode;
    private final OffsetDateTime startedAt;
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public RunContext(UUID runId, RunMode mode, OffsetDateTime startedAt) {
        this.runId = runId;
        this.mode = mode;
        this.startedAt = startedAt;
    }

    public static RunContext start(RunMode mode, Clock clock) {
        return new RunContext(UUID.randomUUID(), mode, OffsetDateTime.now(clock));
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
