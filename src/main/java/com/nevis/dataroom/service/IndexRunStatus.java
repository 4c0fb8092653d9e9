package com.nevis.dataroom.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.dataroom.pipeline.RunMode;
import com.nevis.dataroom.pipeline.RunReport;

import java.time.OffsetDateTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexRunStatus(
    @JsonProperty("run_id")
    UUID runId,

    RunMode mode,

    State state,

    @JsonProperty("started_at")
    OffsetDateTime startedAt,

    @JsonProperty("finished_at")
    OffsetDateTime finishedAt,

    RunReport report,

    @JsonProperty("error_message")
    String errorMessage
) {

    public enum State {
        RUNNING,
        COMPLETED,
        CANCELLED,
        FAILED
    }

    public static IndexRunStatus running(UUID runId, RunMode mode, OffsetDateTime startedAt) {
        return new IndexRunStatus(runId, mode, State.RUNNING, startedAt, null, null, null);
    }

    public IndexRunStatus finished(RunReport report, OffsetDateTime at) {
        State state = report.cancelled() ? State.CANCELLED : State.COMPLETED;
        return new IndexRunStatus(runId, mode, state, startedAt, at, report, null);
    }

    public IndexRunStatus failed(String message, OffsetDateTime at) {
        return new IndexRunStatus(runId, mode, State.FAILED, startedAt, at, null, message);
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }
}
