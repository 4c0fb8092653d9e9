package com.nevis.dataroom.model;

import java.util.Objects;

public record StageFailure(PipelineStage stage, String reason) {

    public StageFailure {
        Objects.requireNonNull(stage, "stage");
        reason = reason == null || reason.isBlank() ? "unknown error" : reason;
    }
}
